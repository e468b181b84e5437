package com.jdc.pantry_service.domain.type;

public enum AssistantAction {
    INVENTORY_UPDATED,
    INVENTORY_UNCHANGED,
    RECIPE_SUGGESTED,
    RECIPE_CONFIRMED
}
