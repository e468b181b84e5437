package com.jdc.pantry_service.domain.type;

public enum LedgerStatus {
    CREATED,
    UPDATED,
    REDUCED,
    DELETED,
    NOT_FOUND
}
