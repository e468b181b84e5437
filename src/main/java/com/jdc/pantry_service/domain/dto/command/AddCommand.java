package com.jdc.pantry_service.domain.dto.command;

/**
 * 수량이 없으면 1 로 본다.
 */
public record AddCommand(String itemName, Double quantity, String unit) implements AssistantCommand {

    public AddCommand {
        if (quantity == null) {
            quantity = 1.0;
        }
    }
}
