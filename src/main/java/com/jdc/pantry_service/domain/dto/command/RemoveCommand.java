package com.jdc.pantry_service.domain.dto.command;

/**
 * quantity 가 null 이면 항목 전체 삭제.
 */
public record RemoveCommand(String itemName, Double quantity, String unit) implements AssistantCommand {
}
