package com.jdc.pantry_service.domain.dto.inventory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
@Builder
public class InventoryEntryDto {
    private final Long id;
    private final String name;
    private final double quantity;
    private final String unit;
    private final String display;
    private final LocalDateTime updatedAt;
}
