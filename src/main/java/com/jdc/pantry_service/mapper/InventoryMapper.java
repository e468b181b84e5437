package com.jdc.pantry_service.mapper;

import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.shopping.RestockSuggestionDto;
import com.jdc.pantry_service.domain.entity.InventoryEntry;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class InventoryMapper {

    public static InventoryEntryDto toDto(InventoryEntry entry) {
        return InventoryEntryDto.builder()
                .id(entry.getId())
                .name(entry.getCanonicalName())
                .quantity(entry.getQuantity())
                .unit(entry.getUnit().getSymbol())
                .display(display(entry))
                .updatedAt(entry.getUpdatedAt())
                .build();
    }

    public static RestockSuggestionDto toRestockDto(InventoryEntry entry) {
        return RestockSuggestionDto.builder()
                .name(entry.getCanonicalName())
                .quantity(entry.getQuantity())
                .unit(entry.getUnit().getSymbol())
                .display(display(entry))
                .build();
    }

    private static String display(InventoryEntry entry) {
        String number = BigDecimal.valueOf(entry.getQuantity())
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return number + " " + entry.getUnit().getSymbol();
    }
}
