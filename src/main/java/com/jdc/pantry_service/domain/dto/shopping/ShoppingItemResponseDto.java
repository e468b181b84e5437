package com.jdc.pantry_service.domain.dto.shopping;

import com.jdc.pantry_service.domain.entity.ShoppingListEntry;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor @AllArgsConstructor @Builder
public class ShoppingItemResponseDto {
    private Long id;
    private String name;
    private String quantityDisplay;
    private boolean checked;
    private LocalDateTime createdAt;

    public static ShoppingItemResponseDto from(ShoppingListEntry entry) {
        return ShoppingItemResponseDto.builder()
                .id(entry.getId())
                .name(entry.getName())
                .quantityDisplay(entry.getQuantityDisplay())
                .checked(entry.isChecked())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
