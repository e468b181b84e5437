package com.jdc.pantry_service.domain.dto.inventory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class InventoryItemRequestDto {

    @NotBlank
    @Size(max = 100)
    private String name;

    /** 추가 시에는 0 보다 커야 하고, 수량 지정(PUT) 시 0 이면 삭제 */
    @NotNull
    @PositiveOrZero
    private Double quantity;

    private String unit;
}
