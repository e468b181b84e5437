package com.jdc.pantry_service.domain.dto.inventory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class InventoryTextRequestDto {

    /** 예: "2 kg tomatoes", "3 bags of rice" */
    @NotBlank
    @Size(max = 200)
    private String text;
}
