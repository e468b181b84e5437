package com.jdc.pantry_service.domain.dto.safety;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class SafetyCheckRequestDto {
    @NotNull
    @Size(max = 1000)
    private String text;
}
