package com.jdc.pantry_service.domain.dto.shopping;

import lombok.*;

@Getter
@NoArgsConstructor @AllArgsConstructor @Builder
public class RestockSuggestionDto {
    private String name;
    private double quantity;
    private String unit;
    private String display;
}
