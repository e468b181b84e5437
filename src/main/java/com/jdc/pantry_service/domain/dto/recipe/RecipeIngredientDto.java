package com.jdc.pantry_service.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecipeIngredientDto {
    private String name;
    private Double quantity;
    private String unit;
}
