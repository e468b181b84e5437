package com.jdc.pantry_service.domain.dto.recipe;

import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecipeConfirmRequestDto {

    @NotEmpty
    private List<RecipeIngredientDto> ingredients;
}
