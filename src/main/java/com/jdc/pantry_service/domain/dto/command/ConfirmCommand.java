package com.jdc.pantry_service.domain.dto.command;

import com.jdc.pantry_service.domain.dto.recipe.RecipeIngredientDto;

import java.util.List;

public record ConfirmCommand(List<RecipeIngredientDto> ingredients) implements AssistantCommand {

    public ConfirmCommand {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
    }
}
