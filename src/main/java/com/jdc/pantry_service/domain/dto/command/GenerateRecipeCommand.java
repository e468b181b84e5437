package com.jdc.pantry_service.domain.dto.command;

import com.jdc.pantry_service.domain.type.RecipeMode;

public record GenerateRecipeCommand(String intent, Integer servings, RecipeMode mode) implements AssistantCommand {

    public GenerateRecipeCommand {
        if (mode == null) {
            mode = RecipeMode.FLEXIBLE;
        }
    }
}
