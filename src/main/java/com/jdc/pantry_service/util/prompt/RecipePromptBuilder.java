package com.jdc.pantry_service.util.prompt;

import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * 재고 + 요청 요리 + 모드로 LLM 프롬프트를 만든다.
 * 같은 입력이면 항상 같은 문자열이 나오도록 재고는 이름순으로 정렬한다.
 */
@Component
@RequiredArgsConstructor
public class RecipePromptBuilder {

    private final UnitConverter unitConverter;

    private static final String RECIPE_SYSTEM_PROMPT = """
            You are a home-cooking assistant that writes practical recipes from a user's kitchen inventory.
            Respond with a single JSON object only. No markdown, no commentary.
            Never include non-food, toxic, or otherwise inedible ingredients.
            """;

    private static final String STRICT_CONSTRAINTS = """
            [CONSTRAINTS - STRICT MODE]
            - Use ONLY ingredients from the inventory list above. Do not add anything else, not even salt or water.
            - If the inventory cannot make the requested dish, do NOT invent a different dish and do NOT pull in
              unrelated inventory items. Keep the requested dish name, use whatever fits, and explain exactly
              what is missing in "description". "ingredients" may then be an empty list.
            - Ingredient quantities must not exceed the quantities in the inventory.
            """;

    private static final String FLEXIBLE_CONSTRAINTS = """
            [CONSTRAINTS - FLEXIBLE MODE]
            - Treat the inventory as the primary source and use as much of it as makes sense.
            - You may add universally common staples (salt, water, cooking oil, sugar, black pepper, basic spices).
            - You may add any ingredient that is essential to the authenticity of the requested dish,
              even if it is not in the inventory.
            - Do not add unrelated luxury or specialty ingredients.
            """;

    private static final String RECIPE_SCHEMA = """
            [OUTPUT JSON SCHEMA]
            {
              "name": "string",
              "description": "string",
              "servings": integer,
              "ingredients": [ { "name": "string", "quantity": number, "unit": "string" } ],
              "instructions": [ "string" ]
            }
            """;

    private static final String PARSE_SYSTEM_PROMPT = """
            You extract a single grocery item from short free text.
            Respond with a JSON object only: {"quantity": number, "unit": "string", "item_name": "string"}.
            Use a lowercase item name without quantity words. If no quantity is given use 1. If no unit is given use "unit".
            """;

    public String recipeSystemPrompt() {
        return RECIPE_SYSTEM_PROMPT;
    }

    public String parseSystemPrompt() {
        return PARSE_SYSTEM_PROMPT;
    }

    public String buildRecipePrompt(List<InventoryEntryDto> inventory, String intent, int servings, RecipeMode mode) {
        StringBuilder sb = new StringBuilder();

        sb.append("[INVENTORY]\n");
        inventory.stream()
                .sorted(Comparator.comparing(InventoryEntryDto::getName))
                .forEach(item -> sb.append("- ")
                        .append(item.getName()).append(": ")
                        .append(item.getDisplay()).append('\n'));
        sb.append('\n');

        if (intent != null && !intent.isBlank()) {
            String dish = intent.trim();
            sb.append("[PRIMARY REQUEST - HIGHEST PRIORITY]\n")
                    .append("The user wants exactly this dish: \"").append(dish).append("\".\n")
                    .append("The recipe \"name\" must be this dish. Do not replace it, generalize it, ")
                    .append("or blend it with another cuisine or diet.\n")
                    .append("This request overrides every other preference below.\n\n");
        } else {
            sb.append("[REQUEST]\n")
                    .append("Suggest one dish that makes the best use of the inventory.\n\n");
        }

        sb.append(mode == RecipeMode.STRICT ? STRICT_CONSTRAINTS : FLEXIBLE_CONSTRAINTS).append('\n');

        sb.append("[SERVINGS]\n").append(servings).append("\n\n");
        sb.append("[ALLOWED UNITS]\n").append(unitConverter.allowedSymbols()).append("\n\n");
        sb.append(RECIPE_SCHEMA);
        return sb.toString();
    }

    public String buildParsePrompt(String text) {
        return "Text: \"" + text.trim() + "\"\nAllowed units: " + unitConverter.allowedSymbols();
    }
}
