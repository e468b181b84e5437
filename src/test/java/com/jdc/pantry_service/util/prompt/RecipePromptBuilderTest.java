package com.jdc.pantry_service.util.prompt;

import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecipePromptBuilderTest {

    private final RecipePromptBuilder builder = new RecipePromptBuilder(TestFixtures.unitConverter());

    private static InventoryEntryDto item(String name, double quantity, String unit) {
        return InventoryEntryDto.builder()
                .name(name).quantity(quantity).unit(unit).display(quantity + " " + unit)
                .build();
    }

    @Test
    @DisplayName("재고 순서와 무관하게 같은 프롬프트가 나온다")
    void deterministic() {
        List<InventoryEntryDto> a = List.of(item("rice", 1, "kg"), item("chicken", 500, "g"));
        List<InventoryEntryDto> b = List.of(item("chicken", 500, "g"), item("rice", 1, "kg"));

        String prompt = builder.buildRecipePrompt(a, "chicken biryani", 4, RecipeMode.FLEXIBLE);

        assertEquals(prompt, builder.buildRecipePrompt(b, "chicken biryani", 4, RecipeMode.FLEXIBLE));
        assertTrue(prompt.indexOf("- chicken: 500.0 g") < prompt.indexOf("- rice: 1.0 kg"));
    }

    @Test
    @DisplayName("요청 요리는 최우선 블록에 그대로 들어간다")
    void primaryRequest() {
        String prompt = builder.buildRecipePrompt(List.of(item("paneer", 200, "g")),
                "  Paneer Butter Masala ", 2, RecipeMode.FLEXIBLE);

        assertTrue(prompt.contains("[PRIMARY REQUEST - HIGHEST PRIORITY]"));
        assertTrue(prompt.contains("\"Paneer Butter Masala\""));
        assertTrue(prompt.contains("[CONSTRAINTS - FLEXIBLE MODE]"));
        assertTrue(prompt.contains("[SERVINGS]\n2"));
        assertTrue(prompt.contains("[ALLOWED UNITS]"));
    }

    @Test
    @DisplayName("요청 요리가 없으면 재고 활용 요청, STRICT 제약 블록")
    void noIntent_strict() {
        String prompt = builder.buildRecipePrompt(List.of(item("eggs", 6, "piece")), null, 1, RecipeMode.STRICT);

        assertFalse(prompt.contains("PRIMARY REQUEST"));
        assertTrue(prompt.contains("[REQUEST]"));
        assertTrue(prompt.contains("[CONSTRAINTS - STRICT MODE]"));
        assertFalse(prompt.contains("FLEXIBLE MODE"));
    }

    @Test
    @DisplayName("파싱 프롬프트에 원문과 허용 단위가 들어간다")
    void parsePrompt() {
        String prompt = builder.buildParsePrompt(" 2 kg tomatoes ");

        assertTrue(prompt.startsWith("Text: \"2 kg tomatoes\""));
        assertTrue(prompt.contains("kg"));
        assertTrue(builder.parseSystemPrompt().contains("item_name"));
    }
}
