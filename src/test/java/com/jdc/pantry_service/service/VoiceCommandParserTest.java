package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.command.AddCommand;
import com.jdc.pantry_service.domain.dto.command.AssistantCommand;
import com.jdc.pantry_service.domain.dto.command.GenerateRecipeCommand;
import com.jdc.pantry_service.domain.dto.command.RemoveCommand;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class VoiceCommandParserTest {

    private final VoiceCommandParser parser = new VoiceCommandParser(TestFixtures.unitConverter());

    @Test
    @DisplayName("추가: 수량 + 단위 + 이름")
    void add_withQuantityAndUnit() {
        AssistantCommand command = parser.parse("Add 2 kg of tomatoes");

        AddCommand add = assertInstanceOf(AddCommand.class, command);
        assertEquals("tomatoes", add.itemName());
        assertEquals(2.0, add.quantity());
        assertEquals("kg", add.unit());
    }

    @Test
    @DisplayName("추가: 용기 단위는 일반 개수 단위로")
    void add_containerUnit() {
        AddCommand add = assertInstanceOf(AddCommand.class, parser.parse("I bought 3 bags of rice"));

        assertEquals("rice", add.itemName());
        assertEquals(3.0, add.quantity());
        assertEquals("unit", add.unit());
    }

    @Test
    @DisplayName("추가: 수량이 없으면 1")
    void add_withoutQuantity() {
        AddCommand add = assertInstanceOf(AddCommand.class, parser.parse("Please add milk to my fridge"));

        assertEquals("milk", add.itemName());
        assertEquals(1.0, add.quantity());
        assertNull(add.unit());
    }

    @Test
    @DisplayName("차감: 숫자 단어와 단위 없는 개수")
    void remove_numberWord() {
        RemoveCommand remove = assertInstanceOf(RemoveCommand.class, parser.parse("I used three eggs"));

        assertEquals("eggs", remove.itemName());
        assertEquals(3.0, remove.quantity());
        assertNull(remove.unit());
    }

    @Test
    @DisplayName("차감: 수량이 없으면 전체 삭제 명령")
    void remove_withoutQuantity() {
        RemoveCommand remove = assertInstanceOf(RemoveCommand.class, parser.parse("Remove the milk"));

        assertEquals("milk", remove.itemName());
        assertNull(remove.quantity());
    }

    @Test
    @DisplayName("레시피: 인분과 재료 요청")
    void recipe_withServings() {
        GenerateRecipeCommand generate = assertInstanceOf(GenerateRecipeCommand.class,
                parser.parse("Suggest a recipe with paneer for 4 people"));

        assertEquals("paneer", generate.intent());
        assertEquals(4, generate.servings());
        assertEquals(RecipeMode.FLEXIBLE, generate.mode());
    }

    @Test
    @DisplayName("레시피: 요리 이름 키워드는 intent 에 남고 only 는 STRICT")
    void recipe_dishKeywordAndStrict() {
        GenerateRecipeCommand generate = assertInstanceOf(GenerateRecipeCommand.class,
                parser.parse("Make chicken biryani using only what I have"));

        assertEquals("chicken biryani", generate.intent());
        assertNull(generate.servings());
        assertEquals(RecipeMode.STRICT, generate.mode());
    }

    @Test
    @DisplayName("레시피 키워드가 차감 키워드보다 우선")
    void recipe_takesPriorityOverRemove() {
        GenerateRecipeCommand generate = assertInstanceOf(GenerateRecipeCommand.class,
                parser.parse("Use the chicken to make curry"));

        assertEquals("curry", generate.intent());
    }

    @Test
    @DisplayName("레시피: 요청 요리가 없으면 intent 는 null")
    void recipe_withoutIntent() {
        GenerateRecipeCommand generate = assertInstanceOf(GenerateRecipeCommand.class,
                parser.parse("What can I cook tonight?"));

        assertNull(generate.intent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"What's the weather like", "hello there", "   ", "add"})
    @DisplayName("인식할 수 없는 문장은 UNRECOGNIZED_COMMAND")
    void unrecognized(String text) {
        CustomException ex = assertThrows(CustomException.class, () -> parser.parse(text));
        assertEquals(ErrorCode.UNRECOGNIZED_COMMAND, ex.getErrorCode());
    }
}
