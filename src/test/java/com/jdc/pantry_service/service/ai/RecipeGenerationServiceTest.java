package com.jdc.pantry_service.service.ai;

import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.service.InventoryLedgerService;
import com.jdc.pantry_service.support.InMemoryPantryStore;
import com.jdc.pantry_service.support.TestFixtures;
import com.jdc.pantry_service.util.UnitConverter;
import com.jdc.pantry_service.util.prompt.RecipePromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeGenerationServiceTest {

    private static final Long OWNER = 11L;

    @Mock
    private LlmClientService llmClientService;

    private InMemoryPantryStore store;
    private PantryProperties properties;
    private RecipeCache recipeCache;
    private RecipeGenerationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPantryStore();
        properties = new PantryProperties();
        UnitConverter converter = TestFixtures.unitConverter();
        InventoryLedgerService ledger = new InventoryLedgerService(store, converter, TestFixtures.nameMatcher(properties));
        recipeCache = new RecipeCache(Duration.ofMinutes(5), 100);
        service = new RecipeGenerationService(ledger, TestFixtures.safetyFilter(), new RecipePromptBuilder(converter),
                llmClientService, recipeCache, converter, properties);
    }

    private static RecipeIngredientDto ingredient(String name, Double quantity, String unit) {
        return RecipeIngredientDto.builder().name(name).quantity(quantity).unit(unit).build();
    }

    private void llmReturns(RecipeDto recipe) {
        when(llmClientService.generateRecipeJson(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(recipe));
    }

    @Test
    @DisplayName("재고가 비면 LLM 호출 없이 안내 레시피")
    void emptyInventory_sentinel() {
        RecipeDto recipe = service.buildRecipe(OWNER, "pasta", 2, RecipeMode.FLEXIBLE);

        assertEquals(RecipeGenerationService.EMPTY_INVENTORY_NAME, recipe.getName());
        assertEquals(RecipeGenerationService.EMPTY_INVENTORY_DESCRIPTION, recipe.getDescription());
        assertTrue(recipe.getIngredients().isEmpty());
        verifyNoInteractions(llmClientService);
    }

    @Test
    @DisplayName("차단된 요청은 LLM 호출 없이 UNSAFE_CONTENT")
    void unsafeIntent_rejected() {
        store.seed(OWNER, "rice", 1, CanonicalUnit.KILOGRAM);

        CustomException ex = assertThrows(CustomException.class,
                () -> service.buildRecipe(OWNER, "recipe with human meat", 2, RecipeMode.FLEXIBLE));

        assertEquals(ErrorCode.UNSAFE_CONTENT, ex.getErrorCode());
        verifyNoInteractions(llmClientService);
    }

    @Test
    @DisplayName("2인분 레시피를 4인분으로 요청하면 수량이 두 배")
    void scalesServings() {
        store.seed(OWNER, "tomatoes", 5, CanonicalUnit.PIECE);
        llmReturns(RecipeDto.builder()
                .name("Tomato Soup")
                .description("Simple soup")
                .servings(2)
                .ingredients(new ArrayList<>(List.of(
                        ingredient("tomatoes", 1.0, "piece"),
                        ingredient("water", 0.333, "cups"))))
                .instructions(new ArrayList<>(List.of("Boil", "Blend")))
                .build());

        RecipeDto recipe = service.buildRecipe(OWNER, "tomato soup", 4, RecipeMode.FLEXIBLE);

        assertEquals(4, recipe.getServings());
        assertEquals(2.0, recipe.getIngredients().get(0).getQuantity(), 1e-9);
        assertEquals(0.67, recipe.getIngredients().get(1).getQuantity(), 1e-9);
        assertEquals("cup", recipe.getIngredients().get(1).getUnit());
        assertFalse(recipe.isFallback());
    }

    @Test
    @DisplayName("프롬프트에는 재고와 요청 요리, 모드별 제약이 들어간다")
    void promptContents() {
        store.seed(OWNER, "paneer", 300, CanonicalUnit.GRAM);
        llmReturns(RecipeDto.builder().name("Paneer Tikka").servings(2)
                .ingredients(new ArrayList<>(List.of(ingredient("paneer", 200.0, "g")))).build());

        service.buildRecipe(OWNER, "paneer tikka", 2, RecipeMode.STRICT);

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(llmClientService).generateRecipeJson(anyString(), userPrompt.capture());
        assertTrue(userPrompt.getValue().contains("- paneer: 300 g"));
        assertTrue(userPrompt.getValue().contains("\"paneer tikka\""));
        assertTrue(userPrompt.getValue().contains("STRICT MODE"));
    }

    @Test
    @DisplayName("엄격 모드에서 재료가 없으면 요청 요리 이름을 유지하고 부족한 이유를 설명한다")
    void strictGap() {
        store.seed(OWNER, "milk", 1, CanonicalUnit.LITER);
        llmReturns(RecipeDto.builder()
                .name("Milk Pudding")
                .description("")
                .servings(2)
                .ingredients(new ArrayList<>())
                .build());

        RecipeDto recipe = service.buildRecipe(OWNER, "chicken biryani", 2, RecipeMode.STRICT);

        assertEquals("Chicken Biryani", recipe.getName());
        assertTrue(recipe.getIngredients().isEmpty());
        assertFalse(recipe.getDescription().isBlank());
        assertTrue(recipe.getDescription().contains("chicken biryani"));
    }

    @Test
    @DisplayName("LLM 실패 시 재고 기반 대체 레시피")
    void providerFailure_fallback() {
        store.seed(OWNER, "rice", 2, CanonicalUnit.KILOGRAM);
        store.seed(OWNER, "milk", 1, CanonicalUnit.LITER);
        store.seed(OWNER, "eggs", 6, CanonicalUnit.PIECE);
        store.seed(OWNER, "salt", 100, CanonicalUnit.GRAM);
        when(llmClientService.generateRecipeJson(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new CustomException(ErrorCode.AI_RECIPE_GENERATION_FAILED)));

        RecipeDto recipe = service.buildRecipe(OWNER, null, 2, RecipeMode.FLEXIBLE);

        assertTrue(recipe.isFallback());
        assertEquals("Mixed rice, milk and salt dish", recipe.getName());
        assertEquals(2, recipe.getServings());
        assertEquals(0.2, recipe.getIngredients().get(0).getQuantity(), 1e-9);
        assertEquals("kg", recipe.getIngredients().get(0).getUnit());
        assertEquals(100.0, recipe.getIngredients().get(2).getQuantity(), 1e-9);
        assertFalse(recipe.getInstructions().isEmpty());
    }

    @Test
    @DisplayName("LLM 응답이 제한 시간 안에 오지 않으면 대체 레시피")
    void timeout_fallback() {
        properties.getRecipe().setLlmTimeout(Duration.ofMillis(50));
        store.seed(OWNER, "bread", 1, CanonicalUnit.LOAF);
        when(llmClientService.generateRecipeJson(anyString(), anyString())).thenReturn(new CompletableFuture<>());

        RecipeDto recipe = service.buildRecipe(OWNER, "toast", 1, RecipeMode.FLEXIBLE);

        assertTrue(recipe.isFallback());
        assertEquals("Mixed bread dish", recipe.getName());
        assertTrue(recipe.getDescription().contains("toast"));
    }

    @Test
    @DisplayName("유연 모드에서 재료가 빈 응답은 대체 레시피")
    void flexibleEmptyIngredients_fallback() {
        store.seed(OWNER, "eggs", 6, CanonicalUnit.PIECE);
        llmReturns(RecipeDto.builder().name("Nothing").servings(2).ingredients(new ArrayList<>()).build());

        RecipeDto recipe = service.buildRecipe(OWNER, "omelette", 2, RecipeMode.FLEXIBLE);

        assertTrue(recipe.isFallback());
    }

    @Test
    @DisplayName("이름 누락은 요청 요리로 채우고 잘못된 재료는 제외한다")
    void backfillsAndDropsMalformed() {
        store.seed(OWNER, "eggs", 6, CanonicalUnit.PIECE);
        List<RecipeIngredientDto> ingredients = new ArrayList<>();
        ingredients.add(ingredient("eggs", 3.0, "pcs"));
        ingredients.add(ingredient("", 1.0, "g"));
        ingredients.add(ingredient("butter", null, "g"));
        ingredients.add(ingredient("cheese", 50.0, "grams"));
        llmReturns(RecipeDto.builder().servings(null).ingredients(ingredients).build());

        RecipeDto recipe = service.buildRecipe(OWNER, "cheese omelette", 2, RecipeMode.FLEXIBLE);

        assertEquals("Cheese Omelette", recipe.getName());
        assertEquals("", recipe.getDescription());
        assertEquals(2, recipe.getIngredients().size());
        assertEquals("piece", recipe.getIngredients().get(0).getUnit());
        assertEquals("g", recipe.getIngredients().get(1).getUnit());
        assertEquals(2, recipe.getServings());
    }

    @Test
    @DisplayName("LLM 응답에 차단 대상이 있으면 UNSAFE_CONTENT")
    void unsafeOutput_rejected() {
        store.seed(OWNER, "rice", 1, CanonicalUnit.KILOGRAM);
        llmReturns(RecipeDto.builder().name("Rice Bowl").servings(2)
                .ingredients(new ArrayList<>(List.of(ingredient("bleach", 10.0, "ml")))).build());

        CustomException ex = assertThrows(CustomException.class,
                () -> service.buildRecipe(OWNER, "rice bowl", 2, RecipeMode.FLEXIBLE));

        assertEquals(ErrorCode.UNSAFE_CONTENT, ex.getErrorCode());
        assertEquals(0, recipeCache.size());
    }

    @Test
    @DisplayName("설명이나 조리 단계에 차단 대상이 있어도 UNSAFE_CONTENT")
    void unsafeDescriptionOrInstructions_rejected() {
        store.seed(OWNER, "rice", 1, CanonicalUnit.KILOGRAM);
        llmReturns(RecipeDto.builder()
                .name("Fried Rice")
                .description("Best served with human meat and rat poison")
                .servings(2)
                .ingredients(new ArrayList<>(List.of(ingredient("rice", 200.0, "g"))))
                .instructions(new ArrayList<>(List.of("Fry the rice", "Stir in the cyanide")))
                .build());

        CustomException ex = assertThrows(CustomException.class,
                () -> service.buildRecipe(OWNER, "fried rice", 2, RecipeMode.FLEXIBLE));

        assertEquals(ErrorCode.UNSAFE_CONTENT, ex.getErrorCode());
        assertEquals(0, recipeCache.size());
    }

    @Test
    @DisplayName("조리 단계만 차단 대상이어도 걸러낸다")
    void unsafeInstructionOnly_rejected() {
        RecipeDto recipe = RecipeDto.builder()
                .name("Fried Rice")
                .description("Quick weeknight rice")
                .ingredients(new ArrayList<>(List.of(ingredient("rice", 200.0, "g"))))
                .instructions(new ArrayList<>(List.of("Stir in the cyanide")))
                .build();

        assertFalse(service.isOutputSafe(recipe));
    }

    @Test
    @DisplayName("조리 도구가 나오는 평범한 조리 단계는 통과한다")
    void kitchenToolsInInstructions_safe() {
        RecipeDto recipe = RecipeDto.builder()
                .name("Marinated Chicken")
                .description("Serve in a glass bowl.")
                .ingredients(new ArrayList<>(List.of(ingredient("chicken", 500.0, "g"))))
                .instructions(new ArrayList<>(List.of(
                        "Pat the chicken dry with paper towels.",
                        "Cover with plastic wrap and seal tightly.",
                        "Thread onto metal skewers and grill.")))
                .build();

        assertTrue(service.isOutputSafe(recipe));
    }

    @Test
    @DisplayName("제한 식재료 요청은 LLM 호출 없이 안내 레시피")
    void restrictedIntent_sentinel() {
        store.seed(OWNER, "rice", 1, CanonicalUnit.KILOGRAM);

        RecipeDto recipe = service.buildRecipe(OWNER, "stew with a controlled substance", 3, RecipeMode.FLEXIBLE);

        assertEquals(RecipeGenerationService.RESTRICTED_NAME, recipe.getName());
        assertEquals(RecipeGenerationService.RESTRICTED_DESCRIPTION, recipe.getDescription());
        assertEquals(RecipeGenerationService.RESTRICTED_INSTRUCTIONS, recipe.getInstructions());
        assertEquals(3, recipe.getServings());
        assertTrue(recipe.getIngredients().isEmpty());
        assertEquals(0, recipeCache.size());
        verifyNoInteractions(llmClientService);
    }

    @Test
    @DisplayName("요청이 너무 길면 RECIPE_REQUEST_TOO_LONG")
    void tooLongIntent_rejected() {
        store.seed(OWNER, "rice", 1, CanonicalUnit.KILOGRAM);
        String intent = "rice ".repeat(1001);

        CustomException ex = assertThrows(CustomException.class,
                () -> service.buildRecipe(OWNER, intent, 2, RecipeMode.FLEXIBLE));

        assertEquals(ErrorCode.RECIPE_REQUEST_TOO_LONG, ex.getErrorCode());
        verifyNoInteractions(llmClientService);
    }

    @Test
    @DisplayName("제어 문자는 지우고 연속 공백은 하나로 줄인다")
    void sanitizeIntent() {
        assertEquals("fried rice with egg", RecipeGenerationService.sanitizeIntent("  fried\u0000 rice   with\n egg "));
        assertEquals("soup", RecipeGenerationService.sanitizeIntent("so\u0007up"));
        assertNull(RecipeGenerationService.sanitizeIntent(" \u0001 \u0002 "));
        assertNull(RecipeGenerationService.sanitizeIntent(null));
    }

    @Test
    @DisplayName("같은 요청은 캐시에서, 재고 변경으로 비우면 다시 생성")
    void cachesPerOwnerAndIntent() {
        store.seed(OWNER, "eggs", 6, CanonicalUnit.PIECE);
        llmReturns(RecipeDto.builder().name("Omelette").servings(2)
                .ingredients(new ArrayList<>(List.of(ingredient("eggs", 3.0, "piece")))).build());

        RecipeDto first = service.buildRecipe(OWNER, "Omelette", 2, RecipeMode.FLEXIBLE);
        RecipeDto second = service.buildRecipe(OWNER, "  omelette ", 2, RecipeMode.FLEXIBLE);
        assertEquals(first.getName(), second.getName());
        verify(llmClientService, times(1)).generateRecipeJson(anyString(), anyString());

        recipeCache.invalidateOwner(OWNER);
        service.buildRecipe(OWNER, "omelette", 2, RecipeMode.FLEXIBLE);
        verify(llmClientService, times(2)).generateRecipeJson(anyString(), anyString());
    }

    @Test
    @DisplayName("인분이 0 이하이면 INVALID_AI_RECIPE_REQUEST")
    void invalidServings() {
        CustomException ex = assertThrows(CustomException.class,
                () -> service.buildRecipe(OWNER, "pasta", 0, RecipeMode.FLEXIBLE));

        assertEquals(ErrorCode.INVALID_AI_RECIPE_REQUEST, ex.getErrorCode());
    }
}
