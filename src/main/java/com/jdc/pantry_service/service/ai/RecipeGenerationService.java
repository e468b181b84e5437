package com.jdc.pantry_service.service.ai;

import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.domain.type.UnitClass;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.service.InventoryLedgerService;
import com.jdc.pantry_service.util.ContentSafetyFilter;
import com.jdc.pantry_service.util.UnitConverter;
import com.jdc.pantry_service.util.prompt.RecipePromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 재고 기반 레시피 생성.
 *
 * 1. 요청 문구 정리, 길이 제한, 안전 검사 (차단 시 UNSAFE_CONTENT)
 * 2. 제한 식재료 요청이거나 재고가 비었으면 LLM 호출 없이 안내 레시피
 * 3. 캐시 조회 → 프롬프트 → LLM (대기 시간 제한)
 * 4. 응답 검증/보정 → 인분 스케일링 → 응답 안전 검사 → 캐시 저장
 * LLM 단계가 실패하면 재고만으로 만든 대체 레시피를 돌려준다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeGenerationService {

    static final String EMPTY_INVENTORY_NAME = "No ingredients available";
    static final String EMPTY_INVENTORY_DESCRIPTION = "Please add some ingredients to your inventory first.";
    static final String UNTITLED = "Untitled Recipe";
    static final String RESTRICTED_NAME = "Recipe Not Available";
    static final String RESTRICTED_DESCRIPTION = "I apologize, but I don't have access to recipes involving restricted "
            + "or illegal food items. I can help you find delicious and safe recipes using commonly available ingredients instead.";
    static final List<String> RESTRICTED_INSTRUCTIONS = List.of(
            "I'm unable to provide recipes for restricted or illegal food items.",
            "Would you like me to suggest an alternative recipe using safe, legal ingredients?",
            "I can help you find recipes based on your dietary preferences and available ingredients.");

    private final InventoryLedgerService ledgerService;
    private final ContentSafetyFilter safetyFilter;
    private final RecipePromptBuilder promptBuilder;
    private final LlmClientService llmClientService;
    private final RecipeCache recipeCache;
    private final UnitConverter unitConverter;
    private final PantryProperties properties;

    public RecipeDto buildRecipe(Long ownerId, String intent, Integer servings, RecipeMode mode) {
        int requestedServings = servings == null ? properties.getRecipe().getDefaultServings() : servings;
        if (requestedServings <= 0) {
            throw new CustomException(ErrorCode.INVALID_AI_RECIPE_REQUEST, "인분은 1 이상이어야 합니다: " + servings);
        }
        RecipeMode recipeMode = mode == null ? RecipeMode.FLEXIBLE : mode;
        String dish = sanitizeIntent(intent);
        if (dish != null && dish.length() > properties.getRecipe().getMaxIntentLength()) {
            throw new CustomException(ErrorCode.RECIPE_REQUEST_TOO_LONG, "요청 길이 초과: " + dish.length());
        }

        if (dish != null && !safetyFilter.isSafe(dish)) {
            throw new CustomException(ErrorCode.UNSAFE_CONTENT, "레시피 요청 차단: owner=" + ownerId);
        }
        if (dish != null && safetyFilter.isRestricted(dish)) {
            log.info("[레시피] 제한 식재료 요청, 안내 레시피 반환: owner={}", ownerId);
            return RecipeDto.builder()
                    .name(RESTRICTED_NAME)
                    .description(RESTRICTED_DESCRIPTION)
                    .servings(requestedServings)
                    .instructions(new ArrayList<>(RESTRICTED_INSTRUCTIONS))
                    .build();
        }

        List<InventoryEntryDto> inventory = ledgerService.getAll(ownerId);
        if (inventory.isEmpty()) {
            log.info("[레시피] 재고 없음, 안내 레시피 반환: owner={}", ownerId);
            return RecipeDto.builder()
                    .name(EMPTY_INVENTORY_NAME)
                    .description(EMPTY_INVENTORY_DESCRIPTION)
                    .servings(requestedServings)
                    .build();
        }

        RecipeCache.Key cacheKey = RecipeCache.keyOf(ownerId, dish, requestedServings, recipeMode);
        Optional<RecipeDto> cached = recipeCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("[레시피] 캐시 적중: {}", cacheKey);
            return cached.get();
        }

        RecipeDto generated = requestFromLlm(inventory, dish, requestedServings, recipeMode);
        if (generated == null) {
            return fallbackRecipe(inventory, dish, requestedServings);
        }

        if (!isOutputSafe(generated)) {
            throw new CustomException(ErrorCode.UNSAFE_CONTENT, "LLM 응답 차단: owner=" + ownerId);
        }

        recipeCache.put(cacheKey, generated);
        return generated;
    }

    /**
     * LLM 호출부터 검증/스케일링까지. 어떤 실패든 null 을 돌려 대체 레시피로 가게 한다.
     */
    private RecipeDto requestFromLlm(List<InventoryEntryDto> inventory, String dish, int servings, RecipeMode mode) {
        String userPrompt = promptBuilder.buildRecipePrompt(inventory, dish, servings, mode);
        long timeoutMillis = properties.getRecipe().getLlmTimeout().toMillis();

        RecipeDto response;
        try {
            response = llmClientService.generateRecipeJson(promptBuilder.recipeSystemPrompt(), userPrompt)
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[레시피] LLM 대기 중 인터럽트, 대체 레시피 사용");
            return null;
        } catch (TimeoutException e) {
            log.warn("[레시피] LLM 응답 시간 초과({}ms), 대체 레시피 사용", timeoutMillis);
            return null;
        } catch (ExecutionException e) {
            log.warn("[레시피] LLM 호출 실패, 대체 레시피 사용: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("[레시피] LLM 호출 중 예외, 대체 레시피 사용: {}", e.getMessage());
            return null;
        }

        if (response == null) {
            log.warn("[레시피] LLM 응답 없음, 대체 레시피 사용");
            return null;
        }
        return validateAndScale(response, dish, servings, mode);
    }

    RecipeDto validateAndScale(RecipeDto response, String dish, int requestedServings, RecipeMode mode) {
        List<RecipeIngredientDto> ingredients = new ArrayList<>();
        if (response.getIngredients() != null) {
            for (RecipeIngredientDto ing : response.getIngredients()) {
                if (ing == null || ing.getName() == null || ing.getName().isBlank()
                        || ing.getQuantity() == null || !(ing.getQuantity() > 0)) {
                    log.debug("[레시피] 잘못된 재료 제외: {}", ing == null ? null : ing.getName());
                    continue;
                }
                ingredients.add(RecipeIngredientDto.builder()
                        .name(ing.getName().trim())
                        .quantity(ing.getQuantity())
                        .unit(unitConverter.normalizeUnit(ing.getUnit()).getSymbol())
                        .build());
            }
        }

        String name = response.getName() == null || response.getName().isBlank()
                ? (dish == null ? UNTITLED : titleCase(dish))
                : response.getName().trim();
        String description = response.getDescription() == null ? "" : response.getDescription().trim();

        if (ingredients.isEmpty()) {
            if (mode != RecipeMode.STRICT) {
                log.warn("[레시피] 재료 없는 응답, 대체 레시피 사용");
                return null;
            }
            // 엄격 모드: 다른 요리로 바꾸지 않고 부족한 이유만 설명
            if (description.isEmpty()) {
                description = "Your current inventory does not contain the ingredients needed for "
                        + (dish == null ? "this recipe" : dish) + ".";
            }
            if (dish != null) {
                name = titleCase(dish);
            }
        }

        int responseServings = response.getServings() == null || response.getServings() <= 0
                ? requestedServings
                : response.getServings();
        if (responseServings != requestedServings) {
            double factor = (double) requestedServings / responseServings;
            ingredients = ingredients.stream()
                    .map(ing -> ing.toBuilder()
                            .quantity(unitConverter.round(ing.getQuantity() * factor, 2))
                            .build())
                    .toList();
        }

        List<String> instructions = response.getInstructions() == null
                ? List.of()
                : response.getInstructions().stream().filter(s -> s != null && !s.isBlank()).toList();

        return RecipeDto.builder()
                .name(name)
                .description(description)
                .servings(requestedServings)
                .ingredients(new ArrayList<>(ingredients))
                .instructions(new ArrayList<>(instructions))
                .build();
    }

    /**
     * 재고에서 기준 단위 수량이 많은 순으로 몇 가지를 골라 "Mixed ... dish" 를 만든다.
     */
    RecipeDto fallbackRecipe(List<InventoryEntryDto> inventory, String dish, int servings) {
        int count = properties.getRecipe().getFallbackItemCount();
        List<InventoryEntryDto> picked = inventory.stream()
                .sorted(Comparator.comparingDouble(this::baseQuantity).reversed()
                        .thenComparing(InventoryEntryDto::getName))
                .limit(count)
                .toList();

        List<RecipeIngredientDto> ingredients = picked.stream()
                .map(item -> portionFor(item, servings))
                .toList();
        List<String> names = picked.stream().map(InventoryEntryDto::getName).toList();

        String description = dish == null
                ? "A simple dish made from what you have on hand."
                : "We couldn't generate \"" + dish + "\" right now, so here is a simple dish made from what you have on hand.";

        log.info("[레시피] 대체 레시피 생성: items={}", names);
        return RecipeDto.builder()
                .name("Mixed " + joinNames(names) + " dish")
                .description(description)
                .servings(servings)
                .ingredients(new ArrayList<>(ingredients))
                .instructions(new ArrayList<>(List.of(
                        "Prepare and chop the ingredients.",
                        "Cook everything together in a pan over medium heat until done.",
                        "Season to taste and serve.")))
                .fallback(true)
                .build();
    }

    /** 이름, 설명, 재료, 조리 단계 전부 검사한다 */
    public boolean isOutputSafe(RecipeDto recipe) {
        StringBuilder text = new StringBuilder(recipe.getName() == null ? "" : recipe.getName());
        if (recipe.getDescription() != null) {
            text.append(". ").append(recipe.getDescription());
        }
        if (recipe.getIngredients() != null) {
            recipe.getIngredients().forEach(i -> text.append(", ").append(i.getName()));
        }
        if (recipe.getInstructions() != null) {
            recipe.getInstructions().forEach(step -> text.append(". ").append(step));
        }
        return safetyFilter.isSafe(text.toString());
    }

    /**
     * 줄바꿈을 제외한 제어 문자를 지우고 연속 공백을 하나로 줄인다. 남는 게 없으면 null.
     */
    static String sanitizeIntent(String intent) {
        if (intent == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(intent.length());
        intent.chars()
                .filter(c -> c >= 32 || c == '\n')
                .forEach(c -> sb.append((char) c));
        String collapsed = sb.toString().trim().replaceAll("\\s+", " ");
        return collapsed.isEmpty() ? null : collapsed;
    }

    /** 1인분 = 100 g / 100 ml / 1 개, 재고를 넘지 않게 */
    private RecipeIngredientDto portionFor(InventoryEntryDto item, int servings) {
        CanonicalUnit unit = unitConverter.normalizeUnit(item.getUnit());
        double wanted;
        if (unit.getUnitClass() == UnitClass.MASS) {
            wanted = unitConverter.convert(100.0 * servings, CanonicalUnit.GRAM, unit);
        } else if (unit.getUnitClass() == UnitClass.VOLUME) {
            wanted = unitConverter.convert(100.0 * servings, CanonicalUnit.MILLILITER, unit);
        } else {
            wanted = servings;
        }
        double quantity = unitConverter.round(Math.min(wanted, item.getQuantity()), 2);
        return RecipeIngredientDto.builder()
                .name(item.getName())
                .quantity(quantity)
                .unit(unit.getSymbol())
                .build();
    }

    private double baseQuantity(InventoryEntryDto item) {
        return unitConverter.toBase(item.getQuantity(), unitConverter.normalizeUnit(item.getUnit()));
    }

    private static String joinNames(List<String> names) {
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    private static String titleCase(String text) {
        return Arrays.stream(text.trim().split("\\s+"))
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1))
                .collect(Collectors.joining(" "));
    }
}
