package com.jdc.pantry_service.service.ai;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.pantry_service.domain.type.RecipeMode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 생성된 레시피 캐시. 키는 (사용자, 정규화된 요청, 인분, 모드).
 * 재고가 바뀌면 해당 사용자 항목을 모두 비운다.
 */
public class RecipeCache {

    public record Key(Long ownerId, String normalizedIntent, int servings, RecipeMode mode) {
    }

    private final Cache<Key, RecipeDto> cache;

    public RecipeCache(Duration ttl, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public static Key keyOf(Long ownerId, String intent, int servings, RecipeMode mode) {
        String normalized = intent == null ? "" : intent.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return new Key(ownerId, normalized, servings, mode);
    }

    /** 호출자가 고쳐도 캐시 항목은 그대로 남도록 복사본을 돌려준다 */
    public Optional<RecipeDto> get(Key key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(RecipeCache::copyOf);
    }

    public void put(Key key, RecipeDto recipe) {
        cache.put(key, copyOf(recipe));
    }

    public void invalidateOwner(Long ownerId) {
        cache.asMap().keySet().removeIf(k -> k.ownerId().equals(ownerId));
    }

    private static RecipeDto copyOf(RecipeDto recipe) {
        List<RecipeIngredientDto> ingredients = recipe.getIngredients() == null
                ? new ArrayList<>()
                : recipe.getIngredients().stream()
                        .map(i -> i == null ? null : i.toBuilder().build())
                        .collect(Collectors.toCollection(ArrayList::new));
        List<String> instructions = recipe.getInstructions() == null
                ? new ArrayList<>()
                : new ArrayList<>(recipe.getInstructions());
        return recipe.toBuilder()
                .ingredients(ingredients)
                .instructions(instructions)
                .build();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
