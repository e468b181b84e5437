package com.jdc.pantry_service.config;

import com.jdc.pantry_service.service.ai.RecipeCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /**
     * 생성된 레시피 캐시. 빌더가 직접 들고 있지 않고 주입받는다.
     */
    @Bean
    public RecipeCache recipeCache(PantryProperties properties) {
        PantryProperties.Recipe recipe = properties.getRecipe();
        return new RecipeCache(recipe.getCacheTtl(), recipe.getCacheMaxSize());
    }
}
