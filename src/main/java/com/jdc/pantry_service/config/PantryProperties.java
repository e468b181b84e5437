package com.jdc.pantry_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "pantry")
@Getter @Setter
public class PantryProperties {

    private Ledger ledger = new Ledger();
    private Recipe recipe = new Recipe();

    @Getter @Setter
    public static class Ledger {
        /** 정규화 편집거리(거리 / 긴 쪽 길이) 허용 상한 */
        private double fuzzyThreshold = 0.2;
        /** 이 수량 이하이면 재구매 추천 대상 */
        private double lowStockThreshold = 1.0;
    }

    @Getter @Setter
    public static class Recipe {
        private int defaultServings = 4;
        private Duration llmTimeout = Duration.ofSeconds(45);
        private Duration cacheTtl = Duration.ofMinutes(30);
        private long cacheMaxSize = 500;
        /** 대체 레시피에 넣을 최대 재료 수 */
        private int fallbackItemCount = 3;
        private int maxIntentLength = 5000;
    }
}
