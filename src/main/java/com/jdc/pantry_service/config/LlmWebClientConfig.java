package com.jdc.pantry_service.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Slf4j
public class LlmWebClientConfig {

    @Value("${ai.llm.api-key:}")
    private String apiKey;

    @Value("${ai.llm.base-url}")
    private String baseUrl;

    @Bean("llmWebClient")
    public WebClient llmWebClient() {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @PostConstruct
    public void validateApiKey() {
        // 키가 없으면 LLM 호출은 실패하고 재고 기반 대체 레시피로 응답한다
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("ai.llm.api-key 가 비어 있습니다. 레시피 생성은 대체 레시피로 동작합니다.");
        }
    }
}
