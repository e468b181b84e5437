package com.jdc.pantry_service.service.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.inventory.ParsedIngredientDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * OpenAI 호환 /chat/completions 엔드포인트 클라이언트.
 * 응답은 JSON 모드로 받고, 실패는 모두 AI_RECIPE_GENERATION_FAILED 로 감싸서 호출자가 대체 경로로 가게 한다.
 */
@Service
@Slf4j
public class LlmClientService {

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final String recipeModelName;
    private final String parseModelName;

    public LlmClientService(@Qualifier("llmWebClient") WebClient client,
                            ObjectMapper objectMapper,
                            PantryProperties properties,
                            @Value("${ai.llm.model.recipe:gpt-4o-mini}") String recipeModelName,
                            @Value("${ai.llm.model.parse:gpt-4o-mini}") String parseModelName) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.timeout = properties.getRecipe().getLlmTimeout();
        this.recipeModelName = recipeModelName;
        this.parseModelName = parseModelName;
    }

    @Retry(name = "aiGenerate", fallbackMethod = "fallbackGenerate")
    @CircuitBreaker(name = "aiGenerate", fallbackMethod = "fallbackGenerate")
    @TimeLimiter(name = "aiGenerate", fallbackMethod = "fallbackGenerate")
    public CompletableFuture<RecipeDto> generateRecipeJson(String systemContent, String userContent) {
        log.info("LLM 레시피 생성 호출");

        return callLlmApi(recipeModelName, systemContent, userContent, 2000, 0.4)
                .flatMap(jsonString -> {
                    try {
                        JsonNode rootNode = objectMapper.readTree(normalizeFields(jsonString));
                        JsonNode targetNode = rootNode;

                        if (rootNode.has("service_response")) {
                            targetNode = rootNode.get("service_response");
                            log.debug("감지됨: wrapper 구조 (service_response 추출)");
                        }
                        if (!targetNode.isObject()) {
                            return Mono.error(new CustomException(ErrorCode.AI_RESPONSE_INVALID, "레시피 JSON 이 객체가 아님"));
                        }

                        return Mono.just(objectMapper.treeToValue(targetNode, RecipeDto.class));
                    } catch (Exception e) {
                        log.error("레시피 DTO 파싱 실패. JSON: {}", jsonString);
                        return Mono.error(new CustomException(ErrorCode.AI_RESPONSE_INVALID, "JSON 파싱 실패: " + e.getMessage(), e));
                    }
                })
                .toFuture();
    }

    @Retry(name = "aiGenerate", fallbackMethod = "fallbackParse")
    @CircuitBreaker(name = "aiGenerate", fallbackMethod = "fallbackParse")
    @TimeLimiter(name = "aiGenerate", fallbackMethod = "fallbackParse")
    public CompletableFuture<ParsedIngredientDto> parseIngredient(String systemContent, String userContent) {
        log.info("LLM 재료 파싱 호출");

        return callLlmApi(parseModelName, systemContent, userContent, 200, 0.0)
                .flatMap(jsonString -> {
                    try {
                        ParsedIngredientDto parsed = objectMapper.readValue(normalizeFields(jsonString), ParsedIngredientDto.class);
                        return Mono.just(parsed);
                    } catch (Exception e) {
                        return Mono.error(new CustomException(ErrorCode.AI_RESPONSE_INVALID, "재료 파싱 결과 해석 실패", e));
                    }
                })
                .toFuture();
    }

    private Mono<String> callLlmApi(String model, String systemContent, String userContent, int maxTokens, double temperature) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "temperature", temperature,
                "max_tokens", maxTokens,
                "messages", List.of(
                        Map.of("role", "system", "content", systemContent),
                        Map.of("role", "user", "content", userContent)
                ),
                "response_format", Map.of("type", "json_object")
        );

        return client.post()
                .uri("/chat/completions")
                .bodyValue(requestBody)
                .retrieve()
                .onStatus(
                        status -> status.is4xxClientError() || status.is5xxServerError(),
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> {
                                    log.error("LLM API 오류: Status={}, Body={}", response.statusCode(), body);
                                    return Mono.error(new CustomException(ErrorCode.AI_RECIPE_GENERATION_FAILED, "LLM API 호출 실패"));
                                })
                )
                .bodyToMono(String.class)
                .timeout(timeout)
                .doOnError(WebClientResponseException.class, e ->
                        log.error("WebClient 오류: status={}, body={}", e.getStatusCode(), e.getResponseBodyAsString())
                )
                .flatMap(this::extractContentString);
    }

    private Mono<String> extractContentString(String rawJsonResponse) {
        return Mono.fromCallable(() -> {
            if (rawJsonResponse == null || rawJsonResponse.trim().isEmpty()) {
                throw new CustomException(ErrorCode.AI_RESPONSE_INVALID, "LLM 응답이 비어 있습니다.");
            }
            try {
                Map<String, Object> responseMap = objectMapper.readValue(rawJsonResponse, new TypeReference<>() {});
                List<Map<String, Object>> choices = (List<Map<String, Object>>) responseMap.get("choices");

                if (choices == null || choices.isEmpty()) {
                    throw new CustomException(ErrorCode.AI_RESPONSE_INVALID, "LLM 응답에 choices가 없습니다.");
                }

                Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
                Object content = message == null ? null : message.get("content");
                if (content == null) {
                    throw new CustomException(ErrorCode.AI_RESPONSE_INVALID, "LLM 응답에 content가 없습니다.");
                }
                String text = content.toString();

                log.debug("응답 content 앞 200자: {}", text.substring(0, Math.min(200, text.length())));

                return text.replaceAll("(?s)```json\\s*", "")
                        .replaceAll("(?s)```\\s*", "")
                        .trim();

            } catch (CustomException e) {
                throw e;
            } catch (Exception e) {
                log.error("JSON 추출 실패", e);
                throw new CustomException(ErrorCode.AI_RESPONSE_INVALID, "LLM 응답 처리 중 오류", e);
            }
        });
    }

    private CompletableFuture<RecipeDto> fallbackGenerate(String system, String user, Throwable ex) {
        log.error("LLM Fallback (Recipe): {}", ex.getMessage());
        return CompletableFuture.failedFuture(new CustomException(ErrorCode.AI_RECIPE_GENERATION_FAILED, "AI 생성 실패 (Fallback)", ex));
    }

    private CompletableFuture<ParsedIngredientDto> fallbackParse(String system, String user, Throwable ex) {
        log.warn("LLM Fallback (Parse): {}", ex.getMessage());
        return CompletableFuture.failedFuture(new CustomException(ErrorCode.AI_RECIPE_GENERATION_FAILED, "AI 파싱 실패 (Fallback)", ex));
    }

    /** 빈 문자열 수치는 null 로 바꿔 검증 단계에서 걸러지게 한다 */
    private String normalizeFields(String json) {
        return json.replaceAll("\"(quantity|servings)\"\\s*:\\s*\"\\s*\"", "\"$1\": null");
    }
}
