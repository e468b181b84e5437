package com.jdc.pantry_service.service.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.inventory.ParsedIngredientDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LlmClientServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private LlmClientService clientReturning(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
        WebClient webClient = WebClient.builder()
                .baseUrl("http://llm.test/v1")
                .exchangeFunction(exchange)
                .build();
        return new LlmClientService(webClient, objectMapper, new PantryProperties(), "recipe-model", "parse-model");
    }

    private String completion(String content) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }

    private static CustomException causeOf(CompletionException ex) {
        assertInstanceOf(CustomException.class, ex.getCause());
        return (CustomException) ex.getCause();
    }

    @Test
    @DisplayName("chat/completions 로 요청하고 content 의 JSON 을 레시피로 파싱한다")
    void generateRecipeJson_success() throws Exception {
        String content = "{\"name\":\"Tomato Soup\",\"description\":\"warm\",\"servings\":2,"
                + "\"ingredients\":[{\"name\":\"tomatoes\",\"quantity\":4,\"unit\":\"piece\"}],"
                + "\"instructions\":[\"Boil\"],\"extra\":\"ignored\"}";
        LlmClientService client = clientReturning(HttpStatus.OK, completion(content));

        RecipeDto recipe = client.generateRecipeJson("system", "user").join();

        assertEquals("Tomato Soup", recipe.getName());
        assertEquals(2, recipe.getServings());
        assertEquals(4.0, recipe.getIngredients().get(0).getQuantity());
        assertEquals(HttpMethod.POST, lastRequest.get().method());
        assertEquals("/v1/chat/completions", lastRequest.get().url().getPath());
    }

    @Test
    @DisplayName("코드 펜스와 service_response 래퍼를 벗겨낸다")
    void generateRecipeJson_unwraps() throws Exception {
        String content = "```json\n{\"service_response\":{\"name\":\"Omelette\",\"servings\":1,"
                + "\"ingredients\":[{\"name\":\"eggs\",\"quantity\":\"\",\"unit\":\"piece\"}]}}\n```";
        LlmClientService client = clientReturning(HttpStatus.OK, completion(content));

        RecipeDto recipe = client.generateRecipeJson("system", "user").join();

        assertEquals("Omelette", recipe.getName());
        assertNull(recipe.getIngredients().get(0).getQuantity());
    }

    @Test
    @DisplayName("choices 가 비어 있으면 AI_RESPONSE_INVALID")
    void generateRecipeJson_emptyChoices() {
        LlmClientService client = clientReturning(HttpStatus.OK, "{\"choices\":[]}");

        CompletionException ex = assertThrows(CompletionException.class,
                () -> client.generateRecipeJson("system", "user").join());

        assertEquals(ErrorCode.AI_RESPONSE_INVALID, causeOf(ex).getErrorCode());
    }

    @Test
    @DisplayName("content 가 JSON 이 아니면 AI_RESPONSE_INVALID")
    void generateRecipeJson_invalidJson() throws Exception {
        LlmClientService client = clientReturning(HttpStatus.OK, completion("Sorry, I can't help with that."));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> client.generateRecipeJson("system", "user").join());

        assertEquals(ErrorCode.AI_RESPONSE_INVALID, causeOf(ex).getErrorCode());
    }

    @Test
    @DisplayName("HTTP 오류 응답은 AI_RECIPE_GENERATION_FAILED")
    void generateRecipeJson_httpError() {
        LlmClientService client = clientReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}");

        CompletionException ex = assertThrows(CompletionException.class,
                () -> client.generateRecipeJson("system", "user").join());

        assertEquals(ErrorCode.AI_RECIPE_GENERATION_FAILED, causeOf(ex).getErrorCode());
    }

    @Test
    @DisplayName("재료 파싱 스키마 {quantity, unit, item_name}")
    void parseIngredient_success() throws Exception {
        LlmClientService client = clientReturning(HttpStatus.OK,
                completion("{\"quantity\": 2, \"unit\": \"kg\", \"item_name\": \"tomatoes\"}"));

        ParsedIngredientDto parsed = client.parseIngredient("system", "2 kg tomatoes").join();

        assertEquals(2.0, parsed.getQuantity());
        assertEquals("kg", parsed.getUnit());
        assertEquals("tomatoes", parsed.getItemName());
    }
}
