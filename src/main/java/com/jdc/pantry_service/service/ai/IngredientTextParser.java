package com.jdc.pantry_service.service.ai;

import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.inventory.ParsedIngredientDto;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.util.IngredientNameMatcher;
import com.jdc.pantry_service.util.QuantityParser;
import com.jdc.pantry_service.util.UnitConverter;
import com.jdc.pantry_service.util.prompt.RecipePromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * "2 kg tomatoes" 같은 자유 입력을 {quantity, unit, item_name} 으로 해석한다.
 * LLM 을 먼저 시도하고, 실패하거나 결과가 이상하면 규칙 기반 파서로 처리한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngredientTextParser {

    private final LlmClientService llmClientService;
    private final RecipePromptBuilder promptBuilder;
    private final UnitConverter unitConverter;
    private final PantryProperties properties;

    public ParsedIngredientDto parse(String text) {
        String normalized = IngredientNameMatcher.normalize(text);
        if (normalized.isEmpty()) {
            throw new CustomException(ErrorCode.MISSING_INGREDIENT_NAME);
        }

        Optional<ParsedIngredientDto> fromLlm = parseWithLlm(normalized);
        if (fromLlm.isPresent()) {
            return fromLlm.get();
        }
        return parseWithRules(normalized);
    }

    private Optional<ParsedIngredientDto> parseWithLlm(String text) {
        try {
            ParsedIngredientDto parsed = llmClientService
                    .parseIngredient(promptBuilder.parseSystemPrompt(), promptBuilder.buildParsePrompt(text))
                    .get(properties.getRecipe().getLlmTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (parsed == null || parsed.getItemName() == null || parsed.getItemName().isBlank()) {
                log.debug("[재료파싱] LLM 결과에 이름 없음, 규칙 파서 사용");
                return Optional.empty();
            }
            double quantity = parsed.getQuantity() == null || !(parsed.getQuantity() > 0) ? 1.0 : parsed.getQuantity();
            return Optional.of(ParsedIngredientDto.builder()
                    .itemName(IngredientNameMatcher.normalize(parsed.getItemName()))
                    .quantity(quantity)
                    .unit(unitConverter.normalizeUnit(parsed.getUnit()).getSymbol())
                    .build());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.debug("[재료파싱] LLM 파싱 실패, 규칙 파서 사용: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * "5 kg tomatoes", "3 bags of rice", "5 tomatoes", "5kg tomatoes", "tomatoes 5 kg", "tomatoes"
     */
    ParsedIngredientDto parseWithRules(String text) {
        List<String> tokens = new ArrayList<>();
        for (String raw : text.replaceAll("[,;!?]", " ").trim().split("\\s+")) {
            Optional<String[]> split = QuantityParser.splitNumberAndUnit(raw);
            if (split.isPresent() && unitConverter.findUnit(split.get()[1]).isPresent()) {
                tokens.addAll(Arrays.asList(split.get()));
            } else {
                tokens.add(raw);
            }
        }

        Optional<Double> leading = QuantityParser.parse(tokens.get(0));
        if (leading.isPresent() && tokens.size() > 1) {
            return build(tokens.subList(1, tokens.size()), leading.get());
        }

        // 뒤쪽 수량: "tomatoes 5 kg" / "tomatoes 5"
        for (int i = tokens.size() - 1; i > 0; i--) {
            Optional<Double> trailing = QuantityParser.parse(tokens.get(i));
            if (trailing.isPresent()) {
                List<String> unitPart = tokens.subList(i + 1, tokens.size());
                Optional<CanonicalUnit> unit = unitPart.isEmpty()
                        ? Optional.empty()
                        : unitConverter.findUnit(String.join(" ", unitPart));
                if (unitPart.isEmpty() || unit.isPresent()) {
                    return ParsedIngredientDto.builder()
                            .itemName(String.join(" ", tokens.subList(0, i)))
                            .quantity(trailing.get())
                            .unit(unit.orElse(UnitConverter.FALLBACK_UNIT).getSymbol())
                            .build();
                }
            }
        }

        return ParsedIngredientDto.builder()
                .itemName(String.join(" ", tokens))
                .quantity(1.0)
                .unit(UnitConverter.FALLBACK_UNIT.getSymbol())
                .build();
    }

    private ParsedIngredientDto build(List<String> rest, double quantity) {
        int index = 0;
        CanonicalUnit unit = UnitConverter.FALLBACK_UNIT;

        if (rest.size() > 2) {
            Optional<CanonicalUnit> twoWord = unitConverter.findUnit(rest.get(0) + " " + rest.get(1));
            if (twoWord.isPresent()) {
                unit = twoWord.get();
                index = 2;
            }
        }
        if (index == 0 && rest.size() > 1) {
            Optional<CanonicalUnit> oneWord = unitConverter.findUnit(rest.get(0));
            if (oneWord.isPresent()) {
                unit = oneWord.get();
                index = 1;
            }
        }
        if (index < rest.size() && rest.get(index).equals("of")) {
            index++;
        }
        String name = String.join(" ", rest.subList(index, rest.size()));
        if (name.isEmpty()) {
            throw new CustomException(ErrorCode.MISSING_INGREDIENT_NAME);
        }
        return ParsedIngredientDto.builder()
                .itemName(name)
                .quantity(quantity)
                .unit(unit.getSymbol())
                .build();
    }
}
