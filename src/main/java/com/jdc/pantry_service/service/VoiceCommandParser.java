package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.command.AddCommand;
import com.jdc.pantry_service.domain.dto.command.AssistantCommand;
import com.jdc.pantry_service.domain.dto.command.GenerateRecipeCommand;
import com.jdc.pantry_service.domain.dto.command.RemoveCommand;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.domain.type.RecipeMode;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.util.QuantityParser;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 음성/채팅 문장을 고정 규칙으로 명령으로 바꾼다. 키워드는 토큰 단위로만 비교한다.
 *
 * 레시피 키워드가 있으면 추가/삭제 키워드보다 우선한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoiceCommandParser {

    private static final Set<String> RECIPE_KEYWORDS = Set.of(
            "suggest", "recipe", "recipes", "cook", "make", "prepare", "dinner", "lunch", "breakfast",
            "biryani", "curry");
    /** 요리 이름의 일부이기도 해서 intent 에 남기는 키워드 */
    private static final Set<String> DISH_KEYWORDS = Set.of("biryani", "curry");

    private static final Set<String> ADD_KEYWORDS = Set.of(
            "add", "buy", "bought", "got", "put", "purchase", "purchased", "stock", "restock");
    private static final Set<String> REMOVE_KEYWORDS = Set.of(
            "remove", "delete", "used", "use", "finished", "ate", "consumed", "throw", "discard", "take");

    private static final Set<String> SERVING_WORDS = Set.of(
            "people", "persons", "person", "servings", "serving", "portions", "guests");
    private static final Set<String> STRICT_WORDS = Set.of("only", "strict", "strictly");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "some", "of", "to", "from", "my", "me", "i", "please", "can", "could", "you",
            "would", "will", "want", "like", "have", "has", "and", "for", "with", "in", "into", "on", "out",
            "up", "away", "inventory", "pantry", "fridge", "list", "kitchen", "what", "something", "using",
            "let", "lets", "let's", "us", "we", "today", "tonight", "all");

    private final UnitConverter unitConverter;

    public AssistantCommand parse(String text) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            throw new CustomException(ErrorCode.UNRECOGNIZED_COMMAND, "빈 음성 명령");
        }

        int recipeIndex = indexOfAny(tokens, RECIPE_KEYWORDS);
        if (recipeIndex >= 0) {
            return parseRecipe(tokens, recipeIndex);
        }
        int addIndex = indexOfAny(tokens, ADD_KEYWORDS);
        int removeIndex = indexOfAny(tokens, REMOVE_KEYWORDS);
        if (addIndex >= 0 && (removeIndex < 0 || addIndex < removeIndex)) {
            ItemPhrase item = parseItem(tokens, addIndex);
            return new AddCommand(item.name(), item.quantity(), item.unit());
        }
        if (removeIndex >= 0) {
            ItemPhrase item = parseItem(tokens, removeIndex);
            return new RemoveCommand(item.name(), item.quantity(), item.unit());
        }

        log.info("[음성명령] 인식 불가: '{}'", text);
        throw new CustomException(ErrorCode.UNRECOGNIZED_COMMAND, "인식할 수 없는 명령: " + text);
    }

    private GenerateRecipeCommand parseRecipe(List<String> tokens, int keywordIndex) {
        Integer servings = null;
        RecipeMode mode = RecipeMode.FLEXIBLE;
        List<String> intent = new ArrayList<>();

        // 첫 키워드가 요리 이름이면 포함해서 시작
        int start = DISH_KEYWORDS.contains(tokens.get(keywordIndex)) ? keywordIndex : keywordIndex + 1;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            Optional<Double> number = QuantityParser.parse(token);
            if (number.isPresent() && i + 1 < tokens.size() && SERVING_WORDS.contains(tokens.get(i + 1))) {
                servings = (int) Math.round(number.get());
                i++;
                continue;
            }
            if (STRICT_WORDS.contains(token)) {
                mode = RecipeMode.STRICT;
                continue;
            }
            if (i < start) {
                continue;
            }
            if (RECIPE_KEYWORDS.contains(token) && !DISH_KEYWORDS.contains(token)) {
                continue;
            }
            if (STOP_WORDS.contains(token) || SERVING_WORDS.contains(token)) {
                continue;
            }
            intent.add(token);
        }

        String dish = intent.isEmpty() ? null : String.join(" ", intent);
        return new GenerateRecipeCommand(dish, servings, mode);
    }

    private ItemPhrase parseItem(List<String> tokens, int keywordIndex) {
        List<String> rest = new ArrayList<>(tokens.subList(keywordIndex + 1, tokens.size()));

        Double quantity = null;
        String unit = null;
        for (int i = 0; i < rest.size(); i++) {
            Optional<Double> number = QuantityParser.parse(rest.get(i));
            if (number.isEmpty()) {
                continue;
            }
            quantity = number.get();
            rest.remove(i);
            if (i + 1 < rest.size() && unitConverter.findUnit(rest.get(i) + " " + rest.get(i + 1)).isPresent()) {
                unit = unitConverter.normalizeUnit(rest.get(i) + " " + rest.get(i + 1)).getSymbol();
                rest.remove(i);
                rest.remove(i);
            } else if (i < rest.size()) {
                Optional<CanonicalUnit> single = unitConverter.findUnit(rest.get(i));
                if (single.isPresent()) {
                    unit = single.get().getSymbol();
                    rest.remove(i);
                }
            }
            break;
        }

        List<String> nameTokens = rest.stream()
                .filter(t -> !STOP_WORDS.contains(t))
                .filter(t -> !ADD_KEYWORDS.contains(t) && !REMOVE_KEYWORDS.contains(t))
                .toList();
        if (nameTokens.isEmpty()) {
            throw new CustomException(ErrorCode.UNRECOGNIZED_COMMAND, "품목 이름 없음");
        }
        return new ItemPhrase(String.join(" ", nameTokens), quantity, unit);
    }

    private static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String cleaned = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9./' ]", " ")
                .replaceAll("(?<!\\d)\\.|\\.(?!\\d)", " ")
                .trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(cleaned.split("\\s+")));
    }

    private static int indexOfAny(List<String> tokens, Set<String> keywords) {
        for (int i = 0; i < tokens.size(); i++) {
            if (keywords.contains(tokens.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private record ItemPhrase(String name, Double quantity, String unit) {
    }
}
