package com.jdc.pantry_service.util;

import com.jdc.pantry_service.config.SafetyFilterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * LLM 호출 전(그리고 응답 후) 자유 입력을 안전/차단으로 분류한다.
 *
 * <ol>
 *   <li>소문자 변환, 앞뒤 공백 제거</li>
 *   <li>예외 문구 제거 ("tiger prawn", "hot dog" 등). 단어 단위 스캔보다 반드시 먼저.</li>
 *   <li>차단 단어: 단어 경계 일치 (복수형 포함, 더 긴 단어 내부는 불일치)</li>
 *   <li>차단 패턴: 공백 허용 정규식</li>
 * </ol>
 * 첫 번째 일치에서 종료한다. 제한 식재료 여부는 {@link #isRestricted(String)} 로 따로 묻는다. 어떤 규칙이 걸렸는지는 호출자에게 돌려주지 않는다.
 */
@Component
@Slf4j
public class ContentSafetyFilter {

    private final List<Pattern> exceptionPatterns;
    private final List<NamedPattern> termPatterns;
    private final List<NamedPattern> phrasePatterns;
    private final List<NamedPattern> restrictedPatterns;

    public ContentSafetyFilter(SafetyFilterProperties properties) {
        // 긴 예외 문구부터 지워야 "baby back ribs" 가 "baby ..." 보다 먼저 빠진다
        this.exceptionPatterns = properties.getExceptionPhrases().stream()
                .map(p -> p.toLowerCase(Locale.ROOT).trim())
                .filter(p -> !p.isEmpty())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(p -> Pattern.compile("\\b" + phraseRegex(p) + "\\b"))
                .toList();
        this.termPatterns = properties.getBlockedTerms().stream()
                .map(t -> t.toLowerCase(Locale.ROOT).trim())
                .filter(t -> !t.isEmpty())
                .map(t -> new NamedPattern("term:" + t,
                        Pattern.compile("\\b" + phraseRegex(t) + "(?:e?s)?\\b")))
                .toList();
        this.phrasePatterns = properties.getBlockedPatterns().stream()
                .map(p -> new NamedPattern("pattern:" + p, Pattern.compile(p)))
                .toList();
        this.restrictedPatterns = Stream.concat(
                        properties.getRestrictedItems().stream()
                                .map(t -> t.toLowerCase(Locale.ROOT).trim())
                                .filter(t -> !t.isEmpty())
                                .map(t -> new NamedPattern("restricted:" + t,
                                        Pattern.compile("\\b" + phraseRegex(t) + "\\b"))),
                        properties.getRestrictedPatterns().stream()
                                .map(p -> new NamedPattern("restricted-pattern:" + p, Pattern.compile(p))))
                .toList();
    }

    public SafetyVerdict evaluate(String text) {
        if (text == null) {
            return SafetyVerdict.ofSafe();
        }
        String normalized = text.toLowerCase(Locale.ROOT).trim();
        if (normalized.isEmpty()) {
            return SafetyVerdict.ofSafe();
        }

        String remaining = stripExceptions(normalized);

        for (NamedPattern term : termPatterns) {
            if (term.pattern().matcher(remaining).find()) {
                return block(term.rule(), normalized);
            }
        }
        for (NamedPattern phrase : phrasePatterns) {
            if (phrase.pattern().matcher(remaining).find()) {
                return block(phrase.rule(), normalized);
            }
        }
        return SafetyVerdict.ofSafe();
    }

    public boolean isSafe(String text) {
        return evaluate(text).safe();
    }

    /**
     * 차단 대상은 아니지만 레시피로 다룰 수 없는 식재료(보호종, 규제 물질 등)를 요청했는지.
     * 차단 검사를 통과한 입력에만 의미가 있다.
     */
    public boolean isRestricted(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String remaining = stripExceptions(text.toLowerCase(Locale.ROOT).trim());
        for (NamedPattern restricted : restrictedPatterns) {
            if (restricted.pattern().matcher(remaining).find()) {
                log.info("[안전필터] 제한 식재료 요청: rule={}", restricted.rule());
                return true;
            }
        }
        return false;
    }

    private String stripExceptions(String normalized) {
        String remaining = normalized;
        for (Pattern exception : exceptionPatterns) {
            remaining = exception.matcher(remaining).replaceAll(" ");
        }
        return remaining;
    }

    private SafetyVerdict block(String rule, String normalized) {
        log.warn("[안전필터] 차단: rule={}, input={}", rule, abbreviate(normalized));
        return SafetyVerdict.blocked(rule);
    }

    /** 단어 사이 공백은 여러 칸 허용, 아포스트로피는 생략 가능 */
    private static String phraseRegex(String phrase) {
        StringBuilder sb = new StringBuilder();
        for (String word : phrase.split("\\s+")) {
            if (sb.length() > 0) {
                sb.append("\\s+");
            }
            sb.append(Pattern.quote(word).replace("'", "\\E'?\\Q"));
        }
        return sb.toString();
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }

    private record NamedPattern(String rule, Pattern pattern) {
    }
}
