package com.jdc.pantry_service.util;

import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.entity.InventoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 재료 이름 퍼지 매칭.
 *
 * 우선순위: 완전 일치 → 단위 주석(" (mass)") 제외 일치 → 단수형 토큰 집합 일치 → 정규화 편집거리.
 * 같은 순위 안에서는 거리, 최근 수정 순, 이름 순으로 결정한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngredientNameMatcher {

    private static final Pattern ANNOTATION = Pattern.compile("\\s*\\([a-z ]+\\)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int TIER_EXACT = 0;
    static final int TIER_ANNOTATED = 1;
    static final int TIER_TOKENS = 2;
    static final int TIER_FUZZY = 3;

    private final PantryProperties properties;

    public record MatchCandidate(InventoryEntry entry, int tier, double distance) {
    }

    /** 소문자, 앞뒤 공백 제거, 연속 공백 하나로 */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /** 단위 그룹 주석을 뗀 비교용 키 */
    public static String matchKey(String normalizedName) {
        return ANNOTATION.matcher(normalizedName).replaceAll("").trim();
    }

    /**
     * 임계값 이상인 후보는 제외하고 우선순위대로 정렬해 돌려준다.
     */
    public List<MatchCandidate> rank(String name, List<InventoryEntry> entries) {
        String normalized = normalize(name);
        if (normalized.isEmpty() || entries.isEmpty()) {
            return List.of();
        }
        String key = matchKey(normalized);
        List<String> singularTokens = singularTokens(key);
        Set<String> tokens = tokenSet(key);
        double threshold = properties.getLedger().getFuzzyThreshold();

        List<MatchCandidate> candidates = new ArrayList<>();
        for (InventoryEntry entry : entries) {
            String entryName = entry.getCanonicalName();
            String entryKey = matchKey(entryName);

            if (entryName.equals(normalized)) {
                candidates.add(new MatchCandidate(entry, TIER_EXACT, 0.0));
            } else if (entryKey.equals(key)) {
                candidates.add(new MatchCandidate(entry, TIER_ANNOTATED, 0.0));
            } else if (tokenSet(entryKey).equals(tokens)) {
                candidates.add(new MatchCandidate(entry, TIER_TOKENS, 0.0));
            } else {
                double distance = fuzzyDistance(singularTokens, singularTokens(entryKey));
                if (distance < threshold) {
                    candidates.add(new MatchCandidate(entry, TIER_FUZZY, distance));
                }
            }
        }

        candidates.sort(Comparator
                .comparingInt(MatchCandidate::tier)
                .thenComparingDouble(MatchCandidate::distance)
                .thenComparing(c -> c.entry().getUpdatedAt(),
                        Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
                .thenComparing(c -> c.entry().getCanonicalName()));

        if (candidates.size() > 1) {
            MatchCandidate first = candidates.get(0);
            MatchCandidate second = candidates.get(1);
            if (first.tier() == second.tier() && first.distance() == second.distance()) {
                log.info("[재고매칭] 동순위 후보 충돌: input='{}', 선택='{}', 경합='{}'",
                        normalized, first.entry().getCanonicalName(), second.entry().getCanonicalName());
            }
        }
        return candidates;
    }

    /**
     * 여러 단어 이름은 단어 수가 같고 한 단어만 다를 때, 그 단어의 거리로 비교한다.
     * 단어 수가 다르거나 두 단어 이상 다르면 1.0. "coconut milk" 와 "coconut oil" 은 milk/oil 의 거리(0.5)가 된다.
     */
    static double fuzzyDistance(List<String> a, List<String> b) {
        if (a.size() != b.size() || a.isEmpty()) {
            return 1.0;
        }
        int differing = -1;
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).equals(b.get(i))) {
                if (differing >= 0) {
                    return 1.0;
                }
                differing = i;
            }
        }
        return differing < 0 ? 0.0 : normalizedDistance(a.get(differing), b.get(differing));
    }

    /** 편집거리 / 긴 쪽 길이 (0.0 ~ 1.0) */
    public static double normalizedDistance(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 0.0;
        }
        return (double) levenshtein(a, b) / longer;
    }

    static int levenshtein(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = (a.charAt(i - 1) == b.charAt(j - 1)) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }

    private static Set<String> tokenSet(String key) {
        return Arrays.stream(key.split(" "))
                .filter(t -> !t.isEmpty())
                .map(IngredientNameMatcher::singular)
                .collect(Collectors.toSet());
    }

    private static List<String> singularTokens(String key) {
        return Arrays.stream(key.split(" "))
                .filter(t -> !t.isEmpty())
                .map(IngredientNameMatcher::singular)
                .toList();
    }

    static String singular(String word) {
        if (word.length() <= 3) {
            return word;
        }
        if (word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("oes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("ves")) {
            return word.substring(0, word.length() - 3) + "f";
        }
        if (word.endsWith("ches") || word.endsWith("shes") || word.endsWith("xes")
                || word.endsWith("sses") || word.endsWith("zes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
