package com.jdc.pantry_service.util;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "2", "1.5", "1/2", "two" 같은 수량 토큰 해석.
 */
public final class QuantityParser {

    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern FRACTION = Pattern.compile("(\\d+)/(\\d+)");
    /** "5kg", "500ml" 처럼 숫자와 단위가 붙은 토큰 */
    private static final Pattern NUMBER_WITH_UNIT = Pattern.compile("(\\d+(?:\\.\\d+)?)([a-z]+)");

    private static final Map<String, Double> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1.0), Map.entry("two", 2.0), Map.entry("three", 3.0),
            Map.entry("four", 4.0), Map.entry("five", 5.0), Map.entry("six", 6.0),
            Map.entry("seven", 7.0), Map.entry("eight", 8.0), Map.entry("nine", 9.0),
            Map.entry("ten", 10.0), Map.entry("half", 0.5)
    );

    private QuantityParser() {
    }

    public static Optional<Double> parse(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        if (DECIMAL.matcher(token).matches()) {
            return Optional.of(Double.parseDouble(token));
        }
        Matcher fraction = FRACTION.matcher(token);
        if (fraction.matches()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0) {
                return Optional.empty();
            }
            return Optional.of(Double.parseDouble(fraction.group(1)) / denominator);
        }
        return Optional.ofNullable(NUMBER_WORDS.get(token));
    }

    /**
     * 숫자+단위 결합 토큰이면 [숫자, 단위] 로 나눈다.
     */
    public static Optional<String[]> splitNumberAndUnit(String token) {
        Matcher m = NUMBER_WITH_UNIT.matcher(token);
        if (m.matches()) {
            return Optional.of(new String[]{m.group(1), m.group(2)});
        }
        return Optional.empty();
    }
}
