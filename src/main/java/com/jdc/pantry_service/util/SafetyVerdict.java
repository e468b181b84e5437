package com.jdc.pantry_service.util;

/**
 * matchedRule 은 서버 로그용이며 응답에 실리지 않는다.
 */
public record SafetyVerdict(boolean safe, String matchedRule) {

    private static final SafetyVerdict SAFE = new SafetyVerdict(true, null);

    public static SafetyVerdict ofSafe() {
        return SAFE;
    }

    public static SafetyVerdict blocked(String rule) {
        return new SafetyVerdict(false, rule);
    }
}
