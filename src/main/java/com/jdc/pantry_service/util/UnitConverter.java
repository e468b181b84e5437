package com.jdc.pantry_service.util;

import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.exception.UnitMismatchException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 단위 표기(약어, 복수형, 동의어)를 표준 단위로 정규화하고 같은 그룹 안에서 환산한다.
 * 표기 목록은 classpath 의 units.csv 에서 읽는다.
 */
@Component
@Slf4j
public class UnitConverter {

    public static final CanonicalUnit FALLBACK_UNIT = CanonicalUnit.UNIT;

    private Map<String, CanonicalUnit> unitByToken;

    @PostConstruct
    public void loadUnits() {
        try (var reader = new BufferedReader(
                new InputStreamReader(
                        new ClassPathResource("units.csv").getInputStream(),
                        StandardCharsets.UTF_8))) {

            Map<String, CanonicalUnit> table = new LinkedHashMap<>();
            reader.lines().skip(1)
                    .map(line -> line.split(",", -1))
                    .filter(parts -> parts.length > 1)
                    .forEach(parts -> {
                        String token = parts[0].trim().toLowerCase(Locale.ROOT);
                        CanonicalUnit unit = CanonicalUnit.fromSymbol(parts[1].trim())
                                .orElseThrow(() -> new IllegalStateException("알 수 없는 표준 단위: " + parts[1]));
                        table.putIfAbsent(token, unit);
                    });
            // 표준 기호 자체는 항상 인식
            for (CanonicalUnit unit : CanonicalUnit.values()) {
                table.putIfAbsent(unit.getSymbol(), unit);
            }
            this.unitByToken = Collections.unmodifiableMap(table);
            log.info("단위 표기 {}개 로드 완료", unitByToken.size());

        } catch (Exception e) {
            throw new IllegalStateException("units.csv 로드 실패", e);
        }
    }

    /**
     * 알려진 표기면 해당 표준 단위, 아니면 empty.
     */
    public Optional<CanonicalUnit> findUnit(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String token = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        CanonicalUnit unit = unitByToken.get(token);
        if (unit == null && token.endsWith(".")) {
            unit = unitByToken.get(token.substring(0, token.length() - 1));
        }
        return Optional.ofNullable(unit);
    }

    /**
     * 모르는 표기, null, 빈 문자열은 일반 개수 단위로 떨어진다.
     */
    public CanonicalUnit normalizeUnit(String raw) {
        return findUnit(raw).orElse(FALLBACK_UNIT);
    }

    public boolean isCompatible(CanonicalUnit from, CanonicalUnit to) {
        if (from == to) {
            return true;
        }
        if (from.isAtomic() || to.isAtomic()) {
            return false;
        }
        return from.getUnitClass() == to.getUnitClass();
    }

    /**
     * @throws UnitMismatchException 그룹이 다르거나 서로 다른 원자 단위일 때
     */
    public double convert(double quantity, CanonicalUnit from, CanonicalUnit to) {
        if (from == to) {
            return quantity;
        }
        if (!isCompatible(from, to)) {
            throw new UnitMismatchException(from, to);
        }
        return quantity * from.getFactorToBase() / to.getFactorToBase();
    }

    /** 그룹 기준 단위(g, ml, 개수) 로 환산한 값 */
    public double toBase(double quantity, CanonicalUnit unit) {
        return quantity * unit.getFactorToBase();
    }

    public double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /** "200 g", "1.5 kg" 처럼 사람이 읽는 수량 문자열 */
    public String display(double quantity, CanonicalUnit unit) {
        String number = BigDecimal.valueOf(quantity)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return number + " " + unit.getSymbol();
    }

    /** 프롬프트에 넣는 허용 단위 목록 */
    public String allowedSymbols() {
        return Arrays.stream(CanonicalUnit.values())
                .map(CanonicalUnit::getSymbol)
                .collect(Collectors.joining(", "));
    }
}
