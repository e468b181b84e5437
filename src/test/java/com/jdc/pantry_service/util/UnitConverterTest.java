package com.jdc.pantry_service.util;

import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.exception.UnitMismatchException;
import com.jdc.pantry_service.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitConverterTest {

    private UnitConverter converter;

    @BeforeEach
    void setUp() {
        converter = TestFixtures.unitConverter();
    }

    @Test
    @DisplayName("약어, 복수형, 동의어를 표준 단위로 정규화한다")
    void normalizeUnit_aliases() {
        assertEquals(CanonicalUnit.KILOGRAM, converter.normalizeUnit("Kilograms"));
        assertEquals(CanonicalUnit.GRAM, converter.normalizeUnit(" grams "));
        assertEquals(CanonicalUnit.TABLESPOON, converter.normalizeUnit("tbs"));
        assertEquals(CanonicalUnit.FLUID_OUNCE, converter.normalizeUnit("fl  oz"));
        assertEquals(CanonicalUnit.POUND, converter.normalizeUnit("lbs."));
        assertEquals(CanonicalUnit.CLOVE, converter.normalizeUnit("cloves"));
        assertEquals(CanonicalUnit.LOAF, converter.normalizeUnit("loaves"));
    }

    @Test
    @DisplayName("봉지/상자/팩 같은 용기 단위는 일반 개수 단위가 된다")
    void normalizeUnit_containers() {
        assertEquals(CanonicalUnit.UNIT, converter.normalizeUnit("bags"));
        assertEquals(CanonicalUnit.UNIT, converter.normalizeUnit("box"));
        assertEquals(CanonicalUnit.UNIT, converter.normalizeUnit("pack"));
        assertEquals(CanonicalUnit.PIECE, converter.normalizeUnit("pcs"));
    }

    @Test
    @DisplayName("모르는 단위, null, 빈 문자열은 일반 개수 단위로 떨어진다")
    void normalizeUnit_unknown() {
        assertEquals(UnitConverter.FALLBACK_UNIT, converter.normalizeUnit("handful"));
        assertEquals(UnitConverter.FALLBACK_UNIT, converter.normalizeUnit(null));
        assertEquals(UnitConverter.FALLBACK_UNIT, converter.normalizeUnit("  "));
        assertTrue(converter.findUnit("handful").isEmpty());
    }

    @Test
    @DisplayName("같은 그룹 안에서는 기준 단위 배율로 환산한다")
    void convert_sameClass() {
        assertEquals(1500.0, converter.convert(1.5, CanonicalUnit.KILOGRAM, CanonicalUnit.GRAM), 1e-9);
        assertEquals(0.25, converter.convert(250, CanonicalUnit.MILLILITER, CanonicalUnit.LITER), 1e-9);
        assertEquals(3.0, converter.convert(1, CanonicalUnit.TABLESPOON, CanonicalUnit.TEASPOON), 0.01);
        assertEquals(453.592, converter.convert(1, CanonicalUnit.POUND, CanonicalUnit.GRAM), 1e-9);
        assertEquals(4.0, converter.convert(4, CanonicalUnit.PIECE, CanonicalUnit.UNIT), 1e-9);
    }

    @Test
    @DisplayName("그룹이 다르면 UnitMismatchException")
    void convert_crossClass_throws() {
        assertThrows(UnitMismatchException.class,
                () -> converter.convert(1, CanonicalUnit.KILOGRAM, CanonicalUnit.LITER));
        assertThrows(UnitMismatchException.class,
                () -> converter.convert(2, CanonicalUnit.PIECE, CanonicalUnit.GRAM));
    }

    @Test
    @DisplayName("원자 단위는 자기 자신으로만 변환된다")
    void convert_atomic() {
        assertEquals(3.0, converter.convert(3, CanonicalUnit.CLOVE, CanonicalUnit.CLOVE));
        assertThrows(UnitMismatchException.class,
                () -> converter.convert(1, CanonicalUnit.HEAD, CanonicalUnit.CLOVE));
        assertThrows(UnitMismatchException.class,
                () -> converter.convert(1, CanonicalUnit.LOAF, CanonicalUnit.UNIT));
        assertFalse(converter.isCompatible(CanonicalUnit.SLICE, CanonicalUnit.PIECE));
    }

    @Test
    @DisplayName("표시 문자열은 소수 둘째 자리까지, 뒤의 0 은 뗀다")
    void display() {
        assertEquals("200 g", converter.display(200.0, CanonicalUnit.GRAM));
        assertEquals("1.5 kg", converter.display(1.5, CanonicalUnit.KILOGRAM));
        assertEquals("0.33 cup", converter.display(1.0 / 3, CanonicalUnit.CUP));
    }
}
