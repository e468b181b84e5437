package com.jdc.pantry_service.domain.type;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 재고/레시피에서 사용하는 표준 단위.
 * factorToBase 는 그룹 기준 단위(g, ml, piece)에 대한 배율이다.
 */
@Getter
public enum CanonicalUnit {

    MILLIGRAM("mg", UnitClass.MASS, 0.001),
    GRAM("g", UnitClass.MASS, 1.0),
    KILOGRAM("kg", UnitClass.MASS, 1000.0),
    OUNCE("oz", UnitClass.MASS, 28.3495),
    POUND("lb", UnitClass.MASS, 453.592),

    MILLILITER("ml", UnitClass.VOLUME, 1.0),
    LITER("l", UnitClass.VOLUME, 1000.0),
    TEASPOON("tsp", UnitClass.VOLUME, 4.92892),
    TABLESPOON("tbsp", UnitClass.VOLUME, 14.7868),
    FLUID_OUNCE("fl oz", UnitClass.VOLUME, 29.5735),
    CUP("cup", UnitClass.VOLUME, 236.588),

    PIECE("piece", UnitClass.COUNT, 1.0),
    UNIT("unit", UnitClass.COUNT, 1.0),

    HEAD("head", UnitClass.ATOMIC, 1.0),
    LOAF("loaf", UnitClass.ATOMIC, 1.0),
    CLOVE("clove", UnitClass.ATOMIC, 1.0),
    BUNCH("bunch", UnitClass.ATOMIC, 1.0),
    SLICE("slice", UnitClass.ATOMIC, 1.0),
    PINCH("pinch", UnitClass.ATOMIC, 1.0);

    private final String symbol;
    private final UnitClass unitClass;
    private final double factorToBase;

    CanonicalUnit(String symbol, UnitClass unitClass, double factorToBase) {
        this.symbol = symbol;
        this.unitClass = unitClass;
        this.factorToBase = factorToBase;
    }

    public boolean isAtomic() {
        return unitClass == UnitClass.ATOMIC;
    }

    public static Optional<CanonicalUnit> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(u -> u.symbol.equals(symbol))
                .findFirst();
    }
}
