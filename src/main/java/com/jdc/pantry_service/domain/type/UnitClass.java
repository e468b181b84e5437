package com.jdc.pantry_service.domain.type;

/**
 * 단위 호환 그룹. ATOMIC 은 자기 자신 외에는 변환 불가.
 */
public enum UnitClass {
    MASS,
    VOLUME,
    COUNT,
    ATOMIC;

    public String label() {
        return name().toLowerCase();
    }
}
