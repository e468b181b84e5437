package com.jdc.pantry_service.exception;

import com.jdc.pantry_service.domain.type.CanonicalUnit;
import lombok.Getter;

/**
 * 서로 다른 단위 그룹(또는 원자 단위) 간 변환 시도.
 * 호출자는 병합하지 않고 별도 항목으로 취급하며, API 응답으로는 나가지 않는다.
 */
@Getter
public class UnitMismatchException extends RuntimeException {

    private final CanonicalUnit from;
    private final CanonicalUnit to;

    public UnitMismatchException(CanonicalUnit from, CanonicalUnit to) {
        super("단위 변환 불가: " + from.getSymbol() + " -> " + to.getSymbol());
        this.from = from;
        this.to = to;
    }
}
