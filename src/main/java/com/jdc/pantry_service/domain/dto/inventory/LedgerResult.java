package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.LedgerStatus;

/**
 * 감소/수량지정 결과. 항목이 없으면 예외 대신 NOT_FOUND 로 보고한다.
 */
public record LedgerResult(LedgerStatus status, String name, Double remaining, String unit) {

    public static LedgerResult notFound(String name) {
        return new LedgerResult(LedgerStatus.NOT_FOUND, name, null, null);
    }

    public static LedgerResult deleted(String name) {
        return new LedgerResult(LedgerStatus.DELETED, name, 0.0, null);
    }

    public boolean isDeleted() {
        return status == LedgerStatus.DELETED;
    }
}
