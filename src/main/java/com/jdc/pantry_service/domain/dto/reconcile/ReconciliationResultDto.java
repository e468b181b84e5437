package com.jdc.pantry_service.domain.dto.reconcile;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationResultDto {

    @Builder.Default
    private List<ReducedItem> reduced = new ArrayList<>();

    @Builder.Default
    private List<String> deleted = new ArrayList<>();

    @Builder.Default
    private List<ShortfallItem> shortfallAdded = new ArrayList<>();

    /** 이름/수량이 잘못되어 정산하지 못한 재료 */
    @Builder.Default
    private List<String> skipped = new ArrayList<>();

    @Getter
    @AllArgsConstructor
    public static class ReducedItem {
        private final String name;
        private final double remaining;
        private final String unit;
    }

    @Getter
    @AllArgsConstructor
    public static class ShortfallItem {
        private final String name;
        private final double quantity;
        private final String unit;
        private final String display;
    }
}
