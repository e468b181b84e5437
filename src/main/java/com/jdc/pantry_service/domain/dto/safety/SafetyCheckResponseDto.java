package com.jdc.pantry_service.domain.dto.safety;

import lombok.*;

/** 차단 사유(규칙)는 포함하지 않는다 */
@Getter
@NoArgsConstructor @AllArgsConstructor @Builder
public class SafetyCheckResponseDto {
    private boolean safe;
    private String message;
}
