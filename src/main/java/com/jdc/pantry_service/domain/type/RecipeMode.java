package com.jdc.pantry_service.domain.type;

/**
 * 레시피 생성 시 재고 사용 정책
 */
public enum RecipeMode {
    /** 재고에 있는 재료만 사용 */
    STRICT,
    /** 재고 우선, 기본 양념과 요리 정체성에 필요한 재료는 추가 허용 */
    FLEXIBLE
}
