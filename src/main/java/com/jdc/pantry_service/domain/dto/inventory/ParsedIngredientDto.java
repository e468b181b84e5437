package com.jdc.pantry_service.domain.dto.inventory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * 자유 입력 재료 파싱 결과. LLM 응답 스키마 {quantity, unit, item_name} 와 동일.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParsedIngredientDto {

    private Double quantity;

    private String unit;

    @JsonProperty("item_name")
    private String itemName;
}
