package com.jdc.pantry_service.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM 응답 스키마이자 생성 결과. 저장하지 않는다.
 */
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecipeDto {
    private String name;
    private String description;
    private Integer servings;

    @Builder.Default
    private List<RecipeIngredientDto> ingredients = new ArrayList<>();

    @Builder.Default
    private List<String> instructions = new ArrayList<>();

    /** LLM 이 아닌 재고 기반 대체 레시피인지 */
    private boolean fallback;
}
