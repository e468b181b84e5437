package com.jdc.pantry_service.domain.dto.recipe;

import com.jdc.pantry_service.domain.type.RecipeMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecipeGenerateRequestDto {

    /** 원하는 요리 이름. 비어 있으면 재고로 알아서 추천 */
    @Size(max = 200)
    private String intent;

    @Positive
    @Max(50)
    private Integer servings;

    private RecipeMode mode;
}
