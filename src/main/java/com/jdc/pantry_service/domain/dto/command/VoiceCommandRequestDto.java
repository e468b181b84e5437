package com.jdc.pantry_service.domain.dto.command;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class VoiceCommandRequestDto {

    /** 음성 인식 결과 또는 채팅 입력 */
    @NotBlank
    @Size(max = 300)
    private String text;
}
