package com.jdc.pantry_service.domain.dto.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jdc.pantry_service.domain.type.AssistantAction;
import lombok.*;

/**
 * 모든 명령의 공통 응답.
 */
@Getter
@NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResult {
    private boolean success;
    private AssistantAction action;
    private String message;
    private Object data;
}
