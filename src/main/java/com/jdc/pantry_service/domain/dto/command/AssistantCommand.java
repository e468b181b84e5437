package com.jdc.pantry_service.domain.dto.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 어시스턴트가 처리하는 명령. JSON 의 "type" 필드로 구분한다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AddCommand.class, name = "add"),
        @JsonSubTypes.Type(value = RemoveCommand.class, name = "remove"),
        @JsonSubTypes.Type(value = GenerateRecipeCommand.class, name = "generate-recipe"),
        @JsonSubTypes.Type(value = ConfirmCommand.class, name = "confirm-recipe")
})
public sealed interface AssistantCommand
        permits AddCommand, RemoveCommand, GenerateRecipeCommand, ConfirmCommand {
}
