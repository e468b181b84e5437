package com.jdc.pantry_service.facade;

import com.jdc.pantry_service.domain.dto.command.AssistantCommand;
import com.jdc.pantry_service.domain.dto.command.CommandResult;

public interface CommandHandler {

    CommandResult handle(Long ownerId, AssistantCommand command);
}
