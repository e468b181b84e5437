package com.jdc.pantry_service.facade;

import com.jdc.pantry_service.domain.dto.command.AddCommand;
import com.jdc.pantry_service.domain.dto.command.AssistantCommand;
import com.jdc.pantry_service.domain.dto.command.CommandResult;
import com.jdc.pantry_service.domain.dto.command.ConfirmCommand;
import com.jdc.pantry_service.domain.dto.command.GenerateRecipeCommand;
import com.jdc.pantry_service.domain.dto.command.RemoveCommand;
import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.inventory.LedgerResult;
import com.jdc.pantry_service.domain.dto.recipe.RecipeDto;
import com.jdc.pantry_service.domain.dto.reconcile.ReconciliationResultDto;
import com.jdc.pantry_service.domain.type.AssistantAction;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.domain.type.LedgerStatus;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.service.InventoryLedgerService;
import com.jdc.pantry_service.service.MealConfirmationService;
import com.jdc.pantry_service.service.ai.RecipeCache;
import com.jdc.pantry_service.service.ai.RecipeGenerationService;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * 어시스턴트 명령 진입점. 명령 타입별로 엔진에 넘기고 결과를 CommandResult 로 맞춘다.
 * 재고가 바뀌는 명령 뒤에는 해당 사용자의 레시피 캐시를 비운다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantCommandRouter implements CommandHandler {

    private final InventoryLedgerService ledgerService;
    private final RecipeGenerationService recipeGenerationService;
    private final MealConfirmationService mealConfirmationService;
    private final RecipeCache recipeCache;
    private final UnitConverter unitConverter;

    @Override
    public CommandResult handle(Long ownerId, AssistantCommand command) {
        if (ownerId == null) {
            throw new CustomException(ErrorCode.USER_ID_REQUIRED);
        }
        if (command == null) {
            throw new CustomException(ErrorCode.INVALID_ASSISTANT_COMMAND, "명령이 없습니다.");
        }
        log.debug("[어시스턴트] owner={}, command={}", ownerId, command.getClass().getSimpleName());

        if (command instanceof AddCommand add) {
            return handleAdd(ownerId, add);
        } else if (command instanceof RemoveCommand remove) {
            return handleRemove(ownerId, remove);
        } else if (command instanceof GenerateRecipeCommand generate) {
            return handleGenerate(ownerId, generate);
        } else if (command instanceof ConfirmCommand confirm) {
            return handleConfirm(ownerId, confirm);
        }
        throw new CustomException(ErrorCode.INVALID_ASSISTANT_COMMAND, "지원하지 않는 명령: " + command);
    }

    private CommandResult handleAdd(Long ownerId, AddCommand command) {
        CanonicalUnit unit = unitConverter.normalizeUnit(command.unit());
        InventoryEntryDto entry = ledgerService.add(ownerId, command.itemName(), command.quantity(), unit);
        recipeCache.invalidateOwner(ownerId);

        String message = "Added " + number(command.quantity()) + " " + unit.getSymbol()
                + " of " + entry.getName() + " to your inventory.";
        return CommandResult.builder()
                .success(true)
                .action(AssistantAction.INVENTORY_UPDATED)
                .message(message)
                .data(entry)
                .build();
    }

    private CommandResult handleRemove(Long ownerId, RemoveCommand command) {
        CanonicalUnit unit = command.unit() == null || command.unit().isBlank()
                ? null
                : unitConverter.normalizeUnit(command.unit());
        LedgerResult result = ledgerService.reduce(ownerId, command.itemName(), command.quantity(), unit);

        if (result.status() == LedgerStatus.NOT_FOUND) {
            return CommandResult.builder()
                    .success(false)
                    .action(AssistantAction.INVENTORY_UNCHANGED)
                    .message(result.name() + " was not found in your inventory.")
                    .data(result)
                    .build();
        }
        recipeCache.invalidateOwner(ownerId);

        String message;
        if (result.isDeleted()) {
            message = "Removed " + result.name() + " from your inventory.";
        } else {
            String removedUnit = unit == null ? result.unit() : unit.getSymbol();
            message = "Removed " + number(command.quantity()) + " " + removedUnit + " of " + result.name()
                    + ". Remaining: " + number(result.remaining()) + " " + result.unit() + ".";
        }
        return CommandResult.builder()
                .success(true)
                .action(AssistantAction.INVENTORY_UPDATED)
                .message(message)
                .data(result)
                .build();
    }

    private CommandResult handleGenerate(Long ownerId, GenerateRecipeCommand command) {
        RecipeDto recipe = recipeGenerationService.buildRecipe(ownerId, command.intent(), command.servings(), command.mode());
        return CommandResult.builder()
                .success(true)
                .action(AssistantAction.RECIPE_SUGGESTED)
                .message(recipe.getName())
                .data(recipe)
                .build();
    }

    private CommandResult handleConfirm(Long ownerId, ConfirmCommand command) {
        if (command.ingredients().isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_ASSISTANT_COMMAND, "확정할 재료가 없습니다.");
        }
        ReconciliationResultDto result = mealConfirmationService.confirm(ownerId, command.ingredients());
        recipeCache.invalidateOwner(ownerId);

        String message = "Recipe confirmed. Updated " + (result.getReduced().size() + result.getDeleted().size())
                + " inventory item(s) and added " + result.getShortfallAdded().size() + " item(s) to your shopping list.";
        return CommandResult.builder()
                .success(true)
                .action(AssistantAction.RECIPE_CONFIRMED)
                .message(message)
                .data(result)
                .build();
    }

    private static String number(Double value) {
        if (value == null) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
