package com.jdc.pantry_service.facade;

import com.jdc.pantry_service.domain.dto.command.AddCommand;
import com.jdc.pantry_service.domain.dto.command.CommandResult;
import com.jdc.pantry_service.domain.dto.command.RemoveCommand;
import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryItemRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.LedgerResult;
import com.jdc.pantry_service.domain.dto.inventory.ParsedIngredientDto;
import com.jdc.pantry_service.service.InventoryLedgerService;
import com.jdc.pantry_service.service.ai.IngredientTextParser;
import com.jdc.pantry_service.service.ai.RecipeCache;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 재고 화면용 진입점. 추가/삭제는 어시스턴트 명령과 같은 경로로 처리한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryFacade {

    private final CommandHandler commandHandler;
    private final InventoryLedgerService ledgerService;
    private final IngredientTextParser ingredientTextParser;
    private final RecipeCache recipeCache;
    private final UnitConverter unitConverter;

    public List<InventoryEntryDto> getItems(Long ownerId) {
        return ledgerService.getAll(ownerId);
    }

    public CommandResult addItem(Long ownerId, InventoryItemRequestDto dto) {
        return commandHandler.handle(ownerId, new AddCommand(dto.getName(), dto.getQuantity(), dto.getUnit()));
    }

    /**
     * 자유 입력("2 kg tomatoes") 을 해석해서 추가
     */
    public CommandResult addItemFromText(Long ownerId, String text) {
        ParsedIngredientDto parsed = ingredientTextParser.parse(text);
        log.debug("[재고] 자유 입력 해석: '{}' -> {} {} {}", text, parsed.getQuantity(), parsed.getUnit(), parsed.getItemName());
        return commandHandler.handle(ownerId, new AddCommand(parsed.getItemName(), parsed.getQuantity(), parsed.getUnit()));
    }

    public CommandResult removeItem(Long ownerId, String name, Double quantity, String unit) {
        return commandHandler.handle(ownerId, new RemoveCommand(name, quantity, unit));
    }

    public LedgerResult setQuantity(Long ownerId, InventoryItemRequestDto dto) {
        LedgerResult result = ledgerService.setQuantity(ownerId, dto.getName(), dto.getQuantity(),
                unitConverter.normalizeUnit(dto.getUnit()));
        recipeCache.invalidateOwner(ownerId);
        return result;
    }
}
