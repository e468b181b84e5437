package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.LedgerResult;
import com.jdc.pantry_service.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.pantry_service.domain.dto.reconcile.ReconciliationResultDto;
import com.jdc.pantry_service.domain.dto.reconcile.ReconciliationResultDto.ReducedItem;
import com.jdc.pantry_service.domain.dto.reconcile.ReconciliationResultDto.ShortfallItem;
import com.jdc.pantry_service.domain.entity.InventoryEntry;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.util.IngredientNameMatcher;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 요리 확정 시 레시피 재료를 재고에서 차감하고, 모자란 만큼 장보기 목록에 넣는다.
 *
 * 재료마다 독립적으로 처리하며 잘못된 재료 하나가 전체를 중단시키지 않는다.
 * 같은 레시피를 두 번 확정하면 두 번 차감된다(중복 방지 없음).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MealConfirmationService {

    private final InventoryLedgerService ledgerService;
    private final ShoppingListService shoppingListService;
    private final UnitConverter unitConverter;

    @Transactional
    public ReconciliationResultDto confirm(Long ownerId, List<RecipeIngredientDto> ingredients) {
        ReconciliationResultDto result = ReconciliationResultDto.builder().build();
        if (ingredients == null) {
            return result;
        }

        for (RecipeIngredientDto ingredient : ingredients) {
            String name = ingredient == null ? "" : IngredientNameMatcher.normalize(ingredient.getName());
            try {
                if (name.isEmpty() || ingredient.getQuantity() == null || !(ingredient.getQuantity() > 0)) {
                    log.warn("[정산] 잘못된 재료 건너뜀: name='{}', quantity={}",
                            name, ingredient == null ? null : ingredient.getQuantity());
                    result.getSkipped().add(name.isEmpty() ? "(unnamed)" : name);
                    continue;
                }
                settle(ownerId, name, ingredient.getQuantity(),
                        unitConverter.normalizeUnit(ingredient.getUnit()), result);
            } catch (CustomException | IllegalArgumentException e) {
                log.warn("[정산] 재료 처리 실패, 건너뜀: name='{}', reason={}", name, e.getMessage());
                result.getSkipped().add(name);
            }
        }

        log.info("[정산] owner={} 완료: 차감 {}건, 삭제 {}건, 부족분 {}건, 건너뜀 {}건", ownerId,
                result.getReduced().size(), result.getDeleted().size(),
                result.getShortfallAdded().size(), result.getSkipped().size());
        return result;
    }

    private void settle(Long ownerId, String name, double requested, CanonicalUnit unit,
                        ReconciliationResultDto result) {
        Optional<InventoryEntry> match = ledgerService.findCompatible(ownerId, name, unit);
        if (match.isEmpty()) {
            addShortfall(ownerId, name, requested, unit, result);
            return;
        }

        InventoryEntry entry = match.get();
        double available = unitConverter.convert(entry.getQuantity(), entry.getUnit(), unit);

        if (available + InventoryLedgerService.EPSILON >= requested) {
            double used = unitConverter.convert(requested, unit, entry.getUnit());
            LedgerResult reduced = ledgerService.reduceEntry(entry, entry.getQuantity() - used);
            if (reduced.isDeleted()) {
                result.getDeleted().add(reduced.name());
            } else {
                result.getReduced().add(new ReducedItem(reduced.name(),
                        unitConverter.round(reduced.remaining(), 2), reduced.unit()));
            }
            return;
        }

        String entryName = entry.getCanonicalName();
        ledgerService.deleteEntry(entry);
        result.getDeleted().add(entryName);
        addShortfall(ownerId, name, unitConverter.round(requested - available, 2), unit, result);
    }

    private void addShortfall(Long ownerId, String name, double quantity, CanonicalUnit unit,
                              ReconciliationResultDto result) {
        shoppingListService.addShortfall(ownerId, name, quantity, unit);
        result.getShortfallAdded().add(
                new ShortfallItem(name, quantity, unit.getSymbol(), unitConverter.display(quantity, unit)));
    }
}
