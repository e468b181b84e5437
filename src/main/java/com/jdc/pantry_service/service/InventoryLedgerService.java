package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.inventory.LedgerResult;
import com.jdc.pantry_service.domain.entity.InventoryEntry;
import com.jdc.pantry_service.domain.store.PantryStore;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.domain.type.LedgerStatus;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.exception.UnitMismatchException;
import com.jdc.pantry_service.mapper.InventoryMapper;
import com.jdc.pantry_service.util.IngredientNameMatcher;
import com.jdc.pantry_service.util.IngredientNameMatcher.MatchCandidate;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 사용자별 재고 원장.
 *
 * 이름은 퍼지 매칭으로, 수량은 기존 항목의 단위로 환산해서 합친다.
 * 단위 그룹이 달라 합칠 수 없으면 "이름 (mass)" 처럼 그룹을 붙인 별도 항목을 만든다.
 * 감소 결과가 0 이하이면 항목을 삭제하며, 0 수량 항목은 남기지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class InventoryLedgerService {

    static final double EPSILON = 1e-9;

    private final PantryStore store;
    private final UnitConverter unitConverter;
    private final IngredientNameMatcher nameMatcher;

    @Transactional
    public InventoryEntryDto add(Long ownerId, String name, double quantity, CanonicalUnit unit) {
        String normalized = requireName(name);
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new CustomException(ErrorCode.INVALID_INGREDIENT_QUANTITY, "추가 수량은 0보다 커야 합니다: " + quantity);
        }
        CanonicalUnit incoming = unit == null ? UnitConverter.FALLBACK_UNIT : unit;
        LocalDateTime now = LocalDateTime.now();

        List<MatchCandidate> candidates = nameMatcher.rank(normalized, store.getEntries(ownerId));
        for (MatchCandidate candidate : candidates) {
            InventoryEntry entry = candidate.entry();
            try {
                double converted = unitConverter.convert(quantity, incoming, entry.getUnit());
                entry.changeQuantity(unitConverter.round(entry.getQuantity() + converted, 4), now);
                InventoryEntry saved = store.upsertEntry(entry);
                log.debug("[재고] 병합: owner={}, '{}' + {} {} -> {} {}", ownerId, entry.getCanonicalName(),
                        quantity, incoming.getSymbol(), saved.getQuantity(), saved.getUnit().getSymbol());
                return InventoryMapper.toDto(saved);
            } catch (UnitMismatchException e) {
                log.debug("[재고] 단위 불일치로 병합하지 않음: '{}' ({})", entry.getCanonicalName(), e.getMessage());
            }
        }

        String entryName = candidates.isEmpty()
                ? normalized
                : annotate(IngredientNameMatcher.matchKey(normalized), incoming);
        InventoryEntry created = InventoryEntry.builder()
                .ownerId(ownerId)
                .canonicalName(entryName)
                .quantity(unitConverter.round(quantity, 4))
                .unit(incoming)
                .updatedAt(now)
                .build();
        InventoryEntry saved = store.upsertEntry(created);
        log.debug("[재고] 신규 항목: owner={}, '{}' {} {}", ownerId, entryName, quantity, incoming.getSymbol());
        return InventoryMapper.toDto(saved);
    }

    /**
     * @param quantity null 이면 수량과 무관하게 삭제
     * @param unit     null 이면 기존 항목의 단위로 본다
     */
    @Transactional
    public LedgerResult reduce(Long ownerId, String name, Double quantity, CanonicalUnit unit) {
        String normalized = requireName(name);
        if (quantity != null && (!(quantity > 0) || quantity.isInfinite())) {
            throw new CustomException(ErrorCode.INVALID_INGREDIENT_QUANTITY, "감소 수량은 0보다 커야 합니다: " + quantity);
        }

        List<MatchCandidate> candidates = nameMatcher.rank(normalized, store.getEntries(ownerId));
        if (candidates.isEmpty()) {
            log.info("[재고] 감소 대상 없음: owner={}, name='{}'", ownerId, normalized);
            return LedgerResult.notFound(normalized);
        }

        if (quantity == null) {
            InventoryEntry target = candidates.get(0).entry();
            deleteEntry(target);
            return LedgerResult.deleted(target.getCanonicalName());
        }

        for (MatchCandidate candidate : candidates) {
            InventoryEntry entry = candidate.entry();
            CanonicalUnit from = unit == null ? entry.getUnit() : unit;
            try {
                double converted = unitConverter.convert(quantity, from, entry.getUnit());
                return reduceEntry(entry, entry.getQuantity() - converted);
            } catch (UnitMismatchException e) {
                log.debug("[재고] 단위 불일치 후보 건너뜀: '{}' ({})", entry.getCanonicalName(), e.getMessage());
            }
        }
        log.info("[재고] 단위가 맞는 감소 대상 없음: owner={}, name='{}', unit={}", ownerId, normalized, unit);
        return LedgerResult.notFound(normalized);
    }

    /**
     * 절대 수량 지정. 없으면 만들고, 0 이면 삭제한다.
     */
    @Transactional
    public LedgerResult setQuantity(Long ownerId, String name, double quantity, CanonicalUnit unit) {
        String normalized = requireName(name);
        if (quantity < 0 || Double.isNaN(quantity) || Double.isInfinite(quantity)) {
            throw new CustomException(ErrorCode.INVALID_INGREDIENT_QUANTITY, "수량은 음수가 될 수 없습니다: " + quantity);
        }
        CanonicalUnit target = unit == null ? UnitConverter.FALLBACK_UNIT : unit;

        Optional<InventoryEntry> match = findCompatible(ownerId, normalized, target);
        if (match.isEmpty()) {
            if (quantity <= EPSILON) {
                return LedgerResult.notFound(normalized);
            }
            InventoryEntryDto created = add(ownerId, normalized, quantity, target);
            return new LedgerResult(LedgerStatus.CREATED, created.getName(), created.getQuantity(), created.getUnit());
        }
        InventoryEntry entry = match.get();
        LedgerResult result = reduceEntry(entry, unitConverter.convert(quantity, target, entry.getUnit()));
        return result.isDeleted()
                ? result
                : new LedgerResult(LedgerStatus.UPDATED, result.name(), result.remaining(), result.unit());
    }

    public List<InventoryEntryDto> getAll(Long ownerId) {
        return store.getEntries(ownerId).stream()
                .sorted(Comparator.comparing(InventoryEntry::getCanonicalName))
                .map(InventoryMapper::toDto)
                .toList();
    }

    /**
     * 이름이 매칭되고 단위 환산이 가능한 첫 번째 항목.
     */
    public Optional<InventoryEntry> findCompatible(Long ownerId, String name, CanonicalUnit unit) {
        List<MatchCandidate> candidates = nameMatcher.rank(name, store.getEntries(ownerId));
        return candidates.stream()
                .map(MatchCandidate::entry)
                .filter(e -> unitConverter.isCompatible(unit, e.getUnit()))
                .findFirst();
    }

    /**
     * 항목을 새 수량(항목 단위 기준)으로 바꾼다. 0 이하이면 삭제.
     */
    @Transactional
    LedgerResult reduceEntry(InventoryEntry entry, double newQuantity) {
        if (newQuantity <= EPSILON) {
            deleteEntry(entry);
            return LedgerResult.deleted(entry.getCanonicalName());
        }
        entry.changeQuantity(unitConverter.round(newQuantity, 4), LocalDateTime.now());
        InventoryEntry saved = store.upsertEntry(entry);
        return new LedgerResult(LedgerStatus.REDUCED, saved.getCanonicalName(),
                saved.getQuantity(), saved.getUnit().getSymbol());
    }

    @Transactional
    void deleteEntry(InventoryEntry entry) {
        store.deleteEntry(entry.getOwnerId(), entry.getCanonicalName());
        log.debug("[재고] 삭제: owner={}, '{}'", entry.getOwnerId(), entry.getCanonicalName());
    }

    private String requireName(String name) {
        String normalized = IngredientNameMatcher.normalize(name);
        if (normalized.isEmpty()) {
            throw new CustomException(ErrorCode.MISSING_INGREDIENT_NAME);
        }
        return normalized;
    }

    private static String annotate(String key, CanonicalUnit unit) {
        String label = unit.isAtomic() ? unit.getSymbol() : unit.getUnitClass().label();
        return key + " (" + label + ")";
    }
}
