package com.jdc.pantry_service.service;

import com.jdc.pantry_service.config.PantryProperties;
import com.jdc.pantry_service.domain.dto.shopping.RestockSuggestionDto;
import com.jdc.pantry_service.domain.dto.shopping.ShoppingItemResponseDto;
import com.jdc.pantry_service.domain.entity.InventoryEntry;
import com.jdc.pantry_service.domain.entity.ShoppingListEntry;
import com.jdc.pantry_service.domain.repository.ShoppingListEntryRepository;
import com.jdc.pantry_service.domain.store.PantryStore;
import com.jdc.pantry_service.domain.type.CanonicalUnit;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.mapper.InventoryMapper;
import com.jdc.pantry_service.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ShoppingListService {

    private final PantryStore store;
    private final ShoppingListEntryRepository shoppingRepository;
    private final UnitConverter unitConverter;
    private final PantryProperties properties;

    @Transactional
    public ShoppingListEntry addShortfall(Long ownerId, String name, double quantity, CanonicalUnit unit) {
        ShoppingListEntry item = ShoppingListEntry.builder()
                .ownerId(ownerId)
                .name(name)
                .quantityDisplay(unitConverter.display(quantity, unit))
                .checked(false)
                .build();
        ShoppingListEntry saved = store.insertShoppingItem(item);
        log.debug("[장보기] 부족분 추가: owner={}, {} {}", ownerId, name, item.getQuantityDisplay());
        return saved;
    }

    public List<ShoppingItemResponseDto> getItems(Long ownerId) {
        return shoppingRepository.findAllByOwnerIdOrderByCheckedAscIdDesc(ownerId).stream()
                .map(ShoppingItemResponseDto::from)
                .toList();
    }

    @Transactional
    public ShoppingItemResponseDto toggle(Long ownerId, Long itemId) {
        ShoppingListEntry item = shoppingRepository.findByIdAndOwnerId(itemId, ownerId)
                .orElseThrow(() -> new CustomException(ErrorCode.SHOPPING_ITEM_NOT_FOUND));
        item.toggle();
        return ShoppingItemResponseDto.from(item);
    }

    @Transactional
    public void delete(Long ownerId, Long itemId) {
        ShoppingListEntry item = shoppingRepository.findByIdAndOwnerId(itemId, ownerId)
                .orElseThrow(() -> new CustomException(ErrorCode.SHOPPING_ITEM_NOT_FOUND));
        shoppingRepository.delete(item);
    }

    /**
     * 재고가 기준치 이하인 항목. 적게 남은 순.
     */
    public List<RestockSuggestionDto> suggestRestock(Long ownerId) {
        double threshold = properties.getLedger().getLowStockThreshold();
        return store.getEntries(ownerId).stream()
                .filter(e -> e.getQuantity() <= threshold)
                .sorted(Comparator.comparingDouble(InventoryEntry::getQuantity)
                        .thenComparing(InventoryEntry::getCanonicalName))
                .map(InventoryMapper::toRestockDto)
                .toList();
    }
}
