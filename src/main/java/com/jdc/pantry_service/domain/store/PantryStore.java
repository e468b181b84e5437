package com.jdc.pantry_service.domain.store;

import com.jdc.pantry_service.domain.entity.InventoryEntry;
import com.jdc.pantry_service.domain.entity.ShoppingListEntry;

import java.util.List;

/**
 * 재고 원장과 정산 로직이 사용하는 저장소 경계.
 * 재시도/트랜잭션 의미는 구현체(JPA) 쪽 책임이다.
 */
public interface PantryStore {

    List<InventoryEntry> getEntries(Long ownerId);

    InventoryEntry upsertEntry(InventoryEntry entry);

    void deleteEntry(Long ownerId, String canonicalName);

    ShoppingListEntry insertShoppingItem(ShoppingListEntry item);
}
