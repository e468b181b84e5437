package com.jdc.pantry_service.domain.store;

import com.jdc.pantry_service.domain.entity.InventoryEntry;
import com.jdc.pantry_service.domain.entity.ShoppingListEntry;
import com.jdc.pantry_service.domain.repository.InventoryEntryRepository;
import com.jdc.pantry_service.domain.repository.ShoppingListEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaPantryStore implements PantryStore {

    private final InventoryEntryRepository inventoryRepo;
    private final ShoppingListEntryRepository shoppingRepo;

    @Override
    public List<InventoryEntry> getEntries(Long ownerId) {
        return inventoryRepo.findAllByOwnerId(ownerId);
    }

    @Override
    public InventoryEntry upsertEntry(InventoryEntry entry) {
        return inventoryRepo.save(entry);
    }

    @Override
    public void deleteEntry(Long ownerId, String canonicalName) {
        inventoryRepo.deleteByOwnerIdAndCanonicalName(ownerId, canonicalName);
    }

    @Override
    public ShoppingListEntry insertShoppingItem(ShoppingListEntry item) {
        return shoppingRepo.save(item);
    }
}
