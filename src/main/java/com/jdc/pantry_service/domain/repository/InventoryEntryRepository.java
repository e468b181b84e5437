package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.InventoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InventoryEntryRepository extends JpaRepository<InventoryEntry, Long> {

    List<InventoryEntry> findAllByOwnerId(Long ownerId);

    Optional<InventoryEntry> findByOwnerIdAndCanonicalName(Long ownerId, String canonicalName);

    void deleteByOwnerIdAndCanonicalName(Long ownerId, String canonicalName);
}
