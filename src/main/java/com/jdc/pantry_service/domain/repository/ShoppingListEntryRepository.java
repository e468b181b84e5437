package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.ShoppingListEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ShoppingListEntryRepository extends JpaRepository<ShoppingListEntry, Long> {

    /** 미체크 항목 먼저, 같은 상태 안에서는 최근 추가 순 */
    List<ShoppingListEntry> findAllByOwnerIdOrderByCheckedAscIdDesc(Long ownerId);

    Optional<ShoppingListEntry> findByIdAndOwnerId(Long id, Long ownerId);
}
