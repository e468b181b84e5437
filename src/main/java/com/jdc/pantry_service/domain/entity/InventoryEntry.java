package com.jdc.pantry_service.domain.entity;

import com.jdc.pantry_service.domain.type.CanonicalUnit;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 사용자별 재고 한 줄. (owner_id, canonical_name) 당 하나만 존재한다.
 * updated_at 은 퍼지 매칭 동점 처리에 쓰이므로 감사(auditing) 대신 원장이 직접 기록한다.
 */
@Entity
@Table(name = "inventory_entries",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_inventory_owner_name",
                columnNames = {"owner_id", "canonical_name"}),
        indexes = @Index(name = "idx_inventory_owner", columnList = "owner_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class InventoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "canonical_name", nullable = false, length = 100)
    private String canonicalName;

    @Column(nullable = false)
    private double quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CanonicalUnit unit;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void changeQuantity(double quantity, LocalDateTime at) {
        if (quantity < 0) {
            throw new IllegalArgumentException("재고 수량은 음수가 될 수 없습니다: " + quantity);
        }
        this.quantity = quantity;
        this.updatedAt = at;
    }
}
