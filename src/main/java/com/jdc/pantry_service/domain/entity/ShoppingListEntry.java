package com.jdc.pantry_service.domain.entity;

import com.jdc.pantry_service.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "shopping_list_entries",
        indexes = @Index(name = "idx_shopping_owner", columnList = "owner_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ShoppingListEntry extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "quantity_display", length = 50)
    private String quantityDisplay;

    @Column(nullable = false)
    private boolean checked;

    public void toggle() {
        this.checked = !this.checked;
    }
}
