package com.supperclub.reservation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One menu choice on a booking. Food courses and wine share the same shape,
 * told apart by {@link SelectionKind}.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingSelection {

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private SelectionKind kind;

    @Column(name = "item_id", nullable = false, length = 64)
    private String itemId;

    @Column(name = "item_name", length = 200)
    private String name;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    public BookingSelection(SelectionKind kind, String itemId, String name, int quantity) {
        this.kind = kind;
        this.itemId = itemId;
        this.name = name;
        this.quantity = quantity;
    }
}
