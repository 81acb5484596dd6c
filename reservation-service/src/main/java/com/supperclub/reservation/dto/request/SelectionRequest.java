package com.supperclub.reservation.dto.request;

import com.supperclub.reservation.domain.BookingSelection;
import com.supperclub.reservation.domain.SelectionKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record SelectionRequest(
        @NotNull SelectionKind kind,
        @NotBlank String itemId,
        String name,
        @Positive int quantity
) {
    public BookingSelection toSelection() {
        return new BookingSelection(kind, itemId, name, quantity);
    }
}
