package com.supperclub.reservation.service;

public enum HoldCheck {
    VALID,
    NOT_FOUND,
    /** Past its expiry; an ACTIVE hold found in this state is flipped to EXPIRED. */
    EXPIRED,
    /** Token exists but was issued for a different event or table. */
    MISMATCH,
    /** Already completed. */
    INACTIVE
}
