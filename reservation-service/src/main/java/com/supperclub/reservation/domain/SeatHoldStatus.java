package com.supperclub.reservation.domain;

public enum SeatHoldStatus {
    ACTIVE, COMPLETED, EXPIRED
}
