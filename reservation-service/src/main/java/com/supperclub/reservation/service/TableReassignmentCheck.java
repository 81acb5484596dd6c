package com.supperclub.reservation.service;

public record TableReassignmentCheck(boolean valid, String reason) {

    public static TableReassignmentCheck ok() {
        return new TableReassignmentCheck(true, null);
    }

    public static TableReassignmentCheck blocked(String reason) {
        return new TableReassignmentCheck(false, reason);
    }
}
