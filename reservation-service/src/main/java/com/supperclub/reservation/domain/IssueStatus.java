package com.supperclub.reservation.domain;

public enum IssueStatus {
    OPEN, RESOLVED
}
