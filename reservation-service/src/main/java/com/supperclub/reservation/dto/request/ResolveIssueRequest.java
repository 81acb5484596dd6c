package com.supperclub.reservation.dto.request;

public record ResolveIssueRequest(String note) {
}
