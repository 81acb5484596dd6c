package com.supperclub.reservation.dto.response;

import com.supperclub.reservation.domain.ReconciliationIssue;

import java.time.LocalDateTime;

public record ReconciliationIssueResponse(
        Long issueId,
        String type,
        String status,
        String paymentReference,
        Long eventId,
        Long tableId,
        Long bookingId,
        String detail,
        int alertCount,
        String resolvedBy,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {
    public static ReconciliationIssueResponse from(ReconciliationIssue issue) {
        return new ReconciliationIssueResponse(
                issue.getId(),
                issue.getIssueType().name(),
                issue.getStatus().name(),
                issue.getPaymentReference(),
                issue.getEventId(),
                issue.getTableId(),
                issue.getBookingId(),
                issue.getDetail(),
                issue.getAlertCount(),
                issue.getResolvedBy(),
                issue.getCreatedAt(),
                issue.getResolvedAt()
        );
    }
}
