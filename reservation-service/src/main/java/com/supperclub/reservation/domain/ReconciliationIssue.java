package com.supperclub.reservation.domain;

import com.supperclub.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Durable record of a payment outcome that needs a human: refund, reseat or contact the guest.
 */
@Entity
@Table(name = "reconciliation_issues")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReconciliationIssue extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private IssueType issueType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IssueStatus status;

    @Column(length = 100)
    private String gatewayEventId;

    @Column(length = 100)
    private String paymentReference;

    private Long eventId;

    private Long tableId;

    private Long bookingId;

    @Column(length = 1000)
    private String detail;

    @Column(nullable = false)
    private int alertCount;

    private LocalDateTime lastAlertedAt;

    @Column(length = 64)
    private String resolvedBy;

    private LocalDateTime resolvedAt;

    @Column(length = 1000)
    private String resolutionNote;

    @Builder
    private ReconciliationIssue(IssueType issueType, String gatewayEventId, String paymentReference,
                                Long eventId, Long tableId, Long bookingId, String detail) {
        this.issueType = issueType;
        this.gatewayEventId = gatewayEventId;
        this.paymentReference = paymentReference;
        this.eventId = eventId;
        this.tableId = tableId;
        this.bookingId = bookingId;
        this.detail = detail;
        this.status = IssueStatus.OPEN;
    }

    public void recordAlert(LocalDateTime now) {
        this.alertCount++;
        this.lastAlertedAt = now;
    }

    public boolean resolve(String adminId, String note, LocalDateTime now) {
        if (this.status == IssueStatus.RESOLVED) {
            return false;
        }
        this.status = IssueStatus.RESOLVED;
        this.resolvedBy = adminId;
        this.resolutionNote = note;
        this.resolvedAt = now;
        return true;
    }

    public boolean isOpen() {
        return this.status == IssueStatus.OPEN;
    }
}
