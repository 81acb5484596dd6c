package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.domain.IssueStatus;
import com.supperclub.reservation.domain.IssueType;
import com.supperclub.reservation.domain.ReconciliationIssue;
import com.supperclub.reservation.event.producer.AdminAlertPublisher;
import com.supperclub.reservation.repository.ReconciliationIssueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Human-review queue for payment outcomes the engine cannot settle by itself.
 * Each issue is persisted first, then alerted; open issues are re-alerted by the sweep
 * until an admin resolves them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    private final ReconciliationIssueRepository issueRepository;
    private final AdminAlertPublisher alertPublisher;
    private final AdminAuditService auditService;
    private final Clock clock;

    @Transactional
    public ReconciliationIssue escalate(IssueType type, String gatewayEventId, String paymentReference,
                                        Long eventId, Long tableId, Long bookingId, String detail) {
        ReconciliationIssue issue = issueRepository.save(ReconciliationIssue.builder()
                .issueType(type)
                .gatewayEventId(gatewayEventId)
                .paymentReference(paymentReference)
                .eventId(eventId)
                .tableId(tableId)
                .bookingId(bookingId)
                .detail(detail)
                .build());
        log.error("ESCALATION: type={}, issueId={}, paymentReference={}, eventId={}, tableId={}, detail={}",
                type, issue.getId(), paymentReference, eventId, tableId, detail);
        sendAlert(issue, LocalDateTime.now(clock));
        return issue;
    }

    @Transactional
    public ReconciliationIssue recordNotificationFailure(Long bookingId, String eventType, String topic) {
        return escalate(IssueType.NOTIFICATION_FAILED, null, null, null, null, bookingId,
                "Notification " + eventType + " could not be delivered to " + topic);
    }

    /**
     * @return how many open issues were alerted successfully this round
     */
    @Transactional
    public int realertOpenIssues() {
        List<ReconciliationIssue> open = issueRepository.findByStatusOrderByCreatedAtAsc(IssueStatus.OPEN);
        LocalDateTime now = LocalDateTime.now(clock);
        int delivered = 0;
        for (ReconciliationIssue issue : open) {
            if (sendAlert(issue, now)) {
                delivered++;
            }
        }
        return delivered;
    }

    @Transactional(readOnly = true)
    public List<ReconciliationIssue> findIssues(IssueStatus status) {
        return issueRepository.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional
    public ReconciliationIssue resolve(Long issueId, String adminId, String note) {
        ReconciliationIssue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ISSUE_NOT_FOUND));
        if (issue.resolve(adminId, note, LocalDateTime.now(clock))) {
            auditService.record(adminId, "RESOLVE_ISSUE", "ReconciliationIssue", issueId,
                    Map.of("type", issue.getIssueType().name(), "note", note == null ? "" : note));
            log.info("Reconciliation issue resolved: issueId={}, by={}", issueId, adminId);
        }
        return issue;
    }

    /** Only acknowledged alerts count towards alertCount. */
    private boolean sendAlert(ReconciliationIssue issue, LocalDateTime now) {
        if (!alertPublisher.alert(issue)) {
            return false;
        }
        issue.recordAlert(now);
        return true;
    }
}
