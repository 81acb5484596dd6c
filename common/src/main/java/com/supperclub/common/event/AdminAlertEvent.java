package com.supperclub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AdminAlertEvent extends DomainEvent {

    public static final String TYPE_PAID_UNSEATED = "PAID_UNSEATED";
    public static final String TYPE_PAYMENT_DISPUTED = "PAYMENT_DISPUTED";
    public static final String TYPE_MALFORMED_METADATA = "MALFORMED_METADATA";
    public static final String TYPE_NOTIFICATION_FAILED = "NOTIFICATION_FAILED";

    private Long issueId;
    private String paymentReference;
    private Long eventId;
    private Long tableId;
    private String detail;

    private AdminAlertEvent(String eventType, Long issueId, String paymentReference,
                            Long eventId, Long tableId, String detail) {
        super(eventType);
        this.issueId = issueId;
        this.paymentReference = paymentReference;
        this.eventId = eventId;
        this.tableId = tableId;
        this.detail = detail;
    }

    public static AdminAlertEvent of(String alertType, Long issueId, String paymentReference,
                                     Long eventId, Long tableId, String detail) {
        return new AdminAlertEvent(alertType, issueId, paymentReference, eventId, tableId, detail);
    }
}
