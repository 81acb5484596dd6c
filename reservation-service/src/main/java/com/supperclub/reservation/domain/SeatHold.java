package com.supperclub.reservation.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Short-lived claim on a table while the guest completes checkout.
 * COMPLETED and EXPIRED are terminal.
 */
@Entity
@Table(name = "seat_holds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long tableId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "seat_hold_seats", joinColumns = @JoinColumn(name = "seat_hold_id"))
    @Column(name = "seat_number", nullable = false)
    private List<Integer> seatNumbers = new ArrayList<>();

    @Column(length = 64)
    private String ownerId;

    @Column(length = 128)
    private String sessionId;

    @Column(nullable = false, unique = true, length = 36)
    private String lockToken;

    @Column(nullable = false)
    private LocalDateTime holdStartTime;

    @Column(nullable = false)
    private LocalDateTime holdExpiry;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SeatHoldStatus status;

    @Builder
    private SeatHold(Long eventId, Long tableId, List<Integer> seatNumbers, String ownerId,
                     String sessionId, String lockToken, LocalDateTime holdStartTime, Duration ttl) {
        this.eventId = eventId;
        this.tableId = tableId;
        if (seatNumbers != null) {
            this.seatNumbers.addAll(seatNumbers);
        }
        this.ownerId = ownerId;
        this.sessionId = sessionId;
        this.lockToken = lockToken;
        this.holdStartTime = holdStartTime;
        this.holdExpiry = holdStartTime.plus(ttl);
        this.status = SeatHoldStatus.ACTIVE;
    }

    /** Strictly after the expiry instant; a hold is still valid at exactly {@code holdExpiry}. */
    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(this.holdExpiry);
    }

    public boolean isActiveAt(LocalDateTime now) {
        return this.status == SeatHoldStatus.ACTIVE && !isExpired(now);
    }

    public boolean complete() {
        if (this.status != SeatHoldStatus.ACTIVE) {
            return false;
        }
        this.status = SeatHoldStatus.COMPLETED;
        return true;
    }

    public boolean expire() {
        if (this.status != SeatHoldStatus.ACTIVE) {
            return false;
        }
        this.status = SeatHoldStatus.EXPIRED;
        return true;
    }

    /** Whole minutes left, rounded up. Zero once expired. */
    public long remainingMinutes(LocalDateTime now) {
        long seconds = Duration.between(now, this.holdExpiry).getSeconds();
        if (seconds <= 0) {
            return 0;
        }
        return (seconds + 59) / 60;
    }
}
