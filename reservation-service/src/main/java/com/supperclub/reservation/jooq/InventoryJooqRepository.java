package com.supperclub.reservation.jooq;

import com.supperclub.reservation.domain.BookingStatus;
import com.supperclub.reservation.domain.SeatHoldStatus;
import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record2;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * jOOQ repository for hot path inventory statements.
 * Handles: availability aggregates, bulk hold expiry, live hold lookups, counter writes.
 * Callers that read inside a JPA transaction must flush pending entity changes first.
 */
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryJooqRepository {

    static final Table<?> BOOKINGS = DSL.table(DSL.name("bookings"));
    static final Field<Long> BOOKING_EVENT_ID = DSL.field(DSL.name("bookings", "event_id"), Long.class);
    static final Field<Long> BOOKING_TABLE_ID = DSL.field(DSL.name("bookings", "table_id"), Long.class);
    static final Field<Integer> BOOKING_PARTY_SIZE = DSL.field(DSL.name("bookings", "party_size"), Integer.class);
    static final Field<String> BOOKING_STATUS = DSL.field(DSL.name("bookings", "status"), String.class);
    static final Field<String> BOOKING_LOCK_TOKEN = DSL.field(DSL.name("bookings", "lock_token"), String.class);

    static final Table<?> SEAT_HOLDS = DSL.table(DSL.name("seat_holds"));
    static final Field<Long> HOLD_EVENT_ID = DSL.field(DSL.name("seat_holds", "event_id"), Long.class);
    static final Field<Long> HOLD_TABLE_ID = DSL.field(DSL.name("seat_holds", "table_id"), Long.class);
    static final Field<String> HOLD_LOCK_TOKEN = DSL.field(DSL.name("seat_holds", "lock_token"), String.class);
    static final Field<String> HOLD_STATUS = DSL.field(DSL.name("seat_holds", "status"), String.class);
    static final Field<LocalDateTime> HOLD_EXPIRY =
            DSL.field(DSL.name("seat_holds", "hold_expiry"), LocalDateTime.class);

    static final Table<?> EVENTS = DSL.table(DSL.name("events"));
    static final Field<Long> EVENT_ID = DSL.field(DSL.name("events", "id"), Long.class);
    static final Field<Integer> EVENT_AVAILABLE_SEATS =
            DSL.field(DSL.name("events", "available_seats"), Integer.class);
    static final Field<Integer> EVENT_AVAILABLE_TABLES =
            DSL.field(DSL.name("events", "available_tables"), Integer.class);
    static final Field<LocalDateTime> EVENT_UPDATED_AT =
            DSL.field(DSL.name("events", "updated_at"), LocalDateTime.class);

    private static final String ACTIVE = SeatHoldStatus.ACTIVE.name();
    private static final String EXPIRED = SeatHoldStatus.EXPIRED.name();

    private final DSLContext dsl;

    /**
     * Seats booked (every non-released booking) and distinct tables occupied
     * (blocking bookings only) for one event, in a single pass.
     */
    public BookingTotals aggregateBookings(Long eventId) {
        Field<BigDecimal> bookedSeats = DSL.sum(
                DSL.case_()
                        .when(BOOKING_STATUS.notIn(names(BookingStatus.RELEASED)), BOOKING_PARTY_SIZE)
                        .otherwise(0));
        Field<Integer> bookedTables = DSL.countDistinct(
                DSL.case_()
                        .when(BOOKING_STATUS.in(names(BookingStatus.BLOCKING)), BOOKING_TABLE_ID));

        Record2<BigDecimal, Integer> row = dsl.select(bookedSeats, bookedTables)
                .from(BOOKINGS)
                .where(BOOKING_EVENT_ID.eq(eventId))
                .fetchOne();

        if (row == null) {
            return new BookingTotals(0, 0);
        }
        BigDecimal seats = row.value1();
        Integer tables = row.value2();
        return new BookingTotals(
                seats == null ? 0 : seats.intValue(),
                tables == null ? 0 : tables);
    }

    /**
     * Flips every ACTIVE hold past its expiry to EXPIRED. Returns the number of rows changed.
     */
    @Transactional
    public int expireStaleHolds(LocalDateTime now) {
        return dsl.update(SEAT_HOLDS)
                .set(HOLD_STATUS, EXPIRED)
                .where(HOLD_STATUS.eq(ACTIVE))
                .and(HOLD_EXPIRY.lt(now))
                .execute();
    }

    /**
     * Same as {@link #expireStaleHolds(LocalDateTime)} scoped to one table, run before
     * a new hold is attempted so a dead hold cannot trip the active-hold unique index.
     */
    @Transactional
    public int expireStaleHolds(Long eventId, Long tableId, LocalDateTime now) {
        return dsl.update(SEAT_HOLDS)
                .set(HOLD_STATUS, EXPIRED)
                .where(HOLD_EVENT_ID.eq(eventId))
                .and(HOLD_TABLE_ID.eq(tableId))
                .and(HOLD_STATUS.eq(ACTIVE))
                .and(HOLD_EXPIRY.lt(now))
                .execute();
    }

    /**
     * Counts live holds on a table. A hold owned by {@code excludeLockToken} is not counted.
     */
    public int countActiveHolds(Long eventId, Long tableId, LocalDateTime now, String excludeLockToken) {
        Condition condition = HOLD_EVENT_ID.eq(eventId)
                .and(HOLD_TABLE_ID.eq(tableId))
                .and(HOLD_STATUS.eq(ACTIVE))
                .and(HOLD_EXPIRY.ge(now));
        if (excludeLockToken != null) {
            condition = condition.and(HOLD_LOCK_TOKEN.ne(excludeLockToken));
        }
        return dsl.fetchCount(SEAT_HOLDS, condition);
    }

    /**
     * Lock tokens of holds still ACTIVE although a blocking booking was written from them.
     */
    public List<String> findDanglingHoldTokens() {
        return dsl.select(HOLD_LOCK_TOKEN)
                .from(SEAT_HOLDS)
                .join(BOOKINGS).on(BOOKING_LOCK_TOKEN.eq(HOLD_LOCK_TOKEN))
                .where(HOLD_STATUS.eq(ACTIVE))
                .and(BOOKING_STATUS.in(names(BookingStatus.BLOCKING)))
                .fetch(HOLD_LOCK_TOKEN);
    }

    /**
     * Writes the derived availability counters onto the event row.
     */
    @Transactional
    public int updateEventAvailability(Long eventId, int availableSeats, int availableTables) {
        return dsl.update(EVENTS)
                .set(EVENT_AVAILABLE_SEATS, availableSeats)
                .set(EVENT_AVAILABLE_TABLES, availableTables)
                .set(EVENT_UPDATED_AT, DSL.currentLocalDateTime())
                .where(EVENT_ID.eq(eventId))
                .execute();
    }

    public List<Long> findAllEventIds() {
        return dsl.select(EVENT_ID)
                .from(EVENTS)
                .orderBy(EVENT_ID.asc())
                .fetch(EVENT_ID);
    }

    private static List<String> names(Collection<BookingStatus> statuses) {
        return statuses.stream()
                .map(Enum::name)
                .sorted()
                .collect(Collectors.toList());
    }

    public record BookingTotals(int bookedSeats, int bookedTables) {
    }
}
