package com.supperclub.reservation.controller;

import com.supperclub.common.response.ApiResponse;
import com.supperclub.reservation.domain.IssueStatus;
import com.supperclub.reservation.dto.request.CancelBookingRequest;
import com.supperclub.reservation.dto.request.ManualReservationRequest;
import com.supperclub.reservation.dto.request.MarkPaidOfflineRequest;
import com.supperclub.reservation.dto.request.ModifyBookingRequest;
import com.supperclub.reservation.dto.request.ResolveIssueRequest;
import com.supperclub.reservation.dto.response.BookingResponse;
import com.supperclub.reservation.dto.response.ModificationCheckResponse;
import com.supperclub.reservation.dto.response.ReconciliationIssueResponse;
import com.supperclub.reservation.service.AdminConflictGuard;
import com.supperclub.reservation.service.AvailabilityCalculator;
import com.supperclub.reservation.service.BookingService;
import com.supperclub.reservation.service.EscalationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Back-office operations. The gateway authenticates admins and forwards their id in {@code X-Admin-Id}.
 */
@Tag(name = "Admin", description = "Manual bookings, modifications and reconciliation review")
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminBookingController {

    private final BookingService bookingService;
    private final AdminConflictGuard conflictGuard;
    private final EscalationService escalationService;
    private final AvailabilityCalculator availabilityCalculator;

    @Operation(summary = "Get booking", description = "Booking details including the version needed for modification")
    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(@PathVariable Long bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(bookingService.getBooking(bookingId))));
    }

    @Operation(summary = "Create manual reservation", description = "Reserve or comp a table on behalf of a guest")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Event or table not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Table sold or on hold")
    })
    @PostMapping("/bookings/reserve")
    public ResponseEntity<ApiResponse<BookingResponse>> createReservation(
            @Parameter(hidden = true) @RequestHeader("X-Admin-Id") String adminId,
            @Valid @RequestBody ManualReservationRequest request) {
        var booking = bookingService.createManualReservation(request, adminId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Mark paid offline", description = "Confirm a reserved booking paid outside the gateway")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking confirmed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking not in RESERVED status")
    })
    @PostMapping("/bookings/{bookingId}/mark-paid-offline")
    public ResponseEntity<ApiResponse<BookingResponse>> markPaidOffline(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Admin-Id") String adminId,
            @Valid @RequestBody MarkPaidOfflineRequest request) {
        var booking = bookingService.markPaidOffline(bookingId, request.amountCents(), adminId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Modify booking", description = "Change table, party or selections of a booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking modified"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Target table blocked or stale version")
    })
    @PatchMapping("/bookings/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> modifyBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Admin-Id") String adminId,
            @Valid @RequestBody ModifyBookingRequest request) {
        var booking = bookingService.modifyBooking(bookingId, request, adminId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Cancel booking", description = "Cancel a booking and release its table")
    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Admin-Id") String adminId,
            @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request == null ? null : request.reason();
        var booking = bookingService.cancelBooking(bookingId, adminId, reason);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Check table reassignment",
            description = "Whether a booking may be moved onto the given table")
    @GetMapping("/events/{eventId}/tables/{tableId}/modification-check")
    public ResponseEntity<ApiResponse<ModificationCheckResponse>> checkModification(
            @PathVariable Long eventId,
            @PathVariable Long tableId,
            @RequestParam(required = false) Long excludeBookingId) {
        var check = conflictGuard.checkSeatModification(tableId, eventId, excludeBookingId);
        return ResponseEntity.ok(ApiResponse.ok(ModificationCheckResponse.from(check)));
    }

    @Operation(summary = "List reconciliation issues", description = "Escalated payment outcomes awaiting review")
    @GetMapping("/reconciliation-issues")
    public ResponseEntity<ApiResponse<List<ReconciliationIssueResponse>>> listIssues(
            @RequestParam(defaultValue = "OPEN") IssueStatus status) {
        var issues = escalationService.findIssues(status).stream()
                .map(ReconciliationIssueResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(issues));
    }

    @Operation(summary = "Resolve reconciliation issue")
    @PostMapping("/reconciliation-issues/{issueId}/resolve")
    public ResponseEntity<ApiResponse<ReconciliationIssueResponse>> resolveIssue(
            @PathVariable Long issueId,
            @Parameter(hidden = true) @RequestHeader("X-Admin-Id") String adminId,
            @RequestBody(required = false) ResolveIssueRequest request) {
        String note = request == null ? null : request.note();
        var issue = escalationService.resolve(issueId, adminId, note);
        return ResponseEntity.ok(ApiResponse.ok(ReconciliationIssueResponse.from(issue)));
    }

    @Operation(summary = "Resync availability", description = "Recompute stored availability counters for every event")
    @PostMapping("/availability/sync")
    public ResponseEntity<ApiResponse<Integer>> syncAvailability() {
        return ResponseEntity.ok(ApiResponse.ok(availabilityCalculator.syncAllEventsAvailability()));
    }
}
