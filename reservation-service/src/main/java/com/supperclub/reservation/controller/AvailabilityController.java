package com.supperclub.reservation.controller;

import com.supperclub.common.response.ApiResponse;
import com.supperclub.reservation.dto.response.AvailabilityResponse;
import com.supperclub.reservation.dto.response.TableAvailabilityResponse;
import com.supperclub.reservation.service.AvailabilityCalculator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Availability", description = "Remaining seats and tables per event")
@RestController
@RequestMapping("/api/v1/events/{eventId}")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityCalculator availabilityCalculator;

    @Operation(summary = "Event availability", description = "Cached seat and table counts for an event")
    @GetMapping("/availability")
    public ResponseEntity<ApiResponse<AvailabilityResponse>> getAvailability(@PathVariable Long eventId) {
        var snapshot = availabilityCalculator.computeAvailability(eventId);
        return ResponseEntity.ok(ApiResponse.ok(AvailabilityResponse.from(snapshot)));
    }

    @Operation(summary = "Table availability", description = "Live check whether a table can still be booked")
    @GetMapping("/tables/{tableId}/availability")
    public ResponseEntity<ApiResponse<TableAvailabilityResponse>> getTableAvailability(
            @PathVariable Long eventId,
            @PathVariable Long tableId) {
        boolean available = availabilityCalculator.isTableAvailable(eventId, tableId);
        return ResponseEntity.ok(ApiResponse.ok(new TableAvailabilityResponse(eventId, tableId, available)));
    }
}
