package com.supperclub.reservation.controller;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ApiResponse;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.dto.request.CreateHoldRequest;
import com.supperclub.reservation.dto.request.ValidateHoldRequest;
import com.supperclub.reservation.dto.response.HoldResponse;
import com.supperclub.reservation.dto.response.HoldValidationResponse;
import com.supperclub.reservation.service.SeatHoldManager;
import com.supperclub.reservation.service.SeatHoldService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Seat Hold", description = "Time-limited table holds taken before checkout")
@RestController
@RequestMapping("/api/v1/seat-holds")
@RequiredArgsConstructor
public class SeatHoldController {

    private final SeatHoldService seatHoldService;
    private final SeatHoldManager seatHoldManager;

    @Operation(summary = "Hold a table", description = "Take an exclusive hold on a table for checkout")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Table held"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or sales closed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Event or table not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Table unavailable or duplicate booking"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Hold could not be stored")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<HoldResponse>> createHold(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CreateHoldRequest request) {
        HoldResponse hold = seatHoldService.createHold(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(hold));
    }

    @Operation(summary = "Validate a hold", description = "Check that a lock token still holds the given table")
    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<HoldValidationResponse>> validateHold(
            @Valid @RequestBody ValidateHoldRequest request) {
        var check = seatHoldManager.checkHold(request.lockToken(), request.eventId(), request.tableId());
        return ResponseEntity.ok(ApiResponse.ok(HoldValidationResponse.from(check)));
    }

    @Operation(summary = "Complete a hold", description = "Mark a hold as converted into a booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Hold completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No active hold for token")
    })
    @PostMapping("/{lockToken}/complete")
    public ResponseEntity<ApiResponse<Void>> completeHold(@PathVariable String lockToken) {
        if (!seatHoldManager.completeHold(lockToken)) {
            throw new BusinessException(ErrorCode.HOLD_NOT_FOUND);
        }
        return ResponseEntity.ok(ApiResponse.ok());
    }

    @Operation(summary = "Expire stale holds", description = "Mark every elapsed active hold as expired")
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<Integer>> cleanup() {
        return ResponseEntity.ok(ApiResponse.ok(seatHoldManager.expireStaleHolds()));
    }
}
