package com.nosota.tripfund.controller;

import com.nosota.tripfund.api.TripApi;
import com.nosota.tripfund.api.dto.TimelineItemDTO;
import com.nosota.tripfund.api.dto.TripMemberDTO;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.request.AddMemberRequest;
import com.nosota.tripfund.api.request.CreateTripRequest;
import com.nosota.tripfund.api.request.SpendStatusRequest;
import com.nosota.tripfund.api.request.UpdateRsvpRequest;
import com.nosota.tripfund.api.response.SpendStatusResponse;
import com.nosota.tripfund.api.response.TripBalanceSummaryResponse;
import com.nosota.tripfund.api.response.TripResponse;
import com.nosota.tripfund.api.response.UserBalanceResponse;
import com.nosota.tripfund.dto.SpendWindowResult;
import com.nosota.tripfund.service.SpendWindowService;
import com.nosota.tripfund.service.TimelineService;
import com.nosota.tripfund.service.TripBalanceService;
import com.nosota.tripfund.service.TripService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for trips.
 *
 * <p>Implements {@link TripApi} interface for:
 * <ul>
 *   <li>Trip and membership management</li>
 *   <li>Spend window close / reopen</li>
 *   <li>Balance queries and timeline milestones</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class TripController implements TripApi {

    private static final String CLOSED_MESSAGE = "Trip spending is now closed. No one can add or edit spends.";
    private static final String OPEN_MESSAGE = "Trip spending is now open. Members can add and edit spends.";

    private final TripService tripService;
    private final SpendWindowService spendWindowService;
    private final TripBalanceService tripBalanceService;
    private final TimelineService timelineService;

    // ==================== Trips & Members ====================

    @Override
    public ResponseEntity<TripResponse> createTrip(String actingUserId, CreateTripRequest request) throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(tripService.createTrip(actingUserId, request));
    }

    @Override
    public ResponseEntity<TripResponse> getTrip(String actingUserId, UUID tripId) throws Exception {
        return ResponseEntity.ok(tripService.getTrip(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<List<TripMemberDTO>> getMembers(String actingUserId, UUID tripId) throws Exception {
        return ResponseEntity.ok(tripService.getMembers(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<TripMemberDTO> addMember(String actingUserId, UUID tripId, AddMemberRequest request)
            throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(tripService.addMember(tripId, actingUserId, request));
    }

    @Override
    public ResponseEntity<TripMemberDTO> updateRsvp(String actingUserId, UUID tripId, UpdateRsvpRequest request)
            throws Exception {
        return ResponseEntity.ok(tripService.updateRsvp(tripId, actingUserId, request));
    }

    // ==================== Spend Window ====================

    @Override
    public ResponseEntity<SpendStatusResponse> changeSpendStatus(String actingUserId, UUID tripId,
                                                                 SpendStatusRequest request) throws Exception {
        SpendWindowResult result = spendWindowService.changeSpendStatus(
                tripId, actingUserId, request != null ? request.action() : null);

        SpendStatusResponse response = new SpendStatusResponse(
                result.tripId(),
                result.spendStatus(),
                result.settlementCount(),
                result.spendStatus() == SpendStatus.CLOSED ? CLOSED_MESSAGE : OPEN_MESSAGE
        );
        return ResponseEntity.ok(response);
    }

    // ==================== Balances ====================

    @Override
    public ResponseEntity<TripBalanceSummaryResponse> getBalances(String actingUserId, UUID tripId) throws Exception {
        return ResponseEntity.ok(tripBalanceService.calculateTripBalances(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<UserBalanceResponse> getUserBalance(String actingUserId, UUID tripId, String userId)
            throws Exception {
        return ResponseEntity.ok(tripBalanceService.calculateUserBalance(tripId, actingUserId, userId));
    }

    // ==================== Timeline ====================

    @Override
    public ResponseEntity<List<TimelineItemDTO>> getTimeline(String actingUserId, UUID tripId) throws Exception {
        return ResponseEntity.ok(timelineService.getTimeline(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<TimelineItemDTO> toggleMilestone(String actingUserId, UUID tripId, UUID itemId)
            throws Exception {
        return ResponseEntity.ok(timelineService.toggleMilestone(tripId, itemId, actingUserId));
    }
}
