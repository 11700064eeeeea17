package com.nosota.tripfund.api;

import com.nosota.tripfund.api.dto.TimelineItemDTO;
import com.nosota.tripfund.api.dto.TripMemberDTO;
import com.nosota.tripfund.api.request.AddMemberRequest;
import com.nosota.tripfund.api.request.CreateTripRequest;
import com.nosota.tripfund.api.request.SpendStatusRequest;
import com.nosota.tripfund.api.request.UpdateRsvpRequest;
import com.nosota.tripfund.api.response.SpendStatusResponse;
import com.nosota.tripfund.api.response.TripBalanceSummaryResponse;
import com.nosota.tripfund.api.response.TripResponse;
import com.nosota.tripfund.api.response.UserBalanceResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Trip API interface.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Trip and membership management</li>
 *   <li>Spend window lifecycle (close / reopen, materializes settlements)</li>
 *   <li>Balance queries (per-person balances and minimal settlement plan)</li>
 *   <li>Timeline milestones</li>
 * </ul>
 *
 * <p>Every call carries the caller's ID in the {@value ApiHeaders#USER_ID} header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>TripController - in service module (server-side implementation)</li>
 *   <li>TripClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/trips")
public interface TripApi {

    // ==================== Trips & Members ====================

    /**
     * Creates a trip. The caller becomes its OWNER and default milestones are seeded.
     *
     * @param actingUserId Caller ID
     * @param request      Trip details
     * @return Created trip
     */
    @PostMapping
    ResponseEntity<TripResponse> createTrip(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @Valid @RequestBody CreateTripRequest request) throws Exception;

    @GetMapping("/{tripId}")
    ResponseEntity<TripResponse> getTrip(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    @GetMapping("/{tripId}/members")
    ResponseEntity<List<TripMemberDTO>> getMembers(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    /**
     * Adds a user to the trip. Organizers only.
     */
    @PostMapping("/{tripId}/members")
    ResponseEntity<TripMemberDTO> addMember(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody AddMemberRequest request) throws Exception;

    /**
     * Updates the caller's own RSVP.
     */
    @PutMapping("/{tripId}/members/me/rsvp")
    ResponseEntity<TripMemberDTO> updateRsvp(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody UpdateRsvpRequest request) throws Exception;

    // ==================== Spend Window ====================

    /**
     * Closes, reopens or toggles the trip's spend window. Organizers only.
     *
     * <p>Closing recomputes balances and replaces all settlement records of the trip;
     * reopening deletes them. Both run in a single transaction.
     *
     * @param actingUserId Caller ID
     * @param tripId       Trip UUID
     * @param request      Optional action; absent body toggles
     * @return Resulting spend status and number of settlements
     */
    @PostMapping("/{tripId}/spend-status")
    ResponseEntity<SpendStatusResponse> changeSpendStatus(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @RequestBody(required = false) SpendStatusRequest request) throws Exception;

    // ==================== Balances ====================

    /**
     * Calculates per-person balances and the minimal settlement plan. Members only.
     */
    @GetMapping("/{tripId}/balances")
    ResponseEntity<TripBalanceSummaryResponse> getBalances(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    /**
     * Calculates how much a single user owes and is owed. Members only.
     */
    @GetMapping("/{tripId}/balances/{userId}")
    ResponseEntity<UserBalanceResponse> getUserBalance(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @PathVariable("userId") String userId) throws Exception;

    // ==================== Timeline ====================

    @GetMapping("/{tripId}/timeline")
    ResponseEntity<List<TimelineItemDTO>> getTimeline(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    /**
     * Toggles completion of a milestone. Completing "Spending Window Closes" closes the
     * spend window exactly like {@link #changeSpendStatus}; un-completing it reopens it.
     */
    @PostMapping("/{tripId}/timeline/{itemId}/toggle")
    ResponseEntity<TimelineItemDTO> toggleMilestone(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @PathVariable("itemId") UUID itemId) throws Exception;
}
