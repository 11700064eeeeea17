package com.nosota.tripfund.api;

import com.nosota.tripfund.api.request.RecordPaymentRequest;
import com.nosota.tripfund.api.request.UpdatePaymentRequest;
import com.nosota.tripfund.api.response.PaymentResponse;
import com.nosota.tripfund.api.response.SettlementResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Settlement API interface.
 *
 * <p>Settlements are created when a trip's spend window closes; this API reads them
 * and records repayments against them.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>SettlementController - in service module (server-side implementation)</li>
 *   <li>SettlementClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1")
public interface SettlementApi {

    /**
     * Lists persisted settlements of a trip (empty while the spend window is OPEN).
     */
    @GetMapping("/trips/{tripId}/settlements")
    ResponseEntity<List<SettlementResponse>> getTripSettlements(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    @GetMapping("/settlements/{settlementId}")
    ResponseEntity<SettlementResponse> getSettlement(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("settlementId") UUID settlementId) throws Exception;

    /**
     * Records a payment. Only the creditor or a trip organizer may record payments.
     */
    @PostMapping("/settlements/{settlementId}/payments")
    ResponseEntity<PaymentResponse> recordPayment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("settlementId") UUID settlementId,
            @Valid @RequestBody RecordPaymentRequest request) throws Exception;

    @PatchMapping("/settlements/{settlementId}/payments/{paymentId}")
    ResponseEntity<PaymentResponse> updatePayment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("settlementId") UUID settlementId,
            @PathVariable("paymentId") UUID paymentId,
            @Valid @RequestBody UpdatePaymentRequest request) throws Exception;

    @DeleteMapping("/settlements/{settlementId}/payments/{paymentId}")
    ResponseEntity<PaymentResponse> deletePayment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("settlementId") UUID settlementId,
            @PathVariable("paymentId") UUID paymentId) throws Exception;

    /**
     * Creditor confirms receipt of a fully paid settlement.
     */
    @PostMapping("/settlements/{settlementId}/verify")
    ResponseEntity<SettlementResponse> verifySettlement(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("settlementId") UUID settlementId) throws Exception;
}
