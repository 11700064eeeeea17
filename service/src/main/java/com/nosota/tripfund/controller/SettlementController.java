package com.nosota.tripfund.controller;

import com.nosota.tripfund.api.SettlementApi;
import com.nosota.tripfund.api.request.RecordPaymentRequest;
import com.nosota.tripfund.api.request.UpdatePaymentRequest;
import com.nosota.tripfund.api.response.PaymentResponse;
import com.nosota.tripfund.api.response.SettlementResponse;
import com.nosota.tripfund.service.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for persisted settlements and the payments recorded against them.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SettlementController implements SettlementApi {

    private final SettlementService settlementService;

    @Override
    public ResponseEntity<List<SettlementResponse>> getTripSettlements(String actingUserId, UUID tripId)
            throws Exception {
        return ResponseEntity.ok(settlementService.getTripSettlements(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<SettlementResponse> getSettlement(String actingUserId, UUID settlementId) throws Exception {
        return ResponseEntity.ok(settlementService.getSettlement(settlementId, actingUserId));
    }

    @Override
    public ResponseEntity<PaymentResponse> recordPayment(String actingUserId, UUID settlementId,
                                                         RecordPaymentRequest request) throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(settlementService.recordPayment(settlementId, actingUserId, request));
    }

    @Override
    public ResponseEntity<PaymentResponse> updatePayment(String actingUserId, UUID settlementId, UUID paymentId,
                                                         UpdatePaymentRequest request) throws Exception {
        return ResponseEntity.ok(settlementService.updatePayment(settlementId, paymentId, actingUserId, request));
    }

    @Override
    public ResponseEntity<PaymentResponse> deletePayment(String actingUserId, UUID settlementId, UUID paymentId)
            throws Exception {
        return ResponseEntity.ok(settlementService.deletePayment(settlementId, paymentId, actingUserId));
    }

    @Override
    public ResponseEntity<SettlementResponse> verifySettlement(String actingUserId, UUID settlementId)
            throws Exception {
        return ResponseEntity.ok(settlementService.verifySettlement(settlementId, actingUserId));
    }
}
