package com.nosota.tripfund.api;

import com.nosota.tripfund.api.request.RecordPaymentRequest;
import com.nosota.tripfund.api.request.UpdatePaymentRequest;
import com.nosota.tripfund.api.response.PaymentResponse;
import com.nosota.tripfund.api.response.SettlementResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of SettlementApi.
 *
 * <p>Not a Spring @Component; register it as a bean in the consuming service,
 * see {@link TripClient} for a configuration example.
 */
@RequiredArgsConstructor
@Slf4j
public class SettlementClient implements SettlementApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<SettlementResponse>> getTripSettlements(String actingUserId, UUID tripId) {
        log.debug("Calling getTripSettlements: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/settlements", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SettlementResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> getSettlement(String actingUserId, UUID settlementId) {
        log.debug("Calling getSettlement: settlementId={}", settlementId);

        return webClient.get()
                .uri("/api/v1/settlements/{settlementId}", settlementId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> recordPayment(String actingUserId, UUID settlementId,
                                                         RecordPaymentRequest request) {
        log.debug("Calling recordPayment: settlementId={}, amount={}", settlementId, request.amount());

        return webClient.post()
                .uri("/api/v1/settlements/{settlementId}/payments", settlementId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> updatePayment(String actingUserId, UUID settlementId, UUID paymentId,
                                                         UpdatePaymentRequest request) {
        log.debug("Calling updatePayment: settlementId={}, paymentId={}", settlementId, paymentId);

        return webClient.patch()
                .uri("/api/v1/settlements/{settlementId}/payments/{paymentId}", settlementId, paymentId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentResponse> deletePayment(String actingUserId, UUID settlementId, UUID paymentId) {
        log.debug("Calling deletePayment: settlementId={}, paymentId={}", settlementId, paymentId);

        return webClient.delete()
                .uri("/api/v1/settlements/{settlementId}/payments/{paymentId}", settlementId, paymentId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(PaymentResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> verifySettlement(String actingUserId, UUID settlementId) {
        log.debug("Calling verifySettlement: settlementId={}", settlementId);

        return webClient.post()
                .uri("/api/v1/settlements/{settlementId}/verify", settlementId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }
}
