package com.nosota.tripfund.api;

import com.nosota.tripfund.api.dto.ExpenseDTO;
import com.nosota.tripfund.api.request.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of ExpenseApi.
 *
 * <p>Not a Spring @Component; register it as a bean in the consuming service,
 * see {@link TripClient} for a configuration example.
 */
@RequiredArgsConstructor
@Slf4j
public class ExpenseClient implements ExpenseApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<ExpenseDTO> createExpense(String actingUserId, UUID tripId, CreateExpenseRequest request) {
        log.debug("Calling createExpense: tripId={}, amount={} {}", tripId, request.amount(), request.currency());

        return webClient.post()
                .uri("/api/v1/trips/{tripId}/expenses", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<ExpenseDTO>> getTripExpenses(String actingUserId, UUID tripId) {
        log.debug("Calling getTripExpenses: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/expenses", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<ExpenseDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> getExpense(String actingUserId, UUID expenseId) {
        log.debug("Calling getExpense: expenseId={}", expenseId);

        return webClient.get()
                .uri("/api/v1/expenses/{expenseId}", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> updateExpense(String actingUserId, UUID expenseId, UpdateExpenseRequest request) {
        log.debug("Calling updateExpense: expenseId={}", expenseId);

        return webClient.patch()
                .uri("/api/v1/expenses/{expenseId}", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteExpense(String actingUserId, UUID expenseId) {
        log.debug("Calling deleteExpense: expenseId={}", expenseId);

        return webClient.delete()
                .uri("/api/v1/expenses/{expenseId}", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> finalizeExpense(String actingUserId, UUID expenseId,
                                                      FinalizeExpenseRequest request) {
        log.debug("Calling finalizeExpense: expenseId={}, request={}", expenseId, request);

        WebClient.RequestBodySpec spec = webClient.post()
                .uri("/api/v1/expenses/{expenseId}/finalize", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId);
        if (request != null) {
            spec.bodyValue(request);
        }
        return spec.retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> reopenExpense(String actingUserId, UUID expenseId) {
        log.debug("Calling reopenExpense: expenseId={}", expenseId);

        return webClient.post()
                .uri("/api/v1/expenses/{expenseId}/reopen", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> replaceAssignments(String actingUserId, UUID expenseId,
                                                         ReplaceAssignmentsRequest request) {
        log.debug("Calling replaceAssignments: expenseId={}, count={}", expenseId, request.assignments().size());

        return webClient.put()
                .uri("/api/v1/expenses/{expenseId}/assignments", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> addAssignment(String actingUserId, UUID expenseId,
                                                    AddAssignmentRequest request) {
        log.debug("Calling addAssignment: expenseId={}, userId={}", expenseId, request.userId());

        return webClient.post()
                .uri("/api/v1/expenses/{expenseId}/assignments", expenseId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> updateAssignment(String actingUserId, UUID expenseId, UUID assignmentId,
                                                       UpdateAssignmentRequest request) {
        log.debug("Calling updateAssignment: expenseId={}, assignmentId={}", expenseId, assignmentId);

        return webClient.patch()
                .uri("/api/v1/expenses/{expenseId}/assignments/{assignmentId}", expenseId, assignmentId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ExpenseDTO> deleteAssignment(String actingUserId, UUID expenseId, UUID assignmentId) {
        log.debug("Calling deleteAssignment: expenseId={}, assignmentId={}", expenseId, assignmentId);

        return webClient.delete()
                .uri("/api/v1/expenses/{expenseId}/assignments/{assignmentId}", expenseId, assignmentId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(ExpenseDTO.class)
                .block();
    }
}
