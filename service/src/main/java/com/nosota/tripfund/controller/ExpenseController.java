package com.nosota.tripfund.controller;

import com.nosota.tripfund.api.ExpenseApi;
import com.nosota.tripfund.api.dto.ExpenseDTO;
import com.nosota.tripfund.api.request.*;
import com.nosota.tripfund.service.ExpenseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for expenses and their cost assignments.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ExpenseController implements ExpenseApi {

    private final ExpenseService expenseService;

    // ==================== Expenses ====================

    @Override
    public ResponseEntity<ExpenseDTO> createExpense(String actingUserId, UUID tripId, CreateExpenseRequest request)
            throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(expenseService.createExpense(tripId, actingUserId, request));
    }

    @Override
    public ResponseEntity<List<ExpenseDTO>> getTripExpenses(String actingUserId, UUID tripId) throws Exception {
        return ResponseEntity.ok(expenseService.getTripExpenses(tripId, actingUserId));
    }

    @Override
    public ResponseEntity<ExpenseDTO> getExpense(String actingUserId, UUID expenseId) throws Exception {
        return ResponseEntity.ok(expenseService.getExpense(expenseId, actingUserId));
    }

    @Override
    public ResponseEntity<ExpenseDTO> updateExpense(String actingUserId, UUID expenseId, UpdateExpenseRequest request)
            throws Exception {
        return ResponseEntity.ok(expenseService.updateExpense(expenseId, actingUserId, request));
    }

    @Override
    public ResponseEntity<Void> deleteExpense(String actingUserId, UUID expenseId) throws Exception {
        expenseService.deleteExpense(expenseId, actingUserId);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<ExpenseDTO> finalizeExpense(String actingUserId, UUID expenseId,
                                                      FinalizeExpenseRequest request) throws Exception {
        boolean force = request != null && request.forced();
        return ResponseEntity.ok(expenseService.finalizeExpense(expenseId, actingUserId, force));
    }

    @Override
    public ResponseEntity<ExpenseDTO> reopenExpense(String actingUserId, UUID expenseId) throws Exception {
        return ResponseEntity.ok(expenseService.reopenExpense(expenseId, actingUserId));
    }

    // ==================== Assignments ====================

    @Override
    public ResponseEntity<ExpenseDTO> replaceAssignments(String actingUserId, UUID expenseId,
                                                         ReplaceAssignmentsRequest request) throws Exception {
        return ResponseEntity.ok(expenseService.replaceAssignments(expenseId, actingUserId, request));
    }

    @Override
    public ResponseEntity<ExpenseDTO> addAssignment(String actingUserId, UUID expenseId,
                                                    AddAssignmentRequest request) throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(expenseService.addAssignment(expenseId, actingUserId, request));
    }

    @Override
    public ResponseEntity<ExpenseDTO> updateAssignment(String actingUserId, UUID expenseId, UUID assignmentId,
                                                       UpdateAssignmentRequest request) throws Exception {
        return ResponseEntity.ok(expenseService.updateAssignment(expenseId, assignmentId, actingUserId, request));
    }

    @Override
    public ResponseEntity<ExpenseDTO> deleteAssignment(String actingUserId, UUID expenseId, UUID assignmentId)
            throws Exception {
        return ResponseEntity.ok(expenseService.deleteAssignment(expenseId, assignmentId, actingUserId));
    }
}
