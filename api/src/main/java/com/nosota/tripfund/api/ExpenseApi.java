package com.nosota.tripfund.api;

import com.nosota.tripfund.api.dto.ExpenseDTO;
import com.nosota.tripfund.api.request.*;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Expense API interface.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Expense CRUD (only while the trip's spend window is OPEN)</li>
 *   <li>Finalizing and reopening single expenses</li>
 *   <li>Cost assignments (who owes which share of an expense)</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ExpenseController - in service module (server-side implementation)</li>
 *   <li>ExpenseClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1")
public interface ExpenseApi {

    // ==================== Expenses ====================

    @PostMapping("/trips/{tripId}/expenses")
    ResponseEntity<ExpenseDTO> createExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId,
            @Valid @RequestBody CreateExpenseRequest request) throws Exception;

    @GetMapping("/trips/{tripId}/expenses")
    ResponseEntity<List<ExpenseDTO>> getTripExpenses(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("tripId") UUID tripId) throws Exception;

    @GetMapping("/expenses/{expenseId}")
    ResponseEntity<ExpenseDTO> getExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId) throws Exception;

    @PatchMapping("/expenses/{expenseId}")
    ResponseEntity<ExpenseDTO> updateExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @Valid @RequestBody UpdateExpenseRequest request) throws Exception;

    @DeleteMapping("/expenses/{expenseId}")
    ResponseEntity<Void> deleteExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId) throws Exception;

    /**
     * Closes an expense. Fails when assignments do not add up to the amount unless forced.
     */
    @PostMapping("/expenses/{expenseId}/finalize")
    ResponseEntity<ExpenseDTO> finalizeExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestBody(required = false) FinalizeExpenseRequest request) throws Exception;

    @PostMapping("/expenses/{expenseId}/reopen")
    ResponseEntity<ExpenseDTO> reopenExpense(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId) throws Exception;

    // ==================== Assignments ====================

    /**
     * Replaces all assignments; shares are derived from the split type and values.
     */
    @PutMapping("/expenses/{expenseId}/assignments")
    ResponseEntity<ExpenseDTO> replaceAssignments(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @Valid @RequestBody ReplaceAssignmentsRequest request) throws Exception;

    @PostMapping("/expenses/{expenseId}/assignments")
    ResponseEntity<ExpenseDTO> addAssignment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @Valid @RequestBody AddAssignmentRequest request) throws Exception;

    @PatchMapping("/expenses/{expenseId}/assignments/{assignmentId}")
    ResponseEntity<ExpenseDTO> updateAssignment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @PathVariable("assignmentId") UUID assignmentId,
            @Valid @RequestBody UpdateAssignmentRequest request) throws Exception;

    @DeleteMapping("/expenses/{expenseId}/assignments/{assignmentId}")
    ResponseEntity<ExpenseDTO> deleteAssignment(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("expenseId") UUID expenseId,
            @PathVariable("assignmentId") UUID assignmentId) throws Exception;
}
