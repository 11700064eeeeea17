package com.nosota.tripfund.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Replaces every assignment of an expense. An empty list removes all assignments.
 * All entries must use the same split type.
 */
public record ReplaceAssignmentsRequest(
        @NotNull(message = "Assignments are required")
        List<@Valid AssignmentRequest> assignments
) {
}
