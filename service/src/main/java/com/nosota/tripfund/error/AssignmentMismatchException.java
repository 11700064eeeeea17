package com.nosota.tripfund.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Cost assignments of an expense do not add up to its amount at finalize time.
 */
@Getter
public class AssignmentMismatchException extends Exception {

    private final BigDecimal assignedPercentage;

    public AssignmentMismatchException(BigDecimal assignedPercentage) {
        super(String.format("Cannot close: assignments total %s%%, must be 100%%. Use force=true to override.",
                assignedPercentage.toPlainString()));
        this.assignedPercentage = assignedPercentage;
    }
}
