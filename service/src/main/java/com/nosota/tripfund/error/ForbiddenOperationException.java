package com.nosota.tripfund.error;

/**
 * The calling user is not allowed to perform the operation on the trip.
 *
 * <p>Raised before any state is read for computation or modified, so a rejected
 * call never leaves partial changes behind.
 */
public class ForbiddenOperationException extends Exception {
    public ForbiddenOperationException() {
    }

    public ForbiddenOperationException(String message) {
        super(message);
    }

    public ForbiddenOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
