package com.nosota.tripfund.error;

import java.util.UUID;

/**
 * Trip does not exist or has been soft-deleted.
 */
public class TripNotFoundException extends Exception {
    public TripNotFoundException(UUID tripId) {
        super("Trip not found: " + tripId);
    }

    public TripNotFoundException(String message) {
        super(message);
    }
}
