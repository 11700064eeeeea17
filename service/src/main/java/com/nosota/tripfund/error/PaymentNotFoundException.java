package com.nosota.tripfund.error;

import java.util.UUID;

public class PaymentNotFoundException extends Exception {
    public PaymentNotFoundException(UUID paymentId) {
        super("Payment not found: " + paymentId);
    }
}
