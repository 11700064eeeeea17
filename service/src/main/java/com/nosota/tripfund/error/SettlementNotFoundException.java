package com.nosota.tripfund.error;

import java.util.UUID;

public class SettlementNotFoundException extends Exception {
    public SettlementNotFoundException(UUID settlementId) {
        super("Settlement not found: " + settlementId);
    }

    public SettlementNotFoundException(String message) {
        super(message);
    }
}
