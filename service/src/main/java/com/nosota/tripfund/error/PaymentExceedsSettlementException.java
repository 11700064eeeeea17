package com.nosota.tripfund.error;

import java.math.BigDecimal;

public class PaymentExceedsSettlementException extends Exception {
    public PaymentExceedsSettlementException(BigDecimal totalPaid, BigDecimal settlementAmount) {
        super(String.format("Payments total %s would exceed settlement amount %s",
                totalPaid.toPlainString(), settlementAmount.toPlainString()));
    }
}
