package com.nosota.tripfund.api.request;

/**
 * @param force close the expense even if assignments do not add up to its amount
 */
public record FinalizeExpenseRequest(
        Boolean force
) {
    public boolean forced() {
        return Boolean.TRUE.equals(force);
    }
}
