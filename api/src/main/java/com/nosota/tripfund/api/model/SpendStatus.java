package com.nosota.tripfund.api.model;

/**
 * Trip-level spend window status.
 * Settlement records exist only while the window is CLOSED.
 */
public enum SpendStatus {
    /**
     * OPEN: members may add, edit and delete expenses.
     */
    OPEN,

    /**
     * CLOSED: expenses are locked and the settlement plan has been materialized.
     */
    CLOSED
}
