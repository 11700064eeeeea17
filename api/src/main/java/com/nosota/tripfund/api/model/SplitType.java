package com.nosota.tripfund.api.model;

/**
 * How a cost assignment's share was derived from the expense amount.
 */
public enum SplitType {
    /** Amount divided evenly between all assignees. */
    EQUAL,

    /** splitValue is a percentage (0-100) of the amount. */
    PERCENTAGE,

    /** splitValue is the exact share in the expense currency. */
    EXACT,

    /** splitValue is a weight; share = amount × weight / Σ weights. */
    SHARE
}
