package com.nosota.tripfund.api.model;

/**
 * What completed a timeline milestone.
 */
public enum MilestoneTriggerType {
    /** Completed by an organizer or member through the API. */
    MANUAL,

    /** Completed by the scheduler after the milestone date passed. */
    AUTOMATIC
}
