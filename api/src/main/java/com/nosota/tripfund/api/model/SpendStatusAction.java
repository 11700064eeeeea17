package com.nosota.tripfund.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requested change of a trip's spend window.
 */
public enum SpendStatusAction {
    @JsonProperty("close")
    CLOSE,

    @JsonProperty("open")
    OPEN,

    @JsonProperty("toggle")
    TOGGLE;

    /**
     * Resolves the status the trip should end up in.
     *
     * @param current current spend status of the trip
     * @return target spend status
     */
    public SpendStatus resolve(SpendStatus current) {
        return switch (this) {
            case CLOSE -> SpendStatus.CLOSED;
            case OPEN -> SpendStatus.OPEN;
            case TOGGLE -> current == SpendStatus.OPEN ? SpendStatus.CLOSED : SpendStatus.OPEN;
        };
    }
}
