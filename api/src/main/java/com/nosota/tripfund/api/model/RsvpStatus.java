package com.nosota.tripfund.api.model;

public enum RsvpStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    MAYBE
}
