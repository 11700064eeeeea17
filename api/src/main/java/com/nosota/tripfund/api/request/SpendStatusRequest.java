package com.nosota.tripfund.api.request;

import com.nosota.tripfund.api.model.SpendStatusAction;

/**
 * @param action "close", "open" or "toggle"; null toggles
 */
public record SpendStatusRequest(
        SpendStatusAction action
) {
}
