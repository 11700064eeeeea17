package com.nosota.tripfund.api.response;

import com.nosota.tripfund.api.dto.PaymentDTO;

/**
 * @param payment    The recorded or updated payment (null after deletion)
 * @param settlement Settlement state after the change
 */
public record PaymentResponse(
        PaymentDTO payment,
        SettlementResponse settlement
) {
}
