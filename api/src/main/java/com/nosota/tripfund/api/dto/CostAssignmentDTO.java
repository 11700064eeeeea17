package com.nosota.tripfund.api.dto;

import com.nosota.tripfund.api.model.SplitType;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param id                    Assignment UUID
 * @param expenseId             Expense UUID
 * @param userId                Assignee user ID
 * @param shareAmount           Share in the expense currency
 * @param normalizedShareAmount Share in the trip base currency (shareAmount × fxRate)
 * @param splitType             How the share was derived
 * @param splitValue            Percentage, weight or exact value depending on splitType
 */
public record CostAssignmentDTO(
        UUID id,
        UUID expenseId,
        String userId,
        BigDecimal shareAmount,
        BigDecimal normalizedShareAmount,
        SplitType splitType,
        BigDecimal splitValue
) {
}
