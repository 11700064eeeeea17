package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.ExpenseStatus;
import com.nosota.tripfund.api.model.SplitType;
import com.nosota.tripfund.dto.LedgerAssignment;
import com.nosota.tripfund.dto.LedgerExpense;
import com.nosota.tripfund.dto.ParticipantRef;
import com.nosota.tripfund.dto.PersonBalance;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builders for ledger rows used by the engine unit tests.
 */
final class LedgerFixtures {

    private LedgerFixtures() {
    }

    static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    static LedgerAssignment share(String userId, String amount) {
        BigDecimal value = amount(amount);
        return new LedgerAssignment(ParticipantRef.of(userId), value, value, SplitType.EXACT);
    }

    static LedgerExpense expense(String payerId, String amount, LocalDateTime date, LedgerAssignment... shares) {
        BigDecimal value = amount(amount);
        return LedgerExpense.builder()
                .id(UUID.randomUUID())
                .amount(value)
                .currency("USD")
                .fxRate(BigDecimal.ONE)
                .normalizedAmount(value)
                .date(date)
                .status(ExpenseStatus.OPEN)
                .paidBy(ParticipantRef.of(payerId))
                .assignments(new ArrayList<>(List.of(shares)))
                .build();
    }

    static PersonBalance net(String userId, String netBalance) {
        BigDecimal net = amount(netBalance);
        BigDecimal paid = net.signum() > 0 ? net : BigDecimal.ZERO;
        BigDecimal owed = net.signum() < 0 ? net.negate() : BigDecimal.ZERO;
        return new PersonBalance(ParticipantRef.of(userId), paid, owed, net);
    }
}
