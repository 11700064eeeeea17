package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.SettlementStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SettlementStatusStateMachineTest {

    private final SettlementStatusStateMachine stateMachine = new SettlementStatusStateMachine();

    @Test
    public void paymentsMoveBothWays() {
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PENDING, SettlementStatus.PARTIALLY_PAID)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PARTIALLY_PAID, SettlementStatus.PAID)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PAID, SettlementStatus.PARTIALLY_PAID)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PAID, SettlementStatus.PENDING)).isTrue();
    }

    @Test
    public void onlyPaidCanBeVerified() {
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PAID, SettlementStatus.VERIFIED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PENDING, SettlementStatus.VERIFIED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PARTIALLY_PAID, SettlementStatus.VERIFIED)).isFalse();
    }

    @Test
    public void verifiedIsFinal() {
        assertThat(stateMachine.isFinalState(SettlementStatus.VERIFIED)).isTrue();
        assertThat(stateMachine.isFinalState(SettlementStatus.PAID)).isFalse();

        assertThatThrownBy(() -> stateMachine.validateTransition(SettlementStatus.VERIFIED, SettlementStatus.PAID))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("VERIFIED → PAID");
    }

    @Test
    public void sameStatusAndNulls() {
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PENDING, SettlementStatus.PENDING)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(null, SettlementStatus.PENDING)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(SettlementStatus.PENDING, null)).isFalse();
    }
}
