package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.SpendStatusAction;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.dto.LedgerExpense;
import com.nosota.tripfund.dto.SettlementDraft;
import com.nosota.tripfund.dto.SpendWindowResult;
import com.nosota.tripfund.dto.TripSnapshot;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.TripNotFoundException;
import com.nosota.tripfund.repository.TripLedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

import static com.nosota.tripfund.service.LedgerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class SpendWindowServiceTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 5, 1, 9, 30);

    private InMemoryLedgerStore store;
    private SpendWindowService service;
    private UUID tripId;

    @BeforeEach
    public void setUp() {
        store = new InMemoryLedgerStore();
        service = new SpendWindowService(store,
                new BalanceAggregator(Clock.systemUTC()),
                new SettlementPlanner(new BigDecimal("0.01")));

        tripId = UUID.randomUUID();
        store.trips.put(tripId, SpendStatus.OPEN);
        store.currency = "USD";
        store.roles.put("owner", TripMemberRole.OWNER);
        store.roles.put("admin", TripMemberRole.ADMIN);
        store.roles.put("member", TripMemberRole.MEMBER);
        store.expenses.add(expense("owner", "90", DAY_1, share("owner", "30"), share("admin", "30"), share("member", "30")));
        store.expenses.add(expense("admin", "30", DAY_1, share("owner", "10"), share("admin", "10"), share("member", "10")));
    }

    @Test
    public void closeCreatesPlannedSettlements() throws Exception {
        SpendWindowResult result = service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);

        assertThat(result.spendStatus()).isEqualTo(SpendStatus.CLOSED);
        assertThat(result.settlementCount()).isEqualTo(2);
        assertThat(store.trips.get(tripId)).isEqualTo(SpendStatus.CLOSED);
        assertThat(store.milestoneCompleted).isTrue();
        assertThat(store.milestoneTrigger).isEqualTo(MilestoneTriggerType.MANUAL);

        assertThat(store.settlements).extracting(SettlementDraft::fromUserId, SettlementDraft::toUserId)
                .containsExactly(
                        tuple("member", "owner"),
                        tuple("admin", "owner"));
        assertThat(store.settlements.get(0).amount()).isEqualByComparingTo("40.00");
        assertThat(store.settlements.get(0).currency()).isEqualTo("USD");
        assertThat(store.settlements.get(0).notes()).isEqualTo("Debt since 2024-05-01");
    }

    @Test
    public void closingTwiceProducesTheSameSettlements() throws Exception {
        service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);
        List<SettlementDraft> first = new ArrayList<>(store.settlements);

        SpendWindowResult second = service.changeSpendStatus(tripId, "admin", SpendStatusAction.CLOSE);

        assertThat(second.spendStatus()).isEqualTo(SpendStatus.CLOSED);
        assertThat(store.settlements).isEqualTo(first);
        assertThat(store.replaceCalls).isEqualTo(2);
    }

    @Test
    public void reopenClearsSettlements() throws Exception {
        service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);

        SpendWindowResult result = service.changeSpendStatus(tripId, "owner", SpendStatusAction.OPEN);

        assertThat(result.spendStatus()).isEqualTo(SpendStatus.OPEN);
        assertThat(result.settlementCount()).isZero();
        assertThat(store.settlements).isEmpty();
        assertThat(store.trips.get(tripId)).isEqualTo(SpendStatus.OPEN);
        assertThat(store.milestoneCompleted).isFalse();
    }

    @Test
    public void missingActionToggles() throws Exception {
        assertThat(service.changeSpendStatus(tripId, "owner", null).spendStatus()).isEqualTo(SpendStatus.CLOSED);
        assertThat(service.changeSpendStatus(tripId, "owner", null).spendStatus()).isEqualTo(SpendStatus.OPEN);
    }

    @Test
    public void memberCannotCloseAndNothingChanges() {
        assertThatThrownBy(() -> service.changeSpendStatus(tripId, "member", SpendStatusAction.CLOSE))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("Only trip organizers can change spend status");

        assertThat(store.trips.get(tripId)).isEqualTo(SpendStatus.OPEN);
        assertThat(store.replaceCalls).isZero();
        assertThat(store.settlements).isEmpty();
    }

    @Test
    public void outsiderCannotReopenAndSettlementsStay() throws Exception {
        service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);

        assertThatThrownBy(() -> service.changeSpendStatus(tripId, "stranger", SpendStatusAction.OPEN))
                .isInstanceOf(ForbiddenOperationException.class);

        assertThat(store.trips.get(tripId)).isEqualTo(SpendStatus.CLOSED);
        assertThat(store.settlements).hasSize(2);
    }

    @Test
    public void unknownTripIsReportedBeforePermission() {
        assertThatThrownBy(() -> service.changeSpendStatus(UUID.randomUUID(), "stranger", SpendStatusAction.CLOSE))
                .isInstanceOf(TripNotFoundException.class);
        assertThat(store.replaceCalls).isZero();
    }

    @Test
    public void automaticCloseSkipsPermissionCheck() throws Exception {
        SpendWindowResult result = service.applySpendStatus(tripId, SpendStatus.CLOSED, MilestoneTriggerType.AUTOMATIC);

        assertThat(result.settlementCount()).isEqualTo(2);
        assertThat(store.milestoneTrigger).isEqualTo(MilestoneTriggerType.AUTOMATIC);
    }

    @Test
    public void settledTripClosesWithoutSettlements() throws Exception {
        store.expenses.clear();
        store.expenses.add(expense("owner", "20", DAY_1, share("owner", "20")));

        SpendWindowResult result = service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);

        assertThat(result.spendStatus()).isEqualTo(SpendStatus.CLOSED);
        assertThat(result.settlementCount()).isZero();
    }

    @Test
    public void transfersRoundingToZeroAreSkipped() throws Exception {
        store.currency = "JPY";
        store.expenses.clear();
        store.expenses.add(expense("owner", "0.8", DAY_1, share("owner", "0.4"), share("member", "0.4")));

        SpendWindowResult result = service.changeSpendStatus(tripId, "owner", SpendStatusAction.CLOSE);

        assertThat(result.settlementCount()).isZero();
        assertThat(store.settlements).isEmpty();
    }

    private static final class InMemoryLedgerStore implements TripLedgerStore {

        private final Map<UUID, SpendStatus> trips = new HashMap<>();
        private final Map<String, TripMemberRole> roles = new HashMap<>();
        private final List<LedgerExpense> expenses = new ArrayList<>();
        private final List<SettlementDraft> settlements = new ArrayList<>();
        private String currency;
        private int replaceCalls;
        private Boolean milestoneCompleted;
        private MilestoneTriggerType milestoneTrigger;

        @Override
        public Optional<TripSnapshot> findActiveTrip(UUID tripId) {
            return Optional.ofNullable(trips.get(tripId))
                    .map(status -> new TripSnapshot(tripId, currency, status));
        }

        @Override
        public Optional<TripSnapshot> lockTrip(UUID tripId) {
            return findActiveTrip(tripId);
        }

        @Override
        public Optional<TripMemberRole> findMemberRole(UUID tripId, String userId) {
            return Optional.ofNullable(roles.get(userId));
        }

        @Override
        public List<LedgerExpense> listExpenses(UUID tripId) {
            return List.copyOf(expenses);
        }

        @Override
        public int replaceSettlements(UUID tripId, List<SettlementDraft> drafts) {
            replaceCalls++;
            settlements.clear();
            settlements.addAll(drafts);
            return drafts.size();
        }

        @Override
        public int deleteSettlements(UUID tripId) {
            int count = settlements.size();
            settlements.clear();
            return count;
        }

        @Override
        public void setSpendStatus(UUID tripId, SpendStatus spendStatus) {
            trips.put(tripId, spendStatus);
        }

        @Override
        public void syncSpendWindowMilestone(UUID tripId, boolean completed, MilestoneTriggerType triggerType) {
            milestoneCompleted = completed;
            milestoneTrigger = completed ? triggerType : null;
        }
    }
}
