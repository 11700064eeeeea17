package com.nosota.tripfund.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.tripfund.TestBase;
import com.nosota.tripfund.api.ApiHeaders;
import com.nosota.tripfund.api.dto.PersonBalanceDTO;
import com.nosota.tripfund.api.model.SettlementStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.api.response.SettlementResponse;
import com.nosota.tripfund.api.response.TripBalanceSummaryResponse;
import com.nosota.tripfund.api.response.UserBalanceResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Balances and the spend window lifecycle through the REST API.
 *
 * <p>Trip setup: owner paid 90 split equally by three, admin paid 30 split equally by three.
 * Net balances: owner +50, admin -10, member -40.
 */
@Transactional
public class TripSettlementFlowTest extends TestBase {

    private static final LocalDateTime FIRST_DAY = LocalDateTime.of(2024, 5, 1, 19, 0);
    private static final LocalDateTime SECOND_DAY = LocalDateTime.of(2024, 5, 2, 13, 0);

    private String owner;
    private String admin;
    private String member;
    private UUID tripId;

    @BeforeEach
    public void setupTrip() throws Exception {
        owner = createUser("Owner");
        admin = createUser("Admin");
        member = createUser("Member");

        tripId = createTrip(owner);
        addMember(tripId, owner, admin, TripMemberRole.ADMIN);
        addMember(tripId, owner, member, TripMemberRole.MEMBER);

        createEqualExpense(tripId, owner, "90.00", FIRST_DAY, owner, admin, member);
        createEqualExpense(tripId, admin, "30.00", SECOND_DAY, owner, admin, member);
    }

    @Test
    public void balancesAndPlanAreCalculatedOnTheFly() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/v1/trips/{tripId}/balances", tripId)
                        .header(ApiHeaders.USER_ID, member))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseCurrency").value("USD"))
                .andExpect(jsonPath("$.settlements.length()").value(2))
                .andReturn();

        TripBalanceSummaryResponse summary = read(result, TripBalanceSummaryResponse.class);
        assertThat(summary.totalSpent()).isEqualByComparingTo("120.00");

        Map<String, PersonBalanceDTO> balances = summary.balances().stream()
                .collect(Collectors.toMap(PersonBalanceDTO::userId, Function.identity()));
        assertThat(balances.get(owner).netBalance()).isEqualByComparingTo("50.00");
        assertThat(balances.get(admin).netBalance()).isEqualByComparingTo("-10.00");
        assertThat(balances.get(member).netBalance()).isEqualByComparingTo("-40.00");
        assertThat(balances.get(owner).userName()).isEqualTo("Owner");

        assertThat(summary.settlements())
                .extracting(s -> s.fromUserId(), s -> s.toUserId(), s -> s.amount().setScale(2))
                .containsExactly(
                        tuple(member, owner, new BigDecimal("40.00")),
                        tuple(admin, owner, new BigDecimal("10.00")));
        assertThat(summary.settlements().get(0).oldestDebtDate()).isEqualTo(FIRST_DAY);
    }

    @Test
    public void userBalanceSplitsOwesAndIsOwed() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/v1/trips/{tripId}/balances/{userId}", tripId, owner)
                        .header(ApiHeaders.USER_ID, admin))
                .andExpect(status().isOk())
                .andReturn();

        UserBalanceResponse balance = read(result, UserBalanceResponse.class);
        assertThat(balance.userId()).isEqualTo(owner);
        assertThat(balance.userIsOwed()).isEqualByComparingTo("50.00");
        assertThat(balance.userOwes()).isEqualByComparingTo("0");
    }

    @Test
    public void closingMaterializesSettlements() throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"close\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spendStatus").value("CLOSED"))
                .andExpect(jsonPath("$.settlementCount").value(2))
                .andExpect(jsonPath("$.message").value("Trip spending is now closed. No one can add or edit spends."));

        List<SettlementResponse> settlements = listSettlements(member);
        assertThat(settlements)
                .extracting(SettlementResponse::fromUserId, SettlementResponse::toUserId,
                        SettlementResponse::status)
                .containsExactly(
                        tuple(member, owner, SettlementStatus.PENDING),
                        tuple(admin, owner, SettlementStatus.PENDING));
        assertThat(settlements.get(0).amount()).isEqualByComparingTo("40.00");
        assertThat(settlements.get(0).remainingAmount()).isEqualByComparingTo("40.00");
        assertThat(settlements.get(0).notes()).isEqualTo("Debt since 2024-05-01");
        assertThat(settlements.get(1).amount()).isEqualByComparingTo("10.00");
    }

    @Test
    public void closingTwiceGivesTheSameSettlements() throws Exception {
        changeSpendStatus(owner, "{\"action\":\"close\"}");
        List<SettlementResponse> first = listSettlements(owner);

        changeSpendStatus(admin, "{\"action\":\"close\"}");
        List<SettlementResponse> second = listSettlements(owner);

        assertThat(second)
                .extracting(SettlementResponse::fromUserId, SettlementResponse::toUserId,
                        s -> s.amount().setScale(2))
                .containsExactlyElementsOf(first.stream()
                        .map(s -> tuple(s.fromUserId(), s.toUserId(), s.amount().setScale(2)))
                        .toList());
    }

    @Test
    public void reopeningDeletesSettlements() throws Exception {
        changeSpendStatus(owner, "{\"action\":\"close\"}");

        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"open\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spendStatus").value("OPEN"))
                .andExpect(jsonPath("$.settlementCount").value(0));

        assertThat(listSettlements(owner)).isEmpty();
    }

    @Test
    public void emptyBodyToggles() throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spendStatus").value("CLOSED"));

        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spendStatus").value("OPEN"));
    }

    @Test
    public void memberCannotCloseSpending() throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, member)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"close\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Only trip organizers can change spend status"));

        mockMvc.perform(get("/api/v1/trips/{tripId}", tripId)
                        .header(ApiHeaders.USER_ID, member))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spendStatus").value("OPEN"));
        assertThat(listSettlements(member)).isEmpty();
    }

    @Test
    public void closedTripRejectsNewExpenses() throws Exception {
        changeSpendStatus(owner, "{\"action\":\"close\"}");

        mockMvc.perform(post("/api/v1/trips/{tripId}/expenses", tripId)
                        .header(ApiHeaders.USER_ID, member)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"Taxi\",\"amount\":12.50,\"currency\":\"USD\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    public void unknownTripIsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", UUID.randomUUID())
                        .header(ApiHeaders.USER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"close\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void outsiderCannotSeeBalances() throws Exception {
        String outsider = createUser("Outsider");

        mockMvc.perform(get("/api/v1/trips/{tripId}/balances", tripId)
                        .header(ApiHeaders.USER_ID, outsider))
                .andExpect(status().isForbidden());
    }

    @Test
    public void missingUserHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/trips/{tripId}/balances", tripId))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void correlationIdIsEchoed() throws Exception {
        mockMvc.perform(get("/api/v1/trips/{tripId}", tripId)
                        .header(ApiHeaders.USER_ID, owner)
                        .header(ApiHeaders.CORRELATION_ID, "trace-42"))
                .andExpect(status().isOk())
                .andExpect(header().string(ApiHeaders.CORRELATION_ID, "trace-42"));
    }

    private void changeSpendStatus(String userId, String body) throws Exception {
        mockMvc.perform(post("/api/v1/trips/{tripId}/spend-status", tripId)
                        .header(ApiHeaders.USER_ID, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());
    }

    private List<SettlementResponse> listSettlements(String userId) throws Exception {
        MvcResult result = mockMvc.perform(get("/api/v1/trips/{tripId}/settlements", tripId)
                        .header(ApiHeaders.USER_ID, userId))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(),
                new TypeReference<List<SettlementResponse>>() {
                });
    }

    private <T> T read(MvcResult result, Class<T> type) throws Exception {
        return objectMapper.readValue(result.getResponse().getContentAsString(), type);
    }
}
