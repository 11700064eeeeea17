package com.nosota.tripfund;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.tripfund.api.model.RsvpStatus;
import com.nosota.tripfund.api.model.SplitType;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.api.request.*;
import com.nosota.tripfund.service.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@SpringBootTest(
        classes = TripFundApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Testcontainers
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    @Autowired
    protected UserService userService;

    @Autowired
    protected TripService tripService;

    @Autowired
    protected ExpenseService expenseService;

    @Autowired
    protected SettlementService settlementService;

    @Autowired
    protected SpendWindowService spendWindowService;

    @Autowired
    protected TripBalanceService tripBalanceService;

    @Autowired
    protected TimelineService timelineService;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @LocalServerPort
    protected int port;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    /**
     * Syncs a user profile with a unique ID built from the given name.
     */
    protected String createUser(String name) throws Exception {
        String userId = name.toLowerCase() + "-" + UUID.randomUUID();
        userService.upsertUser(userId, userId, new UpsertUserRequest(name, userId + "@example.com", null));
        return userId;
    }

    /**
     * Creates a USD trip owned by the given user, without dates.
     */
    protected UUID createTrip(String ownerId) throws Exception {
        return createTrip(ownerId, null, null);
    }

    protected UUID createTrip(String ownerId, LocalDate startDate, LocalDate endDate) throws Exception {
        return tripService.createTrip(ownerId,
                new CreateTripRequest("Lisbon", "Test trip", "USD", startDate, endDate)).id();
    }

    protected void addMember(UUID tripId, String organizerId, String userId, TripMemberRole role) throws Exception {
        tripService.addMember(tripId, organizerId, new AddMemberRequest(userId, role, RsvpStatus.ACCEPTED));
    }

    protected UUID createExpense(UUID tripId, String payerId, String amount, LocalDateTime date) throws Exception {
        return expenseService.createExpense(tripId, payerId, new CreateExpenseRequest(
                "Dinner", new BigDecimal(amount), "USD", null, date, payerId, null, null)).id();
    }

    /**
     * Creates an expense split equally among the given users.
     */
    protected UUID createEqualExpense(UUID tripId, String payerId, String amount, LocalDateTime date,
                                      String... assignees) throws Exception {
        UUID expenseId = createExpense(tripId, payerId, amount, date);
        List<AssignmentRequest> assignments = Arrays.stream(assignees)
                .map(userId -> new AssignmentRequest(userId, SplitType.EQUAL, null))
                .toList();
        expenseService.replaceAssignments(expenseId, payerId, new ReplaceAssignmentsRequest(assignments));
        return expenseId;
    }
}
