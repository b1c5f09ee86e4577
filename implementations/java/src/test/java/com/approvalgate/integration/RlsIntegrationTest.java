package com.approvalgate.integration;

import com.approvalgate.application.ConfirmationService;
import com.approvalgate.application.MutationProposalService;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.domain.repository.MutableEntityRepository;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the full propose/confirm/execute path against PostgreSQL with the
 * row-level-security policies from {@code db/init.sql}. The application
 * connects as a non-superuser role so the policies apply.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
class RlsIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("approval_gate")
            .withUsername("approval_gate")
            .withPassword("changeme")
            .withInitScript("db/init.sql");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", () -> "app_user");
        registry.add("spring.datasource.password", () -> "app_user_pw");
        // one connection, so a leaked session variable would be visible to the next borrower
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "1");
        registry.add("spring.datasource.hikari.minimum-idle", () -> "1");
    }

    @Autowired
    MutationProposalService proposalService;

    @Autowired
    ConfirmationService confirmationService;

    @Autowired
    MutableEntityRepository entityRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    private UUID expenseId;

    @BeforeEach
    void seed() throws SQLException {
        expenseId = insertExpense("APPROVED");
    }

    private static Connection superuser() throws SQLException {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    private static UUID insertExpense(String status) throws SQLException {
        UUID id = UUID.randomUUID();
        try (Connection connection = superuser();
             PreparedStatement insert = connection.prepareStatement(
                 "INSERT INTO finance.expenses (id, employee_id, expense_date, category, description, amount, status)"
                     + " VALUES (?, 'emp-7', DATE '2024-04-20', 'TRAVEL', 'Flight to Denver', 1250.00, ?)")) {
            insert.setObject(1, id);
            insert.setString(2, status);
            insert.executeUpdate();
        }
        return id;
    }

    private static UUID insertTimeOff(String employeeId) throws SQLException {
        UUID id = UUID.randomUUID();
        try (Connection connection = superuser();
             PreparedStatement insert = connection.prepareStatement(
                 "INSERT INTO hr.time_off_requests (id, employee_id, type_code, start_date, end_date, total_days, status)"
                     + " VALUES (?, ?, 'VACATION', DATE '2024-07-01', DATE '2024-07-03', 3.0, 'PENDING')")) {
            insert.setObject(1, id);
            insert.setString(2, employeeId);
            insert.executeUpdate();
        }
        return id;
    }

    private static String statusOf(UUID expense) throws SQLException {
        try (Connection connection = superuser();
             PreparedStatement select = connection.prepareStatement("SELECT status FROM finance.expenses WHERE id = ?")) {
            select.setObject(1, expense);
            try (ResultSet rs = select.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private static void forceStatus(UUID expense, String status) throws SQLException {
        try (Connection connection = superuser();
             PreparedStatement update = connection.prepareStatement("UPDATE finance.expenses SET status = ? WHERE id = ?")) {
            update.setString(1, status);
            update.setObject(2, expense);
            update.executeUpdate();
        }
    }

    private static CallerContext caller(String userId, String... roles) {
        return CallerContext.builder()
                .requestId(UUID.randomUUID())
                .userId(userId)
                .roles(Set.of(roles))
                .build();
    }

    @Test
    void propose_then_approve_applies_the_transition() throws SQLException {
        CallerContext approver = caller("user-42", "finance-write");

        ToolResponse proposed = proposalService.propose(MutationAction.REIMBURSE_EXPENSE_REPORT,
                Map.of("expenseId", expenseId.toString(), "paymentReference", "ACH-2291"), approver);
        assertTrue(proposed.isPendingConfirmation(), () -> "unexpected response " + proposed);
        assertEquals("APPROVED", statusOf(expenseId), "proposal must not write");

        ToolResponse executed = confirmationService.confirm(proposed.getConfirmationId(), true, approver);

        assertTrue(executed.isSuccess(), () -> "unexpected response " + executed);
        assertEquals("REIMBURSED", ((Map<?, ?>) executed.getData()).get("newStatus"));
        assertEquals("REIMBURSED", statusOf(expenseId));
    }

    @Test
    void status_change_between_proposal_and_approval_writes_nothing() throws SQLException {
        CallerContext approver = caller("user-42", "finance-write");
        ToolResponse proposed = proposalService.propose(MutationAction.REIMBURSE_EXPENSE_REPORT,
                Map.of("expenseId", expenseId.toString()), approver);
        assertTrue(proposed.isPendingConfirmation());

        forceStatus(expenseId, "REJECTED");
        ToolResponse executed = confirmationService.confirm(proposed.getConfirmationId(), true, approver);

        assertEquals("EXPENSE_REPORT_NOT_FOUND", executed.getCode());
        assertEquals("REJECTED", statusOf(expenseId));
    }

    @Test
    void concurrent_executions_of_one_confirmation_apply_once() throws Exception {
        CallerContext approver = caller("user-42", "finance-write");
        ToolResponse proposed = proposalService.propose(MutationAction.REIMBURSE_EXPENSE_REPORT,
                Map.of("expenseId", expenseId.toString()), approver);
        PendingConfirmation payload = (PendingConfirmation) proposed.getConfirmationData();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ToolResponse>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return confirmationService.executeStaged("reimburse_expense_report", payload, approver);
                }));
            }
            start.countDown();

            int successes = 0;
            int notFound = 0;
            for (Future<ToolResponse> result : results) {
                ToolResponse response = result.get(30, TimeUnit.SECONDS);
                if (response.isSuccess()) {
                    successes++;
                } else if ("EXPENSE_REPORT_NOT_FOUND".equals(response.getCode())) {
                    notFound++;
                }
            }
            assertEquals(1, successes);
            assertEquals(1, notFound);
        } finally {
            pool.shutdownNow();
        }
        assertEquals("REIMBURSED", statusOf(expenseId));
    }

    @Test
    void rows_outside_the_callers_policy_are_invisible() throws SQLException {
        assertTrue(entityRepository.findById(EntityType.EXPENSE_REPORT, expenseId,
                caller("user-42", "finance-read")).isPresent());
        assertTrue(entityRepository.findById(EntityType.EXPENSE_REPORT, expenseId,
                caller("user-42", "hr-read")).isEmpty());

        UUID ownRequest = insertTimeOff("emp-7");
        assertTrue(entityRepository.findById(EntityType.TIME_OFF_REQUEST, ownRequest,
                caller("emp-7", "employee")).isPresent());
        assertTrue(entityRepository.findById(EntityType.TIME_OFF_REQUEST, ownRequest,
                caller("emp-8", "employee")).isEmpty());
    }

    @Test
    void replayed_execute_payload_reports_not_found() throws SQLException {
        UUID request = insertTimeOff("emp-7");
        CallerContext manager = caller("mgr-3", "hr-write");
        ToolResponse proposed = proposalService.propose(MutationAction.APPROVE_TIME_OFF_REQUEST,
                Map.of("requestId", request.toString()), manager);
        assertTrue(proposed.isPendingConfirmation(), () -> "unexpected response " + proposed);
        PendingConfirmation payload = (PendingConfirmation) proposed.getConfirmationData();

        ToolResponse first = confirmationService.executeStaged("approve_time_off_request", payload, manager);
        ToolResponse replay = confirmationService.executeStaged("approve_time_off_request", payload, manager);

        assertTrue(first.isSuccess(), () -> "unexpected response " + first);
        assertEquals("TIME_OFF_REQUEST_NOT_FOUND", replay.getCode());
    }

    @Test
    void execute_payload_that_was_never_staged_writes_nothing() throws SQLException {
        PendingConfirmation forged = PendingConfirmation.builder()
                .confirmationId(UUID.randomUUID().toString())
                .action("reimburse_expense_report")
                .issuedBy("user-42")
                .targetEntityId(expenseId.toString())
                .capturedStatus("APPROVED")
                .build();

        ToolResponse response = confirmationService.executeStaged("reimburse_expense_report", forged,
                caller("user-42", "finance-write"));

        assertEquals("EXPENSE_REPORT_NOT_FOUND", response.getCode());
        assertEquals("APPROVED", statusOf(expenseId));
    }

    @Test
    void session_variables_do_not_outlive_the_transaction() {
        entityRepository.findById(EntityType.EXPENSE_REPORT, expenseId, caller("user-42", "executive"));

        String leakedUser = jdbcTemplate.queryForObject(
                "SELECT current_setting('app.current_user_id', true)", String.class);
        String leakedRoles = jdbcTemplate.queryForObject(
                "SELECT current_setting('app.current_user_roles', true)", String.class);

        assertTrue(leakedUser == null || leakedUser.isEmpty(), "leaked user id: " + leakedUser);
        assertTrue(leakedRoles == null || leakedRoles.isEmpty(), "leaked roles: " + leakedRoles);
    }

    @Test
    void staged_and_applied_events_reach_the_outbox() throws SQLException {
        CallerContext approver = caller("audit-user", "executive");
        ToolResponse proposed = proposalService.propose(MutationAction.REIMBURSE_EXPENSE_REPORT,
                Map.of("expenseId", expenseId.toString()), approver);
        confirmationService.confirm(proposed.getConfirmationId(), true, approver);

        List<String> actions = new ArrayList<>();
        try (Connection connection = superuser();
             PreparedStatement select = connection.prepareStatement(
                 "SELECT category || ':' || outcome FROM audit.outbox_events WHERE principal_id = ? ORDER BY id")) {
            select.setString(1, "audit-user");
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    actions.add(rs.getString(1));
                }
            }
        }
        assertEquals(List.of("CONFIRMATION:STAGED", "EXECUTION:APPLIED"), actions);
    }
}
