package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.account.Account;
import com.flagship.transfer_engine.account.AccountRepository;
import com.flagship.transfer_engine.account.AccountService;
import com.flagship.transfer_engine.approval.ApprovalProcessor;
import com.flagship.transfer_engine.approval.ApprovalStatus;
import com.flagship.transfer_engine.audit.AuditAction;
import com.flagship.transfer_engine.audit.AuditQueryService;
import com.flagship.transfer_engine.audit.AuditRecord;
import com.flagship.transfer_engine.audit.RequestMetadata;
import com.flagship.transfer_engine.transfer.exception.TransferExecutionException;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import com.flagship.transfer_engine.transfer.exception.ValidationFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transfer initiation against a real PostgreSQL store.
 *
 * These tests verify that:
 * - Auto-executing transfers move money atomically and conserve value
 * - Rejected proposals leave no rows behind
 * - Transfers above the threshold are parked with exactly one PENDING approval
 * - An execution failure is committed as FAILED with balances untouched
 * - Concurrent debits of one account never overdraw it
 * - Opposite-direction transfers between two accounts all complete
 */
@SpringBootTest
@Testcontainers
class TransferEngineIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("transfer_engine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private TransferQueryService transferQueryService;

    @Autowired
    private ApprovalProcessor approvalProcessor;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private AuditQueryService auditQueryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID controller = UUID.randomUUID();
    private final RequestMetadata metadata = RequestMetadata.of("203.0.113.5", "integration-test");

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Account newAccount(String balance, String minimum) {
        return accountService.createAccount("ACC-" + UUID.randomUUID().toString().substring(0, 8),
                "Test account", new BigDecimal(balance), new BigDecimal(minimum));
    }

    private BigDecimal balanceOf(UUID accountId) {
        return accountRepository.findById(accountId).orElseThrow().getBalance();
    }

    private long countTransfersFrom(UUID accountId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transfers WHERE from_account_id = ?", Long.class, accountId);
        return count != null ? count : 0L;
    }

    private long countApprovals(UUID transferId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM approvals WHERE transfer_id = ?", Long.class, transferId);
        return count != null ? count : 0L;
    }

    @Test
    @DisplayName("Balance 10000, minimum 100: transfer of 5000 completes and leaves 5000")
    void autoExecutedTransferCompletes() {
        printTestHeader("Auto-executed transfer completes");

        Account a = newAccount("10000.00", "100.00");
        Account b = newAccount("250.00", "0.00");
        printInput("Source balance", a.getBalance());
        printInput("Amount", "5000.00");

        Transfer transfer = transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("5000.00"),
                controller, "supplier invoice", metadata);

        printOutput("Status", transfer.getStatus());
        assertEquals(TransferStatus.COMPLETED, transfer.getStatus());
        assertEquals(0, new BigDecimal("5000.00").compareTo(balanceOf(a.getId())));
        assertEquals(0, new BigDecimal("5250.00").compareTo(balanceOf(b.getId())));
        assertEquals(0, countApprovals(transfer.getId()));

        TransferDetails details = transferQueryService.getTransferById(transfer.getId()).orElseThrow();
        assertEquals(TransferStatus.COMPLETED, details.getTransfer().getStatus());
        assertNotNull(details.getTransfer().getCompletedAt());
        assertEquals(a.getAccountNumber(), details.getFromAccount().getAccountNumber());
        assertNull(details.getApproval());

        List<AuditAction> actions = auditQueryService.listAuditTrail(transfer.getId()).stream()
                .map(AuditRecord::getAction)
                .toList();
        assertEquals(List.of(AuditAction.TRANSFER_INITIATED, AuditAction.TRANSFER_VALIDATED,
                AuditAction.TRANSFER_COMPLETED), actions);

        printSuccess("Money moved and audit trail recorded in order");
    }

    @Test
    @DisplayName("Conservation: source loses exactly what the destination gains")
    void conservation() {
        printTestHeader("Conservation of value");

        Account a = newAccount("800.55", "0.00");
        Account b = newAccount("19.45", "0.00");
        BigDecimal amount = new BigDecimal("300.10");

        transferEngine.initiate(a.getId(), b.getId(), amount, controller, null, metadata);

        assertEquals(0, a.getBalance().subtract(amount).compareTo(balanceOf(a.getId())));
        assertEquals(0, b.getBalance().add(amount).compareTo(balanceOf(b.getId())));
        printSuccess("Sum of balances unchanged");
    }

    @Test
    @DisplayName("Balance 1000, minimum 100: transfer of 5000 fails INSUFFICIENT_FUNDS with no transfer row")
    void insufficientFundsLeavesNothing() {
        printTestHeader("Insufficient funds");

        Account a = newAccount("1000.00", "100.00");
        Account b = newAccount("0.00", "0.00");

        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("5000.00"),
                        controller, null, metadata));

        printOutput("Reason", e.getReason());
        assertEquals(ValidationFailure.INSUFFICIENT_FUNDS, e.getReason());
        assertEquals(0, countTransfersFrom(a.getId()));
        assertEquals(0, new BigDecimal("1000.00").compareTo(balanceOf(a.getId())));
        printSuccess("Nothing persisted");
    }

    @Test
    @DisplayName("Transfer into an inactive account fails ACCOUNT_NOT_FOUND")
    void inactiveDestination() {
        Account a = newAccount("1000.00", "0.00");
        Account b = newAccount("0.00", "0.00");
        accountRepository.deactivate(b.getId());

        TransferValidationException e = assertThrows(TransferValidationException.class,
                () -> transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("10.00"),
                        controller, null, metadata));

        assertEquals(ValidationFailure.ACCOUNT_NOT_FOUND, e.getReason());
        assertEquals(0, countTransfersFrom(a.getId()));
    }

    @Test
    @DisplayName("Balance 2,000,000: transfer of 1,500,000 is parked with one PENDING approval")
    void aboveThresholdIsParked() {
        printTestHeader("Threshold routing");

        Account a = newAccount("2000000.00", "0.00");
        Account b = newAccount("0.00", "0.00");

        Transfer transfer = transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("1500000.00"),
                controller, "acquisition", metadata);

        printOutput("Status", transfer.getStatus());
        assertEquals(TransferStatus.AWAITING_APPROVAL, transfer.getStatus());
        assertTrue(transfer.isRequiresApproval());
        assertEquals(1, countApprovals(transfer.getId()));
        assertEquals(ApprovalStatus.PENDING,
                approvalProcessor.getApprovalByTransferId(transfer.getId()).orElseThrow().getStatus());
        assertEquals(0, new BigDecimal("2000000.00").compareTo(balanceOf(a.getId())));

        List<AuditRecord> trail = auditQueryService.listAuditTrail(transfer.getId());
        assertEquals(AuditAction.TRANSFER_AWAITING_APPROVAL, trail.get(trail.size() - 1).getAction());
        assertEquals("203.0.113.5", trail.get(0).getOriginAddress());
        printSuccess("Parked without moving money");
    }

    @Test
    @DisplayName("Amount exactly at the threshold executes without approval")
    void atThresholdExecutes() {
        Account a = newAccount("1000000.00", "0.00");
        Account b = newAccount("0.00", "0.00");

        Transfer transfer = transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("1000000.00"),
                controller, null, metadata);

        assertEquals(TransferStatus.COMPLETED, transfer.getStatus());
        assertEquals(0, countApprovals(transfer.getId()));
        assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(a.getId())));
    }

    @Test
    @DisplayName("Store failure during execution commits FAILED and leaves balances unchanged")
    void executionFailureIsCommittedAsFailed() {
        printTestHeader("Execution failure recording");

        Account a = newAccount("500.00", "0.00");
        Account b = newAccount("0.00", "0.00");
        String trigger = "block_credit_" + b.getId().toString().replace("-", "");

        jdbcTemplate.execute("CREATE OR REPLACE FUNCTION reject_test_credit() RETURNS trigger AS $$ " +
                "BEGIN RAISE EXCEPTION 'credit blocked for %', NEW.account_number; END; $$ LANGUAGE plpgsql");
        jdbcTemplate.execute("CREATE TRIGGER " + trigger + " BEFORE UPDATE OF balance ON accounts FOR EACH ROW " +
                "WHEN (NEW.id = '" + b.getId() + "'::uuid AND NEW.balance > OLD.balance) " +
                "EXECUTE FUNCTION reject_test_credit()");
        try {
            TransferExecutionException e = assertThrows(TransferExecutionException.class,
                    () -> transferEngine.initiate(a.getId(), b.getId(), new BigDecimal("120.00"),
                            controller, null, metadata));

            printOutput("Error", e.getMessage());
            assertTrue(e.getMessage().contains("credit blocked for " + b.getAccountNumber()));

            TransferDetails failed = transferQueryService.getTransferById(e.getTransferId()).orElseThrow();
            assertEquals(TransferStatus.FAILED, failed.getTransfer().getStatus());
            assertEquals(e.getMessage(), failed.getTransfer().getErrorMessage());
            assertEquals(0, new BigDecimal("500.00").compareTo(balanceOf(a.getId())));
            assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(b.getId())));

            List<AuditAction> actions = auditQueryService.listAuditTrail(e.getTransferId()).stream()
                    .map(AuditRecord::getAction)
                    .toList();
            assertEquals(List.of(AuditAction.TRANSFER_INITIATED, AuditAction.TRANSFER_VALIDATED,
                    AuditAction.TRANSFER_FAILED), actions);
            printSuccess("FAILED status survived the rollback of the money movement");
        } finally {
            jdbcTemplate.execute("DROP TRIGGER IF EXISTS " + trigger + " ON accounts");
        }
    }

    @Test
    @DisplayName("Concurrent debits of one account never overdraw it")
    void concurrentDebitsRespectBalance() throws Exception {
        printTestHeader("Concurrent debits");

        Account a = newAccount("1000.00", "0.00");
        Account b = newAccount("0.00", "0.00");
        int attempts = 10;
        BigDecimal amount = new BigDecimal("150.00");

        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < attempts; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    transferEngine.initiate(a.getId(), b.getId(), amount, controller, null, RequestMetadata.NONE);
                    completed.incrementAndGet();
                } catch (TransferValidationException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        printOutput("Completed", completed.get());
        printOutput("Rejected", rejected.get());
        assertEquals(6, completed.get());
        assertEquals(4, rejected.get());
        assertEquals(0, new BigDecimal("100.00").compareTo(balanceOf(a.getId())));
        assertEquals(0, new BigDecimal("900.00").compareTo(balanceOf(b.getId())));
        printSuccess("Row lock serialized the read-modify-write sequence");
    }

    @Test
    @DisplayName("Opposite-direction transfers between two accounts all complete")
    void oppositeDirectionsDoNotDeadlock() throws Exception {
        printTestHeader("Opposite-direction transfers");

        Account a = newAccount("10000.00", "0.00");
        Account b = newAccount("10000.00", "0.00");
        int pairs = 4;
        BigDecimal amount = new BigDecimal("100.00");

        ExecutorService executor = Executors.newFixedThreadPool(pairs * 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Transfer>> futures = new ArrayList<>();

        for (int i = 0; i < pairs; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return transferEngine.initiate(a.getId(), b.getId(), amount, controller, null, RequestMetadata.NONE);
            }));
            futures.add(executor.submit(() -> {
                start.await();
                return transferEngine.initiate(b.getId(), a.getId(), amount, controller, null, RequestMetadata.NONE);
            }));
        }
        start.countDown();

        List<TransferStatus> statuses = new ArrayList<>();
        for (Future<Transfer> future : futures) {
            statuses.add(future.get(30, TimeUnit.SECONDS).getStatus());
        }
        executor.shutdown();

        printOutput("Statuses", statuses);
        assertTrue(statuses.stream().allMatch(status -> status == TransferStatus.COMPLETED));
        assertEquals(0, new BigDecimal("10000.00").compareTo(balanceOf(a.getId())));
        assertEquals(0, new BigDecimal("10000.00").compareTo(balanceOf(b.getId())));
        printSuccess("Both legs locked in id order, no transfer failed");
    }
}
