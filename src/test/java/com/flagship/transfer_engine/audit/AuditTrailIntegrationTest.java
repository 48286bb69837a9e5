package com.flagship.transfer_engine.audit;

import com.flagship.transfer_engine.account.Account;
import com.flagship.transfer_engine.account.AccountService;
import com.flagship.transfer_engine.common.PagedResult;
import com.flagship.transfer_engine.transfer.Transfer;
import com.flagship.transfer_engine.transfer.TransferEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Audit trail storage and lookups against a real PostgreSQL store.
 */
@SpringBootTest
@Testcontainers
class AuditTrailIntegrationTest {

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
    private AccountService accountService;

    @Autowired
    private AuditQueryService auditQueryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID controller = UUID.randomUUID();
    private final UUID auditor = UUID.randomUUID();
    private final RequestMetadata metadata = RequestMetadata.of("192.0.2.44", "audit-test");

    private Account source;
    private Transfer transfer;

    @BeforeEach
    void setUp() {
        source = accountService.createAccount("ACC-" + UUID.randomUUID().toString().substring(0, 8),
                "Audited", new BigDecimal("5000.00"), BigDecimal.ZERO);
        Account destination = accountService.createAccount("ACC-" + UUID.randomUUID().toString().substring(0, 8),
                "Counterparty", BigDecimal.ZERO, BigDecimal.ZERO);
        transfer = transferEngine.initiate(source.getId(), destination.getId(), new BigDecimal("125.50"),
                controller, "invoice 42", metadata);
    }

    @Test
    @DisplayName("Updating an audit record is rejected by the store")
    void updateRejected() {
        DataAccessException e = assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("UPDATE audit_records SET client_info = 'tampered' WHERE transfer_id = ?",
                        transfer.getId()));

        assertTrue(e.getMostSpecificCause().getMessage().contains("append-only"));
        assertTrue(auditQueryService.listAuditTrail(transfer.getId()).stream()
                .allMatch(record -> "audit-test".equals(record.getClientInfo())));
    }

    @Test
    @DisplayName("Deleting an audit record is rejected by the store")
    void deleteRejected() {
        assertThrows(DataAccessException.class,
                () -> jdbcTemplate.update("DELETE FROM audit_records WHERE transfer_id = ?", transfer.getId()));

        assertEquals(3, auditQueryService.listAuditTrail(transfer.getId()).size());
    }

    @Test
    @DisplayName("Trail is ordered and carries request metadata and details")
    void trailContents() {
        List<AuditRecord> trail = auditQueryService.listAuditTrail(transfer.getId());

        assertEquals(List.of(AuditAction.TRANSFER_INITIATED, AuditAction.TRANSFER_VALIDATED,
                AuditAction.TRANSFER_COMPLETED), trail.stream().map(AuditRecord::getAction).toList());
        assertTrue(trail.get(0).getSequenceNumber() < trail.get(1).getSequenceNumber());
        assertTrue(trail.stream().allMatch(record -> controller.equals(record.getActorId())));
        assertEquals("192.0.2.44", trail.get(0).getOriginAddress());
        assertEquals(Optional.of(AuditValue.number(new BigDecimal("125.50"))),
                trail.get(0).getDetail().get("amount"));
    }

    @Test
    @DisplayName("Filtered listing returns matches and records the lookup")
    void filteredListingRecordsLookup() {
        AuditFilter filter = AuditFilter.builder()
                .transferId(transfer.getId())
                .actions(Set.of(AuditAction.TRANSFER_COMPLETED))
                .build();

        PagedResult<AuditRecord> page = auditQueryService.listAuditRecords(filter, 0, 10, auditor, metadata);

        assertEquals(1, page.getTotal());
        assertEquals(AuditAction.TRANSFER_COMPLETED, page.getItems().get(0).getAction());

        PagedResult<AuditRecord> lookups = auditQueryService.listAuditRecords(AuditFilter.builder()
                .actorId(auditor)
                .actions(Set.of(AuditAction.AUDIT_LOG_VIEWED))
                .build(), 0, 10, auditor, metadata);

        assertEquals(1, lookups.getTotal());
        AuditValue.Fields filters = (AuditValue.Fields) lookups.getItems().get(0).getDetail().get("filters")
                .orElseThrow();
        assertEquals(AuditValue.text(transfer.getId().toString()), filters.getValues().get("transfer_id"));
    }

    @Test
    @DisplayName("Account view and balance check are recorded for the viewer")
    void accountLookupsRecorded() {
        accountService.getAccount(source.getId(), auditor, metadata);
        accountService.getBalance(source.getId(), auditor, metadata);

        PagedResult<AuditRecord> records = auditQueryService.listAuditRecords(AuditFilter.builder()
                .actorId(auditor)
                .accountId(source.getId())
                .build(), 0, 10, auditor, metadata);

        assertEquals(List.of(AuditAction.BALANCE_CHECKED, AuditAction.ACCOUNT_VIEWED),
                records.getItems().stream().map(AuditRecord::getAction).toList());
        assertEquals(Optional.of(AuditValue.number(new BigDecimal("4874.50"))),
                records.getItems().get(0).getDetail().get("balance"));
    }
}
