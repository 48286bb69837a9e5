package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.approval.Approval;
import com.flagship.transfer_engine.approval.ApprovalStatus;
import com.flagship.transfer_engine.common.PagedResult;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side for transfers: single lookups, filtered listings and the approval queue.
 * Plain JDBC joins; nothing here writes.
 */
@Service
@RequiredArgsConstructor
public class TransferQueryService {

    private static final String DETAILS_SELECT =
        "SELECT t.id, t.from_account_id, t.to_account_id, t.amount, t.status, t.initiated_by, " +
        "t.approved_by, t.approved_at, t.requires_approval, t.description, t.error_message, " +
        "t.created_at, t.updated_at, t.completed_at, " +
        "fa.account_number AS from_account_number, fa.account_name AS from_account_name, " +
        "ta.account_number AS to_account_number, ta.account_name AS to_account_name, " +
        "a.id AS approval_id, a.assigned_to AS approval_assigned_to, a.status AS approval_status, " +
        "a.decision_notes AS approval_decision_notes, a.decided_at AS approval_decided_at, " +
        "a.created_at AS approval_created_at, a.updated_at AS approval_updated_at " +
        "FROM transfers t " +
        "LEFT JOIN accounts fa ON t.from_account_id = fa.id " +
        "LEFT JOIN accounts ta ON t.to_account_id = ta.id " +
        "LEFT JOIN approvals a ON t.id = a.transfer_id";

    private static final String PENDING_APPROVAL_CONDITION =
        " WHERE t.status = 'AWAITING_APPROVAL' AND a.status = 'PENDING'";

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public Optional<TransferDetails> getTransferById(UUID transferId) {
        return jdbcTemplate.query(
            DETAILS_SELECT + " WHERE t.id = ?",
            detailsRowMapper(),
            transferId
        ).stream().findFirst();
    }

    /**
     * Filtered listing, newest first.
     */
    @Transactional(readOnly = true)
    public PagedResult<TransferDetails> listTransfers(TransferFilter filter, int page, int size) {
        TransferFilter criteria = filter != null ? filter : TransferFilter.none();
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (criteria.getAccountId() != null) {
            conditions.add("(t.from_account_id = ? OR t.to_account_id = ?)");
            params.add(criteria.getAccountId());
            params.add(criteria.getAccountId());
        }
        if (criteria.getInitiatedBy() != null) {
            conditions.add("t.initiated_by = ?");
            params.add(criteria.getInitiatedBy());
        }
        if (criteria.getStatus() != null) {
            conditions.add("t.status = ?");
            params.add(criteria.getStatus().name());
        }
        if (criteria.getFrom() != null) {
            conditions.add("t.created_at >= ?");
            params.add(Timestamp.from(criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            conditions.add("t.created_at <= ?");
            params.add(Timestamp.from(criteria.getTo()));
        }

        String whereClause = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transfers t" + whereClause,
            Long.class,
            params.toArray()
        );

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(size);
        pageParams.add((long) page * size);

        List<TransferDetails> items = jdbcTemplate.query(
            DETAILS_SELECT + whereClause + " ORDER BY t.created_at DESC, t.id LIMIT ? OFFSET ?",
            detailsRowMapper(),
            pageParams.toArray()
        );

        return new PagedResult<>(items, total != null ? total : 0L, page, size);
    }

    /**
     * Transfers waiting for a decision that the given actor may decide: their own requests are excluded.
     * Oldest first.
     */
    @Transactional(readOnly = true)
    public List<TransferDetails> listPendingApprovals(UUID excludingActor) {
        return jdbcTemplate.query(
            DETAILS_SELECT + PENDING_APPROVAL_CONDITION + " AND t.initiated_by <> ? ORDER BY t.created_at ASC",
            detailsRowMapper(),
            excludingActor
        );
    }

    @Transactional(readOnly = true)
    public List<TransferDetails> listAllPendingApprovals() {
        return jdbcTemplate.query(
            DETAILS_SELECT + PENDING_APPROVAL_CONDITION + " ORDER BY t.created_at ASC",
            detailsRowMapper()
        );
    }

    private RowMapper<TransferDetails> detailsRowMapper() {
        return (rs, rowNum) -> new TransferDetails(
            mapTransfer(rs),
            new TransferDetails.AccountSummary(
                UUID.fromString(rs.getString("from_account_id")),
                rs.getString("from_account_number"),
                rs.getString("from_account_name")),
            new TransferDetails.AccountSummary(
                UUID.fromString(rs.getString("to_account_id")),
                rs.getString("to_account_number"),
                rs.getString("to_account_name")),
            mapApproval(rs)
        );
    }

    private static Transfer mapTransfer(ResultSet rs) throws SQLException {
        return Transfer.builder()
            .id(UUID.fromString(rs.getString("id")))
            .fromAccountId(UUID.fromString(rs.getString("from_account_id")))
            .toAccountId(UUID.fromString(rs.getString("to_account_id")))
            .amount(rs.getBigDecimal("amount"))
            .status(TransferStatus.valueOf(rs.getString("status")))
            .initiatedBy(UUID.fromString(rs.getString("initiated_by")))
            .approvedBy(uuidOrNull(rs.getString("approved_by")))
            .approvedAt(toInstant(rs.getTimestamp("approved_at")))
            .requiresApproval(rs.getBoolean("requires_approval"))
            .description(rs.getString("description"))
            .errorMessage(rs.getString("error_message"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .completedAt(toInstant(rs.getTimestamp("completed_at")))
            .build();
    }

    private static Approval mapApproval(ResultSet rs) throws SQLException {
        String approvalId = rs.getString("approval_id");
        if (approvalId == null) {
            return null;
        }
        return Approval.builder()
            .id(UUID.fromString(approvalId))
            .transferId(UUID.fromString(rs.getString("id")))
            .assignedTo(uuidOrNull(rs.getString("approval_assigned_to")))
            .status(ApprovalStatus.valueOf(rs.getString("approval_status")))
            .decisionNotes(rs.getString("approval_decision_notes"))
            .decidedAt(toInstant(rs.getTimestamp("approval_decided_at")))
            .createdAt(toInstant(rs.getTimestamp("approval_created_at")))
            .updatedAt(toInstant(rs.getTimestamp("approval_updated_at")))
            .build();
    }

    private static UUID uuidOrNull(String value) {
        return value != null ? UUID.fromString(value) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
