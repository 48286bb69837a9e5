package com.flagship.transfer_engine.audit;

import com.flagship.transfer_engine.common.PagedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the audit trail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditQueryService {

    private final AuditRecordRepository repository;
    private final AuditDetailCodec codec;
    private final AuditRecorder auditRecorder;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Every audit record linked to a transfer, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditRecord> listAuditTrail(UUID transferId) {
        return repository.findByTransferIdOrderBySequenceNumberAsc(transferId)
            .stream()
            .map(this::toDomain)
            .toList();
    }

    /**
     * Filtered, paginated audit listing, newest first.
     * The lookup itself is recorded as an AUDIT_LOG_VIEWED event for the viewer.
     */
    @Transactional
    public PagedResult<AuditRecord> listAuditRecords(AuditFilter filter, int page, int size,
                                                     UUID viewerId, RequestMetadata metadata) {
        AuditFilter criteria = filter != null ? filter : AuditFilter.none();
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (criteria.getActorId() != null) {
            conditions.add("actor_id = ?");
            params.add(criteria.getActorId());
        }
        if (criteria.getTransferId() != null) {
            conditions.add("transfer_id = ?");
            params.add(criteria.getTransferId());
        }
        if (criteria.getAccountId() != null) {
            conditions.add("account_id = ?");
            params.add(criteria.getAccountId());
        }
        if (criteria.getActions() != null && !criteria.getActions().isEmpty()) {
            conditions.add("action IN (" + String.join(", ",
                Collections.nCopies(criteria.getActions().size(), "?")) + ")");
            criteria.getActions().forEach(action -> params.add(action.name()));
        }
        if (criteria.getFrom() != null) {
            conditions.add("created_at >= ?");
            params.add(Timestamp.from(criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            conditions.add("created_at <= ?");
            params.add(Timestamp.from(criteria.getTo()));
        }

        String whereClause = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_records" + whereClause,
            Long.class,
            params.toArray()
        );

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(size);
        pageParams.add((long) page * size);

        List<AuditRecord> records = jdbcTemplate.query(
            "SELECT id, sequence_number, action, actor_id, transfer_id, account_id, details::text AS details, " +
            "origin_address, client_info, created_at FROM audit_records" + whereClause +
            " ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            auditRecordRowMapper(),
            pageParams.toArray()
        );

        auditRecorder.record(AuditAction.AUDIT_LOG_VIEWED, viewerId, null, null,
            AuditDetail.builder().put("filters", criteria.toDetail()).build(), metadata);

        log.debug("Listed audit records: viewer={}, total={}, page={}, size={}", viewerId, total, page, size);

        return new PagedResult<>(records, total != null ? total : 0L, page, size);
    }

    private AuditRecord toDomain(AuditRecordEntity entity) {
        return new AuditRecord(
            entity.getId(),
            entity.getSequenceNumber(),
            entity.getAction(),
            entity.getActorId(),
            entity.getTransferId(),
            entity.getAccountId(),
            codec.decode(entity.getDetails()),
            entity.getOriginAddress(),
            entity.getClientInfo(),
            entity.getCreatedAt()
        );
    }

    private RowMapper<AuditRecord> auditRecordRowMapper() {
        return (rs, rowNum) -> new AuditRecord(
            UUID.fromString(rs.getString("id")),
            rs.getLong("sequence_number"),
            AuditAction.valueOf(rs.getString("action")),
            uuidOrNull(rs.getString("actor_id")),
            uuidOrNull(rs.getString("transfer_id")),
            uuidOrNull(rs.getString("account_id")),
            codec.decode(rs.getString("details")),
            rs.getString("origin_address"),
            rs.getString("client_info"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static UUID uuidOrNull(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
