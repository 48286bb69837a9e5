package com.flagship.transfer_engine.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Optional criteria for listing audit records. Null fields do not filter.
 */
@Value
@Builder
public class AuditFilter {
    UUID actorId;
    UUID transferId;
    UUID accountId;
    Set<AuditAction> actions;
    Instant from;
    Instant to;

    public static AuditFilter none() {
        return AuditFilter.builder().build();
    }

    /**
     * Filter description stored on the AUDIT_LOG_VIEWED record.
     */
    AuditDetail toDetail() {
        List<AuditValue> actionNames = new ArrayList<>();
        if (actions != null) {
            actions.stream().map(Enum::name).sorted().forEach(name -> actionNames.add(AuditValue.text(name)));
        }
        return AuditDetail.builder()
            .put("actor_id", actorId)
            .put("transfer_id", transferId)
            .put("account_id", accountId)
            .put("actions", actionNames)
            .put("from", from != null ? from.toString() : null)
            .put("to", to != null ? to.toString() : null)
            .build();
    }
}
