package com.flagship.transfer_engine.observability;

import com.flagship.transfer_engine.approval.ApprovalEntity;
import com.flagship.transfer_engine.approval.ApprovalRepository;
import com.flagship.transfer_engine.approval.ApprovalStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reports the queue of transfers waiting for a second-party decision.
 *
 * WARNING when the queue grows past the warning size or its oldest entry has
 * waited longer than the allowed age; DOWN past the critical size or when the
 * approvals table cannot be read.
 */
@Component("approvalBacklog")
public class ApprovalBacklogHealthIndicator implements HealthIndicator {

    static final Status WARNING = new Status("WARNING");

    private final ApprovalRepository approvalRepository;
    private final Clock clock;
    private final long warningSize;
    private final long criticalSize;
    private final Duration maxPendingAge;

    @Autowired
    public ApprovalBacklogHealthIndicator(
            ApprovalRepository approvalRepository,
            @Value("${transfer.approval-backlog.warning-size:100}") long warningSize,
            @Value("${transfer.approval-backlog.critical-size:1000}") long criticalSize,
            @Value("${transfer.approval-backlog.max-pending-age:PT24H}") Duration maxPendingAge) {
        this(approvalRepository, Clock.systemUTC(), warningSize, criticalSize, maxPendingAge);
    }

    ApprovalBacklogHealthIndicator(ApprovalRepository approvalRepository, Clock clock,
                                   long warningSize, long criticalSize, Duration maxPendingAge) {
        this.approvalRepository = approvalRepository;
        this.clock = clock;
        this.warningSize = warningSize;
        this.criticalSize = criticalSize;
        this.maxPendingAge = maxPendingAge;
    }

    @Override
    public Health health() {
        try {
            long pending = approvalRepository.countByStatus(ApprovalStatus.PENDING);
            Optional<Instant> oldest = approvalRepository
                .findFirstByStatusOrderByCreatedAtAsc(ApprovalStatus.PENDING)
                .map(ApprovalEntity::getCreatedAt);
            Duration oldestAge = oldest
                .map(createdAt -> Duration.between(createdAt, Instant.now(clock)))
                .orElse(Duration.ZERO);

            Status status = pending >= criticalSize
                ? Status.DOWN
                : pending >= warningSize || oldestAge.compareTo(maxPendingAge) > 0
                ? WARNING
                : Status.UP;

            Health.Builder builder = Health.status(status)
                .withDetail("pendingApprovals", pending)
                .withDetail("warningSize", warningSize)
                .withDetail("criticalSize", criticalSize)
                .withDetail("maxPendingAge", maxPendingAge.toString());
            oldest.ifPresent(createdAt -> builder
                .withDetail("oldestPendingSince", createdAt.toString())
                .withDetail("oldestPendingAge", oldestAge.toString()));
            return builder.build();

        } catch (DataAccessException e) {
            return Health.down()
                .withDetail("error", e.getMostSpecificCause().getMessage())
                .build();
        }
    }
}
