package com.flagship.transfer_engine.approval;

/**
 * Approval lifecycle. PENDING is set at creation; the row is decided exactly once.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
