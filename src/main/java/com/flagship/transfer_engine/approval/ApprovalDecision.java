package com.flagship.transfer_engine.approval;

/**
 * Reviewer's verdict on a transfer awaiting approval.
 */
public enum ApprovalDecision {
    APPROVED,
    REJECTED;

    ApprovalStatus toStatus() {
        return this == APPROVED ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
    }
}
