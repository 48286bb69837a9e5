package com.flagship.transfer_engine.audit;

/**
 * Fixed set of actions an audit record can describe.
 */
public enum AuditAction {
    TRANSFER_INITIATED,
    TRANSFER_VALIDATED,
    TRANSFER_AWAITING_APPROVAL,
    TRANSFER_APPROVED,
    TRANSFER_REJECTED,
    TRANSFER_COMPLETED,
    TRANSFER_FAILED,
    BALANCE_CHECKED,
    ACCOUNT_VIEWED,
    AUDIT_LOG_VIEWED
}
