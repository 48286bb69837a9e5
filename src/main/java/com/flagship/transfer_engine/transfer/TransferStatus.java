package com.flagship.transfer_engine.transfer;

/**
 * Transfer lifecycle.
 *
 * PENDING -> COMPLETED | FAILED (auto-executing path)
 * AWAITING_APPROVAL -> APPROVED -> COMPLETED | FAILED, or AWAITING_APPROVAL -> REJECTED
 */
public enum TransferStatus {
    /**
     * Accepted below the approval threshold; execution is attempted immediately.
     */
    PENDING,

    /**
     * Above the threshold; parked until a second party decides.
     */
    AWAITING_APPROVAL,

    /**
     * Approved by a reviewer; execution follows in the same transaction.
     */
    APPROVED,

    /**
     * Terminal. No money moved.
     */
    REJECTED,

    /**
     * Terminal. Source debited and destination credited.
     */
    COMPLETED,

    /**
     * Terminal. Execution was attempted and rolled back; error message recorded.
     */
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED;
    }

    public boolean isExecutable() {
        return this == PENDING || this == APPROVED;
    }
}
