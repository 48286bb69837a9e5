package com.flagship.transfer_engine.transfer.exception;

/**
 * Reasons a proposed transfer is rejected before anything is persisted.
 * Declared in the order the checks run.
 */
public enum ValidationFailure {
    INVALID_AMOUNT,
    SAME_ACCOUNT,
    ACCOUNT_NOT_FOUND,
    INSUFFICIENT_FUNDS,
    MINIMUM_BALANCE_VIOLATION
}
