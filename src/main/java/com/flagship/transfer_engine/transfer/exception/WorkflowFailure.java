package com.flagship.transfer_engine.transfer.exception;

public enum WorkflowFailure {
    TRANSFER_NOT_FOUND,
    NOT_AWAITING_APPROVAL,
    SELF_APPROVAL_FORBIDDEN
}
