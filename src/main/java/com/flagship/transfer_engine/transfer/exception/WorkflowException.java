package com.flagship.transfer_engine.transfer.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * An approval decision is not allowed for the transfer in its current state.
 * Detected inside the decision transaction, which is rolled back in full.
 */
@Getter
public class WorkflowException extends TransferEngineException {

    private final WorkflowFailure reason;
    private final UUID transferId;

    public WorkflowException(WorkflowFailure reason, UUID transferId, String message) {
        super(message);
        this.reason = reason;
        this.transferId = transferId;
    }
}
