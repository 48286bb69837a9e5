package com.flagship.transfer_engine.transfer.exception;

import lombok.Getter;

/**
 * A proposed transfer failed a business rule. Raised before any write, so it never leaves partial state.
 */
@Getter
public class TransferValidationException extends TransferEngineException {

    private final ValidationFailure reason;

    public TransferValidationException(ValidationFailure reason, String message) {
        super(message);
        this.reason = reason;
    }
}
