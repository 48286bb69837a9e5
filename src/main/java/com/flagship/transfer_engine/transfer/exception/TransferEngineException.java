package com.flagship.transfer_engine.transfer.exception;

/**
 * Base type for every error the transfer engine reports to its callers.
 */
public abstract class TransferEngineException extends RuntimeException {

    protected TransferEngineException(String message) {
        super(message);
    }

    protected TransferEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
