package com.flagship.transfer_engine.transfer.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The debit/credit/update sequence failed. The money movement was rolled back
 * and the transfer has been recorded as FAILED with this message.
 */
@Getter
public class TransferExecutionException extends TransferEngineException {

    private final UUID transferId;

    public TransferExecutionException(UUID transferId, String message, Throwable cause) {
        super(message, cause);
        this.transferId = transferId;
    }

    /**
     * Most specific message available, used as the transfer's error message.
     */
    public static String describe(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : failure.getMessage();
        return message != null ? message : failure.getClass().getSimpleName();
    }
}
