package com.flagship.library_ledger.common;

import lombok.Value;

/**
 * Outcome of a core operation: a success flag plus a human-readable message.
 *
 * Failed results always carry a {@link FailureReason}; successful ones never do.
 */
@Value
public class OperationResult {
    boolean success;
    FailureReason reason;
    String message;

    public static OperationResult ok(String message) {
        return new OperationResult(true, null, message);
    }

    public static OperationResult failure(FailureReason reason, String message) {
        if (reason == null) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new OperationResult(false, reason, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
