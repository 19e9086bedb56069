package com.nosota.mescrow.error;

/**
 * The recipient cap is reached or an allocation would exceed the pool.
 */
public class CapacityExceededException extends EscrowException {
    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
