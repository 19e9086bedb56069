package com.nosota.mescrow.error;

/**
 * The operation is illegal for the current strategy, recipient or milestone status.
 */
public class EscrowStateException extends EscrowException {
    public EscrowStateException(String message) {
        super(message);
    }

    public EscrowStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
