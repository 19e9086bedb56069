package com.nosota.mescrow.error;

/**
 * Base class of every rejection raised by an escrow operation.
 *
 * <p>An operation that throws leaves the escrow unchanged and moves no value.
 */
public class EscrowException extends Exception {
    public EscrowException() {
    }

    public EscrowException(String message) {
        super(message);
    }

    public EscrowException(String message, Throwable cause) {
        super(message, cause);
    }

    public EscrowException(Throwable cause) {
        super(cause);
    }

    public EscrowException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
