package com.nosota.mescrow.error;

/**
 * No escrow is open for the requested project.
 */
public class EscrowNotFoundException extends EscrowException {
    public EscrowNotFoundException(String message) {
        super(message);
    }

    public EscrowNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
