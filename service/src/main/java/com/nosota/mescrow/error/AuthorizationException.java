package com.nosota.mescrow.error;

/**
 * The caller lacks the capability an operation requires.
 */
public class AuthorizationException extends EscrowException {
    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
