package com.nosota.mescrow.error;

/**
 * A request argument is invalid: a bad vote status, a milestone plan that does not add up, or unusable contributions.
 */
public class EscrowValidationException extends EscrowException {
    public EscrowValidationException(String message) {
        super(message);
    }

    public EscrowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
