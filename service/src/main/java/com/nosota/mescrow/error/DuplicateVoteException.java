package com.nosota.mescrow.error;

/**
 * The voter already voted in the current round of a tally.
 */
public class DuplicateVoteException extends EscrowException {
    public DuplicateVoteException(String message) {
        super(message);
    }

    public DuplicateVoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
