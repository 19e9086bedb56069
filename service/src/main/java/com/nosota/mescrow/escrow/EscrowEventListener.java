package com.nosota.mescrow.escrow;

/**
 * Receives escrow events synchronously, in emission order, once the operation that
 * produced them has finished.
 */
@FunctionalInterface
public interface EscrowEventListener {

    EscrowEventListener NONE = event -> {
    };

    void onEvent(EscrowEvent event);
}
