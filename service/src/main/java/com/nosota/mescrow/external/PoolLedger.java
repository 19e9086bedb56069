package com.nosota.mescrow.external;

/**
 * External ledger holding pooled value and executing transfers out of it.
 */
public interface PoolLedger {

    PoolInfo getPoolInfo(String poolId);

    /**
     * Moves {@code amount} of the asset to {@code to}.
     *
     * @throws IllegalStateException if the pool holding the asset has an insufficient balance
     */
    void transfer(String assetHandle, String to, long amount);
}
