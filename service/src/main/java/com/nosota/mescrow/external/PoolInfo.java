package com.nosota.mescrow.external;

/**
 * Snapshot of a ledger pool.
 *
 * @param assetHandle Handle used to move the pool's value
 * @param balance     Value currently held by the pool
 */
public record PoolInfo(String assetHandle, long balance) {
}
