package com.nosota.mescrow.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Map-backed implementation of {@link PoolLedger}.
 *
 * <p>Each pool owns one asset handle. Transfers debit the pool owning the asset and
 * credit the destination's balance of that asset.
 */
@Component
@Slf4j
public class InMemoryPoolLedger implements PoolLedger {

    private final Map<String, String> assetByPool = new HashMap<>();
    private final Map<String, String> poolByAsset = new HashMap<>();
    private final Map<String, Long> poolBalances = new HashMap<>();
    // assetHandle -> (holder -> balance)
    private final Map<String, Map<String, Long>> holderBalances = new HashMap<>();

    /**
     * Adds value to a pool, creating the pool on first use.
     */
    public synchronized void fund(String poolId, String assetHandle, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Funding amount must not be negative: " + amount);
        }
        String existingAsset = assetByPool.putIfAbsent(poolId, assetHandle);
        if (existingAsset != null && !existingAsset.equals(assetHandle)) {
            throw new IllegalArgumentException(
                    String.format("Pool %s already holds asset %s", poolId, existingAsset));
        }
        poolByAsset.put(assetHandle, poolId);
        poolBalances.merge(poolId, amount, Long::sum);
        log.info("Pool funded: poolId={}, assetHandle={}, amount={}", poolId, assetHandle, amount);
    }

    @Override
    public synchronized PoolInfo getPoolInfo(String poolId) {
        String assetHandle = assetByPool.get(poolId);
        if (assetHandle == null) {
            throw new IllegalArgumentException("Unknown pool: " + poolId);
        }
        return new PoolInfo(assetHandle, poolBalances.getOrDefault(poolId, 0L));
    }

    @Override
    public synchronized void transfer(String assetHandle, String to, long amount) {
        String poolId = poolByAsset.get(assetHandle);
        if (poolId == null) {
            throw new IllegalArgumentException("Unknown asset: " + assetHandle);
        }
        long balance = poolBalances.getOrDefault(poolId, 0L);
        if (amount < 0 || balance < amount) {
            throw new IllegalStateException(
                    String.format("Insufficient pool balance: poolId=%s, balance=%d, requested=%d",
                            poolId, balance, amount));
        }
        poolBalances.put(poolId, balance - amount);
        holderBalances.computeIfAbsent(assetHandle, k -> new HashMap<>()).merge(to, amount, Long::sum);
        log.info("Transferred {} of {} from pool {} to {}", amount, assetHandle, poolId, to);
    }

    public synchronized long balanceOf(String assetHandle, String holder) {
        return holderBalances.getOrDefault(assetHandle, Map.of()).getOrDefault(holder, 0L);
    }
}
