package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.StrategyState;

import java.util.UUID;

/**
 * Summary of an escrow instance.
 *
 * @param projectId          Project the escrow belongs to
 * @param poolId             Ledger pool backing the escrow
 * @param state              Strategy state
 * @param poolActive         Whether the pool still accepts value-moving operations
 * @param totalSupply        Total voting power (scaled by 10^18)
 * @param currentSupply      Value still held for the project
 * @param allocatedAmount    Value allocated to accepted milestones but not yet paid
 * @param acceptedRecipients Number of accepted recipients
 * @param maxRecipients      Cap on accepted recipients
 */
public record EscrowResponse(
        UUID projectId,
        String poolId,
        StrategyState state,
        boolean poolActive,
        Long totalSupply,
        Long currentSupply,
        Long allocatedAmount,
        Integer acceptedRecipients,
        Integer maxRecipients
) {
}
