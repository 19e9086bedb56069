package com.nosota.mescrow.escrow;

import com.nosota.mescrow.error.EscrowValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Normalized voting power of the participants of one escrow.
 *
 * <p>Weights are fractions of {@link FixedPoint#SCALE}: {@code weight = floor(amount * SCALE / total)}.
 * The rounding remainder goes to the largest contributor (the earliest one in input order on a tie),
 * so the weights always add up to exactly {@code SCALE}. The registry is read-only once built.
 */
@Slf4j
public final class VotingPowerRegistry {

    private final Map<String, Long> weights;
    private final long totalContribution;
    private final String remainderHolder;

    private VotingPowerRegistry(Map<String, Long> weights, long totalContribution, String remainderHolder) {
        this.weights = Collections.unmodifiableMap(weights);
        this.totalContribution = totalContribution;
        this.remainderHolder = remainderHolder;
    }

    /**
     * Builds the registry from contributed amounts.
     *
     * @param contributions Amount per participant, iterated in insertion order for tie-breaking
     * @throws EscrowValidationException if the map is empty, an amount is negative or the total is zero
     */
    public static VotingPowerRegistry normalize(Map<String, Long> contributions) throws EscrowValidationException {
        if (contributions == null || contributions.isEmpty()) {
            throw new EscrowValidationException("At least one contribution is required");
        }

        long total = 0;
        String largest = null;
        long largestAmount = -1;
        for (Map.Entry<String, Long> entry : contributions.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new EscrowValidationException("Contribution entries must have a participant and an amount");
            }
            long amount = entry.getValue();
            if (amount < 0) {
                throw new EscrowValidationException(
                        String.format("Contribution of %s is negative: %d", entry.getKey(), amount));
            }
            try {
                total = Math.addExact(total, amount);
            } catch (ArithmeticException e) {
                throw new EscrowValidationException("Total contribution overflows", e);
            }
            if (amount > largestAmount) {
                largest = entry.getKey();
                largestAmount = amount;
            }
        }
        if (total == 0) {
            throw new EscrowValidationException("Total contribution is zero, voting power cannot be normalized");
        }

        Map<String, Long> weights = new LinkedHashMap<>();
        long assigned = 0;
        for (Map.Entry<String, Long> entry : contributions.entrySet()) {
            long weight = FixedPoint.mulDiv(entry.getValue(), FixedPoint.SCALE, total);
            weights.put(entry.getKey(), weight);
            assigned += weight;
        }
        long remainder = FixedPoint.SCALE - assigned;
        weights.merge(largest, remainder, Long::sum);

        log.debug("Normalized {} contributions: total={}, remainder={} assigned to {}",
                weights.size(), total, remainder, largest);
        return new VotingPowerRegistry(weights, total, largest);
    }

    /**
     * Weight of an identity; zero for non-participants.
     */
    public long weightOf(String identity) {
        return weights.getOrDefault(identity, 0L);
    }

    public boolean isParticipant(String identity) {
        return weights.containsKey(identity);
    }

    public Set<String> participants() {
        return weights.keySet();
    }

    public Map<String, Long> weights() {
        return weights;
    }

    /**
     * Sum of all weights, always {@link FixedPoint#SCALE}.
     */
    public long totalSupply() {
        return FixedPoint.SCALE;
    }

    public long totalContribution() {
        return totalContribution;
    }

    /**
     * Participant that received the rounding remainder.
     */
    public String remainderHolder() {
        return remainderHolder;
    }
}
