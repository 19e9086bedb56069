package com.nosota.mescrow.escrow;

import com.nosota.mescrow.error.DuplicateVoteException;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted threshold vote over rounds.
 *
 * <p>Each voter record stores the round it was cast in. A voter "has voted" only when
 * that round equals the current one, so {@link #reset()} starts a fresh round by
 * bumping the counter instead of clearing every record.
 *
 * <p>The owner applies the accept/reject effect and calls {@link #reset()} in the same step.
 */
public class VoteTally {

    private final Map<String, Long> voterRounds = new HashMap<>();
    @Getter
    private long round = 1;
    @Getter
    private long votesFor;
    @Getter
    private long votesAgainst;

    /**
     * Threshold for a percentage of the total voting power.
     */
    public static long thresholdOf(long totalSupply, int percentage) {
        return FixedPoint.mulDiv(totalSupply, percentage, 100);
    }

    public boolean hasVoted(String voter) {
        Long castIn = voterRounds.get(voter);
        return castIn != null && castIn == round;
    }

    /**
     * Records a vote in the current round.
     *
     * @throws DuplicateVoteException if the voter already voted in this round
     */
    public void castVote(String voter, boolean support, long weight) throws DuplicateVoteException {
        if (hasVoted(voter)) {
            throw new DuplicateVoteException(
                    String.format("%s already voted in round %d", voter, round));
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Vote weight must not be negative: " + weight);
        }
        voterRounds.put(voter, round);
        if (support) {
            votesFor += weight;
        } else {
            votesAgainst += weight;
        }
    }

    /**
     * Side that strictly exceeds the threshold, if any.
     */
    public Optional<ThresholdOutcome> crossedThreshold(long threshold) {
        return outcome(votesFor, votesAgainst, threshold);
    }

    /**
     * Outcome the tally would reach if the given vote were added, without recording it.
     */
    public Optional<ThresholdOutcome> previewVote(boolean support, long weight, long threshold) {
        return outcome(support ? votesFor + weight : votesFor,
                support ? votesAgainst : votesAgainst + weight,
                threshold);
    }

    /**
     * Outcome of a single vote in a freshly reset round.
     */
    public static Optional<ThresholdOutcome> previewFreshVote(boolean support, long weight, long threshold) {
        return outcome(support ? weight : 0, support ? 0 : weight, threshold);
    }

    /**
     * Starts a new round with no votes.
     */
    public void reset() {
        round++;
        votesFor = 0;
        votesAgainst = 0;
    }

    private static Optional<ThresholdOutcome> outcome(long votesFor, long votesAgainst, long threshold) {
        if (votesFor > threshold) {
            return Optional.of(ThresholdOutcome.ACCEPTED);
        }
        if (votesAgainst > threshold) {
            return Optional.of(ThresholdOutcome.REJECTED);
        }
        return Optional.empty();
    }
}
