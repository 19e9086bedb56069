package com.nosota.mescrow.escrow;

import com.nosota.mescrow.error.DuplicateVoteException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Vote tally")
class VoteTallyTest {

    private static final long THRESHOLD = VoteTally.thresholdOf(FixedPoint.SCALE, 77);

    @Test
    @DisplayName("Threshold is the percentage of the total supply")
    void thresholdOfPercentage() {
        assertThat(THRESHOLD).isEqualTo(770_000_000_000_000_000L);
        assertThat(VoteTally.thresholdOf(FixedPoint.SCALE, 100)).isEqualTo(FixedPoint.SCALE);
    }

    @Test
    @DisplayName("A side exactly at the threshold does not cross it, one more unit does")
    void thresholdIsStrict() throws Exception {
        VoteTally atThreshold = new VoteTally();
        atThreshold.castVote("alice", true, THRESHOLD);
        assertThat(atThreshold.crossedThreshold(THRESHOLD)).isEmpty();

        VoteTally aboveThreshold = new VoteTally();
        aboveThreshold.castVote("alice", true, THRESHOLD + 1);
        assertThat(aboveThreshold.crossedThreshold(THRESHOLD)).contains(ThresholdOutcome.ACCEPTED);
    }

    @Test
    @DisplayName("Votes against cross into REJECTED")
    void againstCrossesIntoRejected() throws Exception {
        VoteTally tally = new VoteTally();
        tally.castVote("alice", false, FixedPoint.percent(40));
        tally.castVote("bob", false, FixedPoint.percent(30));
        assertThat(tally.crossedThreshold(THRESHOLD)).isEmpty();

        tally.castVote("carol", false, FixedPoint.percent(30));
        assertThat(tally.crossedThreshold(THRESHOLD)).contains(ThresholdOutcome.REJECTED);
        assertThat(tally.getVotesAgainst()).isEqualTo(FixedPoint.SCALE);
        assertThat(tally.getVotesFor()).isZero();
    }

    @Test
    @DisplayName("Second vote in the same round is rejected and leaves the tally unchanged")
    void duplicateVoteIsRejected() throws Exception {
        VoteTally tally = new VoteTally();
        tally.castVote("alice", true, 10);

        assertThatThrownBy(() -> tally.castVote("alice", false, 10))
                .isInstanceOf(DuplicateVoteException.class);
        assertThat(tally.getVotesFor()).isEqualTo(10);
        assertThat(tally.getVotesAgainst()).isZero();
    }

    @Test
    @DisplayName("Reset opens a new round in which everybody may vote again")
    void resetStartsNewRound() throws Exception {
        VoteTally tally = new VoteTally();
        tally.castVote("alice", true, 10);
        tally.castVote("bob", false, 5);
        long round = tally.getRound();

        tally.reset();

        assertThat(tally.getRound()).isEqualTo(round + 1);
        assertThat(tally.getVotesFor()).isZero();
        assertThat(tally.getVotesAgainst()).isZero();
        assertThat(tally.hasVoted("alice")).isFalse();
        assertThat(tally.hasVoted("bob")).isFalse();

        tally.castVote("alice", false, 10);
        assertThat(tally.hasVoted("alice")).isTrue();
        assertThat(tally.getVotesAgainst()).isEqualTo(10);
    }

    @Test
    @DisplayName("Preview reports the outcome without recording the vote")
    void previewDoesNotRecord() throws Exception {
        VoteTally tally = new VoteTally();
        tally.castVote("alice", true, FixedPoint.percent(70));

        assertThat(tally.previewVote(true, FixedPoint.percent(30), THRESHOLD)).contains(ThresholdOutcome.ACCEPTED);
        assertThat(tally.previewVote(false, FixedPoint.percent(30), THRESHOLD)).isEmpty();
        assertThat(tally.getVotesFor()).isEqualTo(FixedPoint.percent(70));
        assertThat(tally.hasVoted("bob")).isFalse();

        assertThat(VoteTally.previewFreshVote(true, FixedPoint.percent(80), THRESHOLD))
                .contains(ThresholdOutcome.ACCEPTED);
        assertThat(VoteTally.previewFreshVote(true, FixedPoint.percent(40), THRESHOLD)).isEmpty();
    }

    @Test
    @DisplayName("Zero-weight votes are recorded but add nothing")
    void zeroWeightVote() throws Exception {
        VoteTally tally = new VoteTally();
        tally.castVote("stranger", true, 0);

        assertThat(tally.hasVoted("stranger")).isTrue();
        assertThat(tally.getVotesFor()).isZero();
        assertThatThrownBy(() -> tally.castVote("negative", true, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
