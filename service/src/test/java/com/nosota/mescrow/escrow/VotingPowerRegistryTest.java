package com.nosota.mescrow.escrow;

import com.nosota.mescrow.error.EscrowValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Voting power normalization")
class VotingPowerRegistryTest {

    @Test
    @DisplayName("Contributions 400/300/300 normalize to 0.40/0.30/0.30")
    void normalizesProportionally() throws Exception {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("alice", 400L, "bob", 300L, "carol", 300L));

        assertThat(registry.weightOf("alice")).isEqualTo(FixedPoint.percent(40));
        assertThat(registry.weightOf("bob")).isEqualTo(FixedPoint.percent(30));
        assertThat(registry.weightOf("carol")).isEqualTo(FixedPoint.percent(30));
        assertThat(registry.totalContribution()).isEqualTo(1000L);
        assertThat(registry.totalSupply()).isEqualTo(FixedPoint.SCALE);
    }

    @Test
    @DisplayName("Rounding remainder goes to the earliest of equal contributors")
    void remainderGoesToFirstOnTie() throws Exception {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("a", 1L, "b", 1L, "c", 1L));

        long third = FixedPoint.SCALE / 3;
        assertThat(registry.weightOf("a")).isEqualTo(third + 1);
        assertThat(registry.weightOf("b")).isEqualTo(third);
        assertThat(registry.weightOf("c")).isEqualTo(third);
        assertThat(registry.remainderHolder()).isEqualTo("a");
        assertThat(registry.weights().values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(FixedPoint.SCALE);
    }

    @Test
    @DisplayName("Rounding remainder goes to the largest contributor")
    void remainderGoesToLargest() throws Exception {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("small", 1L, "large", 2L));

        assertThat(registry.remainderHolder()).isEqualTo("large");
        assertThat(registry.weightOf("small") + registry.weightOf("large")).isEqualTo(FixedPoint.SCALE);
    }

    @Test
    @DisplayName("Zero-amount contributors hold no weight but stay registered")
    void zeroContributionHasNoWeight() throws Exception {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("alice", 10L, "idle", 0L));

        assertThat(registry.weightOf("alice")).isEqualTo(FixedPoint.SCALE);
        assertThat(registry.weightOf("idle")).isZero();
        assertThat(registry.isParticipant("idle")).isTrue();
        assertThat(registry.weightOf("nobody")).isZero();
    }

    @Test
    @DisplayName("Zero total contribution is rejected")
    void zeroTotalIsRejected() {
        assertThatThrownBy(() -> VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("alice", 0L, "bob", 0L)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("zero");
    }

    @Test
    @DisplayName("Empty and negative contributions are rejected")
    void invalidContributionsAreRejected() {
        assertThatThrownBy(() -> VotingPowerRegistry.normalize(new LinkedHashMap<>()))
                .isInstanceOf(EscrowValidationException.class);
        assertThatThrownBy(() -> VotingPowerRegistry.normalize(Map.of("alice", -5L)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("alice", Long.MAX_VALUE, "bob", 1L)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("overflows");
    }

    @Test
    @DisplayName("Weights of very large contributions do not overflow")
    void largeContributions() throws Exception {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(
                EscrowTestSupport.contributions("alice", Long.MAX_VALUE / 2, "bob", Long.MAX_VALUE / 2));

        assertThat(registry.weightOf("alice")).isEqualTo(FixedPoint.SCALE / 2);
        assertThat(registry.weightOf("bob")).isEqualTo(FixedPoint.SCALE / 2);
    }
}
