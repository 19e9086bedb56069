package com.nosota.mescrow.escrow;

/**
 * Side of a tally that crossed its threshold.
 */
public enum ThresholdOutcome {
    ACCEPTED,
    REJECTED
}
