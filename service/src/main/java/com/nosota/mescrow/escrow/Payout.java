package com.nosota.mescrow.escrow;

/**
 * Transfer decided by a committed transition, issued after the transition.
 */
record Payout(String beneficiary, Integer milestoneIndex, String destination, long amount) {
}
