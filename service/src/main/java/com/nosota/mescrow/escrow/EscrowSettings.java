package com.nosota.mescrow.escrow;

import lombok.Builder;

import java.util.UUID;

/**
 * Per-instance configuration of an escrow.
 *
 * @param projectId                     Project the escrow belongs to
 * @param poolId                        Ledger pool backing the escrow
 * @param maxRecipients                 Cap on accepted recipients
 * @param recipientThreshold            Percentage of voting power to accept/reject a recipient
 * @param milestoneOfferThreshold       Percentage to accept/reject an offered milestone plan
 * @param milestoneSubmissionThreshold  Percentage to accept/reject a submitted milestone
 * @param abortThreshold                Percentage to abort the project or decline the abort
 * @param participantCapability         Capability held by participants
 * @param executorCapability            Capability granted to accepted recipients
 */
@Builder
public record EscrowSettings(
        UUID projectId,
        String poolId,
        int maxRecipients,
        int recipientThreshold,
        int milestoneOfferThreshold,
        int milestoneSubmissionThreshold,
        int abortThreshold,
        String participantCapability,
        String executorCapability
) {

    public EscrowSettings {
        if (projectId == null) {
            throw new IllegalArgumentException("Project ID is required");
        }
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("Pool ID is required");
        }
        if (maxRecipients < 1) {
            throw new IllegalArgumentException("Max recipients must be positive: " + maxRecipients);
        }
        requirePercentage("recipientThreshold", recipientThreshold);
        requirePercentage("milestoneOfferThreshold", milestoneOfferThreshold);
        requirePercentage("milestoneSubmissionThreshold", milestoneSubmissionThreshold);
        requirePercentage("abortThreshold", abortThreshold);
        if (participantCapability == null || executorCapability == null
                || participantCapability.equals(executorCapability)) {
            throw new IllegalArgumentException("Participant and executor capabilities must be distinct and set");
        }
    }

    private static void requirePercentage(String name, int value) {
        if (value < 1 || value > 100) {
            throw new IllegalArgumentException(String.format("%s must be within 1..100: %d", name, value));
        }
    }
}
