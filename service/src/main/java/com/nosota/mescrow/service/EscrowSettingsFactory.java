package com.nosota.mescrow.service;

import com.nosota.mescrow.escrow.EscrowSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Builds {@link EscrowSettings} from the {@code escrow.*} configuration.
 *
 * <p>Each workflow threshold falls back to {@code escrow.threshold.default} when not set.
 * Capability IDs are derived per project, so escrows never share capabilities.
 */
@Component
public class EscrowSettingsFactory {

    @Value("${escrow.max-recipients}")
    private Integer maxRecipients;

    @Value("${escrow.threshold.recipient:${escrow.threshold.default}}")
    private Integer recipientThreshold;

    @Value("${escrow.threshold.milestone-offer:${escrow.threshold.default}}")
    private Integer milestoneOfferThreshold;

    @Value("${escrow.threshold.milestone-submission:${escrow.threshold.default}}")
    private Integer milestoneSubmissionThreshold;

    @Value("${escrow.threshold.abort:${escrow.threshold.default}}")
    private Integer abortThreshold;

    @Value("${escrow.capability.participant-prefix}")
    private String participantPrefix;

    @Value("${escrow.capability.executor-prefix}")
    private String executorPrefix;

    /**
     * @param maxRecipientsOverride Cap requested for this escrow, or null for the configured default
     */
    public EscrowSettings create(UUID projectId, String poolId, Integer maxRecipientsOverride) {
        return EscrowSettings.builder()
                .projectId(projectId)
                .poolId(poolId)
                .maxRecipients(maxRecipientsOverride != null ? maxRecipientsOverride : maxRecipients)
                .recipientThreshold(recipientThreshold)
                .milestoneOfferThreshold(milestoneOfferThreshold)
                .milestoneSubmissionThreshold(milestoneSubmissionThreshold)
                .abortThreshold(abortThreshold)
                .participantCapability(participantCapability(projectId))
                .executorCapability(executorPrefix + ":" + projectId)
                .build();
    }

    public String participantCapability(UUID projectId) {
        return participantPrefix + ":" + projectId;
    }
}
