package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.Status;

import java.util.List;

/**
 * Response DTO for a recipient of an escrow.
 *
 * @param id                    Recipient identity
 * @param recipientAddress      Payout destination
 * @param useRegistryAnchor     Whether the recipient ID is a profile anchor
 * @param metadata              Opaque metadata
 * @param status                Recipient status (NONE if unknown or rejected)
 * @param milestoneReviewStatus Status of the milestone plan
 * @param grantAmount           Amount granted on acceptance
 * @param nextMilestone         Index of the next milestone due for payout
 * @param milestones            Binding milestones
 * @param offeredMilestones     Milestones of the plan currently under vote
 */
public record RecipientResponse(
        String id,
        String recipientAddress,
        boolean useRegistryAnchor,
        String metadata,
        Status status,
        Status milestoneReviewStatus,
        Long grantAmount,
        Integer nextMilestone,
        List<MilestoneResponse> milestones,
        List<MilestoneResponse> offeredMilestones
) {
}
