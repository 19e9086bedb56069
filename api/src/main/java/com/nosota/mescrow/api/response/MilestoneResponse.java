package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.Status;

/**
 * Response DTO for a milestone.
 *
 * @param percentage      Share of the grant, scaled by 10^18
 * @param metadata        Description of the milestone
 * @param evidence        Last submitted evidence (null if never submitted)
 * @param status          Current milestone status
 * @param allocatedAmount Amount allocated when the milestone was accepted (0 before that)
 */
public record MilestoneResponse(
        Long percentage,
        String metadata,
        String evidence,
        Status status,
        Long allocatedAmount
) {
}
