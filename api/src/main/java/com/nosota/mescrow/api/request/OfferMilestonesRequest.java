package com.nosota.mescrow.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for offering a milestone plan for a recipient.
 *
 * @param milestones Ordered milestones; their percentages must add up to one whole unit
 *                   before the plan can be accepted
 */
public record OfferMilestonesRequest(
        @NotEmpty(message = "At least one milestone is required")
        List<@Valid MilestoneRequest> milestones
) {
}
