package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * One milestone of an offered plan.
 *
 * @param percentage Share of the grant, scaled by 10^18 (1.0 = 1_000_000_000_000_000_000)
 * @param metadata   Description of the milestone
 */
public record MilestoneRequest(
        @NotNull(message = "Percentage is required")
        @Positive(message = "Percentage must be positive")
        Long percentage,

        @Size(max = 2000, message = "Metadata must be at most 2000 characters")
        String metadata
) {
}
