package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for submitting evidence that a milestone is complete.
 *
 * @param evidence Pointer to, or description of, the delivered work
 */
public record SubmitMilestoneRequest(
        @NotBlank(message = "Evidence is required")
        @Size(max = 2000, message = "Evidence must be at most 2000 characters")
        String evidence
) {
}
