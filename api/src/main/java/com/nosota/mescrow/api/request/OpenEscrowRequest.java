package com.nosota.mescrow.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for instantiating the escrow of a project.
 *
 * <p>Sent by the project manager once capital intake is complete. The contributions are
 * normalized into voting weights and never change afterwards.
 *
 * @param projectId     Project the escrow belongs to
 * @param poolId        Ledger pool holding the contributed value
 * @param maxRecipients Optional cap on accepted recipients (configured default when null)
 * @param contributions Contributed amount per participant
 */
public record OpenEscrowRequest(
        @NotNull(message = "Project ID is required")
        UUID projectId,

        @NotBlank(message = "Pool ID is required")
        String poolId,

        @Positive(message = "Max recipients must be positive")
        Integer maxRecipients,

        @NotEmpty(message = "At least one contribution is required")
        List<@Valid ContributionRequest> contributions
) {
}
