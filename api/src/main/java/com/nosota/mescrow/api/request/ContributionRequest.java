package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Capital contributed by one participant, as aggregated by the project manager.
 *
 * @param participantId Identity of the contributing participant
 * @param amount        Contributed amount in the pool's smallest unit
 */
public record ContributionRequest(
        @NotBlank(message = "Participant ID is required")
        String participantId,

        @NotNull(message = "Amount is required")
        @PositiveOrZero(message = "Amount must not be negative")
        Long amount
) {
}
