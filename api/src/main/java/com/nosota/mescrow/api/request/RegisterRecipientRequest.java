package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering a recipient candidate.
 *
 * @param recipientId       Recipient identity, or a profile anchor when {@code useRegistryAnchor} is set
 * @param recipientAddress  Payout destination (defaults to the recipient ID)
 * @param useRegistryAnchor Whether the caller acts on behalf of a profile anchor
 * @param metadata          Opaque metadata (max 2000 characters)
 */
public record RegisterRecipientRequest(
        @NotBlank(message = "Recipient ID is required")
        String recipientId,

        String recipientAddress,

        boolean useRegistryAnchor,

        @Size(max = 2000, message = "Metadata must be at most 2000 characters")
        String metadata
) {
}
