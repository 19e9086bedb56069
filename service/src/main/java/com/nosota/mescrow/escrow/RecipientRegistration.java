package com.nosota.mescrow.escrow;

/**
 * Candidate data submitted by {@code registerRecipient}.
 *
 * @param recipientId       Recipient identity or profile anchor
 * @param recipientAddress  Payout destination, null to pay the recipient ID
 * @param useRegistryAnchor Whether the caller acts for the profile registered under {@code recipientId}
 * @param metadata          Opaque metadata
 */
public record RecipientRegistration(
        String recipientId,
        String recipientAddress,
        boolean useRegistryAnchor,
        String metadata
) {
}
