package com.nosota.mescrow.external;

/**
 * External authority deciding which identity holds which capability.
 *
 * <p>A capability is granted once and can later be deactivated or reactivated.
 * {@link #hasCapability} is true only for granted, active capabilities.
 */
public interface AuthorizationOracle {

    boolean hasCapability(String identity, String capabilityId);

    void grantCapability(String capabilityId, String identity);

    void setCapabilityStatus(String capabilityId, String identity, boolean active);
}
