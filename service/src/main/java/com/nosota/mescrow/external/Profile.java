package com.nosota.mescrow.external;

/**
 * Identity profile registered under an anchor.
 *
 * @param id     Profile ID
 * @param anchor Anchor identity the profile acts through
 * @param owner  Owner identity
 */
public record Profile(String id, String anchor, String owner) {
}
