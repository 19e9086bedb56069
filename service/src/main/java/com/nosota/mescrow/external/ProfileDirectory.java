package com.nosota.mescrow.external;

import java.util.Optional;

/**
 * External directory of identity profiles.
 */
public interface ProfileDirectory {

    Optional<Profile> getProfileByAnchor(String anchor);

    boolean isOwnerOrMember(String profileId, String identity);
}
