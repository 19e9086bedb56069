package com.nosota.mescrow.external;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed implementation of {@link ProfileDirectory}.
 */
@Component
public class InMemoryProfileDirectory implements ProfileDirectory {

    private final Map<String, Profile> profilesByAnchor = new ConcurrentHashMap<>();
    private final Map<String, Profile> profilesById = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();

    public void register(Profile profile, Set<String> profileMembers) {
        profilesByAnchor.put(profile.anchor(), profile);
        profilesById.put(profile.id(), profile);
        members.put(profile.id(), Set.copyOf(profileMembers));
    }

    @Override
    public Optional<Profile> getProfileByAnchor(String anchor) {
        return Optional.ofNullable(profilesByAnchor.get(anchor));
    }

    @Override
    public boolean isOwnerOrMember(String profileId, String identity) {
        Profile profile = profilesById.get(profileId);
        if (profile == null || identity == null) {
            return false;
        }
        return identity.equals(profile.owner()) || members.getOrDefault(profileId, Set.of()).contains(identity);
    }
}
