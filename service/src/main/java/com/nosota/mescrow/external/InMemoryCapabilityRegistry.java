package com.nosota.mescrow.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allow-list implementation of {@link AuthorizationOracle}.
 *
 * <p>Used by the standalone service and by tests. A deployment backed by a real
 * role registry replaces this bean.
 */
@Component
@Slf4j
public class InMemoryCapabilityRegistry implements AuthorizationOracle {

    // capabilityId -> (identity -> active)
    private final Map<String, Map<String, Boolean>> capabilities = new ConcurrentHashMap<>();

    @Override
    public boolean hasCapability(String identity, String capabilityId) {
        if (identity == null || capabilityId == null) {
            return false;
        }
        Map<String, Boolean> holders = capabilities.get(capabilityId);
        return holders != null && Boolean.TRUE.equals(holders.get(identity));
    }

    @Override
    public void grantCapability(String capabilityId, String identity) {
        capabilities.computeIfAbsent(capabilityId, k -> new ConcurrentHashMap<>()).put(identity, Boolean.TRUE);
        log.info("Capability granted: capabilityId={}, identity={}", capabilityId, identity);
    }

    @Override
    public void setCapabilityStatus(String capabilityId, String identity, boolean active) {
        Map<String, Boolean> holders = capabilities.get(capabilityId);
        if (holders == null || !holders.containsKey(identity)) {
            throw new IllegalArgumentException(
                    String.format("Capability %s was never granted to %s", capabilityId, identity));
        }
        holders.put(identity, active);
        log.info("Capability status changed: capabilityId={}, identity={}, active={}", capabilityId, identity, active);
    }
}
