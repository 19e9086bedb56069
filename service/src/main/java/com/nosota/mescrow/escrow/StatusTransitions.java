package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.Status;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed {@link Status} transitions, scoped per entity.
 *
 * <p>Recipients, milestone plans and milestones share one status enum but not one
 * lifecycle:
 * <pre>
 * RECIPIENT:        NONE → PENDING → ACCEPTED
 *                   (a passed rejection deletes the record instead of storing REJECTED)
 * MILESTONE_PLAN:   NONE → ACCEPTED
 * MILESTONE:        NONE → PENDING → ACCEPTED
 *                            ↑   ↘
 *                            └─── REJECTED
 * </pre>
 * Transitions are applied by the workflows only, so an illegal one is a programming
 * error and surfaces as {@link IllegalStateException}.
 */
public enum StatusTransitions {

    RECIPIENT(Map.of(
            Status.NONE, EnumSet.of(Status.PENDING),
            Status.PENDING, EnumSet.of(Status.ACCEPTED)
    )),

    MILESTONE_PLAN(Map.of(
            Status.NONE, EnumSet.of(Status.ACCEPTED)
    )),

    MILESTONE(Map.of(
            Status.NONE, EnumSet.of(Status.PENDING),
            // resubmission replaces the evidence of a pending milestone
            Status.PENDING, EnumSet.of(Status.PENDING, Status.ACCEPTED, Status.REJECTED),
            Status.REJECTED, EnumSet.of(Status.PENDING)
    ));

    private final Map<Status, Set<Status>> allowedTransitions;

    StatusTransitions(Map<Status, Set<Status>> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean isTransitionAllowed(Status fromStatus, Status toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<Status> allowedTargets = allowedTransitions.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed for this entity
     */
    public void validateTransition(Status fromStatus, Status toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid %s status transition: %s → %s. Allowed transitions from %s: %s",
                            name(), fromStatus, toStatus, fromStatus,
                            allowedTransitions.getOrDefault(fromStatus, Set.of())));
        }
    }

    public Set<Status> getAllowedTransitions(Status fromStatus) {
        return allowedTransitions.getOrDefault(fromStatus, Set.of());
    }
}
