package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;

import java.util.UUID;

/**
 * Event emitted by an escrow instance.
 *
 * @param projectId      Project the escrow belongs to
 * @param type           Event type
 * @param recipientId    Recipient concerned, null for project-wide events
 * @param milestoneIndex Milestone concerned, null if not milestone related
 * @param status         Status carried by the event
 * @param amount         Amount moved or allocated, null if none
 * @param detail         Evidence, voter or transfer destination
 */
public record EscrowEvent(
        UUID projectId,
        EscrowEventType type,
        String recipientId,
        Integer milestoneIndex,
        Status status,
        Long amount,
        String detail
) {

    static EscrowEvent recipient(UUID projectId, EscrowEventType type, String recipientId, Status status) {
        return new EscrowEvent(projectId, type, recipientId, null, status, null, null);
    }

    static EscrowEvent milestone(UUID projectId, EscrowEventType type, String recipientId, int milestoneIndex,
                                 Status status, String detail) {
        return new EscrowEvent(projectId, type, recipientId, milestoneIndex, status, null, detail);
    }

    static EscrowEvent project(UUID projectId, EscrowEventType type) {
        return new EscrowEvent(projectId, type, null, null, null, null, null);
    }
}
