package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Journal entry of an escrow event.
 *
 * @param id             Sequence number of the entry
 * @param projectId      Project the event belongs to
 * @param type           Event type
 * @param recipientId    Recipient concerned (null for project-wide events)
 * @param milestoneIndex Milestone concerned (null if not milestone related)
 * @param status         Status carried by the event
 * @param amount         Amount moved or allocated (null if none)
 * @param detail         Free-form detail such as evidence or the voter
 * @param createdAt      When the event was recorded
 */
public record EscrowEventResponse(
        Long id,
        UUID projectId,
        EscrowEventType type,
        String recipientId,
        Integer milestoneIndex,
        Status status,
        Long amount,
        String detail,
        LocalDateTime createdAt
) {
}
