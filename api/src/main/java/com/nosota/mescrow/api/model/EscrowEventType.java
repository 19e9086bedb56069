package com.nosota.mescrow.api.model;

/**
 * Observable events emitted by an escrow instance.
 */
public enum EscrowEventType {
    RECIPIENT_STATUS_CHANGED,
    MILESTONES_OFFERED,
    MILESTONES_REVIEWED,
    OFFERED_MILESTONES_RESET,
    MILESTONES_SET,
    MILESTONE_SUBMITTED,
    SUBMITTED_MILESTONE_REVIEWED,
    MILESTONE_STATUS_CHANGED,
    ALLOCATED,
    DISTRIBUTED,
    PROJECT_REJECTED,
    PROJECT_REJECT_DECLINED
}
