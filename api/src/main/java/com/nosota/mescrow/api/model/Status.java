package com.nosota.mescrow.api.model;

/**
 * Lifecycle status shared by recipients, milestone plans and milestones.
 *
 * <p>The enum itself does not restrict which values an entity may move between.
 * Each entity validates its own transitions in the service layer, so for example a
 * milestone can never become {@link #APPEALED} even though the value exists here.
 */
public enum Status {
    /**
     * NONE: Nothing has been proposed yet. Also the status of a cleared record.
     */
    NONE,

    /**
     * PENDING: Proposed or submitted, waiting for participant votes.
     */
    PENDING,

    /**
     * ACCEPTED: The accept side of the vote crossed the threshold.
     */
    ACCEPTED,

    /**
     * REJECTED: The reject side of the vote crossed the threshold.
     */
    REJECTED,

    /**
     * APPEALED: Reserved for appeal flows. Not produced by the escrow voting workflows.
     */
    APPEALED,

    /**
     * IN_REVIEW: Reserved for manual review flows. Not produced by the escrow voting workflows.
     */
    IN_REVIEW,

    /**
     * CANCELED: Reserved for cancellations. Not produced by the escrow voting workflows.
     */
    CANCELED
}
