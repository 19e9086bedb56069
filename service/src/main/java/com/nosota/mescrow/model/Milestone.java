package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.Status;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A percentage share of a recipient's grant, released once participants accept it.
 *
 * <p>Percentage and metadata are fixed once the plan is accepted; only evidence, status
 * and the allocated amount change afterwards.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Milestone {

    /**
     * Share of the grant, scaled by {@code FixedPoint.SCALE}.
     */
    private long percentage;

    private String metadata;

    /**
     * Evidence of the last submission. Null until the milestone is submitted.
     */
    private String evidence;

    private Status status = Status.NONE;

    /**
     * Amount allocated when the milestone was accepted. Zero before that.
     */
    private long allocatedAmount;

    public Milestone(long percentage, String metadata) {
        this.percentage = percentage;
        this.metadata = metadata;
    }

    public Milestone copy() {
        return new Milestone(percentage, metadata, evidence, status, allocatedAmount);
    }
}
