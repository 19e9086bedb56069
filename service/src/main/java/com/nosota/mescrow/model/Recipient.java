package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.Status;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Party proposed to receive, and later execute, the project's grant.
 *
 * <p>Recipient workflow:
 * <pre>
 * 1. Candidate registered or first voted on → PENDING
 * 2. Recipient vote passes → ACCEPTED (grant amount fixed, executor capability granted)
 * 3. Milestone plan offered and voted in → milestoneReviewStatus ACCEPTED
 * 4. Milestones submitted, accepted and paid in order → nextMilestone advances
 * </pre>
 * A passed rejection vote removes the record entirely.
 */
@Getter
@Setter
@NoArgsConstructor
public class Recipient {

    private String id;

    /**
     * Payout destination. Defaults to the recipient ID.
     */
    private String recipientAddress;

    /**
     * Whether {@link #id} is a profile anchor acted on by profile owners or members.
     */
    private boolean useRegistryAnchor;

    private String metadata;

    private Status status = Status.NONE;

    private Status milestoneReviewStatus = Status.NONE;

    private long grantAmount;

    /**
     * Binding milestones. Replaced only when an offered plan is accepted.
     */
    private List<Milestone> milestones = new ArrayList<>();

    /**
     * Plan currently under vote. Empty when no offer is in flight.
     */
    private List<Milestone> offeredMilestones = new ArrayList<>();

    private String offeredBy;

    /**
     * Index of the next milestone due for payout.
     */
    private int nextMilestone;

    public Recipient(String id) {
        this.id = id;
        this.recipientAddress = id;
    }

    /**
     * Detached copy, so callers cannot change escrow state through a returned recipient.
     */
    public Recipient copy() {
        Recipient copy = new Recipient(id);
        copy.setRecipientAddress(recipientAddress);
        copy.setUseRegistryAnchor(useRegistryAnchor);
        copy.setMetadata(metadata);
        copy.setStatus(status);
        copy.setMilestoneReviewStatus(milestoneReviewStatus);
        copy.setGrantAmount(grantAmount);
        copy.setMilestones(copyOf(milestones));
        copy.setOfferedMilestones(copyOf(offeredMilestones));
        copy.setOfferedBy(offeredBy);
        copy.setNextMilestone(nextMilestone);
        return copy;
    }

    public static List<Milestone> copyOf(List<Milestone> milestones) {
        List<Milestone> copies = new ArrayList<>(milestones.size());
        for (Milestone milestone : milestones) {
            copies.add(milestone.copy());
        }
        return copies;
    }
}
