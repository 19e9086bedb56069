package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.EscrowException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Offer and vote-in of a recipient's milestone plan.
 *
 * <p>A new offer replaces the one in flight and opens a fresh round in which the
 * proposer has already voted for it. The plan only becomes binding if its shares add up
 * to exactly one whole unit; that check runs before anything is recorded, so a plan that
 * does not add up makes the crossing vote fail as a whole.
 */
@Slf4j
class MilestoneOfferWorkflow {

    private final EscrowContext context;
    private final Map<String, VoteTally> tallies = new HashMap<>();

    MilestoneOfferWorkflow(EscrowContext context) {
        this.context = context;
    }

    void offer(String caller, String recipientId, List<Milestone> milestones) throws EscrowException {
        context.stateMachine().requireActive("offer milestones");
        Recipient recipient = context.requireAcceptedRecipient(recipientId);

        boolean participant = context.isParticipant(caller);
        if (!participant && !context.isExecutorOf(caller, recipient)) {
            throw new AuthorizationException(caller + " cannot offer milestones for " + recipientId);
        }
        if (recipient.getMilestoneReviewStatus() == Status.ACCEPTED) {
            throw new EscrowStateException("Milestones of " + recipientId + " are already accepted");
        }
        List<Milestone> offered = validateOffer(milestones);

        long weight = context.registry().weightOf(caller);
        long threshold = context.threshold(context.settings().milestoneOfferThreshold());
        if (VoteTally.previewFreshVote(true, weight, threshold).orElse(null) == ThresholdOutcome.ACCEPTED) {
            requireWholeUnit(recipientId, offered);
        }

        VoteTally tally = tallies.computeIfAbsent(recipientId, k -> new VoteTally());
        tally.reset();
        recipient.setOfferedMilestones(offered);
        recipient.setOfferedBy(caller);

        log.info("Milestones offered: projectId={}, recipientId={}, count={}, by={}",
                context.projectId(), recipientId, offered.size(), caller);
        context.emit(new EscrowEvent(context.projectId(), EscrowEventType.MILESTONES_OFFERED,
                recipientId, null, Status.PENDING, null, caller));

        tally.castVote(caller, true, weight);
        resolve(recipient, tally);
    }

    void review(String caller, String recipientId, Status status) throws EscrowException {
        context.stateMachine().requireActive("review offered milestones");
        context.requireParticipant(caller);
        EscrowContext.requireVoteStatus(status);

        Recipient recipient = context.requireAcceptedRecipient(recipientId);
        if (recipient.getMilestoneReviewStatus() == Status.ACCEPTED) {
            throw new EscrowStateException("Milestones of " + recipientId + " are already accepted");
        }
        if (recipient.getOfferedMilestones().isEmpty()) {
            throw new EscrowStateException("No milestones offered for " + recipientId);
        }

        VoteTally tally = tallies.computeIfAbsent(recipientId, k -> new VoteTally());
        boolean support = status == Status.ACCEPTED;
        long weight = context.registry().weightOf(caller);
        long threshold = context.threshold(context.settings().milestoneOfferThreshold());
        if (!tally.hasVoted(caller)
                && tally.previewVote(support, weight, threshold).orElse(null) == ThresholdOutcome.ACCEPTED) {
            requireWholeUnit(recipientId, recipient.getOfferedMilestones());
        }

        tally.castVote(caller, support, weight);
        log.debug("Milestone plan vote: projectId={}, recipientId={}, voter={}, status={}, for={}, against={}",
                context.projectId(), recipientId, caller, status, tally.getVotesFor(), tally.getVotesAgainst());
        resolve(recipient, tally);
    }

    /**
     * Drops the in-flight offer round of a removed recipient.
     */
    void discard(String recipientId) {
        VoteTally tally = tallies.get(recipientId);
        if (tally != null) {
            tally.reset();
        }
    }

    private void resolve(Recipient recipient, VoteTally tally) {
        Optional<ThresholdOutcome> outcome = tally.crossedThreshold(
                context.threshold(context.settings().milestoneOfferThreshold()));
        if (outcome.isEmpty()) {
            return;
        }
        tally.reset();

        String recipientId = recipient.getId();
        if (outcome.get() == ThresholdOutcome.ACCEPTED) {
            StatusTransitions.MILESTONE_PLAN.validateTransition(recipient.getMilestoneReviewStatus(), Status.ACCEPTED);
            recipient.setMilestones(recipient.getOfferedMilestones());
            recipient.setOfferedMilestones(new ArrayList<>());
            recipient.setOfferedBy(null);
            recipient.setMilestoneReviewStatus(Status.ACCEPTED);
            recipient.setNextMilestone(0);

            log.info("Milestones accepted: projectId={}, recipientId={}, count={}",
                    context.projectId(), recipientId, recipient.getMilestones().size());
            context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.MILESTONES_REVIEWED,
                    recipientId, Status.ACCEPTED));
            context.emit(new EscrowEvent(context.projectId(), EscrowEventType.MILESTONES_SET, recipientId,
                    null, Status.ACCEPTED, null, String.valueOf(recipient.getMilestones().size())));
        } else {
            recipient.setOfferedMilestones(new ArrayList<>());
            recipient.setOfferedBy(null);

            log.info("Milestone offer rejected: projectId={}, recipientId={}", context.projectId(), recipientId);
            context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.MILESTONES_REVIEWED,
                    recipientId, Status.REJECTED));
            context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.OFFERED_MILESTONES_RESET,
                    recipientId, recipient.getMilestoneReviewStatus()));
        }
    }

    private static List<Milestone> validateOffer(List<Milestone> milestones) throws EscrowValidationException {
        if (milestones == null || milestones.isEmpty()) {
            throw new EscrowValidationException("At least one milestone is required");
        }
        List<Milestone> offered = new ArrayList<>(milestones.size());
        for (int i = 0; i < milestones.size(); i++) {
            Milestone milestone = milestones.get(i);
            if (milestone == null || milestone.getPercentage() <= 0) {
                throw new EscrowValidationException("Milestone " + i + " must have a positive percentage");
            }
            offered.add(new Milestone(milestone.getPercentage(), milestone.getMetadata()));
        }
        return offered;
    }

    private static void requireWholeUnit(String recipientId, List<Milestone> milestones)
            throws EscrowValidationException {
        long total = 0;
        for (Milestone milestone : milestones) {
            if (total > FixedPoint.SCALE - milestone.getPercentage()) {
                total = Long.MAX_VALUE;
                break;
            }
            total += milestone.getPercentage();
        }
        if (total != FixedPoint.SCALE) {
            throw new EscrowValidationException(
                    String.format("Milestone percentages of %s add up to %d, expected %d",
                            recipientId, total, FixedPoint.SCALE));
        }
    }
}
