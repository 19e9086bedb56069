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
 * Submission, review and payout of milestones.
 *
 * <p>Acceptance of a milestone allocates its share of the grant and then distributes.
 * Distribution always starts at the recipient's next-due milestone and stops at the first
 * one that is not accepted yet, so payouts happen strictly in plan order even when
 * later milestones are accepted first.
 *
 * <p>Transfers are issued only after every status change, tally reset and pointer
 * advance of the operation is in place.
 */
@Slf4j
class MilestoneSubmissionWorkflow {

    private record MilestoneKey(String recipientId, int milestoneIndex) {
    }

    private final EscrowContext context;
    private final Map<MilestoneKey, VoteTally> tallies = new HashMap<>();

    MilestoneSubmissionWorkflow(EscrowContext context) {
        this.context = context;
    }

    void submit(String caller, String recipientId, int milestoneIndex, String evidence) throws EscrowException {
        context.stateMachine().requireActive("submit milestone");
        Recipient recipient = context.requireAcceptedRecipient(recipientId);

        boolean participant = context.isParticipant(caller);
        if (!participant && !context.isExecutorOf(caller, recipient)) {
            throw new AuthorizationException(caller + " cannot submit milestones for " + recipientId);
        }
        Milestone milestone = milestoneAt(recipient, milestoneIndex);
        if (milestone.getStatus() == Status.ACCEPTED) {
            throw new EscrowStateException(
                    String.format("Milestone %d of %s is already accepted", milestoneIndex, recipientId));
        }

        long weight = participant ? context.registry().weightOf(caller) : 0;
        long threshold = context.threshold(context.settings().milestoneSubmissionThreshold());
        if (participant
                && VoteTally.previewFreshVote(true, weight, threshold).orElse(null) == ThresholdOutcome.ACCEPTED) {
            context.checkAllocation(payoutOf(recipient, milestone));
        }

        VoteTally tally = tallies.computeIfAbsent(new MilestoneKey(recipientId, milestoneIndex), k -> new VoteTally());
        tally.reset();
        StatusTransitions.MILESTONE.validateTransition(milestone.getStatus(), Status.PENDING);
        milestone.setEvidence(evidence);
        milestone.setStatus(Status.PENDING);

        log.info("Milestone submitted: projectId={}, recipientId={}, milestoneIndex={}, by={}",
                context.projectId(), recipientId, milestoneIndex, caller);
        context.emit(EscrowEvent.milestone(context.projectId(), EscrowEventType.MILESTONE_SUBMITTED,
                recipientId, milestoneIndex, Status.PENDING, evidence));
        context.emit(EscrowEvent.milestone(context.projectId(), EscrowEventType.MILESTONE_STATUS_CHANGED,
                recipientId, milestoneIndex, Status.PENDING, null));

        if (participant) {
            tally.castVote(caller, true, weight);
            resolve(recipient, milestoneIndex, tally);
        }
    }

    void review(String caller, String recipientId, int milestoneIndex, Status status) throws EscrowException {
        context.stateMachine().requireActive("review submitted milestone");
        context.requireParticipant(caller);
        EscrowContext.requireVoteStatus(status);

        Recipient recipient = context.requireAcceptedRecipient(recipientId);
        Milestone milestone = milestoneAt(recipient, milestoneIndex);
        if (milestone.getStatus() != Status.PENDING) {
            throw new EscrowStateException(String.format("Milestone %d of %s is %s, expected %s",
                    milestoneIndex, recipientId, milestone.getStatus(), Status.PENDING));
        }

        VoteTally tally = tallies.computeIfAbsent(new MilestoneKey(recipientId, milestoneIndex), k -> new VoteTally());
        boolean support = status == Status.ACCEPTED;
        long weight = context.registry().weightOf(caller);
        long threshold = context.threshold(context.settings().milestoneSubmissionThreshold());
        if (!tally.hasVoted(caller)
                && tally.previewVote(support, weight, threshold).orElse(null) == ThresholdOutcome.ACCEPTED) {
            context.checkAllocation(payoutOf(recipient, milestone));
        }

        tally.castVote(caller, support, weight);
        log.debug("Milestone vote: projectId={}, recipientId={}, milestoneIndex={}, voter={}, status={}, for={}, against={}",
                context.projectId(), recipientId, milestoneIndex, caller, status,
                tally.getVotesFor(), tally.getVotesAgainst());
        context.emit(EscrowEvent.milestone(context.projectId(), EscrowEventType.SUBMITTED_MILESTONE_REVIEWED,
                recipientId, milestoneIndex, status, caller));

        resolve(recipient, milestoneIndex, tally);
    }

    /**
     * Drops the submission rounds of a removed recipient.
     */
    void discard(String recipientId) {
        tallies.keySet().removeIf(key -> key.recipientId().equals(recipientId));
    }

    private void resolve(Recipient recipient, int milestoneIndex, VoteTally tally) {
        Optional<ThresholdOutcome> outcome = tally.crossedThreshold(
                context.threshold(context.settings().milestoneSubmissionThreshold()));
        if (outcome.isEmpty()) {
            return;
        }
        tally.reset();

        Milestone milestone = recipient.getMilestones().get(milestoneIndex);
        Status target = outcome.get() == ThresholdOutcome.ACCEPTED ? Status.ACCEPTED : Status.REJECTED;
        StatusTransitions.MILESTONE.validateTransition(milestone.getStatus(), target);
        milestone.setStatus(target);

        log.info("Milestone {}: projectId={}, recipientId={}, milestoneIndex={}",
                target, context.projectId(), recipient.getId(), milestoneIndex);
        context.emit(EscrowEvent.milestone(context.projectId(), EscrowEventType.MILESTONE_STATUS_CHANGED,
                recipient.getId(), milestoneIndex, target, null));

        if (target == Status.ACCEPTED) {
            allocate(recipient, milestoneIndex, milestone);
            List<Payout> payouts = distribute(recipient);
            context.transfer(payouts);
        }
    }

    /**
     * Reserves the milestone's share of the grant. Capacity was checked before the vote was recorded.
     */
    private void allocate(Recipient recipient, int milestoneIndex, Milestone milestone) {
        long amount = payoutOf(recipient, milestone);
        milestone.setAllocatedAmount(amount);
        context.addAllocation(amount);

        log.info("Allocated {} to recipientId={}, milestoneIndex={}", amount, recipient.getId(), milestoneIndex);
        context.emit(new EscrowEvent(context.projectId(), EscrowEventType.ALLOCATED, recipient.getId(),
                milestoneIndex, Status.ACCEPTED, amount, recipient.getRecipientAddress()));
    }

    /**
     * Settles accepted milestones from the next-due pointer onwards and returns the transfers to issue.
     * Finishing the last milestone executes the strategy.
     */
    private List<Payout> distribute(Recipient recipient) {
        List<Payout> payouts = new ArrayList<>();
        List<Milestone> milestones = recipient.getMilestones();
        while (recipient.getNextMilestone() < milestones.size()) {
            int index = recipient.getNextMilestone();
            Milestone due = milestones.get(index);
            if (due.getStatus() != Status.ACCEPTED) {
                break;
            }
            long amount = due.getAllocatedAmount();
            context.settleAllocation(amount);
            recipient.setNextMilestone(index + 1);
            payouts.add(new Payout(recipient.getId(), index, recipient.getRecipientAddress(), amount));
        }

        if (!payouts.isEmpty() && recipient.getNextMilestone() == milestones.size()) {
            context.stateMachine().execute();
            context.deactivatePool();
            log.info("All milestones of {} paid, escrow {} executed", recipient.getId(), context.projectId());
        }
        return payouts;
    }

    private static long payoutOf(Recipient recipient, Milestone milestone) {
        return FixedPoint.mulDiv(recipient.getGrantAmount(), milestone.getPercentage(), FixedPoint.SCALE);
    }

    private static Milestone milestoneAt(Recipient recipient, int milestoneIndex) throws EscrowValidationException {
        List<Milestone> milestones = recipient.getMilestones();
        if (milestoneIndex < 0 || milestoneIndex >= milestones.size()) {
            throw new EscrowValidationException(String.format("Milestone index %d out of bounds for %s (%d milestones)",
                    milestoneIndex, recipient.getId(), milestones.size()));
        }
        return milestones.get(milestoneIndex);
    }
}
