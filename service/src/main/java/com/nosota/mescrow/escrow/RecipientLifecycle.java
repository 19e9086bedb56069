package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.CapacityExceededException;
import com.nosota.mescrow.error.EscrowException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.external.Profile;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candidate → accepted/rejected lifecycle of recipients, decided by participant vote.
 *
 * <p>One tally per recipient ID. An accepted recipient gets the grant amount and the
 * executor capability; a rejected one is removed and loses the capability.
 */
@Slf4j
class RecipientLifecycle {

    private final EscrowContext context;
    private final Map<String, VoteTally> tallies = new HashMap<>();

    RecipientLifecycle(EscrowContext context) {
        this.context = context;
    }

    /**
     * Stores a recipient candidate. Registration alone does not vote.
     */
    void register(String caller, RecipientRegistration registration) throws EscrowException {
        context.stateMachine().requireActive("register recipient");

        String recipientId = registration.recipientId();
        if (recipientId == null || recipientId.isBlank()) {
            throw new EscrowValidationException("Recipient ID is required");
        }
        authorizeRegistration(caller, registration);

        Recipient recipient = context.recipient(recipientId);
        if (recipient != null && recipient.getStatus() == Status.ACCEPTED) {
            throw new EscrowStateException("Recipient " + recipientId + " is already accepted");
        }

        boolean created = recipient == null;
        if (created) {
            recipient = new Recipient(recipientId);
        }
        if (registration.recipientAddress() != null && !registration.recipientAddress().isBlank()) {
            recipient.setRecipientAddress(registration.recipientAddress());
        }
        recipient.setUseRegistryAnchor(registration.useRegistryAnchor());
        recipient.setMetadata(registration.metadata());

        if (created) {
            markPending(recipient);
        }
        log.info("Recipient registered: projectId={}, recipientId={}, address={}, by={}",
                context.projectId(), recipientId, recipient.getRecipientAddress(), caller);
    }

    /**
     * Casts the caller's vote to accept or reject a recipient.
     */
    void review(String caller, String recipientId, Status status) throws EscrowException {
        context.stateMachine().requireActive("review recipient");
        context.requireParticipant(caller);
        EscrowContext.requireVoteStatus(status);

        Recipient recipient = context.recipient(recipientId);
        Status current = recipient == null ? Status.NONE : recipient.getStatus();
        boolean support = status == Status.ACCEPTED;
        if (support) {
            if (current == Status.ACCEPTED) {
                throw new EscrowStateException("Recipient " + recipientId + " is already accepted");
            }
            if (context.getAcceptedRecipientCount() >= context.settings().maxRecipients()) {
                throw new CapacityExceededException(
                        String.format("Max recipients reached (%d)", context.settings().maxRecipients()));
            }
        }

        VoteTally tally = tallies.computeIfAbsent(recipientId, k -> new VoteTally());
        long weight = context.registry().weightOf(caller);
        tally.castVote(caller, support, weight);
        log.debug("Recipient vote: projectId={}, recipientId={}, voter={}, status={}, weight={}, for={}, against={}",
                context.projectId(), recipientId, caller, status, weight, tally.getVotesFor(), tally.getVotesAgainst());

        if (recipient == null && support) {
            recipient = new Recipient(recipientId);
            markPending(recipient);
        }

        Optional<ThresholdOutcome> outcome = tally.crossedThreshold(
                context.threshold(context.settings().recipientThreshold()));
        if (outcome.isEmpty()) {
            return;
        }
        tally.reset();
        if (outcome.get() == ThresholdOutcome.ACCEPTED) {
            accept(recipient);
        } else {
            reject(recipientId, recipient);
        }
    }

    private void authorizeRegistration(String caller, RecipientRegistration registration)
            throws AuthorizationException {
        if (registration.useRegistryAnchor()) {
            Profile profile = context.profileDirectory().getProfileByAnchor(registration.recipientId())
                    .orElseThrow(() -> new AuthorizationException(
                            "No profile registered for anchor " + registration.recipientId()));
            if (!context.profileDirectory().isOwnerOrMember(profile.id(), caller)) {
                throw new AuthorizationException(
                        String.format("%s is neither owner nor member of profile %s", caller, profile.id()));
            }
            return;
        }
        if (!registration.recipientId().equals(caller) && !context.isParticipant(caller)) {
            throw new AuthorizationException(caller + " cannot register recipient " + registration.recipientId());
        }
    }

    private void markPending(Recipient recipient) {
        StatusTransitions.RECIPIENT.validateTransition(recipient.getStatus(), Status.PENDING);
        recipient.setStatus(Status.PENDING);
        context.putRecipient(recipient);
        context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.RECIPIENT_STATUS_CHANGED,
                recipient.getId(), Status.PENDING));
    }

    private void accept(Recipient recipient) {
        StatusTransitions.RECIPIENT.validateTransition(recipient.getStatus(), Status.ACCEPTED);
        recipient.setStatus(Status.ACCEPTED);
        recipient.setGrantAmount(context.getCurrentSupply());
        context.incrementAcceptedRecipients();

        log.info("Recipient accepted: projectId={}, recipientId={}, grantAmount={}",
                context.projectId(), recipient.getId(), recipient.getGrantAmount());
        context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.RECIPIENT_STATUS_CHANGED,
                recipient.getId(), Status.ACCEPTED));

        // external call last: state above is already committed
        String executorCapability = context.settings().executorCapability();
        if (!context.oracle().hasCapability(recipient.getRecipientAddress(), executorCapability)) {
            context.oracle().grantCapability(executorCapability, recipient.getRecipientAddress());
        }
    }

    private void reject(String recipientId, Recipient recipient) {
        String address = recipient == null ? recipientId : recipient.getRecipientAddress();
        if (recipient != null) {
            if (recipient.getStatus() == Status.ACCEPTED) {
                context.decrementAcceptedRecipients();
                releaseUnpaidAllocations(recipient);
            }
            context.removeRecipient(recipientId);
        }

        log.info("Recipient rejected: projectId={}, recipientId={}", context.projectId(), recipientId);
        context.emit(EscrowEvent.recipient(context.projectId(), EscrowEventType.RECIPIENT_STATUS_CHANGED,
                recipientId, Status.REJECTED));

        String executorCapability = context.settings().executorCapability();
        if (context.oracle().hasCapability(address, executorCapability)) {
            context.oracle().setCapabilityStatus(executorCapability, address, false);
        }
    }

    /**
     * Milestones accepted ahead of the next-due one hold an allocation that a removed
     * recipient can no longer be paid.
     */
    private void releaseUnpaidAllocations(Recipient recipient) {
        List<Milestone> milestones = recipient.getMilestones();
        long released = 0;
        for (int i = recipient.getNextMilestone(); i < milestones.size(); i++) {
            Milestone milestone = milestones.get(i);
            if (milestone.getStatus() == Status.ACCEPTED && milestone.getAllocatedAmount() > 0) {
                released += milestone.getAllocatedAmount();
                milestone.setAllocatedAmount(0);
            }
        }
        if (released > 0) {
            context.releaseAllocation(released);
            log.info("Released unpaid allocation of {}: projectId={}, recipientId={}",
                    released, context.projectId(), recipient.getId());
        }
    }
}
