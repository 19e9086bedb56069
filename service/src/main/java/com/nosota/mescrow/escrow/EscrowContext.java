package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.api.model.StrategyState;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.CapacityExceededException;
import com.nosota.mescrow.error.EscrowException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.external.AuthorizationOracle;
import com.nosota.mescrow.external.PoolInfo;
import com.nosota.mescrow.external.PoolLedger;
import com.nosota.mescrow.external.ProfileDirectory;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Escrow of one project: voting power, recipients, vote tallies and pool accounting.
 *
 * <p>Each project gets its own context; contexts share nothing but the external
 * collaborators. Public operations are serialized on the context. An operation that throws
 * {@link EscrowException} has changed nothing: every check, including whether the vote
 * being cast would cross a threshold into a failing effect, runs before the first mutation.
 *
 * <p>Ordering rule for every accept path: status transitions, tally resets and pointer
 * advances are committed first, transfers through the {@link PoolLedger} are issued last.
 * A ledger calling back into the context therefore sees the post-transition state and
 * cannot trigger the same payout twice.
 *
 * <p>Events are buffered while an operation runs and handed to the {@link EscrowEventListener}
 * once the outermost operation has finished, so a failing listener never interrupts a transition.
 */
@Slf4j
public class EscrowContext {

    private final EscrowSettings settings;
    private final VotingPowerRegistry registry;
    private final AuthorizationOracle oracle;
    private final PoolLedger ledger;
    private final ProfileDirectory profileDirectory;
    private final EscrowEventListener listener;

    private final StrategyStateMachine stateMachine = new StrategyStateMachine();
    private final Map<String, Recipient> recipients = new LinkedHashMap<>();
    private final List<EscrowEvent> pendingEvents = new ArrayList<>();

    private final RecipientLifecycle recipientLifecycle;
    private final MilestoneOfferWorkflow milestoneOfferWorkflow;
    private final MilestoneSubmissionWorkflow milestoneSubmissionWorkflow;
    private final ProjectAbortVote projectAbortVote;

    private int acceptedRecipientCount;
    private long currentSupply;
    private long allocatedAmount;
    private boolean poolActive;
    private int operationDepth;

    private EscrowContext(EscrowSettings settings, VotingPowerRegistry registry, AuthorizationOracle oracle,
                          PoolLedger ledger, ProfileDirectory profileDirectory, EscrowEventListener listener) {
        this.settings = settings;
        this.registry = registry;
        this.oracle = oracle;
        this.ledger = ledger;
        this.profileDirectory = profileDirectory;
        this.listener = listener;
        this.recipientLifecycle = new RecipientLifecycle(this);
        this.milestoneOfferWorkflow = new MilestoneOfferWorkflow(this);
        this.milestoneSubmissionWorkflow = new MilestoneSubmissionWorkflow(this);
        this.projectAbortVote = new ProjectAbortVote(this);
    }

    /**
     * Creates an ACTIVE escrow from aggregated contributions.
     *
     * @param contributions Contributed amount per participant; normalized into voting weights
     * @throws EscrowValidationException if the contributions cannot be normalized
     */
    public static EscrowContext open(EscrowSettings settings, Map<String, Long> contributions,
                                     AuthorizationOracle oracle, PoolLedger ledger,
                                     ProfileDirectory profileDirectory, EscrowEventListener listener)
            throws EscrowValidationException {
        VotingPowerRegistry registry = VotingPowerRegistry.normalize(contributions);
        EscrowContext context = new EscrowContext(settings, registry, oracle, ledger, profileDirectory,
                listener == null ? EscrowEventListener.NONE : listener);
        context.currentSupply = registry.totalContribution();
        context.poolActive = true;
        context.stateMachine.activate();

        log.info("Escrow opened: projectId={}, poolId={}, participants={}, totalContribution={}",
                settings.projectId(), settings.poolId(), registry.participants().size(),
                registry.totalContribution());
        return context;
    }

    // ==================== Operations ====================

    public synchronized void registerRecipient(String caller, RecipientRegistration registration)
            throws EscrowException {
        perform(() -> recipientLifecycle.register(caller, registration));
    }

    public synchronized void reviewRecipient(String caller, String recipientId, Status status)
            throws EscrowException {
        perform(() -> recipientLifecycle.review(caller, recipientId, status));
    }

    public synchronized void offerMilestones(String caller, String recipientId, List<Milestone> milestones)
            throws EscrowException {
        perform(() -> milestoneOfferWorkflow.offer(caller, recipientId, milestones));
    }

    public synchronized void reviewOfferedMilestones(String caller, String recipientId, Status status)
            throws EscrowException {
        perform(() -> milestoneOfferWorkflow.review(caller, recipientId, status));
    }

    public synchronized void submitMilestone(String caller, String recipientId, int milestoneIndex,
                                             String evidence) throws EscrowException {
        perform(() -> milestoneSubmissionWorkflow.submit(caller, recipientId, milestoneIndex, evidence));
    }

    public synchronized void reviewSubmittedMilestone(String caller, String recipientId, int milestoneIndex,
                                                      Status status) throws EscrowException {
        perform(() -> milestoneSubmissionWorkflow.review(caller, recipientId, milestoneIndex, status));
    }

    public synchronized void rejectProject(String caller, Status status) throws EscrowException {
        perform(() -> projectAbortVote.vote(caller, status));
    }

    @FunctionalInterface
    private interface Operation {
        void run() throws EscrowException;
    }

    private void perform(Operation operation) throws EscrowException {
        operationDepth++;
        Exception failure = null;
        try {
            operation.run();
        } catch (EscrowException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            operationDepth--;
            if (operationDepth == 0) {
                publishPending(failure);
            }
        }
    }

    /**
     * Delivers the buffered events. Every event is offered to the listener even if an earlier
     * delivery failed; the first listener failure is rethrown unless the operation itself failed,
     * in which case it is attached to that failure as suppressed.
     */
    private void publishPending(Exception operationFailure) {
        if (pendingEvents.isEmpty()) {
            return;
        }
        List<EscrowEvent> batch = new ArrayList<>(pendingEvents);
        pendingEvents.clear();

        RuntimeException listenerFailure = null;
        for (EscrowEvent event : batch) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed: projectId={}, type={}, recipientId={}, milestoneIndex={}",
                        settings.projectId(), event.type(), event.recipientId(), event.milestoneIndex(), e);
                if (listenerFailure == null) {
                    listenerFailure = e;
                } else {
                    listenerFailure.addSuppressed(e);
                }
            }
        }
        if (listenerFailure == null) {
            return;
        }
        if (operationFailure != null) {
            operationFailure.addSuppressed(listenerFailure);
            return;
        }
        throw listenerFailure;
    }

    // ==================== Queries ====================

    /**
     * Detached copy of a recipient. Unknown or rejected recipients come back empty with status NONE.
     */
    public synchronized Recipient getRecipient(String recipientId) {
        Recipient recipient = recipients.get(recipientId);
        return recipient == null ? new Recipient(recipientId) : recipient.copy();
    }

    public synchronized Status getRecipientStatus(String recipientId) {
        Recipient recipient = recipients.get(recipientId);
        return recipient == null ? Status.NONE : recipient.getStatus();
    }

    public synchronized List<Milestone> getMilestones(String recipientId) {
        Recipient recipient = recipients.get(recipientId);
        return recipient == null ? List.of() : Recipient.copyOf(recipient.getMilestones());
    }

    public synchronized Status getMilestoneStatus(String recipientId, int milestoneIndex) {
        Recipient recipient = recipients.get(recipientId);
        if (recipient == null || milestoneIndex < 0 || milestoneIndex >= recipient.getMilestones().size()) {
            return Status.NONE;
        }
        return recipient.getMilestones().get(milestoneIndex).getStatus();
    }

    public synchronized StrategyState getStrategyState() {
        return stateMachine.getState();
    }

    /**
     * True once the escrow is EXECUTED or REJECTED.
     */
    public synchronized boolean isFinished() {
        return stateMachine.isFinalState();
    }

    public synchronized boolean isPoolActive() {
        return poolActive;
    }

    public synchronized long getCurrentSupply() {
        return currentSupply;
    }

    public synchronized long getAllocatedAmount() {
        return allocatedAmount;
    }

    public synchronized int getAcceptedRecipientCount() {
        return acceptedRecipientCount;
    }

    public long getTotalSupply() {
        return registry.totalSupply();
    }

    public long getVotingPower(String participant) {
        return registry.weightOf(participant);
    }

    public UUID getProjectId() {
        return settings.projectId();
    }

    public EscrowSettings getSettings() {
        return settings;
    }

    // ==================== Workflow support ====================

    EscrowSettings settings() {
        return settings;
    }

    VotingPowerRegistry registry() {
        return registry;
    }

    StrategyStateMachine stateMachine() {
        return stateMachine;
    }

    AuthorizationOracle oracle() {
        return oracle;
    }

    ProfileDirectory profileDirectory() {
        return profileDirectory;
    }

    UUID projectId() {
        return settings.projectId();
    }

    Recipient recipient(String recipientId) {
        return recipients.get(recipientId);
    }

    void putRecipient(Recipient recipient) {
        recipients.put(recipient.getId(), recipient);
    }

    void removeRecipient(String recipientId) {
        recipients.remove(recipientId);
        milestoneOfferWorkflow.discard(recipientId);
        milestoneSubmissionWorkflow.discard(recipientId);
    }

    Recipient requireAcceptedRecipient(String recipientId) throws EscrowStateException {
        Recipient recipient = recipients.get(recipientId);
        if (recipient == null || recipient.getStatus() != Status.ACCEPTED) {
            throw new EscrowStateException(String.format("Recipient %s is %s, expected %s", recipientId,
                    recipient == null ? Status.NONE : recipient.getStatus(), Status.ACCEPTED));
        }
        return recipient;
    }

    boolean isParticipant(String caller) {
        return oracle.hasCapability(caller, settings.participantCapability());
    }

    void requireParticipant(String caller) throws AuthorizationException {
        if (!isParticipant(caller)) {
            throw new AuthorizationException(caller + " does not hold the participant capability");
        }
    }

    boolean isExecutorOf(String caller, Recipient recipient) {
        if (caller == null || !oracle.hasCapability(caller, settings.executorCapability())) {
            return false;
        }
        return caller.equals(recipient.getRecipientAddress()) || caller.equals(recipient.getId());
    }

    static void requireVoteStatus(Status status) throws EscrowValidationException {
        if (status != Status.ACCEPTED && status != Status.REJECTED) {
            throw new EscrowValidationException("Vote status must be ACCEPTED or REJECTED, got " + status);
        }
    }

    long threshold(int percentage) {
        return VoteTally.thresholdOf(registry.totalSupply(), percentage);
    }

    void emit(EscrowEvent event) {
        pendingEvents.add(event);
    }

    void incrementAcceptedRecipients() {
        acceptedRecipientCount++;
    }

    void decrementAcceptedRecipients() {
        acceptedRecipientCount--;
    }

    PoolInfo poolInfo() {
        return ledger.getPoolInfo(settings.poolId());
    }

    /**
     * @throws CapacityExceededException if allocating {@code amount} more would exceed the pool balance
     *                                   or the value still held for the project
     */
    void checkAllocation(long amount) throws CapacityExceededException {
        long available = Math.min(currentSupply, poolInfo().balance());
        if (amount > available - allocatedAmount) {
            throw new CapacityExceededException(String.format(
                    "Allocation of %d exceeds available pool value (available=%d, allocated=%d)",
                    amount, available, allocatedAmount));
        }
    }

    void addAllocation(long amount) {
        allocatedAmount += amount;
    }

    /**
     * Returns an allocation that will never be paid out to the available pool value.
     */
    void releaseAllocation(long amount) {
        allocatedAmount -= amount;
    }

    /**
     * Releases an allocation for payout: it leaves both the allocated amount and the current supply.
     */
    void settleAllocation(long amount) {
        allocatedAmount -= amount;
        currentSupply -= amount;
    }

    void clearSupply() {
        currentSupply = 0;
        allocatedAmount = 0;
    }

    void deactivatePool() {
        poolActive = false;
    }

    /**
     * Issues transfers decided by an already committed transition.
     */
    void transfer(List<Payout> payouts) {
        if (payouts.isEmpty()) {
            return;
        }
        String assetHandle = poolInfo().assetHandle();
        for (Payout payout : payouts) {
            ledger.transfer(assetHandle, payout.destination(), payout.amount());
            log.info("Distributed {} to {}: projectId={}, beneficiary={}, milestoneIndex={}",
                    payout.amount(), payout.destination(), settings.projectId(), payout.beneficiary(),
                    payout.milestoneIndex());
            emit(new EscrowEvent(settings.projectId(), EscrowEventType.DISTRIBUTED, payout.beneficiary(),
                    payout.milestoneIndex(), null, payout.amount(), payout.destination()));
        }
    }
}
