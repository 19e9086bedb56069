package com.nosota.mescrow.escrow;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.error.EscrowException;
import com.nosota.mescrow.external.PoolInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Project-wide vote to abort the escrow.
 *
 * <p>A passed abort rejects the strategy and sweeps the whole pool balance back to the
 * participants pro-rata. The round is only reset when the abort is declined.
 */
@Slf4j
class ProjectAbortVote {

    private final EscrowContext context;
    private final VoteTally tally = new VoteTally();

    ProjectAbortVote(EscrowContext context) {
        this.context = context;
    }

    void vote(String caller, Status status) throws EscrowException {
        context.stateMachine().requireActive("reject project");
        context.requireParticipant(caller);
        EscrowContext.requireVoteStatus(status);

        long weight = context.registry().weightOf(caller);
        tally.castVote(caller, status == Status.ACCEPTED, weight);
        log.debug("Abort vote: projectId={}, voter={}, status={}, for={}, against={}",
                context.projectId(), caller, status, tally.getVotesFor(), tally.getVotesAgainst());

        Optional<ThresholdOutcome> outcome = tally.crossedThreshold(
                context.threshold(context.settings().abortThreshold()));
        if (outcome.isEmpty()) {
            return;
        }

        if (outcome.get() == ThresholdOutcome.REJECTED) {
            tally.reset();
            log.info("Project abort declined: projectId={}", context.projectId());
            context.emit(EscrowEvent.project(context.projectId(), EscrowEventType.PROJECT_REJECT_DECLINED));
            return;
        }

        PoolInfo pool = context.poolInfo();
        List<Payout> refunds = refunds(pool.balance());

        context.stateMachine().reject();
        context.deactivatePool();
        context.clearSupply();

        log.info("Project rejected: projectId={}, refunding {} to {} participants",
                context.projectId(), pool.balance(), refunds.size());
        context.emit(new EscrowEvent(context.projectId(), EscrowEventType.PROJECT_REJECTED, null, null,
                Status.REJECTED, pool.balance(), null));

        context.transfer(refunds);
    }

    /**
     * Splits {@code balance} by weight. The rounding remainder goes to the participant that
     * received the normalization remainder, so the refunds add up to the balance exactly.
     */
    private List<Payout> refunds(long balance) {
        VotingPowerRegistry registry = context.registry();
        List<Payout> refunds = new ArrayList<>();
        long assigned = 0;
        int holderPosition = -1;
        for (Map.Entry<String, Long> entry : registry.weights().entrySet()) {
            long amount = FixedPoint.mulDiv(balance, entry.getValue(), registry.totalSupply());
            if (entry.getKey().equals(registry.remainderHolder())) {
                holderPosition = refunds.size();
            }
            refunds.add(new Payout(entry.getKey(), null, entry.getKey(), amount));
            assigned += amount;
        }
        Payout holder = refunds.get(holderPosition);
        refunds.set(holderPosition, new Payout(holder.beneficiary(), null, holder.destination(),
                holder.amount() + balance - assigned));
        refunds.removeIf(refund -> refund.amount() == 0);
        return refunds;
    }
}
