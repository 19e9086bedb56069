package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.Status;
import com.nosota.mescrow.api.request.ContributionRequest;
import com.nosota.mescrow.api.request.OpenEscrowRequest;
import com.nosota.mescrow.api.request.RegisterRecipientRequest;
import com.nosota.mescrow.error.EscrowException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import com.nosota.mescrow.escrow.EscrowContext;
import com.nosota.mescrow.escrow.EscrowSettings;
import com.nosota.mescrow.escrow.RecipientRegistration;
import com.nosota.mescrow.external.AuthorizationOracle;
import com.nosota.mescrow.external.PoolInfo;
import com.nosota.mescrow.external.PoolLedger;
import com.nosota.mescrow.external.ProfileDirectory;
import com.nosota.mescrow.model.EscrowEventRecord;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hosts the escrow instances of all projects.
 *
 * <p>Every project gets its own {@link EscrowContext}. The service resolves the context,
 * delegates the operation to it and leaves serialization to the context itself, so
 * operations on different projects never block each other.
 *
 * <p>Opening an escrow grants the project's participant capability to every contributor.
 * Events emitted by the contexts are persisted by {@link EscrowEventJournal}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final AuthorizationOracle authorizationOracle;
    private final PoolLedger poolLedger;
    private final ProfileDirectory profileDirectory;
    private final EscrowSettingsFactory settingsFactory;
    private final EscrowEventJournal eventJournal;

    private final Map<UUID, EscrowContext> escrows = new ConcurrentHashMap<>();

    /**
     * Opens the escrow of a project.
     *
     * @throws EscrowStateException      if the project already has an escrow
     * @throws EscrowValidationException if the contributions cannot be turned into voting power
     */
    public EscrowContext openEscrow(@Valid @NotNull OpenEscrowRequest request) throws EscrowException {
        UUID projectId = request.projectId();
        if (escrows.containsKey(projectId)) {
            throw new EscrowStateException("Escrow already open for project " + projectId);
        }

        Map<String, Long> contributions = new LinkedHashMap<>();
        for (ContributionRequest contribution : request.contributions()) {
            if (contributions.putIfAbsent(contribution.participantId(), contribution.amount()) != null) {
                throw new EscrowValidationException("Duplicate contribution for " + contribution.participantId());
            }
        }

        // fails for unknown pools
        PoolInfo pool = poolLedger.getPoolInfo(request.poolId());

        EscrowSettings settings = settingsFactory.create(projectId, request.poolId(), request.maxRecipients());
        EscrowContext context = EscrowContext.open(settings, contributions, authorizationOracle, poolLedger,
                profileDirectory, eventJournal);

        if (escrows.putIfAbsent(projectId, context) != null) {
            throw new EscrowStateException("Escrow already open for project " + projectId);
        }
        contributions.forEach((participant, amount) -> {
            if (amount > 0) {
                authorizationOracle.grantCapability(settings.participantCapability(), participant);
            }
        });

        if (pool.balance() < context.getCurrentSupply()) {
            log.warn("Pool {} holds {} but contributions add up to {} for project {}",
                    request.poolId(), pool.balance(), context.getCurrentSupply(), projectId);
        }
        return context;
    }

    /**
     * @throws EscrowNotFoundException if the project has no escrow
     */
    public EscrowContext getEscrow(UUID projectId) throws EscrowNotFoundException {
        EscrowContext context = escrows.get(projectId);
        if (context == null) {
            throw new EscrowNotFoundException("No escrow for project " + projectId);
        }
        return context;
    }

    /**
     * Drops a finished escrow. Its event journal stays available.
     *
     * @throws EscrowStateException if the escrow is still active
     */
    public void closeEscrow(UUID projectId) throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        if (!context.isFinished()) {
            throw new EscrowStateException(String.format("Escrow of project %s is %s and cannot be closed",
                    projectId, context.getStrategyState()));
        }
        escrows.remove(projectId, context);
        log.info("Escrow closed: projectId={}, state={}, distributed={}",
                projectId, context.getStrategyState(), eventJournal.getDistributedTotal(projectId));
    }

    public Recipient registerRecipient(UUID projectId, String caller, @Valid @NotNull RegisterRecipientRequest request)
            throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.registerRecipient(caller, new RecipientRegistration(request.recipientId(),
                request.recipientAddress(), request.useRegistryAnchor(), request.metadata()));
        return context.getRecipient(request.recipientId());
    }

    public Recipient reviewRecipient(UUID projectId, String recipientId, String caller, Status status)
            throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.reviewRecipient(caller, recipientId, status);
        return context.getRecipient(recipientId);
    }

    public Recipient getRecipient(UUID projectId, String recipientId) throws EscrowNotFoundException {
        return getEscrow(projectId).getRecipient(recipientId);
    }

    public Recipient offerMilestones(UUID projectId, String recipientId, String caller, List<Milestone> milestones)
            throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.offerMilestones(caller, recipientId, milestones);
        return context.getRecipient(recipientId);
    }

    public Recipient reviewOfferedMilestones(UUID projectId, String recipientId, String caller, Status status)
            throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.reviewOfferedMilestones(caller, recipientId, status);
        return context.getRecipient(recipientId);
    }

    public Milestone submitMilestone(UUID projectId, String recipientId, int milestoneIndex, String caller,
                                     String evidence) throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.submitMilestone(caller, recipientId, milestoneIndex, evidence);
        return context.getMilestones(recipientId).get(milestoneIndex);
    }

    public Milestone reviewSubmittedMilestone(UUID projectId, String recipientId, int milestoneIndex, String caller,
                                              Status status) throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.reviewSubmittedMilestone(caller, recipientId, milestoneIndex, status);
        return context.getMilestones(recipientId).get(milestoneIndex);
    }

    public EscrowContext rejectProject(UUID projectId, String caller, Status status) throws EscrowException {
        EscrowContext context = getEscrow(projectId);
        context.rejectProject(caller, status);
        return context;
    }

    public List<EscrowEventRecord> getEvents(UUID projectId) {
        return eventJournal.getEvents(projectId);
    }
}
