package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.EscrowApi;
import com.nosota.mescrow.api.request.OfferMilestonesRequest;
import com.nosota.mescrow.api.request.OpenEscrowRequest;
import com.nosota.mescrow.api.request.RegisterRecipientRequest;
import com.nosota.mescrow.api.request.ReviewRequest;
import com.nosota.mescrow.api.request.SubmitMilestoneRequest;
import com.nosota.mescrow.api.response.EscrowEventResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.api.response.RecipientResponse;
import com.nosota.mescrow.escrow.EscrowContext;
import com.nosota.mescrow.mapper.EscrowMapper;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import com.nosota.mescrow.service.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowController implements EscrowApi {

    private final EscrowService escrowService;

    @Override
    public ResponseEntity<EscrowResponse> openEscrow(OpenEscrowRequest request) throws Exception {
        EscrowContext context = escrowService.openEscrow(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toEscrowResponse(context));
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID projectId) throws Exception {
        return ResponseEntity.ok(toEscrowResponse(escrowService.getEscrow(projectId)));
    }

    @Override
    public ResponseEntity<Void> closeEscrow(UUID projectId) throws Exception {
        escrowService.closeEscrow(projectId);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<RecipientResponse> registerRecipient(UUID projectId, String caller,
                                                               RegisterRecipientRequest request) throws Exception {
        Recipient recipient = escrowService.registerRecipient(projectId, caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowMapper.INSTANCE.toRecipientResponse(recipient));
    }

    @Override
    public ResponseEntity<RecipientResponse> reviewRecipient(UUID projectId, String recipientId, String caller,
                                                             ReviewRequest request) throws Exception {
        Recipient recipient = escrowService.reviewRecipient(projectId, recipientId, caller, request.status());
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toRecipientResponse(recipient));
    }

    @Override
    public ResponseEntity<RecipientResponse> getRecipient(UUID projectId, String recipientId) throws Exception {
        Recipient recipient = escrowService.getRecipient(projectId, recipientId);
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toRecipientResponse(recipient));
    }

    @Override
    public ResponseEntity<RecipientResponse> offerMilestones(UUID projectId, String recipientId, String caller,
                                                             OfferMilestonesRequest request) throws Exception {
        List<Milestone> milestones = EscrowMapper.INSTANCE.toMilestones(request.milestones());
        Recipient recipient = escrowService.offerMilestones(projectId, recipientId, caller, milestones);
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toRecipientResponse(recipient));
    }

    @Override
    public ResponseEntity<RecipientResponse> reviewOfferedMilestones(UUID projectId, String recipientId, String caller,
                                                                     ReviewRequest request) throws Exception {
        Recipient recipient = escrowService.reviewOfferedMilestones(projectId, recipientId, caller, request.status());
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toRecipientResponse(recipient));
    }

    @Override
    public ResponseEntity<MilestoneResponse> submitMilestone(UUID projectId, String recipientId, Integer milestoneIndex,
                                                             String caller, SubmitMilestoneRequest request)
            throws Exception {
        Milestone milestone = escrowService.submitMilestone(projectId, recipientId, milestoneIndex, caller,
                request.evidence());
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toMilestoneResponse(milestone));
    }

    @Override
    public ResponseEntity<MilestoneResponse> reviewSubmittedMilestone(UUID projectId, String recipientId,
                                                                      Integer milestoneIndex, String caller,
                                                                      ReviewRequest request) throws Exception {
        Milestone milestone = escrowService.reviewSubmittedMilestone(projectId, recipientId, milestoneIndex, caller,
                request.status());
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toMilestoneResponse(milestone));
    }

    @Override
    public ResponseEntity<EscrowResponse> rejectProject(UUID projectId, String caller, ReviewRequest request)
            throws Exception {
        EscrowContext context = escrowService.rejectProject(projectId, caller, request.status());
        return ResponseEntity.ok(toEscrowResponse(context));
    }

    @Override
    public ResponseEntity<List<EscrowEventResponse>> getEvents(UUID projectId) {
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toEventResponses(escrowService.getEvents(projectId)));
    }

    private EscrowResponse toEscrowResponse(EscrowContext context) {
        return new EscrowResponse(
                context.getProjectId(),
                context.getSettings().poolId(),
                context.getStrategyState(),
                context.isPoolActive(),
                context.getTotalSupply(),
                context.getCurrentSupply(),
                context.getAllocatedAmount(),
                context.getAcceptedRecipientCount(),
                context.getSettings().maxRecipients()
        );
    }
}
