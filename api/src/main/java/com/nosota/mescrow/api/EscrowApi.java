package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.OfferMilestonesRequest;
import com.nosota.mescrow.api.request.OpenEscrowRequest;
import com.nosota.mescrow.api.request.RegisterRecipientRequest;
import com.nosota.mescrow.api.request.ReviewRequest;
import com.nosota.mescrow.api.request.SubmitMilestoneRequest;
import com.nosota.mescrow.api.response.EscrowEventResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.api.response.RecipientResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Escrow API interface.
 *
 * <p>Exposes the voting workflows of a project escrow:
 * <ul>
 *   <li>Recipient registration and review</li>
 *   <li>Milestone plan offer and review</li>
 *   <li>Milestone submission and review (acceptance pays the milestone out)</li>
 *   <li>Project abort vote (acceptance refunds every participant)</li>
 * </ul>
 *
 * <p>The acting identity is passed in the {@value #CALLER_HEADER} header. Authorization is
 * decided by the capability oracle of the service, not by this header alone.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>EscrowController - in service module (server-side implementation)</li>
 *   <li>EscrowClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/escrows")
public interface EscrowApi {

    String CALLER_HEADER = "X-Caller-Id";

    /**
     * Opens the escrow of a project from its aggregated contributions.
     *
     * @param request Project, pool and contributions
     * @return Summary of the new escrow
     */
    @PostMapping
    ResponseEntity<EscrowResponse> openEscrow(@RequestBody @Valid OpenEscrowRequest request) throws Exception;

    @GetMapping("/{projectId}")
    ResponseEntity<EscrowResponse> getEscrow(@PathVariable("projectId") UUID projectId) throws Exception;

    /**
     * Discards a finished escrow. Only EXECUTED or REJECTED escrows can be closed.
     */
    @DeleteMapping("/{projectId}")
    ResponseEntity<Void> closeEscrow(@PathVariable("projectId") UUID projectId) throws Exception;

    /**
     * Registers a recipient candidate. The candidate still needs a passed recipient vote.
     */
    @PostMapping("/{projectId}/recipients")
    ResponseEntity<RecipientResponse> registerRecipient(
            @PathVariable("projectId") UUID projectId,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid RegisterRecipientRequest request) throws Exception;

    /**
     * Casts the caller's vote to accept or reject a recipient.
     */
    @PostMapping("/{projectId}/recipients/{recipientId}/review")
    ResponseEntity<RecipientResponse> reviewRecipient(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid ReviewRequest request) throws Exception;

    @GetMapping("/{projectId}/recipients/{recipientId}")
    ResponseEntity<RecipientResponse> getRecipient(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId) throws Exception;

    /**
     * Offers a milestone plan. The offer counts as the caller's own accept vote.
     */
    @PostMapping("/{projectId}/recipients/{recipientId}/milestones/offer")
    ResponseEntity<RecipientResponse> offerMilestones(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid OfferMilestonesRequest request) throws Exception;

    @PostMapping("/{projectId}/recipients/{recipientId}/milestones/offer/review")
    ResponseEntity<RecipientResponse> reviewOfferedMilestones(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid ReviewRequest request) throws Exception;

    /**
     * Submits evidence for a milestone of an accepted plan.
     */
    @PostMapping("/{projectId}/recipients/{recipientId}/milestones/{milestoneIndex}/submit")
    ResponseEntity<MilestoneResponse> submitMilestone(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId,
            @PathVariable("milestoneIndex") Integer milestoneIndex,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid SubmitMilestoneRequest request) throws Exception;

    /**
     * Casts the caller's vote on a submitted milestone. Acceptance pays the milestone out.
     */
    @PostMapping("/{projectId}/recipients/{recipientId}/milestones/{milestoneIndex}/review")
    ResponseEntity<MilestoneResponse> reviewSubmittedMilestone(
            @PathVariable("projectId") UUID projectId,
            @PathVariable("recipientId") String recipientId,
            @PathVariable("milestoneIndex") Integer milestoneIndex,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid ReviewRequest request) throws Exception;

    /**
     * Casts the caller's vote to abort the project. Acceptance refunds the pool pro-rata.
     */
    @PostMapping("/{projectId}/reject")
    ResponseEntity<EscrowResponse> rejectProject(
            @PathVariable("projectId") UUID projectId,
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid ReviewRequest request) throws Exception;

    /**
     * Lists the journal of events emitted by the escrow, oldest first.
     */
    @GetMapping("/{projectId}/events")
    ResponseEntity<List<EscrowEventResponse>> getEvents(@PathVariable("projectId") UUID projectId) throws Exception;
}
