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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of EscrowApi for consuming the escrow service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MEscrowClientConfig {
 *     @Bean
 *     public WebClient mescrowWebClient(WebClient.Builder builder,
 *                                       @Value("${services.mescrow.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public EscrowClient escrowClient(WebClient mescrowWebClient) {
 *         return new EscrowClient(mescrowWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class EscrowClient implements EscrowApi {

    private static final String BASE = "/api/v1/escrows";

    private final WebClient webClient;

    @Override
    public ResponseEntity<EscrowResponse> openEscrow(OpenEscrowRequest request) {
        log.debug("Calling openEscrow: projectId={}, poolId={}, contributions={}",
                request.projectId(), request.poolId(), request.contributions().size());

        return webClient.post()
                .uri(BASE)
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID projectId) {
        log.debug("Calling getEscrow: projectId={}", projectId);

        return webClient.get()
                .uri(BASE + "/{projectId}", projectId)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> closeEscrow(UUID projectId) {
        log.debug("Calling closeEscrow: projectId={}", projectId);

        return webClient.delete()
                .uri(BASE + "/{projectId}", projectId)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> registerRecipient(UUID projectId, String caller,
                                                               RegisterRecipientRequest request) {
        log.debug("Calling registerRecipient: projectId={}, recipientId={}, caller={}",
                projectId, request.recipientId(), caller);

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients", projectId)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> reviewRecipient(UUID projectId, String recipientId, String caller,
                                                             ReviewRequest request) {
        log.debug("Calling reviewRecipient: projectId={}, recipientId={}, caller={}, status={}",
                projectId, recipientId, caller, request.status());

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients/{recipientId}/review", projectId, recipientId)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> getRecipient(UUID projectId, String recipientId) {
        log.debug("Calling getRecipient: projectId={}, recipientId={}", projectId, recipientId);

        return webClient.get()
                .uri(BASE + "/{projectId}/recipients/{recipientId}", projectId, recipientId)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> offerMilestones(UUID projectId, String recipientId, String caller,
                                                             OfferMilestonesRequest request) {
        log.debug("Calling offerMilestones: projectId={}, recipientId={}, caller={}, milestones={}",
                projectId, recipientId, caller, request.milestones().size());

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients/{recipientId}/milestones/offer", projectId, recipientId)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> reviewOfferedMilestones(UUID projectId, String recipientId,
                                                                     String caller, ReviewRequest request) {
        log.debug("Calling reviewOfferedMilestones: projectId={}, recipientId={}, caller={}, status={}",
                projectId, recipientId, caller, request.status());

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients/{recipientId}/milestones/offer/review", projectId, recipientId)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MilestoneResponse> submitMilestone(UUID projectId, String recipientId,
                                                             Integer milestoneIndex, String caller,
                                                             SubmitMilestoneRequest request) {
        log.debug("Calling submitMilestone: projectId={}, recipientId={}, milestoneIndex={}, caller={}",
                projectId, recipientId, milestoneIndex, caller);

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients/{recipientId}/milestones/{milestoneIndex}/submit",
                        projectId, recipientId, milestoneIndex)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MilestoneResponse> reviewSubmittedMilestone(UUID projectId, String recipientId,
                                                                      Integer milestoneIndex, String caller,
                                                                      ReviewRequest request) {
        log.debug("Calling reviewSubmittedMilestone: projectId={}, recipientId={}, milestoneIndex={}, caller={}, status={}",
                projectId, recipientId, milestoneIndex, caller, request.status());

        return webClient.post()
                .uri(BASE + "/{projectId}/recipients/{recipientId}/milestones/{milestoneIndex}/review",
                        projectId, recipientId, milestoneIndex)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(MilestoneResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> rejectProject(UUID projectId, String caller, ReviewRequest request) {
        log.debug("Calling rejectProject: projectId={}, caller={}, status={}", projectId, caller, request.status());

        return webClient.post()
                .uri(BASE + "/{projectId}/reject", projectId)
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<EscrowEventResponse>> getEvents(UUID projectId) {
        log.debug("Calling getEvents: projectId={}", projectId);

        return webClient.get()
                .uri(BASE + "/{projectId}/events", projectId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<EscrowEventResponse>>() {
                })
                .block();
    }
}
