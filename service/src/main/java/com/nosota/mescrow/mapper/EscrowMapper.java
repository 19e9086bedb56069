package com.nosota.mescrow.mapper;

import com.nosota.mescrow.api.request.MilestoneRequest;
import com.nosota.mescrow.api.response.EscrowEventResponse;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.api.response.RecipientResponse;
import com.nosota.mescrow.model.EscrowEventRecord;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Recipient;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper between escrow models and API DTOs.
 */
@Mapper
public interface EscrowMapper {

    EscrowMapper INSTANCE = Mappers.getMapper(EscrowMapper.class);

    RecipientResponse toRecipientResponse(Recipient recipient);

    MilestoneResponse toMilestoneResponse(Milestone milestone);

    List<MilestoneResponse> toMilestoneResponses(List<Milestone> milestones);

    EscrowEventResponse toEventResponse(EscrowEventRecord record);

    List<EscrowEventResponse> toEventResponses(List<EscrowEventRecord> records);

    /**
     * Maps an offered milestone. Evidence, status and allocation start empty.
     */
    @Mapping(target = "evidence", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "allocatedAmount", ignore = true)
    Milestone toMilestone(MilestoneRequest request);

    List<Milestone> toMilestones(List<MilestoneRequest> requests);
}
