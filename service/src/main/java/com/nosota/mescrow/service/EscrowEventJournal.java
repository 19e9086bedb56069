package com.nosota.mescrow.service;

import com.nosota.mescrow.escrow.EscrowEvent;
import com.nosota.mescrow.escrow.EscrowEventListener;
import com.nosota.mescrow.model.EscrowEventRecord;
import com.nosota.mescrow.repository.EscrowEventRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persists every escrow event to the {@code escrow_event} journal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowEventJournal implements EscrowEventListener {

    private final EscrowEventRepository eventRepository;

    @Override
    @Transactional
    public void onEvent(EscrowEvent event) {
        EscrowEventRecord record = new EscrowEventRecord();
        record.setProjectId(event.projectId());
        record.setType(event.type());
        record.setRecipientId(event.recipientId());
        record.setMilestoneIndex(event.milestoneIndex());
        record.setStatus(event.status());
        record.setAmount(event.amount());
        record.setDetail(event.detail());
        record.setCreatedAt(LocalDateTime.now());
        record = eventRepository.save(record);

        log.debug("Escrow event recorded: id={}, projectId={}, type={}, recipientId={}, milestoneIndex={}, status={}, amount={}",
                record.getId(), event.projectId(), event.type(), event.recipientId(), event.milestoneIndex(),
                event.status(), event.amount());
    }

    public List<EscrowEventRecord> getEvents(UUID projectId) {
        return eventRepository.findByProjectIdOrderByIdAsc(projectId);
    }

    /**
     * Total value transferred out of the escrow's pool so far.
     */
    public long getDistributedTotal(UUID projectId) {
        return eventRepository.sumDistributedAmount(projectId);
    }
}
