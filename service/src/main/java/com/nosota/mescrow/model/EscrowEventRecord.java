package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.EscrowEventType;
import com.nosota.mescrow.api.model.Status;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Journal entry of an event emitted by an escrow.
 *
 * <p>Entries are append-only. The ID gives the emission order within the service.
 */
@Entity
@Table(name = "escrow_event", indexes = @Index(name = "idx_escrow_event_project", columnList = "project_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class EscrowEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 40)
    private EscrowEventType type;

    /**
     * Recipient or participant concerned. Null for project-wide events.
     */
    @Column(name = "recipient_id", updatable = false)
    private String recipientId;

    @Column(name = "milestone_index", updatable = false)
    private Integer milestoneIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", updatable = false, length = 20)
    private Status status;

    /**
     * Amount allocated, distributed or refunded. Null if the event moves no value.
     */
    @Column(name = "amount", updatable = false)
    private Long amount;

    @Column(name = "detail", updatable = false, length = 2000)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
