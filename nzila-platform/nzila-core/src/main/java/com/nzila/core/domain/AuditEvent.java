package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ledger entry. Events for one target form a hash chain ordered by sequence,
 * starting from the literal previous hash {@value #GENESIS_HASH}.
 * There are no mutators; rows are inserted once and never updated.
 */
@Entity
@Table(name = "ai_audit_events", indexes = {
    @Index(name = "idx_ai_audit_events_type", columnList = "event_type"),
    @Index(name = "idx_ai_audit_events_occurred", columnList = "occurred_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_ai_audit_events_target_seq", columnNames = {"target_id", "sequence"})
})
public class AuditEvent {

    public static final String GENESIS_HASH = "GENESIS";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "target_type", nullable = false, updatable = false, length = 60)
    private String targetType;

    @NotNull
    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @Column(nullable = false, updatable = false)
    private long sequence;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 40)
    private EventType eventType;

    @NotNull
    @Column(nullable = false, updatable = false, length = 200)
    private String actor;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, updatable = false, length = 20)
    private ActorType actorType;

    @NotNull
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "payload_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @NotNull
    @Column(name = "previous_hash", nullable = false, updatable = false, length = 64)
    private String previousHash;

    @NotNull
    @Column(name = "event_hash", nullable = false, updatable = false, length = 64)
    private String eventHash;

    protected AuditEvent() {}

    public static AuditEvent create(
            String targetType,
            UUID targetId,
            long sequence,
            EventType eventType,
            String actor,
            ActorType actorType,
            Instant occurredAt,
            String payloadJson,
            String previousHash,
            String eventHash) {

        var event = new AuditEvent();
        event.targetType = targetType;
        event.targetId = targetId;
        event.sequence = sequence;
        event.eventType = eventType;
        event.actor = actor;
        event.actorType = actorType;
        event.occurredAt = occurredAt;
        event.payloadJson = payloadJson;
        event.previousHash = previousHash;
        event.eventHash = eventHash;
        return event;
    }

    // Getters
    public UUID getId() { return id; }
    public String getTargetType() { return targetType; }
    public UUID getTargetId() { return targetId; }
    public long getSequence() { return sequence; }
    public EventType getEventType() { return eventType; }
    public String getActor() { return actor; }
    public ActorType getActorType() { return actorType; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getPayloadJson() { return payloadJson; }
    public String getPreviousHash() { return previousHash; }
    public String getEventHash() { return eventHash; }

    public enum ActorType {
        HUMAN,
        SYSTEM,
        AI
    }

    public enum EventType {
        ACTION_PROPOSED,
        ACTION_POLICY_CHECKED,
        ACTION_APPROVAL_REQUESTED,
        ACTION_APPROVED,
        ACTION_REJECTED,
        ACTION_EXPIRED,
        APPROVAL_REFUSED,
        ACTION_RETRY_APPROVED,
        RUN_STARTED,
        ACTION_EXECUTING,
        EXECUTION_SUCCEEDED,
        EXECUTION_FAILED,
        ATTESTATION_STORED
    }
}
