package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of an approved action.
 * A run is finalized exactly once, to SUCCESS or FAILED, and is immutable afterwards.
 */
@Entity
@Table(name = "ai_action_runs", indexes = {
    @Index(name = "idx_ai_action_runs_action", columnList = "action_id"),
    @Index(name = "idx_ai_action_runs_status", columnList = "status, started_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_ai_action_runs_attempt", columnNames = {"action_id", "attempt_number"})
})
public class ActionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "action_id", nullable = false, updatable = false)
    private UUID actionId;

    @NotNull
    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @NotNull
    @Column(name = "requested_by", nullable = false, length = 200)
    private String requestedBy;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @NotNull
    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "trace_json", columnDefinition = "TEXT")
    private String traceJson;

    @Column(name = "artifacts_json", columnDefinition = "TEXT")
    private String artifactsJson;

    @Column(name = "attestation_document_id")
    private UUID attestationDocumentId;

    @Column(name = "attestation_path", length = 500)
    private String attestationPath;

    @Column(name = "attestation_self_hash", length = 64)
    private String attestationSelfHash;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Version
    private Long version;

    protected ActionRun() {}

    public static ActionRun start(UUID actionId, UUID entityId, String requestedBy, int attemptNumber, Instant now) {
        var run = new ActionRun();
        run.actionId = actionId;
        run.entityId = entityId;
        run.requestedBy = requestedBy;
        run.attemptNumber = attemptNumber;
        run.status = RunStatus.STARTED;
        run.startedAt = now;
        return run;
    }

    public void succeed(String traceJson, String artifactsJson, UUID attestationDocumentId,
                        String attestationPath, String attestationSelfHash, Instant now) {
        requireStarted(RunStatus.SUCCESS);
        this.status = RunStatus.SUCCESS;
        this.traceJson = traceJson;
        this.artifactsJson = artifactsJson;
        this.attestationDocumentId = attestationDocumentId;
        this.attestationPath = attestationPath;
        this.attestationSelfHash = attestationSelfHash;
        this.finishedAt = now;
    }

    /**
     * Failed runs keep the error verbatim and never reference artifacts.
     */
    public void fail(String error, String traceJson, Instant now) {
        requireStarted(RunStatus.FAILED);
        this.status = RunStatus.FAILED;
        this.error = error;
        this.traceJson = traceJson;
        this.finishedAt = now;
    }

    private void requireStarted(RunStatus target) {
        if (status != RunStatus.STARTED) {
            throw new IllegalActionTransitionException(status.name(), target.name());
        }
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getActionId() { return actionId; }
    public UUID getEntityId() { return entityId; }
    public String getRequestedBy() { return requestedBy; }
    public RunStatus getStatus() { return status; }
    public int getAttemptNumber() { return attemptNumber; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getTraceJson() { return traceJson; }
    public String getArtifactsJson() { return artifactsJson; }
    public UUID getAttestationDocumentId() { return attestationDocumentId; }
    public String getAttestationPath() { return attestationPath; }
    public String getAttestationSelfHash() { return attestationSelfHash; }
    public String getError() { return error; }
    public Long getVersion() { return version; }

    public enum RunStatus {
        STARTED,
        SUCCESS,
        FAILED
    }
}
