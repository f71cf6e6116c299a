package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * A proposed automated action and its lifecycle state.
 * The proposal payload is fixed at creation; every other change goes through
 * a transition method guarded by {@link ActionStatus#canTransitionTo(ActionStatus)}.
 * Actions are never deleted.
 */
@Entity
@Table(name = "ai_actions", indexes = {
    @Index(name = "idx_ai_actions_entity_period", columnList = "entity_id, period_label"),
    @Index(name = "idx_ai_actions_status", columnList = "status"),
    @Index(name = "idx_ai_actions_expires", columnList = "expires_at")
})
public class Action {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "action_type", nullable = false, length = 120)
    private String actionType;

    @NotNull
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @NotNull
    @Column(name = "app_key", nullable = false, length = 120)
    private String appKey;

    @NotNull
    @Column(name = "profile_key", nullable = false, length = 120)
    private String profileKey;

    @NotNull
    @Column(name = "proposal_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String proposalJson;

    @NotNull
    @Column(name = "proposal_hash", nullable = false, updatable = false, length = 64)
    private String proposalHash;

    @Column(name = "data_class", length = 40)
    private String dataClass;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_tier", length = 20)
    private RiskTier riskTier;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ActionStatus status;

    @Column(name = "policy_outcome", length = 30)
    private String policyOutcome;

    @Column(name = "policy_decision_json", columnDefinition = "TEXT")
    private String policyDecisionJson;

    /**
     * JSON array of role names, any one of which may decide an awaiting action.
     */
    @Column(name = "required_approver_roles", columnDefinition = "TEXT")
    private String requiredApproverRoles;

    @Column(name = "evidence_pack_eligible", nullable = false)
    private boolean evidencePackEligible;

    @Column(name = "period_label", length = 7)
    private String periodLabel;

    @NotNull
    @Column(name = "requested_by", nullable = false, length = 200)
    private String requestedBy;

    @Column(name = "decided_by", length = 200)
    private String decidedBy;

    @Column(name = "decision_reason", length = 1000)
    private String decisionReason;

    @NotNull
    @Column(name = "proposed_at", nullable = false, updatable = false)
    private Instant proposedAt;

    @Column(name = "policy_checked_at")
    private Instant policyCheckedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected Action() {}

    public static Action propose(
            String actionType,
            UUID entityId,
            String appKey,
            String profileKey,
            String proposalJson,
            String proposalHash,
            String dataClass,
            String periodLabel,
            boolean evidencePackEligible,
            String requestedBy,
            Instant now) {

        var action = new Action();
        action.actionType = actionType;
        action.entityId = entityId;
        action.appKey = appKey;
        action.profileKey = profileKey;
        action.proposalJson = proposalJson;
        action.proposalHash = proposalHash;
        action.dataClass = dataClass;
        action.periodLabel = periodLabel;
        action.evidencePackEligible = evidencePackEligible;
        action.requestedBy = requestedBy;
        action.status = ActionStatus.PROPOSED;
        action.proposedAt = now;
        action.updatedAt = now;
        return action;
    }

    /**
     * Attaches the policy decision. The risk tier is assigned here and only here.
     */
    public void recordPolicyCheck(String outcome, String decisionJson, RiskTier tier,
                                  String approverRolesJson, Instant now) {
        moveTo(ActionStatus.POLICY_CHECKED, now);
        if (this.riskTier != null) {
            throw new IllegalActionTransitionException("Risk tier already assigned for action " + id);
        }
        this.policyOutcome = outcome;
        this.policyDecisionJson = decisionJson;
        this.riskTier = tier;
        this.requiredApproverRoles = approverRolesJson;
        this.policyCheckedAt = now;
    }

    public void autoApprove(String systemActor, Instant now) {
        moveTo(ActionStatus.APPROVED, now);
        this.decidedBy = systemActor;
        this.decisionReason = "auto-approved by policy";
        this.approvedAt = now;
        this.decidedAt = now;
    }

    public void requestApproval(Instant expiresAt, Instant now) {
        moveTo(ActionStatus.AWAITING_APPROVAL, now);
        this.expiresAt = expiresAt;
    }

    public void approve(String approver, String reason, Instant now) {
        moveTo(ActionStatus.APPROVED, now);
        this.decidedBy = approver;
        this.decisionReason = reason;
        this.approvedAt = now;
        this.decidedAt = now;
    }

    public void reject(String approver, String reason, Instant now) {
        moveTo(ActionStatus.REJECTED, now);
        this.decidedBy = approver;
        this.decisionReason = reason;
        this.decidedAt = now;
    }

    public void expire(Instant now) {
        moveTo(ActionStatus.EXPIRED, now);
        this.decisionReason = "approval window elapsed";
        this.decidedAt = now;
    }

    public void startExecution(Instant now) {
        moveTo(ActionStatus.EXECUTING, now);
    }

    public void markExecuted(Instant now) {
        moveTo(ActionStatus.EXECUTED, now);
        this.executedAt = now;
    }

    public void markFailed(Instant now) {
        moveTo(ActionStatus.FAILED, now);
    }

    /**
     * Re-opens a failed action for another attempt. Only actions that were approved before
     * their failed run qualify.
     */
    public void approveRetry(String requestedBy, Instant now) {
        if (approvedAt == null) {
            throw new IllegalActionTransitionException("Action " + id + " was never approved");
        }
        moveTo(ActionStatus.APPROVED, now);
        this.decisionReason = "retry requested by " + requestedBy;
        this.approvedAt = now;
    }

    public boolean isApprovalExpired(Instant now) {
        return status == ActionStatus.AWAITING_APPROVAL && expiresAt != null && !now.isBefore(expiresAt);
    }

    private void moveTo(ActionStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalActionTransitionException(status.name(), target.name());
        }
        this.status = target;
        this.updatedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public String getActionType() { return actionType; }
    public UUID getEntityId() { return entityId; }
    public String getAppKey() { return appKey; }
    public String getProfileKey() { return profileKey; }
    public String getProposalJson() { return proposalJson; }
    public String getProposalHash() { return proposalHash; }
    public String getDataClass() { return dataClass; }
    public RiskTier getRiskTier() { return riskTier; }
    public ActionStatus getStatus() { return status; }
    public String getPolicyOutcome() { return policyOutcome; }
    public String getPolicyDecisionJson() { return policyDecisionJson; }
    public String getRequiredApproverRoles() { return requiredApproverRoles; }
    public boolean isEvidencePackEligible() { return evidencePackEligible; }
    public String getPeriodLabel() { return periodLabel; }
    public String getRequestedBy() { return requestedBy; }
    public String getDecidedBy() { return decidedBy; }
    public String getDecisionReason() { return decisionReason; }
    public Instant getProposedAt() { return proposedAt; }
    public Instant getPolicyCheckedAt() { return policyCheckedAt; }
    public Instant getApprovedAt() { return approvedAt; }
    public Instant getDecidedAt() { return decidedAt; }
    public Instant getExecutedAt() { return executedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }

    public enum RiskTier {
        LOW, MEDIUM, HIGH
    }

    /**
     * Lifecycle states with their explicit successor table.
     */
    public enum ActionStatus {
        PROPOSED,
        POLICY_CHECKED,
        AWAITING_APPROVAL,
        APPROVED,
        EXECUTING,
        EXECUTED,
        FAILED,
        REJECTED,
        EXPIRED;

        public Set<ActionStatus> successors() {
            return switch (this) {
                case PROPOSED -> EnumSet.of(POLICY_CHECKED);
                case POLICY_CHECKED -> EnumSet.of(APPROVED, AWAITING_APPROVAL);
                case AWAITING_APPROVAL -> EnumSet.of(APPROVED, REJECTED, EXPIRED);
                case APPROVED -> EnumSet.of(EXECUTING);
                case EXECUTING -> EnumSet.of(EXECUTED, FAILED);
                case FAILED -> EnumSet.of(APPROVED);
                case EXECUTED, REJECTED, EXPIRED -> EnumSet.noneOf(ActionStatus.class);
            };
        }

        public boolean canTransitionTo(ActionStatus target) {
            return successors().contains(target);
        }

        /**
         * Terminal for the purpose of retention. FAILED still admits an explicit retry.
         */
        public boolean isTerminal() {
            return this == EXECUTED || this == FAILED || this == REJECTED || this == EXPIRED;
        }
    }
}
