package com.nzila.api.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nzila.core.domain.Action.RiskTier;
import com.nzila.core.hash.CanonicalJson;

import java.util.List;

/**
 * Outcome of a policy evaluation. Contains no timestamps, so identical inputs
 * produce byte-identical {@link #toCanonicalJson()} output.
 *
 * @param failedCheck name of the check that denied, {@code null} unless denied
 * @param riskTier    {@code null} when denied before the risk tier check
 */
public record PolicyDecision(
        Outcome outcome,
        List<PolicyCheck> checks,
        String failedCheck,
        String reasonCode,
        RiskTier riskTier,
        List<String> requiredApproverRoles,
        String policyVersion,
        String actionType,
        String proposalHash
) {

    public static final String EVALUATION_ERROR = "EVALUATION_ERROR";

    public enum Outcome {
        ALLOW_AUTO,
        REQUIRE_APPROVAL,
        DENY
    }

    @JsonIgnore
    public boolean isDenied() {
        return outcome == Outcome.DENY;
    }

    public String toCanonicalJson() {
        return CanonicalJson.write(this);
    }

    public String hash() {
        return CanonicalJson.hash(this);
    }
}
