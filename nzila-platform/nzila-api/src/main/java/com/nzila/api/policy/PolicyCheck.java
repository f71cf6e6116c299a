package com.nzila.api.policy;

/**
 * Result of one named check in a policy evaluation.
 */
public record PolicyCheck(String name, boolean passed, String reason) {

    public static final String PROFILE_ENABLED = "PROFILE_ENABLED";
    public static final String FEATURE_FLAG = "FEATURE_FLAG";
    public static final String ACTION_TYPE_ALLOWED = "ACTION_TYPE_ALLOWED";
    public static final String DATA_CLASS_PERMITTED = "DATA_CLASS_PERMITTED";
    public static final String BUDGET_AVAILABLE = "BUDGET_AVAILABLE";
    public static final String RISK_TIER = "RISK_TIER";

    static PolicyCheck pass(String name, String reason) {
        return new PolicyCheck(name, true, reason);
    }

    static PolicyCheck fail(String name, String reason) {
        return new PolicyCheck(name, false, reason);
    }
}
