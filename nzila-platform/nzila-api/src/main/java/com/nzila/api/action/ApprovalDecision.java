package com.nzila.api.action;

public enum ApprovalDecision {
    APPROVE,
    REJECT
}
