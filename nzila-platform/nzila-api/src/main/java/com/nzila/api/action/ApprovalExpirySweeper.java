package com.nzila.api.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ApprovalExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalExpirySweeper.class);

    private final ApprovalService approvalService;

    public ApprovalExpirySweeper(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @Scheduled(fixedDelayString = "${nzila.approval.sweep-interval-ms:60000}",
               initialDelayString = "${nzila.approval.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            approvalService.expireDue();
        } catch (RuntimeException e) {
            log.error("Approval expiry sweep failed", e);
        }
    }
}
