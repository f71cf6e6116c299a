package com.nzila.api.execution;

import com.nzila.core.domain.ActionRun;
import com.nzila.core.repository.ActionRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fails runs left STARTED by a crashed or killed process, so their actions
 * leave EXECUTING and can be retried.
 *
 * Runs whose action is executing in this process are skipped.
 */
@Component
public class StaleRunRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StaleRunRecoveryService.class);

    public static final String RECOVERED_STALE_RUN = "RECOVERED_STALE_RUN";

    private final ActionRunRepository runRepository;
    private final ExecutionRecorder recorder;
    private final ExecutionLockRegistry lockRegistry;
    private final Clock clock;
    private final Duration staleAfter;

    public StaleRunRecoveryService(ActionRunRepository runRepository,
                                   ExecutionRecorder recorder,
                                   ExecutionLockRegistry lockRegistry,
                                   Clock clock,
                                   @Value("${nzila.execution.stale-run-after:PT15M}") Duration staleAfter) {
        this.runRepository = runRepository;
        this.recorder = recorder;
        this.lockRegistry = lockRegistry;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int recovered = recoverStaleRuns();
        if (recovered > 0) {
            log.info("Recovered {} stale runs at startup", recovered);
        }
    }

    @Scheduled(fixedDelayString = "${nzila.execution.stale-check-interval-ms:300000}",
               initialDelayString = "${nzila.execution.stale-check-interval-ms:300000}")
    public void scheduledRecovery() {
        recoverStaleRuns();
    }

    public int recoverStaleRuns() {
        return recoverStaleRuns(clock.instant().minus(staleAfter));
    }

    /**
     * Fails every STARTED run that began before the cutoff.
     */
    public int recoverStaleRuns(Instant cutoff) {
        List<UUID> staleRunIds = runRepository.findStaleRunIds(cutoff);
        int recovered = 0;
        for (UUID runId : staleRunIds) {
            ActionRun run = runRepository.findById(runId).orElse(null);
            if (run == null || lockRegistry.isHeld(run.getActionId())) {
                continue;
            }
            try {
                MDC.put("actionId", run.getActionId().toString());
                recorder.failRun(runId,
                        "Run abandoned in STARTED since " + run.getStartedAt() + "; recovered as failed",
                        List.of(), RECOVERED_STALE_RUN);
                recovered++;
            } catch (RuntimeException e) {
                log.warn("Could not recover stale run {}: {}", runId, e.getMessage());
            } finally {
                MDC.remove("actionId");
            }
        }
        if (recovered > 0) {
            log.warn("Marked {} stale runs as failed (cutoff {})", recovered, cutoff);
        }
        return recovered;
    }
}
