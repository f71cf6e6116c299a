package com.nzila.api.audit;

import com.nzila.api.audit.AuditChainHasher.ChainVerification;
import com.nzila.core.domain.AuditEvent;
import com.nzila.core.domain.AuditEvent.ActorType;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only, hash-chained ledger of lifecycle events.
 *
 * Every action and run event is chained on the action id. Callers append while holding the
 * target's row lock, inside the same transaction as the state change they record; the unique
 * {@code (target_id, sequence)} constraint rejects any append that lost a race.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String TARGET_ACTION = "ai_action";

    private final AuditEventRepository auditRepository;
    private final Clock clock;

    public AuditService(AuditEventRepository auditRepository, Clock clock) {
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    /**
     * Appends the next event for a target.
     */
    @Transactional
    public AuditEvent append(
            String targetType,
            UUID targetId,
            EventType eventType,
            String actor,
            ActorType actorType,
            Map<String, ?> payload) {

        AuditEvent last = auditRepository.findTopByTargetIdOrderBySequenceDesc(targetId).orElse(null);
        long sequence = last == null ? 1 : last.getSequence() + 1;
        String previousHash = last == null ? AuditEvent.GENESIS_HASH : last.getEventHash();

        // Truncated so the stored value round-trips through every supported database
        Instant occurredAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String payloadJson = CanonicalJson.write(payload == null ? Map.of() : payload);

        String eventHash = AuditChainHasher.computeHash(
                targetType, targetId, sequence, eventType, actor, actorType, occurredAt, payloadJson, previousHash);

        AuditEvent event = AuditEvent.create(
                targetType, targetId, sequence, eventType, actor, actorType,
                occurredAt, payloadJson, previousHash, eventHash);

        AuditEvent saved = auditRepository.saveAndFlush(event);
        log.debug("Ledger {} #{} {} by {}", targetId, sequence, eventType, actor);
        return saved;
    }

    @Transactional
    public AuditEvent appendForAction(UUID actionId, EventType eventType, String actor,
                                      ActorType actorType, Map<String, ?> payload) {
        return append(TARGET_ACTION, actionId, eventType, actor, actorType, payload);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> listEvents(UUID targetId) {
        return auditRepository.findByTargetIdOrderBySequenceAsc(targetId);
    }

    /**
     * Recomputes the target's chain from genesis.
     */
    @Transactional(readOnly = true)
    public ChainVerification verifyChain(UUID targetId) {
        ChainVerification result = AuditChainHasher.verify(targetId, listEvents(targetId));
        if (!result.valid()) {
            log.warn("Ledger chain for {} broken at sequence {}: {}",
                    targetId, result.firstInvalidSequence(), result.failure());
        }
        return result;
    }
}
