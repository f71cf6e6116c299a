package com.nzila.api.audit;

import com.nzila.core.domain.AuditEvent;
import com.nzila.core.domain.AuditEvent.ActorType;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.ContentHashing;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Hash chain arithmetic for ledger events. Stateless.
 */
public final class AuditChainHasher {

    private AuditChainHasher() {
    }

    public static String computeHash(
            String targetType,
            UUID targetId,
            long sequence,
            EventType eventType,
            String actor,
            ActorType actorType,
            Instant occurredAt,
            String payloadJson,
            String previousHash) {

        String eventData = String.join("|",
                targetType,
                targetId.toString(),
                Long.toString(sequence),
                eventType.name(),
                actor,
                actorType.name(),
                occurredAt.toString(),
                ContentHashing.sha256(payloadJson),
                previousHash
        );
        return ContentHashing.sha256(eventData);
    }

    public static String computeHash(AuditEvent event) {
        return computeHash(
                event.getTargetType(),
                event.getTargetId(),
                event.getSequence(),
                event.getEventType(),
                event.getActor(),
                event.getActorType(),
                event.getOccurredAt(),
                event.getPayloadJson(),
                event.getPreviousHash());
    }

    /**
     * Walks a target's events in sequence order from genesis, recomputing every hash.
     * Reports the first sequence at which the stored chain diverges.
     */
    public static ChainVerification verify(UUID targetId, List<AuditEvent> orderedEvents) {
        String expectedPrevious = AuditEvent.GENESIS_HASH;
        long expectedSequence = 1;
        for (AuditEvent event : orderedEvents) {
            if (event.getSequence() != expectedSequence) {
                return ChainVerification.broken(targetId, orderedEvents.size(), event.getSequence(), "SEQUENCE_GAP");
            }
            if (!expectedPrevious.equals(event.getPreviousHash())) {
                return ChainVerification.broken(targetId, orderedEvents.size(), event.getSequence(), "PREVIOUS_HASH_MISMATCH");
            }
            if (!ContentHashing.matches(computeHash(event), event.getEventHash())) {
                return ChainVerification.broken(targetId, orderedEvents.size(), event.getSequence(), "EVENT_HASH_MISMATCH");
            }
            expectedPrevious = event.getEventHash();
            expectedSequence++;
        }
        return new ChainVerification(targetId, true, orderedEvents.size(), null, null,
                orderedEvents.isEmpty() ? AuditEvent.GENESIS_HASH : expectedPrevious);
    }

    /**
     * @param firstInvalidSequence {@code null} when the chain is intact
     * @param headHash             hash of the last event when intact
     */
    public record ChainVerification(
            UUID targetId,
            boolean valid,
            int eventCount,
            Long firstInvalidSequence,
            String failure,
            String headHash
    ) {
        static ChainVerification broken(UUID targetId, int eventCount, long sequence, String failure) {
            return new ChainVerification(targetId, false, eventCount, sequence, failure, null);
        }
    }
}
