package com.nzila.api.attestation;

import java.util.UUID;

/**
 * @param storageHashValid stored bytes still match the {@code documents} row
 * @param selfHashValid    recomputed self hash matches the one inside the document
 */
public record AttestationVerification(
        UUID runId,
        String storagePath,
        boolean documentFound,
        boolean storageHashValid,
        boolean selfHashValid,
        String storedSelfHash,
        String recomputedSelfHash
) {

    public boolean valid() {
        return documentFound && storageHashValid && selfHashValid;
    }
}
