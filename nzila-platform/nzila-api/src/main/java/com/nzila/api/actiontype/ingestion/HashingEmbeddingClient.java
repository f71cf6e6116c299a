package com.nzila.api.actiontype.ingestion;

import com.nzila.core.hash.ContentHashing;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic feature-hashing embedder: each lower-cased token adds plus or minus one
 * to a bucket chosen by its SHA-256, and the vector is L2-normalized.
 */
@Component
public class HashingEmbeddingClient implements EmbeddingClient {

    private final int dimensions;

    public HashingEmbeddingClient(@Value("${nzila.tools.ingestion.embedding-dimensions:64}") int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String model() {
        return "feature-hash-sha256-" + dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) {
                continue;
            }
            byte[] digest = HexFormat.of().parseHex(ContentHashing.sha256(token));
            int bucket = Math.floorMod(((digest[0] & 0xff) << 8) | (digest[1] & 0xff), dimensions);
            vector[bucket] += (digest[2] & 1) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < dimensions; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}
