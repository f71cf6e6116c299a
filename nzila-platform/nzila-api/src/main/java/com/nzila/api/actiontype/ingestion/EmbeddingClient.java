package com.nzila.api.actiontype.ingestion;

/**
 * Turns text into a fixed-size vector.
 */
public interface EmbeddingClient {

    String model();

    int dimensions();

    float[] embed(String text);
}
