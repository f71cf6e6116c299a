package com.nzila.api.actiontype.ingestion;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping windows, preferring to cut at whitespace in the
 * second half of a window.
 */
public final class TextChunker {

    private TextChunker() {
    }

    public static List<TextChunk> chunk(String text, int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("Need 0 <= overlap < size, got size=" + chunkSize + " overlap=" + chunkOverlap);
        }
        List<TextChunk> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(length, start + chunkSize);
            if (end < length) {
                int cut = lastWhitespace(text, start + chunkSize / 2, end);
                if (cut > start) {
                    end = cut;
                }
            }
            chunks.add(new TextChunk(chunks.size(), start, end, text.substring(start, end)));
            if (end >= length) {
                break;
            }
            start = Math.max(end - chunkOverlap, start + 1);
        }
        return chunks;
    }

    private static int lastWhitespace(String text, int from, int to) {
        for (int i = to; i > from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    public record TextChunk(int index, int start, int end, String text) {}
}
