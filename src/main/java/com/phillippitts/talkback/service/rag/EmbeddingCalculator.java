package com.phillippitts.talkback.service.rag;

/**
 * Computes a dense embedding vector for a text.
 */
public interface EmbeddingCalculator {

    float[] embed(String text);
}
