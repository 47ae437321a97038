package com.phillippitts.talkback.service.rag;

import java.util.List;

/**
 * Nearest-neighbour search over stored document embeddings.
 */
public interface VectorIndex {

    /**
     * @param query embedding of the query
     * @param topK  maximum number of documents
     * @return document texts, most similar first
     */
    List<String> search(float[] query, int topK);
}
