package com.phillippitts.talkback.service.rag;

import java.util.List;

/**
 * Supplies documents relevant to a user query for the generation prompt.
 *
 * <p>Retrieval is best effort: implementations return an empty list rather than throwing, so a
 * retrieval outage never fails a turn.
 */
public interface ContextRetriever {

    /**
     * @param query      user query
     * @param maxResults upper bound on returned documents
     * @return documents, most relevant first; never {@code null}
     */
    List<String> retrieve(String query, int maxResults);

    String getName();

    boolean isAvailable();
}
