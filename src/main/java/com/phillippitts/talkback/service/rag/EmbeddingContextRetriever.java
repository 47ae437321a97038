package com.phillippitts.talkback.service.rag;

import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Retrieves context by embedding the query and searching the vector index.
 * Any failure degrades to an empty context.
 */
public class EmbeddingContextRetriever implements ContextRetriever {

    private static final Logger LOG = LogManager.getLogger(EmbeddingContextRetriever.class);

    private final EmbeddingCalculator embeddings;
    private final VectorIndex index;

    public EmbeddingContextRetriever(EmbeddingCalculator embeddings, VectorIndex index) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    @Override
    public List<String> retrieve(String query, int maxResults) {
        if (query == null || query.isBlank() || maxResults <= 0) {
            return List.of();
        }
        try {
            float[] vector = embeddings.embed(query);
            List<String> documents = index.search(vector, maxResults);
            if (documents == null) {
                return List.of();
            }
            LOG.debug("Retrieved {} documents for query '{}'", documents.size(), LogSanitizer.truncate(query, 40));
            return documents.size() > maxResults ? List.copyOf(documents.subList(0, maxResults)) : List.copyOf(documents);
        } catch (RuntimeException e) {
            LOG.warn("Context retrieval failed; continuing without context: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public String getName() {
        return "embedding";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
