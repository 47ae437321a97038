package com.phillippitts.talkback.service.rag;

import java.util.List;

/**
 * Used when no retrieval backend is configured: prompts are built without context.
 */
public final class NoOpContextRetriever implements ContextRetriever {

    @Override
    public List<String> retrieve(String query, int maxResults) {
        return List.of();
    }

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
