package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.ConversationExchange;

import java.util.List;
import java.util.Objects;

/**
 * Builds the generation prompt: system prompt, optional retrieved context, recent history
 * and the user question.
 *
 * <pre>
 * {system prompt}
 *
 * Kontext:
 * {doc 1}
 * {doc 2}
 *
 * Verlauf:
 * Nutzer: ...
 * Assistent: ...
 *
 * Frage: {query}
 * </pre>
 */
public final class PromptBuilder {

    private final String systemPrompt;
    private final int minQueryCharsForContext;

    public PromptBuilder(String systemPrompt, int minQueryCharsForContext) {
        this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
        this.minQueryCharsForContext = minQueryCharsForContext;
    }

    /**
     * Whether retrieved context should be used for this query at all.
     */
    public boolean wantsContext(String query) {
        return query != null && query.strip().length() > minQueryCharsForContext;
    }

    public String build(String query, List<String> documents, List<ConversationExchange> history) {
        Objects.requireNonNull(query, "query must not be null");
        StringBuilder prompt = new StringBuilder(systemPrompt.strip());
        if (documents != null && !documents.isEmpty() && wantsContext(query)) {
            prompt.append("\n\nKontext:\n").append(String.join("\n", documents));
        }
        if (history != null && !history.isEmpty()) {
            prompt.append("\n\nVerlauf:");
            for (ConversationExchange exchange : history) {
                prompt.append("\nNutzer: ").append(exchange.userText());
                prompt.append("\nAssistent: ").append(exchange.assistantText());
            }
        }
        prompt.append("\n\nFrage: ").append(query.strip());
        return prompt.toString();
    }
}
