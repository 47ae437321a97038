package com.phillippitts.talkback.service.health;

import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the turn pipeline collaborators.
 *
 * <ul>
 *   <li>UP: transcriber, generator and synthesizer available</li>
 *   <li>DEGRADED: at least one of them available</li>
 *   <li>DOWN: none available</li>
 * </ul>
 *
 * <p>The context retriever is optional and only reported as a detail.
 */
@Component
public class CollaboratorHealthIndicator implements HealthIndicator {

    private final Transcriber transcriber;
    private final TextGenerator generator;
    private final SpeechSynthesizer synthesizer;
    private final ContextRetriever retriever;

    public CollaboratorHealthIndicator(Transcriber transcriber,
                                       TextGenerator generator,
                                       SpeechSynthesizer synthesizer,
                                       ContextRetriever retriever) {
        this.transcriber = transcriber;
        this.generator = generator;
        this.synthesizer = synthesizer;
        this.retriever = retriever;
    }

    @Override
    public Health health() {
        boolean sttReady = transcriber.isAvailable();
        boolean llmReady = generator.isAvailable();
        boolean ttsReady = synthesizer.isAvailable();

        Health.Builder builder = new Health.Builder();
        if (sttReady && llmReady && ttsReady) {
            builder.up().withDetail("status", "All collaborators available");
        } else if (sttReady || llmReady || ttsReady) {
            builder.status("DEGRADED").withDetail("status", "Partial collaborator availability");
        } else {
            builder.down().withDetail("status", "No collaborators available");
        }
        return builder
                .withDetail("transcriber", status(transcriber.getName(), sttReady))
                .withDetail("generator", status(generator.getName(), llmReady))
                .withDetail("synthesizer", status(synthesizer.getName(), ttsReady))
                .withDetail("contextRetriever", status(retriever.getName(), retriever.isAvailable()))
                .build();
    }

    private static String status(String name, boolean available) {
        return name + (available ? " (ready)" : " (unavailable)");
    }
}
