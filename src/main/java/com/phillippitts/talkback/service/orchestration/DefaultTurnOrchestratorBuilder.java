package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.rag.NoOpContextRetriever;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import org.springframework.context.ApplicationEventPublisher;

import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultTurnOrchestrator}.
 *
 * <p>Required: registry, transcriber, generator, synthesizer, call executor. Everything else has
 * a default (no context retrieval, no metrics, events dropped, 80 character chunks).
 *
 * <pre>{@code
 * TurnOrchestrator orchestrator = DefaultTurnOrchestratorBuilder.builder()
 *     .registry(registry)
 *     .transcriber(transcriber)
 *     .generator(generator)
 *     .synthesizer(synthesizer)
 *     .callExecutor(callExecutor)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 */
public final class DefaultTurnOrchestratorBuilder {

    ProcessRegistry registry;
    Transcriber transcriber;
    TextGenerator generator;
    SpeechSynthesizer synthesizer;
    Executor callExecutor;
    ContextRetriever contextRetriever = new NoOpContextRetriever();
    PromptBuilder promptBuilder = new PromptBuilder("Du bist ein hilfreicher Sprachassistent.", 10);
    ApplicationEventPublisher publisher = event -> { };
    TurnMetricsPublisher metrics = TurnMetricsPublisher.NOOP;
    int maxChunkChars = 80;
    int minTranscriptChars = 1;
    int contextMaxDocuments = 5;

    private DefaultTurnOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static DefaultTurnOrchestratorBuilder builder() {
        return new DefaultTurnOrchestratorBuilder();
    }

    public DefaultTurnOrchestratorBuilder registry(ProcessRegistry registry) {
        this.registry = registry;
        return this;
    }

    public DefaultTurnOrchestratorBuilder transcriber(Transcriber transcriber) {
        this.transcriber = transcriber;
        return this;
    }

    public DefaultTurnOrchestratorBuilder generator(TextGenerator generator) {
        this.generator = generator;
        return this;
    }

    public DefaultTurnOrchestratorBuilder synthesizer(SpeechSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
        return this;
    }

    /**
     * Executor running the raced collaborator calls; needs a free thread per active turn.
     */
    public DefaultTurnOrchestratorBuilder callExecutor(Executor callExecutor) {
        this.callExecutor = callExecutor;
        return this;
    }

    public DefaultTurnOrchestratorBuilder contextRetriever(ContextRetriever contextRetriever) {
        this.contextRetriever = contextRetriever;
        return this;
    }

    public DefaultTurnOrchestratorBuilder promptBuilder(PromptBuilder promptBuilder) {
        this.promptBuilder = promptBuilder;
        return this;
    }

    public DefaultTurnOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public DefaultTurnOrchestratorBuilder metrics(TurnMetricsPublisher metrics) {
        this.metrics = metrics;
        return this;
    }

    public DefaultTurnOrchestratorBuilder maxChunkChars(int maxChunkChars) {
        this.maxChunkChars = maxChunkChars;
        return this;
    }

    public DefaultTurnOrchestratorBuilder minTranscriptChars(int minTranscriptChars) {
        this.minTranscriptChars = minTranscriptChars;
        return this;
    }

    public DefaultTurnOrchestratorBuilder contextMaxDocuments(int contextMaxDocuments) {
        this.contextMaxDocuments = contextMaxDocuments;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultTurnOrchestrator build() {
        return new DefaultTurnOrchestrator(this);
    }
}
