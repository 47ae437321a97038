package com.phillippitts.talkback.config.orchestration;

import com.phillippitts.talkback.config.properties.ChunkerProperties;
import com.phillippitts.talkback.config.properties.TurnProperties;
import com.phillippitts.talkback.config.properties.VadProperties;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;
import com.phillippitts.talkback.service.orchestration.DefaultTurnOrchestratorBuilder;
import com.phillippitts.talkback.service.orchestration.PromptBuilder;
import com.phillippitts.talkback.service.orchestration.TurnOrchestrator;
import com.phillippitts.talkback.service.orchestration.VoicePolicy;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import com.phillippitts.talkback.service.vad.RmsVoiceActivityClassifier;
import com.phillippitts.talkback.service.vad.VoiceActivityClassifier;
import com.phillippitts.talkback.service.vad.VoiceActivityDetectorFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the turn pipeline explicitly: voice activity detection, prompt assembly and the
 * turn orchestrator.
 */
@Configuration
public class TurnConfig {

    private final TurnProperties turnProperties;
    private final TurnMetricsPublisher metricsPublisher;

    public TurnConfig(TurnProperties turnProperties, TurnMetricsPublisher metricsPublisher) {
        this.turnProperties = turnProperties;
        this.metricsPublisher = metricsPublisher;
    }

    /**
     * Energy classifier; replace with a model-backed bean to change speech detection.
     */
    @Bean
    @ConditionalOnMissingBean(VoiceActivityClassifier.class)
    public VoiceActivityClassifier voiceActivityClassifier(VadProperties vadProperties) {
        return new RmsVoiceActivityClassifier(vadProperties.getRmsThreshold());
    }

    @Bean
    public VoiceActivityDetectorFactory voiceActivityDetectorFactory(VoiceActivityClassifier classifier,
                                                                     VadProperties vadProperties) {
        return new VoiceActivityDetectorFactory(classifier, vadProperties, metricsPublisher);
    }

    @Bean
    public VoicePolicy voicePolicy() {
        return new VoicePolicy(turnProperties.getDefaultVoice(), turnProperties.getDefaultLanguage());
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder(turnProperties.getSystemPrompt(), turnProperties.getContextMinQueryChars());
    }

    @Bean
    public TurnOrchestrator turnOrchestrator(ProcessRegistry registry,
                                             Transcriber transcriber,
                                             TextGenerator generator,
                                             SpeechSynthesizer synthesizer,
                                             ContextRetriever contextRetriever,
                                             PromptBuilder promptBuilder,
                                             ChunkerProperties chunkerProperties,
                                             ApplicationEventPublisher publisher,
                                             @Qualifier("callExecutor") Executor callExecutor) {
        return DefaultTurnOrchestratorBuilder.builder()
                .registry(registry)
                .transcriber(transcriber)
                .generator(generator)
                .synthesizer(synthesizer)
                .contextRetriever(contextRetriever)
                .promptBuilder(promptBuilder)
                .callExecutor(callExecutor)
                .publisher(publisher)
                .metrics(metricsPublisher)
                .maxChunkChars(chunkerProperties.getMaxChars())
                .minTranscriptChars(turnProperties.getMinTranscriptChars())
                .contextMaxDocuments(turnProperties.getContextMaxDocuments())
                .build();
    }
}
