package com.phillippitts.talkback.config;

import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.llm.UnconfiguredTextGenerator;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.rag.EmbeddingCalculator;
import com.phillippitts.talkback.service.rag.EmbeddingContextRetriever;
import com.phillippitts.talkback.service.rag.NoOpContextRetriever;
import com.phillippitts.talkback.service.rag.VectorIndex;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.stt.UnconfiguredTranscriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import com.phillippitts.talkback.service.tts.UnconfiguredSpeechSynthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators used when no provider integration contributes a bean.
 *
 * <p>The unconfigured transcriber, generator and synthesizer fail every call with their
 * collaborator's error kind, so the service starts and reports DOWN on the health endpoint
 * instead of refusing to boot.
 */
@Configuration
public class CollaboratorDefaultsConfig {

    private static final Logger LOG = LogManager.getLogger(CollaboratorDefaultsConfig.class);

    @Bean
    @ConditionalOnMissingBean(Transcriber.class)
    public Transcriber transcriber() {
        LOG.warn("No Transcriber configured; audio turns will fail with transcription_failed");
        return new UnconfiguredTranscriber();
    }

    @Bean
    @ConditionalOnMissingBean(TextGenerator.class)
    public TextGenerator textGenerator() {
        LOG.warn("No TextGenerator configured; turns will fail with generation_failed");
        return new UnconfiguredTextGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(SpeechSynthesizer.class)
    public SpeechSynthesizer speechSynthesizer() {
        LOG.warn("No SpeechSynthesizer configured; every span will fail synthesis");
        return new UnconfiguredSpeechSynthesizer();
    }

    /**
     * Embedding-based retrieval when both an embedding calculator and a vector index exist,
     * otherwise no context.
     */
    @Bean
    @ConditionalOnMissingBean(ContextRetriever.class)
    public ContextRetriever contextRetriever(ObjectProvider<EmbeddingCalculator> embeddings,
                                             ObjectProvider<VectorIndex> index) {
        EmbeddingCalculator calculator = embeddings.getIfAvailable();
        VectorIndex vectorIndex = index.getIfAvailable();
        if (calculator != null && vectorIndex != null) {
            LOG.info("Context retrieval enabled (embedding + vector index)");
            return new EmbeddingContextRetriever(calculator, vectorIndex);
        }
        LOG.info("Context retrieval disabled");
        return new NoOpContextRetriever();
    }
}
