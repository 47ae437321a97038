package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.config.properties.TurnProperties;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.orchestration.TurnOrchestrator;
import com.phillippitts.talkback.service.orchestration.VoicePolicy;
import com.phillippitts.talkback.service.vad.VoiceActivityDetectorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Opens and closes {@link VoiceSession}s for transport connections.
 */
@Service
public class VoiceSessionManager {

    private static final Logger LOG = LogManager.getLogger(VoiceSessionManager.class);

    /**
     * Collaborators shared by every session.
     */
    record Dependencies(TurnOrchestrator orchestrator,
                        ProcessRegistry registry,
                        Executor turnExecutor,
                        VoicePolicy voicePolicy,
                        int historySize,
                        int sampleRate,
                        int maxPendingSegments,
                        long maxSegmentDurationMs) {
        Dependencies {
            Objects.requireNonNull(orchestrator, "orchestrator must not be null");
            Objects.requireNonNull(registry, "registry must not be null");
            Objects.requireNonNull(turnExecutor, "turnExecutor must not be null");
            Objects.requireNonNull(voicePolicy, "voicePolicy must not be null");
        }
    }

    private final VoiceActivityDetectorFactory vadFactory;
    private final Dependencies dependencies;
    private final Map<String, VoiceSession> sessions = new ConcurrentHashMap<>();

    public VoiceSessionManager(TurnOrchestrator orchestrator,
                               ProcessRegistry registry,
                               @Qualifier("turnExecutor") Executor turnExecutor,
                               VoicePolicy voicePolicy,
                               VoiceActivityDetectorFactory vadFactory,
                               TurnProperties turnProperties) {
        this.vadFactory = Objects.requireNonNull(vadFactory, "vadFactory must not be null");
        this.dependencies = new Dependencies(orchestrator, registry, turnExecutor, voicePolicy,
                turnProperties.getHistorySize(),
                vadFactory.getProperties().getSampleRate(),
                turnProperties.getMaxPendingSegments(),
                vadFactory.getProperties().getMaxSegmentDurationMs());
    }

    /**
     * Opens a session; an existing session with the same id is closed first.
     */
    public VoiceSession open(String sessionId, SessionSink sink) {
        VoiceSession session = new VoiceSession(sessionId, sink, vadFactory.create(), dependencies);
        VoiceSession previous = sessions.put(sessionId, session);
        if (previous != null) {
            LOG.warn("Session {} reopened; closing previous instance", sessionId);
            previous.close();
        }
        LOG.info("Session {} opened ({} active)", sessionId, sessions.size());
        return session;
    }

    public void close(String sessionId) {
        VoiceSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
        }
    }

    public VoiceSession get(String sessionId) {
        return sessions.get(sessionId);
    }

    public int count() {
        return sessions.size();
    }
}
