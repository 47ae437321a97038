package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.domain.AudioFrame;
import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.domain.Transcript;
import com.phillippitts.talkback.domain.TurnMetadata;
import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.InvalidTurnInputException;
import com.phillippitts.talkback.exception.TurnConflictException;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.orchestration.ConversationHistory;
import com.phillippitts.talkback.service.orchestration.TurnEvent;
import com.phillippitts.talkback.service.orchestration.TurnGate;
import com.phillippitts.talkback.service.orchestration.TurnOrchestrator;
import com.phillippitts.talkback.service.orchestration.TurnRequest;
import com.phillippitts.talkback.service.orchestration.TurnStream;
import com.phillippitts.talkback.service.orchestration.VoicePolicy;
import com.phillippitts.talkback.service.stream.StreamResult;
import com.phillippitts.talkback.service.vad.VadDecision;
import com.phillippitts.talkback.service.vad.VoiceActivityDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One client connection: routes inbound messages, owns the connection's voice activity detector
 * and conversation history, and runs at most one turn at a time.
 *
 * <p><b>Threads:</b> {@link #handle(InboundMessage)} is called sequentially by the transport.
 * Each turn is pulled to completion on the turn executor, which sends the turn's messages
 * through the {@link SessionSink}.
 *
 * <p><b>Busy policy:</b> speech segments detected while a turn is active are queued (oldest
 * dropped beyond {@code maxPendingSegments}) and started when the turn ends. A text prompt or
 * explicit audio turn arriving while busy is rejected with {@code turn_conflict}.
 */
public class VoiceSession {

    private static final Logger LOG = LogManager.getLogger(VoiceSession.class);

    static final String SESSION_CLOSED = "session closed";
    private static final String STOPPED_BY_CLIENT = "stopped by client";

    private final String id;
    private final SessionSink sink;
    private final VoiceActivityDetector vad;
    private final TurnOrchestrator orchestrator;
    private final ProcessRegistry registry;
    private final Executor turnExecutor;
    private final VoicePolicy voicePolicy;
    private final ConversationHistory history;
    private final int sampleRate;
    private final int maxPendingSegments;
    private final long maxSegmentDurationMs;

    private final TurnGate gate = new TurnGate();
    private final Lock pendingLock = new ReentrantLock();
    private final Deque<SpeechSegment> pending = new ArrayDeque<>();

    private volatile TurnStream activeTurn;
    private volatile boolean closed;
    private volatile String voice;
    private volatile String language;
    private long receivedSamples;

    VoiceSession(String id, SessionSink sink, VoiceActivityDetector vad, VoiceSessionManager.Dependencies deps) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.vad = Objects.requireNonNull(vad, "vad must not be null");
        this.orchestrator = deps.orchestrator();
        this.registry = deps.registry();
        this.turnExecutor = deps.turnExecutor();
        this.voicePolicy = deps.voicePolicy();
        this.history = new ConversationHistory(deps.historySize());
        this.sampleRate = deps.sampleRate();
        this.maxPendingSegments = deps.maxPendingSegments();
        this.maxSegmentDurationMs = deps.maxSegmentDurationMs();
        this.voice = voicePolicy.getDefaultVoice();
        this.language = voicePolicy.getDefaultLanguage();
    }

    /**
     * Applies one decoded client message.
     */
    public void handle(InboundMessage message) {
        if (closed) {
            LOG.debug("Message for closed session {} ignored", id);
            return;
        }
        if (message instanceof InboundMessage.AudioFrameMessage frame) {
            onAudioFrame(frame);
        } else if (message instanceof InboundMessage.EndAudio) {
            vad.forceFlush().ifPresent(this::submitSegment);
        } else if (message instanceof InboundMessage.TextPrompt prompt) {
            onTextPrompt(prompt);
        } else if (message instanceof InboundMessage.StartTurn start) {
            onStartTurn(start);
        } else if (message instanceof InboundMessage.StopTurn stop) {
            boolean stopped = registry.stop(stop.id(), reasonOr(stop.reason(), STOPPED_BY_CLIENT));
            sink.send(OutboundMessage.turnStopped(stop.id(), stopped));
        } else if (message instanceof InboundMessage.StopAll stopAll) {
            int stopped = registry.stopAll(reasonOr(stopAll.reason(), STOPPED_BY_CLIENT));
            sink.send(OutboundMessage.allTurnsStopped(stopped));
        } else {
            LOG.warn("Unhandled message type {} in session {}", message.getClass().getSimpleName(), id);
        }
    }

    private void onAudioFrame(InboundMessage.AudioFrameMessage message) {
        long timestampMs = message.timestampMs() != null
                ? message.timestampMs()
                : receivedSamples * 1000L / sampleRate;
        receivedSamples += message.samples().length;
        VadDecision decision = vad.process(new AudioFrame(message.samples(), sampleRate, timestampMs));
        if (decision.shouldFlush()) {
            submitSegment(decision.segment());
        } else if (maxSegmentDurationMs > 0 && vad.isSpeaking()
                && vad.bufferedDurationMs() >= maxSegmentDurationMs) {
            LOG.info("Segment reached {} ms in session {}; forcing flush", maxSegmentDurationMs, id);
            vad.forceFlush().ifPresent(this::submitSegment);
        }
    }

    private void onTextPrompt(InboundMessage.TextPrompt prompt) {
        updatePreferences(prompt.voice(), prompt.language());
        if (!gate.tryReserve()) {
            rejectConflict();
            return;
        }
        launch(TurnRequest.text(prompt.text(), metadata(Map.of()), history));
    }

    private void onStartTurn(InboundMessage.StartTurn start) {
        updatePreferences(start.voice(), start.language());
        if (!gate.tryReserve()) {
            rejectConflict();
            return;
        }
        AudioFrame recording = new AudioFrame(start.samples(), sampleRate, 0);
        SpeechSegment segment = SpeechSegment.of(List.of(recording), recording.durationMs());
        launch(TurnRequest.audio(segment, metadata(start.metadata()), history));
    }

    private void updatePreferences(String requestedVoice, String requestedLanguage) {
        if (requestedVoice != null) {
            voice = voicePolicy.resolveVoice(requestedVoice);
        }
        if (requestedLanguage != null) {
            language = voicePolicy.resolveLanguage(requestedLanguage);
        }
    }

    private TurnMetadata metadata(Map<String, String> attributes) {
        return new TurnMetadata(id, language, voice, attributes);
    }

    private void rejectConflict() {
        TurnConflictException conflict = new TurnConflictException(gate.getActiveTurn());
        LOG.info("Turn request rejected in session {}: {}", id, conflict.getMessage());
        sink.send(OutboundMessage.turnError(null, conflict.getErrorKind(), conflict.getMessage()));
    }

    /**
     * Starts a turn for the segment or queues it. Reserve-or-enqueue and the turn worker's
     * release-then-dequeue both run under {@code pendingLock}, so a queued segment always has a
     * turn ahead of it that will pick it up.
     */
    private void submitSegment(SpeechSegment segment) {
        pendingLock.lock();
        try {
            if (!gate.tryReserve()) {
                enqueue(segment);
                return;
            }
        } finally {
            pendingLock.unlock();
        }
        launch(TurnRequest.audio(segment, metadata(Map.of()), history));
    }

    private void enqueue(SpeechSegment segment) {
        if (maxPendingSegments == 0) {
            LOG.info("Segment dropped in busy session {} (queueing disabled)", id);
            return;
        }
        pending.addLast(segment);
        while (pending.size() > maxPendingSegments) {
            pending.removeFirst();
            LOG.info("Oldest pending segment dropped in session {}", id);
        }
    }

    /**
     * Starts a turn on a reserved gate.
     */
    private void launch(TurnRequest request) {
        TurnStream turn;
        try {
            turn = orchestrator.startTurn(request);
        } catch (InvalidTurnInputException e) {
            sink.send(OutboundMessage.turnError(null, e.getErrorKind(), e.getMessage()));
            releaseAndStartNext(null);
            return;
        } catch (RuntimeException e) {
            LOG.error("Turn could not be started in session {}", id, e);
            sink.send(OutboundMessage.turnError(null, ErrorKind.INTERNAL, "turn could not be started"));
            releaseAndStartNext(null);
            return;
        }
        String turnId = turn.getTurnId();
        gate.bind(turnId);
        activeTurn = turn;
        sink.send(OutboundMessage.turnStarted(turnId, request.isAudio() ? "audio" : "text"));
        try {
            turnExecutor.execute(() -> drive(turn));
        } catch (RejectedExecutionException e) {
            LOG.warn("Turn executor saturated; turn {} in session {} not run", turnId, id);
            turn.close();
            activeTurn = null;
            sink.send(OutboundMessage.turnError(turnId, ErrorKind.INTERNAL, "server busy"));
            releaseAndStartNext(turnId);
        }
    }

    /**
     * Pulls one turn to its end on the turn executor and forwards its events.
     */
    private void drive(TurnStream turn) {
        String turnId = turn.getTurnId();
        ThreadContext.put("sessionId", id);
        ThreadContext.put("turnId", turnId);
        try {
            StreamResult<TurnEvent> result = turn.next();
            while (result.isValue()) {
                deliver(turnId, result.value());
                result = turn.next();
            }
            switch (result.kind()) {
                case END_OF_STREAM -> sink.send(OutboundMessage.turnEnd(turnId, turn.getTotalChunks()));
                case CANCELLED -> sink.send(OutboundMessage.turnCancelled(turnId, result.detail()));
                default -> sink.send(OutboundMessage.turnError(turnId, result.errorKind(), result.detail()));
            }
        } catch (RuntimeException e) {
            LOG.error("Turn {} aborted in session {}", turnId, id, e);
            sink.send(OutboundMessage.turnError(turnId, ErrorKind.INTERNAL, "internal error"));
        } finally {
            turn.close();
            activeTurn = null;
            ThreadContext.remove("turnId");
            ThreadContext.remove("sessionId");
            releaseAndStartNext(turnId);
        }
    }

    private void deliver(String turnId, TurnEvent event) {
        if (event instanceof TurnEvent.Transcribed transcribed) {
            Transcript transcript = transcribed.transcript();
            sink.send(OutboundMessage.transcription(turnId, transcript.cleanText(),
                    transcript.confidence(), transcript.languageCode()));
        } else if (event instanceof TurnEvent.Audio audio) {
            sink.send(OutboundMessage.audioChunk(turnId, audio.chunkNumber(), audio.chunk().sampleRate(),
                    audio.chunk().samples(), audio.spanStart() ? audio.span().text() : null));
        }
    }

    /**
     * Frees the gate held by {@code turnId} and starts the oldest queued segment, if any.
     */
    private void releaseAndStartNext(String turnId) {
        SpeechSegment next;
        pendingLock.lock();
        try {
            gate.release(turnId);
            next = closed ? null : pending.peekFirst();
            if (next == null || !gate.tryReserve()) {
                return;
            }
            pending.removeFirst();
        } finally {
            pendingLock.unlock();
        }
        LOG.debug("Starting queued segment in session {}", id);
        launch(TurnRequest.audio(next, metadata(Map.of()), history));
    }

    /**
     * Ends the session: the active turn is cancelled, queued and buffered speech is discarded.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pendingLock.lock();
        try {
            pending.clear();
        } finally {
            pendingLock.unlock();
        }
        vad.forceFlush();
        TurnStream turn = activeTurn;
        if (turn != null) {
            turn.cancel(SESSION_CLOSED);
        }
        LOG.info("Session {} closed", id);
    }

    private static String reasonOr(String reason, String fallback) {
        return reason == null || reason.isBlank() ? fallback : reason;
    }

    public String getId() {
        return id;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isTurnActive() {
        return gate.isBusy();
    }

    public ConversationHistory getHistory() {
        return history;
    }

    int pendingSegments() {
        pendingLock.lock();
        try {
            return pending.size();
        } finally {
            pendingLock.unlock();
        }
    }
}
