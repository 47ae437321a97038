package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.domain.ConversationExchange;
import com.phillippitts.talkback.domain.SynthesizableSpan;
import com.phillippitts.talkback.domain.Transcript;
import com.phillippitts.talkback.domain.TurnState;
import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.InvalidTurnInputException;
import com.phillippitts.talkback.service.cancel.CancellableCall;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.cancel.ProcessHandle;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;
import com.phillippitts.talkback.service.orchestration.event.TurnFinishedEvent;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.stream.PullStream;
import com.phillippitts.talkback.service.stream.StreamResult;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import com.phillippitts.talkback.service.tts.StreamingSynthesisChunker;
import com.phillippitts.talkback.util.LogSanitizer;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link TurnOrchestrator}: transcribe (audio turns), retrieve context, generate,
 * chunk, synthesize.
 *
 * <p><b>Execution:</b> the returned {@link TurnStream} does all work on the thread that pulls it.
 * Each blocking collaborator call (transcribe, retrieve, start generation, start synthesis) runs
 * on the call executor and is raced against the turn's token through {@link CancellableCall}.
 * Cancellation also closes the open generation and synthesis streams, which wakes a puller
 * blocked on them.
 *
 * <p><b>Ordering:</b> spans are synthesized one after the other and their chunks are returned
 * before the next span is pulled, so audio always follows span order.
 *
 * <p><b>Failures:</b>
 * <ul>
 *   <li>transcription failure ends the turn as FAILED without output</li>
 *   <li>an empty transcript ends the turn as REJECTED (kind {@code validation})</li>
 *   <li>a generation failure ends the turn as FAILED; text not yet spoken is dropped</li>
 *   <li>a synthesis failure skips that span only</li>
 * </ul>
 *
 * <p>Every turn leaves the {@link ProcessRegistry} exactly once and then publishes a
 * {@link TurnFinishedEvent}.
 *
 * @see DefaultTurnOrchestratorBuilder
 */
public class DefaultTurnOrchestrator implements TurnOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTurnOrchestrator.class);

    private static final int LOG_PREVIEW_CHARS = 60;

    private final ProcessRegistry registry;
    private final Transcriber transcriber;
    private final TextGenerator generator;
    private final SpeechSynthesizer synthesizer;
    private final ContextRetriever contextRetriever;
    private final PromptBuilder promptBuilder;
    private final Executor callExecutor;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metrics;
    private final int maxChunkChars;
    private final int minTranscriptChars;
    private final int contextMaxDocuments;

    DefaultTurnOrchestrator(DefaultTurnOrchestratorBuilder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        this.transcriber = Objects.requireNonNull(builder.transcriber, "transcriber must not be null");
        this.generator = Objects.requireNonNull(builder.generator, "generator must not be null");
        this.synthesizer = Objects.requireNonNull(builder.synthesizer, "synthesizer must not be null");
        this.contextRetriever = Objects.requireNonNull(builder.contextRetriever, "contextRetriever must not be null");
        this.promptBuilder = Objects.requireNonNull(builder.promptBuilder, "promptBuilder must not be null");
        this.callExecutor = Objects.requireNonNull(builder.callExecutor, "callExecutor must not be null");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics must not be null");
        this.maxChunkChars = builder.maxChunkChars;
        this.minTranscriptChars = builder.minTranscriptChars;
        this.contextMaxDocuments = builder.contextMaxDocuments;
    }

    /**
     * @throws InvalidTurnInputException for a text turn whose text is blank; nothing is registered
     */
    @Override
    public TurnStream startTurn(TurnRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (!request.isAudio() && !isUsable(request.text())) {
            throw new InvalidTurnInputException("text", "text must not be empty");
        }
        ProcessHandle handle = registry.start(request.processName(), request.metadata());
        LOG.info("Turn registered: id={}, kind={}, session={}, language={}, voice={}",
                handle.id(), request.processName(), request.metadata().sessionId(),
                request.metadata().language(), request.metadata().voice());
        return new RunningTurn(handle, request);
    }

    private boolean isUsable(String text) {
        return text != null && text.strip().length() >= minTranscriptChars;
    }

    /**
     * One turn, advanced by whoever pulls it.
     */
    private final class RunningTurn implements TurnStream {

        private final String turnId;
        private final CancellationToken token;
        private final TurnRequest request;
        private final long startNanos = System.nanoTime();
        private final AtomicBoolean finished = new AtomicBoolean();
        private final List<String> spokenSpans = new ArrayList<>();

        private volatile TurnState state = TurnState.CREATED;
        private volatile ErrorKind errorKind;
        private volatile int totalChunks;
        private volatile StreamResult<TurnEvent> terminal;
        private volatile PullStream<SynthesizableSpan> spans;
        private volatile PullStream<AudioChunk> audio;

        private String userText;
        private SynthesizableSpan currentSpan;
        private boolean spanStarted;

        RunningTurn(ProcessHandle handle, TurnRequest request) {
            this.turnId = handle.id();
            this.token = handle.token();
            this.request = request;
            token.whenCancelled().thenRun(this::closeStreams);
        }

        @Override
        public StreamResult<TurnEvent> next() {
            StreamResult<TurnEvent> done = terminal;
            if (done != null) {
                return done;
            }
            try {
                return state == TurnState.CREATED ? begin() : pump();
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure in turn {}", turnId, e);
                return fail(ErrorKind.INTERNAL, "internal error", TurnState.FAILED);
            }
        }

        private StreamResult<TurnEvent> begin() {
            if (token.isCancelled()) {
                return cancelled();
            }
            if (!request.isAudio()) {
                userText = request.text().strip();
                state = TurnState.GENERATING;
                return pump();
            }

            state = TurnState.TRANSCRIBING;
            String language = request.metadata().language();
            StreamResult<Transcript> result = CancellableCall.race(
                    () -> transcriber.transcribe(request.segment(), language),
                    token, callExecutor, ErrorKind.TRANSCRIPTION);
            switch (result.kind()) {
                case CANCELLED:
                    return cancelled();
                case ERROR:
                    LOG.warn("Transcription failed for turn {}: {}", turnId, result.detail());
                    return fail(result.errorKind(), result.detail(), TurnState.FAILED);
                default:
                    break;
            }
            Transcript transcript = result.value();
            if (!isUsable(transcript.text())) {
                LOG.info("Turn {} rejected: empty transcript", turnId);
                return fail(ErrorKind.VALIDATION, "empty transcript", TurnState.REJECTED);
            }
            userText = transcript.cleanText();
            LOG.info("Transcribed turn {}: confidence={}, text='{}'", turnId, transcript.confidence(),
                    LogSanitizer.preview(userText, LOG_PREVIEW_CHARS));
            state = TurnState.GENERATING;
            return StreamResult.value(new TurnEvent.Transcribed(transcript));
        }

        private StreamResult<TurnEvent> pump() {
            while (true) {
                if (token.isCancelled()) {
                    return cancelled();
                }
                if (spans == null) {
                    StreamResult<TurnEvent> failure = startGeneration();
                    if (failure != null) {
                        return failure;
                    }
                    continue;
                }

                PullStream<AudioChunk> currentAudio = audio;
                if (currentAudio != null) {
                    StreamResult<AudioChunk> chunk = currentAudio.next();
                    if (token.isCancelled()) {
                        closeAudio();
                        return cancelled();
                    }
                    if (chunk.isValue()) {
                        return emit(chunk.value());
                    }
                    closeAudio();
                    if (chunk.kind() == StreamResult.Kind.END_OF_STREAM) {
                        if (spanStarted) {
                            spokenSpans.add(currentSpan.text());
                        }
                        continue;
                    }
                    if (token.isCancelled()) {
                        return cancelled();
                    }
                    spanFailed(currentSpan, chunk.detail());
                    continue;
                }

                state = TurnState.GENERATING;
                StreamResult<SynthesizableSpan> span = spans.next();
                switch (span.kind()) {
                    case VALUE:
                        StreamResult<TurnEvent> failure = startSynthesis(span.value());
                        if (failure != null) {
                            return failure;
                        }
                        break;
                    case END_OF_STREAM:
                        return complete();
                    case CANCELLED:
                        if (token.isCancelled()) {
                            return cancelled();
                        }
                        return fail(ErrorKind.GENERATION, "generation stopped: " + span.detail(), TurnState.FAILED);
                    default:
                        LOG.warn("Generation failed for turn {}: {}", turnId, span.detail());
                        ErrorKind kind = span.errorKind() == null ? ErrorKind.GENERATION : span.errorKind();
                        return fail(kind, span.detail(), TurnState.FAILED);
                }
            }
        }

        private StreamResult<TurnEvent> startGeneration() {
            List<String> documents = retrieveContext();
            String prompt = promptBuilder.build(userText, documents, request.history().snapshot());
            StreamResult<PullStream<String>> started = CancellableCall.race(
                    () -> generator.generate(prompt, token),
                    token, callExecutor, ErrorKind.GENERATION, PullStream::close);
            if (started.kind() == StreamResult.Kind.CANCELLED) {
                return cancelled();
            }
            if (started.kind() == StreamResult.Kind.ERROR) {
                LOG.warn("Generation could not start for turn {}: {}", turnId, started.detail());
                return fail(started.errorKind(), started.detail(), TurnState.FAILED);
            }
            spans = StreamingSynthesisChunker.chunk(started.value(), maxChunkChars);
            if (token.isCancelled()) {
                closeStreams();
            }
            return null;
        }

        private List<String> retrieveContext() {
            if (contextMaxDocuments <= 0 || !promptBuilder.wantsContext(userText)) {
                return List.of();
            }
            StreamResult<List<String>> documents = CancellableCall.race(
                    () -> contextRetriever.retrieve(userText, contextMaxDocuments),
                    token, callExecutor, ErrorKind.INTERNAL);
            if (!documents.isValue()) {
                if (documents.kind() == StreamResult.Kind.ERROR) {
                    LOG.warn("Context retrieval failed for turn {}; continuing without context: {}",
                            turnId, documents.detail());
                }
                return List.of();
            }
            return documents.value();
        }

        private StreamResult<TurnEvent> startSynthesis(SynthesizableSpan span) {
            state = TurnState.SYNTHESIZING;
            currentSpan = span;
            spanStarted = false;
            String voice = request.metadata().voice();
            StreamResult<PullStream<AudioChunk>> started = CancellableCall.race(
                    () -> synthesizer.synthesize(span.text(), voice, token),
                    token, callExecutor, ErrorKind.SYNTHESIS, PullStream::close);
            switch (started.kind()) {
                case VALUE:
                    audio = started.value();
                    if (token.isCancelled()) {
                        closeStreams();
                    }
                    return null;
                case CANCELLED:
                    return cancelled();
                default:
                    spanFailed(span, started.detail());
                    return null;
            }
        }

        private StreamResult<TurnEvent> emit(AudioChunk chunk) {
            int number = totalChunks + 1;
            totalChunks = number;
            boolean first = !spanStarted;
            spanStarted = true;
            if (number == 1) {
                metrics.recordFirstAudio(TimeUtils.elapsedNanos(startNanos));
            }
            return StreamResult.value(new TurnEvent.Audio(number, chunk, currentSpan, first));
        }

        private void spanFailed(SynthesizableSpan span, String detail) {
            LOG.warn("Synthesis failed for span {} of turn {}; skipping: {}", span.index(), turnId, detail);
            metrics.recordSpanFailure();
        }

        private StreamResult<TurnEvent> complete() {
            if (!spokenSpans.isEmpty()) {
                request.history().append(new ConversationExchange(userText, String.join(" ", spokenSpans)));
            }
            return finish(TurnState.COMPLETED, null, StreamResult.endOfStream());
        }

        private StreamResult<TurnEvent> cancelled() {
            String reason = token.getReason() == null ? "cancelled" : token.getReason();
            return finish(TurnState.CANCELLED, null, StreamResult.cancelled(reason));
        }

        private StreamResult<TurnEvent> fail(ErrorKind kind, String detail, TurnState terminalState) {
            return finish(terminalState, kind, StreamResult.error(kind, detail, null));
        }

        private StreamResult<TurnEvent> finish(TurnState terminalState, ErrorKind kind, StreamResult<TurnEvent> result) {
            if (!finished.compareAndSet(false, true)) {
                StreamResult<TurnEvent> earlier = terminal;
                return earlier != null ? earlier : result;
            }
            errorKind = kind;
            state = terminalState;
            terminal = result;
            try {
                closeStreams();
            } finally {
                registry.cleanup(turnId);
            }
            long durationNanos = TimeUtils.elapsedNanos(startNanos);
            metrics.recordTurnFinished(terminalState, durationNanos);
            LOG.info("Turn finished: id={}, state={}, chunks={}, durationMs={}",
                    turnId, terminalState, totalChunks, TimeUtils.nanosToMillis(durationNanos));
            try {
                publisher.publishEvent(new TurnFinishedEvent(turnId, request.metadata().sessionId(),
                        terminalState, kind, totalChunks, TimeUtils.nanosToMillis(durationNanos)));
            } catch (RuntimeException e) {
                LOG.warn("TurnFinishedEvent listener failed for turn {}", turnId, e);
            }
            return result;
        }

        private void closeAudio() {
            PullStream<AudioChunk> current = audio;
            audio = null;
            closeQuietly(current, "synthesis");
        }

        private void closeStreams() {
            closeQuietly(audio, "synthesis");
            closeQuietly(spans, "generation");
        }

        private void closeQuietly(PullStream<?> stream, String what) {
            if (stream == null) {
                return;
            }
            try {
                stream.close();
            } catch (RuntimeException e) {
                LOG.warn("Closing the {} stream of turn {} failed", what, turnId, e);
            }
        }

        @Override
        public void close() {
            if (!finished.get()) {
                token.cancel("turn stream closed");
                cancelled();
            }
        }

        @Override
        public boolean cancel(String reason) {
            return token.cancel(reason);
        }

        @Override
        public String getTurnId() {
            return turnId;
        }

        @Override
        public TurnState getState() {
            return state;
        }

        @Override
        public ErrorKind getErrorKind() {
            return errorKind;
        }

        @Override
        public int getTotalChunks() {
            return totalChunks;
        }
    }
}
