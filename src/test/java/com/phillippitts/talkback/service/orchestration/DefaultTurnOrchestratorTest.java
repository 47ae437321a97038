package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.domain.TurnMetadata;
import com.phillippitts.talkback.domain.TurnState;
import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.InvalidTurnInputException;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import com.phillippitts.talkback.service.llm.TextGenerator;
import com.phillippitts.talkback.service.metrics.TurnMetrics;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;
import com.phillippitts.talkback.service.orchestration.event.TurnFinishedEvent;
import com.phillippitts.talkback.service.rag.ContextRetriever;
import com.phillippitts.talkback.service.stream.PullStream;
import com.phillippitts.talkback.service.stream.PullStreams;
import com.phillippitts.talkback.service.stream.QueueStream;
import com.phillippitts.talkback.service.stream.StreamResult;
import com.phillippitts.talkback.service.stt.Transcriber;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;
import com.phillippitts.talkback.testutil.EventCapturingPublisher;
import com.phillippitts.talkback.testutil.ScriptedSpeechSynthesizer;
import com.phillippitts.talkback.testutil.ScriptedTextGenerator;
import com.phillippitts.talkback.testutil.ScriptedTranscriber;
import com.phillippitts.talkback.testutil.SyncExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultTurnOrchestratorTest {

    private static final TurnMetadata META = TurnMetadata.of("s-1", "de-DE", "de-DE-Chirp3-HD-Charon");

    private ProcessRegistry registry;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meters;
    private ConversationHistory history;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry();
        publisher = new EventCapturingPublisher();
        meters = new SimpleMeterRegistry();
        history = new ConversationHistory(10);
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void audioFollowsSpanOrderDespiteUnevenSynthesisLatency() {
        ScriptedSpeechSynthesizer tts = new ScriptedSpeechSynthesizer(2)
                .delay("Hallo,", 80)
                .delay("Gut.", 5);
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("Hallo, wie", " geht es dir?", " Gut."),
                tts, pool);

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Wie geht's?", META, history));
        Drained drained = drain(turn);

        assertThat(drained.audio()).extracting(a -> a.chunk().text()).containsExactly(
                "Hallo,#0", "Hallo,#1",
                "wie geht es dir?#0", "wie geht es dir?#1",
                "Gut.#0", "Gut.#1");
        assertThat(drained.audio()).extracting(TurnEvent.Audio::chunkNumber).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(drained.audio()).extracting(TurnEvent.Audio::spanStart)
                .containsExactly(true, false, true, false, true, false);
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.END_OF_STREAM);
        assertThat(turn.getState()).isEqualTo(TurnState.COMPLETED);
        assertThat(turn.getTotalChunks()).isEqualTo(6);
        assertThat(registry.count()).isZero();
    }

    @Test
    void audioTurnStartsWithTranscription() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("  Wie spät ist es?  "),
                ScriptedTextGenerator.fragments("Es ist zwölf."),
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.audio(segment(), META, history));
        Drained drained = drain(turn);

        assertThat(drained.events().get(0)).isInstanceOf(TurnEvent.Transcribed.class);
        TurnEvent.Transcribed transcribed = (TurnEvent.Transcribed) drained.events().get(0);
        assertThat(transcribed.transcript().cleanText()).isEqualTo("Wie spät ist es?");
        assertThat(transcribed.transcript().languageCode()).isEqualTo("de-DE");
        assertThat(drained.audio()).hasSize(1);
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.END_OF_STREAM);
    }

    @Test
    void failedSpanIsSkippedAndTurnCompletes() {
        ScriptedSpeechSynthesizer tts = new ScriptedSpeechSynthesizer(1).failOn("wie geht es dir?");
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("Hallo, wie", " geht es dir?", " Gut."),
                tts, new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Hallo", META, history));
        Drained drained = drain(turn);

        assertThat(drained.audio()).extracting(a -> a.span().text()).containsExactly("Hallo,", "Gut.");
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.END_OF_STREAM);
        Counter failures = meters.find("talkback.span.failure").counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
        assertThat(history.snapshot()).hasSize(1);
        assertThat(history.snapshot().get(0).assistantText()).isEqualTo("Hallo, Gut.");
    }

    @Test
    void spanWhoseAudioStreamFailsIsSkipped() {
        ScriptedSpeechSynthesizer tts = new ScriptedSpeechSynthesizer(1).failStreamOn("Hallo,");
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("Hallo, wie", " geht es dir?"),
                tts, new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Hallo", META, history));
        Drained drained = drain(turn);

        assertThat(drained.audio()).extracting(a -> a.span().text()).containsExactly("wie geht es dir?");
        assertThat(drained.audio().get(0).chunkNumber()).isEqualTo(1);
        assertThat(drained.audio().get(0).spanStart()).isTrue();
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.END_OF_STREAM);
        assertThat(history.snapshot().get(0).assistantText()).isEqualTo("wie geht es dir?");
    }

    @Test
    void transcriptionFailureFailsTurnWithoutGenerating() {
        ScriptedTextGenerator llm = ScriptedTextGenerator.fragments("nie");
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.failing(), llm, new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.audio(segment(), META, history));
        Drained drained = drain(turn);

        assertThat(drained.events()).isEmpty();
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.ERROR);
        assertThat(drained.terminal().errorKind()).isEqualTo(ErrorKind.TRANSCRIPTION);
        assertThat(turn.getState()).isEqualTo(TurnState.FAILED);
        assertThat(llm.prompts()).isEmpty();
        assertThat(registry.count()).isZero();
    }

    @Test
    void emptyTranscriptRejectsTurn() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("   "),
                ScriptedTextGenerator.fragments("nie"),
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.audio(segment(), META, history));
        StreamResult<TurnEvent> result = turn.next();

        assertThat(result.kind()).isEqualTo(StreamResult.Kind.ERROR);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(turn.getState()).isEqualTo(TurnState.REJECTED);
        assertThat(publisher.finishedEvents()).extracting(TurnFinishedEvent::state)
                .containsExactly(TurnState.REJECTED);
    }

    @Test
    void blankTextIsRejectedBeforeRegistration() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("nie"),
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        assertThatThrownBy(() -> orchestrator.startTurn(TurnRequest.text("  ", META, history)))
                .isInstanceOf(InvalidTurnInputException.class);
        assertThat(registry.count()).isZero();
        assertThat(publisher.finishedEvents()).isEmpty();
    }

    @Test
    void generationErrorFailsTurnAfterSpokenSpans() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.failingAfter("Eins. Zwei"),
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Zähl mal", META, history));
        Drained drained = drain(turn);

        assertThat(drained.audio()).extracting(a -> a.span().text()).containsExactly("Eins.");
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.ERROR);
        assertThat(drained.terminal().errorKind()).isEqualTo(ErrorKind.GENERATION);
        assertThat(turn.getErrorKind()).isEqualTo(ErrorKind.GENERATION);
        assertThat(history.size()).isZero();
    }

    @Test
    void stopWakesBlockedTurnAndCleansUpOnce() throws Exception {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.hangingAfter("Hallo. "),
                new ScriptedSpeechSynthesizer(2), pool);

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Erzähl was", META, history));
        CompletableFuture<Drained> pulling = CompletableFuture.supplyAsync(() -> drain(turn), pool);

        await().atMost(Duration.ofSeconds(2)).until(() -> turn.getTotalChunks() == 2);
        assertThat(registry.stop(turn.getTurnId(), "user stop")).isTrue();

        Drained drained = pulling.get(2, TimeUnit.SECONDS);
        assertThat(drained.audio()).hasSize(2);
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.CANCELLED);
        assertThat(drained.terminal().detail()).isEqualTo("user stop");
        assertThat(turn.getState()).isEqualTo(TurnState.CANCELLED);
        assertThat(registry.count()).isZero();
        assertThat(publisher.finishedEvents()).hasSize(1);

        turn.close();
        assertThat(turn.next().kind()).isEqualTo(StreamResult.Kind.CANCELLED);
        assertThat(publisher.finishedEvents()).hasSize(1);
    }

    @Test
    void stopDuringQueueBackedStreamsCancelsAndCleansUp() throws Exception {
        TextGenerator llm = new TextGenerator() {
            @Override
            public PullStream<String> generate(String prompt, CancellationToken token) {
                QueueStream<String> fragments = new QueueStream<>(4, token);
                fragments.emit("Hallo. ");
                return fragments;
            }

            @Override
            public String getName() {
                return "queued-llm";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        SpeechSynthesizer tts = new SpeechSynthesizer() {
            @Override
            public PullStream<AudioChunk> synthesize(String text, String voice, CancellationToken token) {
                QueueStream<AudioChunk> chunks = new QueueStream<>(4, token);
                chunks.emit(new AudioChunk(new short[240], 24_000, text));
                chunks.complete();
                return chunks;
            }

            @Override
            public String getName() {
                return "queued-tts";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        DefaultTurnOrchestrator orchestrator = orchestrator(ScriptedTranscriber.returning("unused"), llm, tts, pool);

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Erzähl was", META, history));
        CompletableFuture<Drained> pulling = CompletableFuture.supplyAsync(() -> drain(turn), pool);

        await().atMost(Duration.ofSeconds(2)).until(() -> turn.getTotalChunks() == 1);
        assertThat(registry.stop(turn.getTurnId(), "user stop")).isTrue();

        Drained drained = pulling.get(2, TimeUnit.SECONDS);
        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.CANCELLED);
        assertThat(drained.terminal().detail()).isEqualTo("user stop");
        assertThat(registry.count()).isZero();
        assertThat(publisher.finishedEvents()).hasSize(1);
        assertThatCode(turn::close).doesNotThrowAnyException();
    }

    @Test
    void chunkArrivingAfterStopIsDiscarded() {
        SpeechSynthesizer tts = new SpeechSynthesizer() {
            @Override
            public PullStream<AudioChunk> synthesize(String text, String voice, CancellationToken token) {
                return new PullStream<>() {
                    @Override
                    public StreamResult<AudioChunk> next() {
                        token.cancel("user stop");
                        return StreamResult.value(new AudioChunk(new short[240], 24_000, text));
                    }

                    @Override
                    public void close() {
                        // nothing held
                    }
                };
            }

            @Override
            public String getName() {
                return "late-tts";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        DefaultTurnOrchestrator orchestrator = orchestrator(ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("Hallo."), tts, new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Hallo", META, history));
        StreamResult<TurnEvent> first = turn.next();

        assertThat(first.kind()).isEqualTo(StreamResult.Kind.CANCELLED);
        assertThat(first.detail()).isEqualTo("user stop");
        assertThat(turn.getTotalChunks()).isZero();
        assertThat(registry.count()).isZero();
        assertThat(history.size()).isZero();
    }

    @Test
    void failingStreamCloseStillCleansUpRegistry() {
        TextGenerator llm = new TextGenerator() {
            @Override
            public PullStream<String> generate(String prompt, CancellationToken token) {
                PullStream<String> fragments = PullStreams.of("Eins.");
                return new PullStream<>() {
                    @Override
                    public StreamResult<String> next() {
                        return fragments.next();
                    }

                    @Override
                    public void close() {
                        throw new IllegalStateException("connection already disposed");
                    }
                };
            }

            @Override
            public String getName() {
                return "brittle-llm";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        DefaultTurnOrchestrator orchestrator = orchestrator(ScriptedTranscriber.returning("unused"), llm,
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Zähl", META, history));
        Drained drained = drain(turn);

        assertThat(drained.terminal().kind()).isEqualTo(StreamResult.Kind.END_OF_STREAM);
        assertThat(turn.getState()).isEqualTo(TurnState.COMPLETED);
        assertThat(registry.count()).isZero();
        assertThat(publisher.finishedEvents()).hasSize(1);
    }

    @Test
    void closingUnstartedTurnCancelsAndUnregisters() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("nie"),
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Hallo", META, history));
        assertThat(registry.count()).isEqualTo(1);

        turn.close();

        assertThat(turn.getState()).isEqualTo(TurnState.CANCELLED);
        assertThat(registry.count()).isZero();
    }

    @Test
    void completedTurnIsAddedToHistoryAndUsedInNextPrompt() {
        ScriptedTextGenerator llm = ScriptedTextGenerator.fragments("Mir geht es gut.");
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"), llm,
                new ScriptedSpeechSynthesizer(1), new SyncExecutor());

        drain(orchestrator.startTurn(TurnRequest.text("Wie geht es dir?", META, history)));
        drain(orchestrator.startTurn(TurnRequest.text("Und sonst?", META, history)));

        assertThat(history.snapshot()).hasSize(2);
        assertThat(llm.prompts().get(0)).doesNotContain("Verlauf:");
        assertThat(llm.prompts().get(1))
                .contains("Verlauf:\nNutzer: Wie geht es dir?\nAssistent: Mir geht es gut.")
                .endsWith("Frage: Und sonst?");
    }

    @Test
    void retrievedContextIsPartOfPrompt() {
        ContextRetriever retriever = mock(ContextRetriever.class);
        when(retriever.retrieve(anyString(), anyInt())).thenReturn(List.of("Berlin liegt an der Spree."));
        ScriptedTextGenerator llm = ScriptedTextGenerator.fragments("An der Spree.");
        DefaultTurnOrchestrator orchestrator = builder(ScriptedTranscriber.returning("unused"), llm,
                new ScriptedSpeechSynthesizer(1), new SyncExecutor())
                .contextRetriever(retriever)
                .build();

        drain(orchestrator.startTurn(TurnRequest.text("An welchem Fluss liegt Berlin?", META, history)));

        assertThat(llm.prompts().get(0)).contains("Kontext:\nBerlin liegt an der Spree.");
    }

    @Test
    void publishesOneFinishedEventAndRecordsOutcome() {
        DefaultTurnOrchestrator orchestrator = orchestrator(
                ScriptedTranscriber.returning("unused"),
                ScriptedTextGenerator.fragments("Eins."),
                new ScriptedSpeechSynthesizer(3), new SyncExecutor());

        TurnStream turn = orchestrator.startTurn(TurnRequest.text("Zähl", META, history));
        drain(turn);

        List<TurnFinishedEvent> events = publisher.finishedEvents();
        assertThat(events).hasSize(1);
        assertThat(events.get(0).turnId()).isEqualTo(turn.getTurnId());
        assertThat(events.get(0).sessionId()).isEqualTo("s-1");
        assertThat(events.get(0).state()).isEqualTo(TurnState.COMPLETED);
        assertThat(events.get(0).totalChunks()).isEqualTo(3);
        Counter completed = meters.find("talkback.turn.outcome").tag("outcome", "completed").counter();
        assertThat(completed).isNotNull();
        assertThat(completed.count()).isEqualTo(1.0);
        assertThat(meters.find("talkback.turn.first_audio").timer()).isNotNull();
    }

    private DefaultTurnOrchestrator orchestrator(Transcriber stt, TextGenerator llm, SpeechSynthesizer tts,
                                                 Executor executor) {
        return builder(stt, llm, tts, executor).build();
    }

    private DefaultTurnOrchestratorBuilder builder(Transcriber stt, TextGenerator llm, SpeechSynthesizer tts,
                                                   Executor executor) {
        return DefaultTurnOrchestratorBuilder.builder()
                .registry(registry)
                .transcriber(stt)
                .generator(llm)
                .synthesizer(tts)
                .callExecutor(executor)
                .publisher(publisher)
                .metrics(new TurnMetricsPublisher(new TurnMetrics(meters)))
                .promptBuilder(new PromptBuilder("Du bist ein Testassistent.", 10));
    }

    private static SpeechSegment segment() {
        return new SpeechSegment(new float[1600], 16_000, 0, 100);
    }

    private static Drained drain(TurnStream turn) {
        List<TurnEvent> events = new ArrayList<>();
        StreamResult<TurnEvent> result = turn.next();
        while (result.isValue()) {
            events.add(result.value());
            result = turn.next();
        }
        return new Drained(events, result);
    }

    private record Drained(List<TurnEvent> events, StreamResult<TurnEvent> terminal) {
        List<TurnEvent.Audio> audio() {
            return events.stream()
                    .filter(e -> e instanceof TurnEvent.Audio)
                    .map(e -> (TurnEvent.Audio) e)
                    .toList();
        }
    }
}
