package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.stream.PullStream;
import com.phillippitts.talkback.service.stream.PullStreams;
import com.phillippitts.talkback.service.tts.SpeechSynthesizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synthesizer producing {@code chunksPerSpan} chunks per text. Each chunk's text names the
 * span and chunk, e.g. {@code "Hallo.#0"}. Per-text start delays and failures can be scripted.
 */
public class ScriptedSpeechSynthesizer implements SpeechSynthesizer {

    public static final int SAMPLE_RATE = 24_000;

    private final int chunksPerSpan;
    private final Map<String, Long> delays = new ConcurrentHashMap<>();
    private final List<String> failing = new CopyOnWriteArrayList<>();
    private final List<String> failingMidStream = new CopyOnWriteArrayList<>();
    private final List<String> requested = new CopyOnWriteArrayList<>();

    public ScriptedSpeechSynthesizer(int chunksPerSpan) {
        this.chunksPerSpan = chunksPerSpan;
    }

    public ScriptedSpeechSynthesizer delay(String text, long millis) {
        delays.put(text, millis);
        return this;
    }

    public ScriptedSpeechSynthesizer failOn(String text) {
        failing.add(text);
        return this;
    }

    /**
     * Starts synthesis of {@code text} normally but fails on the first pull.
     */
    public ScriptedSpeechSynthesizer failStreamOn(String text) {
        failingMidStream.add(text);
        return this;
    }

    @Override
    public PullStream<AudioChunk> synthesize(String text, String voice, CancellationToken token) {
        requested.add(text);
        Long delay = delays.get(text);
        if (delay != null) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SynthesisException("interrupted", text);
            }
        }
        if (failing.contains(text)) {
            throw new SynthesisException("voice rejected", text);
        }
        if (failingMidStream.contains(text)) {
            return PullStreams.failing(ErrorKind.SYNTHESIS, "stream reset");
        }
        List<AudioChunk> chunks = new ArrayList<>();
        for (int i = 0; i < chunksPerSpan; i++) {
            chunks.add(new AudioChunk(new short[] {(short) i, 1, 2}, SAMPLE_RATE, text + "#" + i));
        }
        return PullStreams.fromList(chunks);
    }

    public List<String> requested() {
        return requested;
    }

    @Override
    public String getName() {
        return "scripted";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
