package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.SynthesizableSpan;
import com.phillippitts.talkback.domain.SynthesizableSpan.Boundary;
import com.phillippitts.talkback.service.stream.PullStream;
import com.phillippitts.talkback.service.stream.StreamResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-segments a stream of generated text fragments into spans worth synthesizing.
 *
 * <p>After each fragment the buffer is tested, in priority order, for:
 * <ol>
 *   <li>a sentence end ({@code . ! ?} or newline): cut after the last one</li>
 *   <li>a clause break ({@code , ; :} or a dash surrounded by spaces): cut after the last one</li>
 *   <li>a buffer longer than {@code maxChars}: cut at the last whitespace before {@code maxChars},
 *       or the first one after it, keeping the partial word in the buffer</li>
 * </ol>
 * A candidate without any letter or digit (a lone {@code "."}) is not cut off on its own; it
 * stays in the buffer and leads the next span. Spans are trimmed, so only whitespace at span
 * boundaries is lost; every other character is emitted exactly once and in order.
 *
 * <p>{@link #finish()} flushes whatever is left when the fragment stream ends. That final span
 * may end inside a word if the generator itself stopped mid-word.
 *
 * <p>Not thread-safe; use one instance per turn.
 */
public final class StreamingSynthesisChunker {

    private static final String CLAUSE_MARKS = ",;:";
    private static final String[] DASHES = {" - ", " – "};

    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();
    private int nextIndex;
    private boolean finished;

    public StreamingSynthesisChunker(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive, got: " + maxChars);
        }
        this.maxChars = maxChars;
    }

    /**
     * Appends a fragment and returns the spans that became ready, possibly none.
     *
     * @throws IllegalStateException after {@link #finish()}
     */
    public List<SynthesizableSpan> offer(String fragment) {
        if (finished) {
            throw new IllegalStateException("Chunker already finished");
        }
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        buffer.append(fragment);
        List<SynthesizableSpan> ready = new ArrayList<>(1);
        SynthesizableSpan span;
        while ((span = cutNext()) != null) {
            ready.add(span);
        }
        return ready;
    }

    /**
     * Flushes the remaining buffer as the final span. Idempotent.
     */
    public Optional<SynthesizableSpan> finish() {
        finished = true;
        String rest = buffer.toString().strip();
        buffer.setLength(0);
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SynthesizableSpan(rest, nextIndex++, Boundary.FINAL));
    }

    /**
     * Text accepted but not yet emitted.
     */
    public String pending() {
        return buffer.toString();
    }

    private SynthesizableSpan cutNext() {
        int cut = lastIndexOfAny(buffer, ".!?\n");
        if (cut >= 0 && hasSpeakableText(cut + 1)) {
            return emit(cut + 1, Boundary.SENTENCE);
        }
        cut = lastClauseEnd();
        if (cut > 0 && hasSpeakableText(cut)) {
            return emit(cut, Boundary.CLAUSE);
        }
        if (buffer.length() > maxChars) {
            cut = wordBoundary();
            if (cut > 0 && hasSpeakableText(cut)) {
                return emit(cut, Boundary.WORD);
            }
        }
        return null;
    }

    /**
     * Exclusive end of the last clause mark, or -1.
     */
    private int lastClauseEnd() {
        int end = lastIndexOfAny(buffer, CLAUSE_MARKS) + 1;
        for (String dash : DASHES) {
            int at = buffer.lastIndexOf(dash);
            if (at >= 0) {
                // cut after the dash, leave the following space for trimming
                end = Math.max(end, at + dash.length() - 1);
            }
        }
        return end == 0 ? -1 : end;
    }

    /**
     * Whitespace position to cut at when the buffer is too long, or -1 when the buffer holds a
     * single unfinished word.
     */
    private int wordBoundary() {
        for (int i = Math.min(maxChars, buffer.length()) - 1; i > 0; i--) {
            if (Character.isWhitespace(buffer.charAt(i))) {
                return i;
            }
        }
        for (int i = maxChars; i < buffer.length(); i++) {
            if (Character.isWhitespace(buffer.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private boolean hasSpeakableText(int end) {
        for (int i = 0; i < end; i++) {
            if (Character.isLetterOrDigit(buffer.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private SynthesizableSpan emit(int end, Boundary boundary) {
        String text = buffer.substring(0, end).strip();
        buffer.delete(0, end);
        int lead = 0;
        while (lead < buffer.length() && Character.isWhitespace(buffer.charAt(lead))) {
            lead++;
        }
        buffer.delete(0, lead);
        return new SynthesizableSpan(text, nextIndex++, boundary);
    }

    private static int lastIndexOfAny(CharSequence text, String chars) {
        for (int i = text.length() - 1; i >= 0; i--) {
            if (chars.indexOf(text.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Lazily chunks a fragment stream. Pulling the returned stream pulls fragments as needed.
     *
     * <p>On end of stream the remaining buffer is flushed as a final span. Errors and
     * cancellation from the fragment stream are forwarded as-is and the buffered remainder is
     * discarded. Closing the returned stream closes the fragment stream.
     */
    public static PullStream<SynthesizableSpan> chunk(PullStream<String> fragments, int maxChars) {
        return new SpanStream(fragments, new StreamingSynthesisChunker(maxChars));
    }

    private static final class SpanStream implements PullStream<SynthesizableSpan> {

        private final PullStream<String> fragments;
        private final StreamingSynthesisChunker chunker;
        private final Deque<SynthesizableSpan> ready = new ArrayDeque<>();
        private StreamResult<SynthesizableSpan> terminal;

        SpanStream(PullStream<String> fragments, StreamingSynthesisChunker chunker) {
            this.fragments = Objects.requireNonNull(fragments, "fragments must not be null");
            this.chunker = chunker;
        }

        @Override
        public StreamResult<SynthesizableSpan> next() {
            while (ready.isEmpty() && terminal == null) {
                StreamResult<String> fragment = fragments.next();
                switch (fragment.kind()) {
                    case VALUE -> ready.addAll(chunker.offer(fragment.value()));
                    case END_OF_STREAM -> {
                        chunker.finish().ifPresent(ready::add);
                        terminal = StreamResult.endOfStream();
                    }
                    default -> terminal = fragment.propagate();
                }
            }
            if (!ready.isEmpty()) {
                return StreamResult.value(ready.removeFirst());
            }
            return terminal;
        }

        @Override
        public void close() {
            fragments.close();
        }
    }
}
