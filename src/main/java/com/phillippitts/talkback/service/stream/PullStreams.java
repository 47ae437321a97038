package com.phillippitts.talkback.service.stream;

import com.phillippitts.talkback.exception.ErrorKind;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Factory methods for simple in-memory {@link PullStream}s.
 */
public final class PullStreams {

    private PullStreams() {
        // Utility class - prevent instantiation
    }

    @SafeVarargs
    public static <T> PullStream<T> of(T... values) {
        return fromList(List.of(values), null);
    }

    /**
     * Stream over the given values that ends with {@link StreamResult.Kind#END_OF_STREAM}.
     */
    public static <T> PullStream<T> fromList(List<T> values) {
        return fromList(values, null);
    }

    /**
     * Stream over {@code values} that ends with the given terminal result instead of end of stream.
     */
    public static <T> PullStream<T> fromList(List<T> values, StreamResult<T> terminal) {
        Objects.requireNonNull(values, "values must not be null");
        if (terminal != null && terminal.isValue()) {
            throw new IllegalArgumentException("terminal must not be a value result");
        }
        Iterator<T> it = List.copyOf(values).iterator();
        StreamResult<T> end = terminal == null ? StreamResult.endOfStream() : terminal;
        AtomicBoolean closed = new AtomicBoolean();
        return new PullStream<>() {
            @Override
            public StreamResult<T> next() {
                if (closed.get()) {
                    return StreamResult.cancelled("stream closed");
                }
                return it.hasNext() ? StreamResult.value(it.next()) : end;
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };
    }

    /**
     * Stream that fails on the first pull.
     */
    public static <T> PullStream<T> failing(ErrorKind kind, String detail) {
        return fromList(List.of(), StreamResult.error(kind, detail, null));
    }
}
