package com.phillippitts.talkback.service.stream;

import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.service.cancel.CancellationToken;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded bridge between one blocking producer thread and one pulling consumer.
 *
 * <p>The producer calls {@link #emit(Object)} for every element and finishes with exactly one of
 * {@link #complete()} or {@link #fail(ErrorKind, String, Throwable)}. The consumer pulls with
 * {@link #next()}. When the optional {@link CancellationToken} is cancelled, a consumer blocked
 * in {@code next()} wakes up with {@link StreamResult.Kind#CANCELLED} and a producer blocked in
 * {@code emit} returns {@code false}.
 *
 * <p>{@link #close()} drains the queue and tells the producer to stop; a producer should treat a
 * {@code false} return from {@code emit} as its signal to release resources and exit.
 *
 * <p>Both sides wait in short slices and re-check closed and cancelled state between them, so
 * cancellation and close may happen any number of times, in any order, from any thread.
 *
 * @param <T> element type
 */
public final class QueueStream<T> implements PullStream<T> {

    private static final long WAIT_SLICE_MS = 20;

    private final BlockingQueue<T> values;
    private final CancellationToken token;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile StreamResult<T> producerEnd;
    private volatile StreamResult<T> terminal;

    public QueueStream(int capacity) {
        this(capacity, null);
    }

    /**
     * @param capacity maximum buffered elements before {@link #emit(Object)} blocks
     * @param token    cancellation governing both sides (nullable)
     */
    public QueueStream(int capacity, CancellationToken token) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.values = new ArrayBlockingQueue<>(capacity);
        this.token = token;
    }

    /**
     * Hands one element to the consumer, blocking while the queue is full.
     *
     * @return {@code false} when the stream was closed, cancelled or already finished;
     *         the element is then discarded
     */
    public boolean emit(T value) {
        Objects.requireNonNull(value, "value must not be null");
        try {
            while (isOpenForProducer()) {
                if (values.offer(value, WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Signals normal end of stream. Only the first terminal signal counts.
     */
    public void complete() {
        finish(StreamResult.endOfStream());
    }

    /**
     * Signals a producer failure. Only the first terminal signal counts.
     */
    public void fail(ErrorKind kind, String detail, Throwable cause) {
        finish(StreamResult.error(kind, detail, cause));
    }

    private void finish(StreamResult<T> result) {
        if (finished.compareAndSet(false, true)) {
            producerEnd = result;
        }
    }

    @Override
    public StreamResult<T> next() {
        if (terminal != null) {
            return terminal;
        }
        try {
            while (true) {
                if (closed.get()) {
                    return remember(StreamResult.cancelled("stream closed"));
                }
                if (token != null && token.isCancelled()) {
                    return remember(StreamResult.cancelled(token.getReason()));
                }
                T value = values.poll();
                if (value != null) {
                    return StreamResult.value(value);
                }
                StreamResult<T> end = producerEnd;
                if (end != null) {
                    // values emitted before the terminal signal still come first
                    value = values.poll();
                    return value != null ? StreamResult.value(value) : remember(end);
                }
                value = values.poll(WAIT_SLICE_MS, TimeUnit.MILLISECONDS);
                if (value != null) {
                    return StreamResult.value(value);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return remember(StreamResult.cancelled("interrupted"));
        }
    }

    private StreamResult<T> remember(StreamResult<T> result) {
        terminal = result;
        return result;
    }

    /**
     * Whether the producer should keep working.
     */
    public boolean isOpenForProducer() {
        return !closed.get() && !finished.get() && (token == null || !token.isCancelled());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            values.clear();
        }
    }
}
