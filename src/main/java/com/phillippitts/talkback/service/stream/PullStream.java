package com.phillippitts.talkback.service.stream;

/**
 * Lazy, single-consumption sequence pulled one element at a time.
 *
 * <p>Once {@link #next()} returns a terminal result it keeps returning a terminal result.
 * {@link #close()} is idempotent and must stop the producer, not merely stop reading from it.
 *
 * @param <T> element type
 */
public interface PullStream<T> extends AutoCloseable {

    /**
     * Blocks until the next element or a terminal outcome is available.
     */
    StreamResult<T> next();

    @Override
    void close();
}
