package com.phillippitts.talkback.service.stream;

import com.phillippitts.talkback.exception.ErrorKind;

import java.util.Objects;

/**
 * Outcome of one pull from a {@link PullStream}.
 *
 * <p>Callers switch over {@link #kind()} instead of catching exceptions for the
 * "no more data" and "cancelled" cases:
 * <ul>
 *   <li>{@link Kind#VALUE}: {@link #value()} holds the next element</li>
 *   <li>{@link Kind#END_OF_STREAM}: the producer finished normally</li>
 *   <li>{@link Kind#CANCELLED}: the governing token was cancelled; {@link #detail()} holds the reason</li>
 *   <li>{@link Kind#ERROR}: the producer failed; {@link #errorKind()} and {@link #cause()} describe it</li>
 * </ul>
 *
 * @param <T> element type
 */
public final class StreamResult<T> {

    public enum Kind { VALUE, END_OF_STREAM, CANCELLED, ERROR }

    private final Kind kind;
    private final T value;
    private final ErrorKind errorKind;
    private final String detail;
    private final Throwable cause;

    private StreamResult(Kind kind, T value, ErrorKind errorKind, String detail, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.errorKind = errorKind;
        this.detail = detail;
        this.cause = cause;
    }

    public static <T> StreamResult<T> value(T value) {
        Objects.requireNonNull(value, "value must not be null");
        return new StreamResult<>(Kind.VALUE, value, null, null, null);
    }

    public static <T> StreamResult<T> endOfStream() {
        return new StreamResult<>(Kind.END_OF_STREAM, null, null, null, null);
    }

    public static <T> StreamResult<T> cancelled(String reason) {
        return new StreamResult<>(Kind.CANCELLED, null, null, reason, null);
    }

    public static <T> StreamResult<T> error(ErrorKind errorKind, String detail, Throwable cause) {
        Objects.requireNonNull(errorKind, "errorKind must not be null");
        return new StreamResult<>(Kind.ERROR, null, errorKind, detail, cause);
    }

    /**
     * Re-types a non-value result so it can be forwarded by a stream of another element type.
     *
     * @throws IllegalStateException if this result carries a value
     */
    public <R> StreamResult<R> propagate() {
        if (kind == Kind.VALUE) {
            throw new IllegalStateException("Cannot propagate a value result");
        }
        return new StreamResult<>(kind, null, errorKind, detail, cause);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isValue() {
        return kind == Kind.VALUE;
    }

    public boolean isTerminal() {
        return kind != Kind.VALUE;
    }

    /**
     * @throws IllegalStateException if this result is not {@link Kind#VALUE}
     */
    public T value() {
        if (kind != Kind.VALUE) {
            throw new IllegalStateException("No value in " + kind + " result");
        }
        return value;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    /**
     * Cancellation reason or error detail; {@code null} for values and end of stream.
     */
    public String detail() {
        return detail;
    }

    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VALUE -> "StreamResult[VALUE]";
            case END_OF_STREAM -> "StreamResult[END_OF_STREAM]";
            case CANCELLED -> "StreamResult[CANCELLED: " + detail + "]";
            case ERROR -> "StreamResult[ERROR " + errorKind + ": " + detail + "]";
        };
    }
}
