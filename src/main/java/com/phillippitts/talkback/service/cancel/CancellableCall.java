package com.phillippitts.talkback.service.cancel;

import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.TalkBackException;
import com.phillippitts.talkback.service.stream.StreamResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Races a blocking external call against a {@link CancellationToken}.
 *
 * <p>The call runs on {@code executor}; the caller blocks until either the call finishes or the
 * token is cancelled, whichever happens first. When cancellation wins, the thread running the
 * call is interrupted and a result that still arrives later is handed to the {@code discard}
 * callback (e.g. to close a stream nobody will read).
 */
public final class CancellableCall {

    private static final Logger LOG = LogManager.getLogger(CancellableCall.class);

    private CancellableCall() {
        // Utility class - prevent instantiation
    }

    public static <T> StreamResult<T> race(Callable<T> call, CancellationToken token, Executor executor,
                                           ErrorKind failureKind) {
        return race(call, token, executor, failureKind, value -> { });
    }

    /**
     * @param call        external call
     * @param token       turn cancellation
     * @param executor    executor running the call
     * @param failureKind error kind reported when the call throws something other than a
     *                    {@link TalkBackException}
     * @param discard     receives a result that arrived after cancellation won
     * @return VALUE, CANCELLED or ERROR; never END_OF_STREAM
     */
    public static <T> StreamResult<T> race(Callable<T> call, CancellationToken token, Executor executor,
                                           ErrorKind failureKind, Consumer<? super T> discard) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(discard, "discard must not be null");
        if (token.isCancelled()) {
            return StreamResult.cancelled(token.getReason());
        }

        RunningCall<T> running = new RunningCall<>(call);
        try {
            executor.execute(running);
        } catch (RejectedExecutionException e) {
            LOG.warn("External call rejected: executor saturated");
            return StreamResult.error(failureKind, "call rejected: executor saturated", e);
        }

        // neither side completes exceptionally, so get() only reports who finished first
        CompletableFuture<Object> first = CompletableFuture.anyOf(
                running.outcome.handle((value, failure) -> Boolean.TRUE),
                token.whenCancelled().toCompletableFuture());
        try {
            first.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.abandon(discard);
            return StreamResult.cancelled("interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Race join failed unexpectedly", e);
        }

        if (!running.outcome.isDone() || token.isCancelled()) {
            running.abandon(discard);
            LOG.debug("Call abandoned after cancellation: reason={}", token.getReason());
            return StreamResult.cancelled(token.getReason());
        }
        try {
            T value = running.outcome.get();
            if (value == null) {
                return StreamResult.error(failureKind, "call returned no result", null);
            }
            return StreamResult.value(value);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ErrorKind kind = cause instanceof TalkBackException tbe ? tbe.getErrorKind() : failureKind;
            return StreamResult.error(kind, cause == null ? "call failed" : cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StreamResult.cancelled("interrupted");
        }
    }

    /**
     * Executes the call and lets the racing thread interrupt it while, and only while, it runs.
     */
    private static final class RunningCall<T> implements Runnable {

        private final Callable<T> call;
        private final CompletableFuture<T> outcome = new CompletableFuture<>();
        private final AtomicBoolean abandoned = new AtomicBoolean();
        private final Object runnerLock = new Object();
        private Thread runner;

        RunningCall(Callable<T> call) {
            this.call = call;
        }

        @Override
        public void run() {
            synchronized (runnerLock) {
                if (abandoned.get()) {
                    return;
                }
                runner = Thread.currentThread();
            }
            try {
                outcome.complete(call.call());
            } catch (Exception e) {
                outcome.completeExceptionally(e);
            } catch (Error e) {
                outcome.completeExceptionally(e);
                throw e;
            } finally {
                synchronized (runnerLock) {
                    runner = null;
                    // clear an interrupt aimed at the call before the pool thread is reused
                    Thread.interrupted();
                }
            }
        }

        void abandon(Consumer<? super T> discard) {
            synchronized (runnerLock) {
                abandoned.set(true);
                if (runner != null) {
                    runner.interrupt();
                }
            }
            outcome.thenAccept(value -> {
                if (value == null) {
                    return;
                }
                try {
                    discard.accept(value);
                } catch (RuntimeException e) {
                    LOG.debug("Discarding abandoned call result failed: {}", e.getMessage());
                }
            });
        }
    }
}
