package com.phillippitts.talkback.service.cancel;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative, one-way cancellation handle for a single turn.
 *
 * <p>States: not cancelled, then cancelled with a reason. The transition happens at most once;
 * later {@link #cancel(String)} calls are no-ops and keep the first reason.
 *
 * <p><b>Thread Safety:</b> all methods may be called from any thread.
 */
public final class CancellationToken {

    static final String DEFAULT_REASON = "cancelled";

    private final String id;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CompletableFuture<String> cancelled = new CompletableFuture<>();

    public CancellationToken(String id) {
        this.id = id;
    }

    /**
     * Token not tied to any registry entry.
     */
    public static CancellationToken standalone() {
        return new CancellationToken(null);
    }

    /**
     * Cancels this token and wakes every waiter.
     *
     * @param why reason recorded on first call; {@code null} or blank becomes "cancelled"
     * @return {@code true} if this call performed the cancellation
     */
    public boolean cancel(String why) {
        String effective = (why == null || why.isBlank()) ? DEFAULT_REASON : why;
        if (reason.compareAndSet(null, effective)) {
            cancelled.complete(effective);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * @return cancellation reason, or {@code null} while not cancelled
     */
    public String getReason() {
        return reason.get();
    }

    /**
     * Blocks until the token is cancelled.
     *
     * @return the cancellation reason
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public String awaitCancelled() throws InterruptedException {
        try {
            return cancelled.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation future completed exceptionally", e);
        }
    }

    /**
     * Blocks up to {@code timeout} for cancellation.
     *
     * @return the reason, or empty if the timeout elapsed first
     */
    public Optional<String> awaitCancelled(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(cancelled.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation future completed exceptionally", e);
        }
    }

    /**
     * Non-blocking view of cancellation, suitable for first-completed-wins joins.
     * Completes with the reason; never completes exceptionally.
     */
    public CompletionStage<String> whenCancelled() {
        return cancelled.minimalCompletionStage();
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        String r = reason.get();
        return "CancellationToken[" + id + (r == null ? "" : ", cancelled: " + r) + "]";
    }
}
