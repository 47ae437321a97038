package com.phillippitts.talkback.service.orchestration;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits at most one active turn per session.
 *
 * <pre>
 * IDLE → ACTIVE(turnId)   via tryAcquire
 * ACTIVE(turnId) → IDLE   via release(turnId)
 * </pre>
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe; the session's inbound thread acquires
 * and the turn worker releases.
 */
public final class TurnGate {

    private final Lock lock = new ReentrantLock();
    private String activeTurn;
    private boolean reserved;

    /**
     * Reserves the gate before the turn id is known.
     *
     * @return {@code true} if no turn was active or reserved
     */
    public boolean tryReserve() {
        lock.lock();
        try {
            if (reserved) {
                return false;
            }
            reserved = true;
            activeTurn = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds the reserved gate to the registered turn id.
     *
     * @throws IllegalStateException if the gate was not reserved
     */
    public void bind(String turnId) {
        if (turnId == null) {
            throw new NullPointerException("turnId cannot be null");
        }
        lock.lock();
        try {
            if (!reserved) {
                throw new IllegalStateException("Gate not reserved");
            }
            activeTurn = turnId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the gate if it belongs to {@code turnId} (or is reserved but unbound when
     * {@code turnId} is null).
     *
     * @return {@code true} if the gate was released
     */
    public boolean release(String turnId) {
        lock.lock();
        try {
            if (!reserved) {
                return false;
            }
            if (activeTurn != null && !activeTurn.equals(turnId)) {
                return false;
            }
            reserved = false;
            activeTurn = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return active turn id, or {@code null} when idle or reserved but unbound
     */
    public String getActiveTurn() {
        lock.lock();
        try {
            return activeTurn;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBusy() {
        lock.lock();
        try {
            return reserved;
        } finally {
            lock.unlock();
        }
    }
}
