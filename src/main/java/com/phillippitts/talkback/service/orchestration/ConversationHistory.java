package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.ConversationExchange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded window of the most recent completed exchanges of one session.
 *
 * <p>Appended by the turn worker thread and read when the next prompt is built, so access is
 * guarded by a lock. The oldest exchange is evicted once {@code capacity} is reached.
 */
public final class ConversationHistory {

    private final Lock lock = new ReentrantLock();
    private final Deque<ConversationExchange> exchanges = new ArrayDeque<>();
    private final int capacity;

    public ConversationHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(ConversationExchange exchange) {
        if (capacity == 0) {
            return;
        }
        lock.lock();
        try {
            exchanges.addLast(exchange);
            while (exchanges.size() > capacity) {
                exchanges.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest first.
     */
    public List<ConversationExchange> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(exchanges);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return exchanges.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            exchanges.clear();
        } finally {
            lock.unlock();
        }
    }
}
