package com.phillippitts.talkback.service.cancel;

import com.phillippitts.talkback.domain.TurnMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps turn ids to their cancellation tokens so a turn can be stopped from outside its own
 * call stack (another session message, the REST API, connection teardown).
 *
 * <p>Every started turn must be removed with {@link #cleanup(String)} exactly once, whatever
 * its outcome. Stopping a turn only signals its token; the turn itself still cleans up.
 *
 * <p><b>Thread Safety:</b> map mutation is guarded by a {@link ReentrantLock}. Tokens are
 * signalled outside the lock so cancellation listeners never run while it is held.
 */
@Component
public class ProcessRegistry {

    private static final Logger LOG = LogManager.getLogger(ProcessRegistry.class);

    private final Lock lock = new ReentrantLock();
    private final Map<String, ProcessInfo> processes = new HashMap<>();
    private final Clock clock;

    public ProcessRegistry() {
        this(Clock.systemUTC());
    }

    public ProcessRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers a new turn.
     *
     * @param name     process name
     * @param metadata turn metadata
     * @return id and fresh token
     */
    public ProcessHandle start(String name, TurnMetadata metadata) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        String id = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken(id);
        ProcessInfo info = new ProcessInfo(id, name, clock.instant(), token, metadata);
        lock.lock();
        try {
            processes.put(id, info);
        } finally {
            lock.unlock();
        }
        LOG.debug("Registered process: id={}, name={}, session={}", id, name, metadata.sessionId());
        return new ProcessHandle(id, token);
    }

    /**
     * Signals cancellation of one turn.
     *
     * @return {@code false} if the id is unknown (already finished and cleaned up)
     */
    public boolean stop(String id, String reason) {
        if (id == null) {
            return false;
        }
        ProcessInfo info;
        lock.lock();
        try {
            info = processes.get(id);
        } finally {
            lock.unlock();
        }
        if (info == null) {
            LOG.debug("Stop requested for unknown process id={}", id);
            return false;
        }
        boolean first = info.token().cancel(reason);
        LOG.info("Stop requested: id={}, reason={}, firstSignal={}", id, reason, first);
        return true;
    }

    /**
     * Signals cancellation of every registered turn.
     *
     * <p>A turn that finishes concurrently, or that was already cancelled, is not counted.
     *
     * @return number of turns this call cancelled
     */
    public int stopAll(String reason) {
        List<ProcessInfo> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(processes.values());
        } finally {
            lock.unlock();
        }
        int stopped = 0;
        for (ProcessInfo info : snapshot) {
            if (isActive(info.id()) && info.token().cancel(reason)) {
                stopped++;
            }
        }
        LOG.info("Stop-all requested: reason={}, stopped={}", reason, stopped);
        return stopped;
    }

    /**
     * Removes a finished turn.
     *
     * @return {@code true} if the entry was present
     */
    public boolean cleanup(String id) {
        ProcessInfo removed;
        lock.lock();
        try {
            removed = processes.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            LOG.warn("Cleanup of unknown process id={} (already cleaned up?)", id);
            return false;
        }
        LOG.debug("Cleaned up process: id={}, name={}", id, removed.name());
        return true;
    }

    public Optional<ProcessInfo> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(processes.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of registered turns, oldest first.
     */
    public List<ProcessInfo> activeProcesses() {
        List<ProcessInfo> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(processes.values());
        } finally {
            lock.unlock();
        }
        snapshot.sort(Comparator.comparing(ProcessInfo::startedAt));
        return snapshot;
    }

    public int count() {
        lock.lock();
        try {
            return processes.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(String id) {
        lock.lock();
        try {
            return processes.containsKey(id);
        } finally {
            lock.unlock();
        }
    }
}
