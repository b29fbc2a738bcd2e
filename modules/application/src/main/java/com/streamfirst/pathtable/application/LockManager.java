package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.domain.LockTimeoutException;
import com.streamfirst.pathtable.domain.NotFoundException;
import com.streamfirst.pathtable.domain.Stamp;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Named advisory locks backed by sentinel files on a storage provider.
 *
 * <p>A lock is held while its sentinel exists. Acquisition creates the sentinel atomically
 * and polls while another holder has it. Locks only exclude callers going through a lock
 * manager on the same storage location; nothing stops a writer that ignores them.
 * Within one manager a lock is re-entrant for the thread holding it.
 */
@Slf4j
public class LockManager {

    static final String SENTINEL_PREFIX = ".lock_";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final StoragePort storagePort;
    private final String lockDirectory;
    private final Duration defaultTimeout;
    private final Duration defaultPollInterval;
    private final Map<String, Hold> holds = new ConcurrentHashMap<>();

    /**
     * @param storagePort the storage holding the sentinels
     * @param lockDirectory directory of the sentinels, without trailing '/'; empty for the root
     */
    public LockManager(StoragePort storagePort, String lockDirectory) {
        this(storagePort, lockDirectory, DEFAULT_TIMEOUT, DEFAULT_POLL_INTERVAL);
    }

    /**
     * @param defaultTimeout timeout of {@link #acquire(String)} and the short {@code withLock} forms
     * @param defaultPollInterval poll interval of those same calls
     */
    public LockManager(StoragePort storagePort, String lockDirectory,
                       Duration defaultTimeout, Duration defaultPollInterval) {
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "Default timeout cannot be null");
        this.defaultPollInterval = Objects.requireNonNull(defaultPollInterval, "Default poll interval cannot be null");
        if (defaultTimeout.isNegative() || defaultPollInterval.isNegative()) {
            throw new IllegalArgumentException("Lock timeout and poll interval must not be negative");
        }
        this.storagePort = Objects.requireNonNull(storagePort, "Storage port cannot be null");
        Objects.requireNonNull(lockDirectory, "Lock directory cannot be null");
        this.lockDirectory = lockDirectory.endsWith("/")
            ? lockDirectory.substring(0, lockDirectory.length() - 1)
            : lockDirectory;
    }

    /**
     * Acquires a lock with the manager's default timeout and poll interval.
     */
    public LockHandle acquire(String name) {
        return acquire(name, defaultTimeout, defaultPollInterval);
    }

    /**
     * Acquires a lock, waiting up to {@code timeout}.
     *
     * @param name lock name, without '/'
     * @param timeout how long to keep trying; zero tries once
     * @param pollInterval mean pause between attempts, jittered by ±50%
     * @return the handle to close on release
     * @throws LockTimeoutException if the lock is still held elsewhere at the deadline, or
     *                              the waiting thread is interrupted
     */
    public LockHandle acquire(String name, Duration timeout, Duration pollInterval) {
        String path = sentinelPath(name);
        Thread current = Thread.currentThread();

        Hold hold = holds.get(name);
        if (hold != null && hold.owner == current) {
            hold.count++;
            log.debug("Re-entered lock '{}' ({} holds)", name, hold.count);
            return new LockHandle(this, name, path, current);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            if (storagePort.createIfAbsent(path)) {
                holds.put(name, new Hold(current));
                log.debug("Acquired lock '{}' at {} after {} attempt(s)", name, path, attempts);
                return new LockHandle(this, name, path, current);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Gave up on lock '{}' after {} attempt(s) over {}", name, attempts, timeout);
                throw new LockTimeoutException(name, timeout);
            }
            long pause = (long) (pollInterval.toNanos() * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(pause, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(name, e);
            }
        }
    }

    /**
     * Runs an action while holding a lock, releasing it however the action ends.
     */
    public <T> T withLock(String name, Duration timeout, Duration pollInterval, Supplier<T> action) {
        try (LockHandle ignored = acquire(name, timeout, pollInterval)) {
            return action.get();
        }
    }

    public void withLock(String name, Duration timeout, Duration pollInterval, Runnable action) {
        try (LockHandle ignored = acquire(name, timeout, pollInterval)) {
            action.run();
        }
    }

    public <T> T withLock(String name, Supplier<T> action) {
        return withLock(name, defaultTimeout, defaultPollInterval, action);
    }

    public void withLock(String name, Runnable action) {
        withLock(name, defaultTimeout, defaultPollInterval, action);
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public Duration defaultPollInterval() {
        return defaultPollInterval;
    }

    /**
     * Reports whether a lock is held, by anyone.
     *
     * @return the stamp of the sentinel, or empty if the lock is free
     */
    public Optional<Stamp> lockInfo(String name) {
        try {
            return Optional.of(storagePort.stat(sentinelPath(name)));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Removes a sentinel regardless of who holds it. Meant for recovering from a holder
     * that died without releasing.
     *
     * @return true if a sentinel was removed
     */
    public boolean forceRelease(String name) {
        String path = sentinelPath(name);
        holds.remove(name);
        try {
            storagePort.delete(path);
            log.warn("Forced release of lock '{}' at {}", name, path);
            return true;
        } catch (NotFoundException e) {
            log.info("No lock '{}' to release at {}", name, path);
            return false;
        }
    }

    /**
     * Path of the sentinel file backing a lock name.
     */
    public String sentinelPath(String name) {
        if (name == null || name.isEmpty() || name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Lock name must be non-empty and without '/': " + name);
        }
        return lockDirectory.isEmpty()
            ? SENTINEL_PREFIX + name
            : lockDirectory + "/" + SENTINEL_PREFIX + name;
    }

    void release(LockHandle handle) {
        Hold hold = holds.get(handle.name());
        if (hold != null && hold.owner == handle.owner()) {
            if (hold.count > 1) {
                hold.count--;
                log.debug("Left re-entered lock '{}' ({} holds)", handle.name(), hold.count);
                return;
            }
            // forget the hold before the sentinel goes, so a new holder's entry is never removed
            holds.remove(handle.name(), hold);
        }
        try {
            storagePort.delete(handle.sentinelPath());
            log.debug("Released lock '{}'", handle.name());
        } catch (NotFoundException e) {
            log.warn("Sentinel {} of lock '{}' was already removed, treating the lock as released",
                handle.sentinelPath(), handle.name());
        }
    }

    private static final class Hold {
        private final Thread owner;
        private int count = 1;

        private Hold(Thread owner) {
            this.owner = owner;
        }
    }
}
