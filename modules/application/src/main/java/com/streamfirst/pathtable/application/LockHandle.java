package com.streamfirst.pathtable.application;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held advisory lock. Closing the handle releases the lock; closing twice is a no-op.
 * Use with try-with-resources so the lock is released on every exit path.
 */
public final class LockHandle implements AutoCloseable {

    private final LockManager manager;
    private final String name;
    private final String sentinelPath;
    private final Thread owner;
    private final AtomicBoolean released = new AtomicBoolean();

    LockHandle(LockManager manager, String name, String sentinelPath, Thread owner) {
        this.manager = manager;
        this.name = name;
        this.sentinelPath = sentinelPath;
        this.owner = owner;
    }

    public String name() {
        return name;
    }

    public String sentinelPath() {
        return sentinelPath;
    }

    public boolean isReleased() {
        return released.get();
    }

    Thread owner() {
        return owner;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release(this);
        }
    }

    @Override
    public String toString() {
        return "LockHandle{" + name + " at " + sentinelPath + (isReleased() ? ", released" : "") + "}";
    }
}
