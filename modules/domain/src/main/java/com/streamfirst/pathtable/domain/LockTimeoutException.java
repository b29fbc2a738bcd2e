package com.streamfirst.pathtable.domain;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised when a named lock could not be acquired within its time budget.
 */
@Getter
public class LockTimeoutException extends PathTableException {

    private final String lockName;

    public LockTimeoutException(String lockName, Duration timeout) {
        super("Failed to acquire lock '" + lockName + "' within " + timeout);
        this.lockName = lockName;
    }

    public LockTimeoutException(String lockName, InterruptedException cause) {
        super("Interrupted while waiting for lock '" + lockName + "'", cause);
        this.lockName = lockName;
    }
}
