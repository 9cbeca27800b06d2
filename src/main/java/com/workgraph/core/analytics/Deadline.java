package com.workgraph.core.analytics;

import com.workgraph.core.error.AnalysisTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caller-supplied time limit for an analytics operation. Checked between per-node
 * computations, never in the middle of one.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, null);

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws AnalysisTimeoutException if the deadline has passed
     */
    public void check(String operation) {
        if (isExpired()) {
            throw new AnalysisTimeoutException(operation);
        }
    }
}
