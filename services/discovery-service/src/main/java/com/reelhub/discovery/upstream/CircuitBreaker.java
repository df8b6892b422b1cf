package com.reelhub.discovery.upstream;

import java.time.Clock;

/**
 * Consecutive-failure breaker. Once open, requests are rejected until the reset window has
 * elapsed since the last failure; then a single probe is let through. The probe's outcome
 * closes or re-opens the circuit.
 */
public class CircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private long lastFailureAtMs;

    public CircuitBreaker(int failureThreshold, long resetTimeoutMs) {
        this(failureThreshold, resetTimeoutMs, Clock.systemUTC());
    }

    public CircuitBreaker(int failureThreshold, long resetTimeoutMs, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.resetTimeoutMs = Math.max(1L, resetTimeoutMs);
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.millis() - lastFailureAtMs >= resetTimeoutMs) {
                    state = State.HALF_OPEN;
                    return true;
                }
                return false;
            case HALF_OPEN:
            default:
                // probe already in flight
                return false;
        }
    }

    public synchronized boolean isOpen() {
        return state != State.CLOSED;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized long getLastFailureAtMs() {
        return lastFailureAtMs;
    }

    /**
     * @return true when this call closed a previously open circuit
     */
    public synchronized boolean recordSuccess() {
        boolean recovered = state != State.CLOSED;
        state = State.CLOSED;
        failureCount = 0;
        return recovered;
    }

    /**
     * @return true when this call opened the circuit
     */
    public synchronized boolean recordFailure() {
        failureCount++;
        lastFailureAtMs = clock.millis();
        if (state == State.HALF_OPEN) {
            state = State.OPEN;
            return true;
        }
        if (state == State.CLOSED && failureCount >= failureThreshold) {
            state = State.OPEN;
            return true;
        }
        return false;
    }
}
