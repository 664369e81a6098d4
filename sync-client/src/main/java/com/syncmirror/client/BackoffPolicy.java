package com.syncmirror.client;

/**
 * Exponential reconnect backoff: {@code min(cap, base * 2^attempt)}.
 */
public final class BackoffPolicy {

    // 2^30 already exceeds any sane cap; keeps the shift from overflowing
    private static final int MAX_EXPONENT = 30;

    private final long baseMs;
    private final long capMs;

    public BackoffPolicy(long baseMs, long capMs) {
        if (baseMs < 1 || capMs < baseMs) {
            throw new IllegalArgumentException("Need 1 <= baseMs <= capMs, got " + baseMs + " / " + capMs);
        }
        this.baseMs = baseMs;
        this.capMs = capMs;
    }

    /**
     * @param attempt zero-based number of failed attempts so far
     */
    public long delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        int exponent = Math.min(attempt, MAX_EXPONENT);
        // Shifting past the sign bit would wrap
        if (exponent >= Long.numberOfLeadingZeros(baseMs) - 1) {
            return capMs;
        }
        return Math.min(capMs, baseMs << exponent);
    }

    public long getBaseMs() {
        return baseMs;
    }

    public long getCapMs() {
        return capMs;
    }
}
