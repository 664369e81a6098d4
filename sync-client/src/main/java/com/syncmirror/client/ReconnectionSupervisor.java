package com.syncmirror.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives reconnect attempts with exponential backoff and publishes the connection status.
 *
 * The attempt counter resets on every successful connection. With a finite
 * {@code maxAttempts}, running out of attempts moves to the terminal OFFLINE status
 * instead of throwing; {@link #resetAttempts()} re-arms it.
 *
 * Mutators are called under the owning client's lock; status and attempt count are
 * volatile so they can be read from anywhere.
 */
public class ReconnectionSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ReconnectionSupervisor.class);

    /**
     * Receives every status transition and every scheduled attempt.
     */
    public interface Listener {
        void onStatusChange(SyncStatus status, String description);

        void onReconnectScheduled(int attempt, long delayMs);
    }

    private final BackoffPolicy backoff;
    private final int maxAttempts;
    private final ScheduledExecutorService scheduler;
    private final Listener listener;

    private volatile SyncStatus status = SyncStatus.DISCONNECTED;
    private volatile int attempts;
    private ScheduledFuture<?> pendingAttempt;

    /**
     * @param maxAttempts reconnect attempts before going OFFLINE; -1 for unlimited
     */
    public ReconnectionSupervisor(BackoffPolicy backoff, int maxAttempts,
                                  ScheduledExecutorService scheduler, Listener listener) {
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    public void connecting(String endpoint) {
        transition(SyncStatus.CONNECTING, attempts == 0
                ? "Connecting to " + endpoint
                : "Connecting to " + endpoint + " (attempt " + attempts + ")");
    }

    public void connected(String endpoint) {
        cancelPending();
        attempts = 0;
        transition(SyncStatus.CONNECTED, "Connected to " + endpoint);
    }

    /**
     * Schedules the next attempt after the backoff delay.
     *
     * @return false if the attempt budget is spent; the status is then OFFLINE
     */
    public boolean scheduleReconnect(Runnable attempt) {
        cancelPending();
        if (maxAttempts >= 0 && attempts >= maxAttempts) {
            logger.warn("Giving up after {} reconnect attempt(s)", attempts);
            transition(SyncStatus.OFFLINE, "Offline after " + attempts + " failed reconnect attempt(s)");
            return false;
        }
        long delayMs = backoff.delayFor(attempts);
        attempts++;
        logger.info("Scheduling reconnect attempt {} in {}ms", attempts, delayMs);
        transition(SyncStatus.RECONNECTING, "Reconnecting in " + delayMs + "ms (attempt " + attempts + ")");
        listener.onReconnectScheduled(attempts, delayMs);
        pendingAttempt = scheduler.schedule(attempt, delayMs, TimeUnit.MILLISECONDS);
        return true;
    }

    /**
     * Cancels any scheduled attempt and reports DISCONNECTED.
     */
    public void stop() {
        cancelPending();
        transition(SyncStatus.DISCONNECTED, "Disconnected");
    }

    public void resetAttempts() {
        attempts = 0;
    }

    public void cancelPending() {
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
    }

    public boolean isReconnectPending() {
        return pendingAttempt != null && !pendingAttempt.isDone();
    }

    public SyncStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    private void transition(SyncStatus next, String description) {
        SyncStatus previous = status;
        status = next;
        if (previous != next) {
            logger.debug("Status {} -> {}: {}", previous, next, description);
        }
        listener.onStatusChange(next, description);
    }
}
