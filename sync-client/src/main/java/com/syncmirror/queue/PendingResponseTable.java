package com.syncmirror.queue;

import com.syncmirror.error.ResponseTimeoutException;
import com.syncmirror.protocol.Message;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Correlates outbound messages with their eventual response.
 *
 * Every registration ends exactly once: resolved by a response, expired by its
 * timeout, failed explicitly, or cancelled by the caller. Whichever happens first
 * removes the entry; the rest find nothing to do.
 *
 * A timeout is local only. The message may still have reached the remote authority,
 * so delivery is at-least-once, not exactly-once.
 *
 * Thread Safety:
 * - Entries live in a ConcurrentHashMap and are claimed with an atomic remove before
 *   their future is completed, so a response racing its timeout completes the future once
 */
public class PendingResponseTable {

    private static final Logger logger = LoggerFactory.getLogger(PendingResponseTable.class);

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public PendingResponseTable(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Registers a wait for the response to {@code messageId}.
     *
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<Message> register(String messageId, long timeoutMs) {
        PendingEntry entry = new PendingEntry();
        if (pending.putIfAbsent(messageId, entry) != null) {
            throw new IllegalStateException("Response to " + messageId + " is already awaited");
        }
        entry.timeout = scheduler.schedule(() -> expire(messageId, entry, timeoutMs),
                timeoutMs, TimeUnit.MILLISECONDS);
        // Caller-side cancellation frees the slot too
        entry.future.whenComplete((response, error) -> {
            if (pending.remove(messageId, entry)) {
                entry.cancelTimeout();
            }
        });
        return entry.future;
    }

    /**
     * Completes the wait whose id matches the response's correlation id.
     *
     * @return true if a pending entry was resolved
     */
    public boolean resolve(Message response) {
        String correlationId = response.getCorrelationId();
        if (correlationId == null) {
            return false;
        }
        PendingEntry entry = pending.remove(correlationId);
        if (entry == null) {
            return false;
        }
        entry.cancelTimeout();
        logger.debug("Resolved pending {} with {} {}", correlationId, response.getType(), response.getId());
        entry.future.complete(response);
        return true;
    }

    /**
     * Fails one pending entry.
     *
     * @return true if the entry existed
     */
    public boolean fail(String messageId, Throwable cause) {
        PendingEntry entry = pending.remove(messageId);
        if (entry == null) {
            return false;
        }
        entry.cancelTimeout();
        entry.future.completeExceptionally(cause);
        return true;
    }

    /**
     * Fails every pending entry.
     *
     * @return how many entries were failed
     */
    public int failAll(Throwable cause) {
        int failed = 0;
        for (String messageId : pending.keySet()) {
            if (fail(messageId, cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            logger.info("Failed {} pending response(s): {}", failed, cause.getMessage());
        }
        return failed;
    }

    public boolean isPending(String messageId) {
        return pending.containsKey(messageId);
    }

    public int size() {
        return pending.size();
    }

    private void expire(String messageId, PendingEntry entry, long timeoutMs) {
        if (pending.remove(messageId, entry)) {
            logger.warn("No response to {} within {}ms", messageId, timeoutMs);
            entry.future.completeExceptionally(new ResponseTimeoutException(messageId, timeoutMs));
        }
    }

    private static final class PendingEntry {
        final CompletableFuture<Message> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeout;

        void cancelTimeout() {
            ScheduledFuture<?> t = timeout;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
