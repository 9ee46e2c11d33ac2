package com.phantomrelay.queue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-account buffers of undelivered messages, oldest first.
 *
 * <p>Every mutation of one account's buffer goes through a single
 * {@link ConcurrentHashMap} compute on that account's key, so enqueue, flush
 * and eviction for the same account never interleave. Buffers are replaced,
 * never modified in place, which keeps snapshots safe to hand out.
 *
 * <p>An account with nothing queued has no key at all.
 */
public class OfflineQueue {

    private final ConcurrentHashMap<String, List<QueuedMessage>> queues = new ConcurrentHashMap<>();

    public void enqueue(String accountId, QueuedMessage message) {
        queues.compute(accountId, (id, existing) -> {
            List<QueuedMessage> next = existing == null ? new ArrayList<>(1) : new ArrayList<>(existing);
            next.add(message);
            return List.copyOf(next);
        });
    }

    /**
     * Removes and returns everything queued for the account, in insertion
     * order. Returns an empty list when nothing is queued.
     */
    public List<QueuedMessage> flush(String accountId) {
        List<QueuedMessage> drained = queues.remove(accountId);
        return drained == null ? List.of() : drained;
    }

    public List<QueuedMessage> pending(String accountId) {
        return queues.getOrDefault(accountId, List.of());
    }

    /** Number of accounts that currently have queued messages. */
    public int size() {
        return queues.size();
    }

    public int messageCount() {
        return queues.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Drops every message whose age at {@code nowMillis} has reached
     * {@code retention}. Accounts left with nothing are removed.
     *
     * @return the number of messages evicted
     */
    public int evictOlderThan(long nowMillis, Duration retention) {
        long retentionMillis = retention.toMillis();
        AtomicInteger evicted = new AtomicInteger();
        for (String accountId : queues.keySet()) {
            queues.computeIfPresent(accountId, (id, messages) -> {
                List<QueuedMessage> kept = messages.stream()
                        .filter(message -> nowMillis - message.timestamp() < retentionMillis)
                        .toList();
                evicted.addAndGet(messages.size() - kept.size());
                return kept.isEmpty() ? null : kept;
            });
        }
        return evicted.get();
    }
}
