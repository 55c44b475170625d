package io.agenthub.bus;

import io.agenthub.model.Message;
import io.agenthub.model.Priority;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO queue per priority tier, drained by weighted round robin (8 high, 3 medium, 1 low).
 * After {@code maxConsecutiveHigh} high-priority claims in a row a waiting low-priority message
 * is forced through. Critical messages never enter these queues.
 */
public final class PriorityQueues {
    private final Map<Priority, Deque<Message>> tiers = new EnumMap<>(Priority.class);
    private final List<Priority> weightedSequence;
    private final int maxConsecutiveHigh;
    private final AtomicLong lowStarvationCount = new AtomicLong();
    private int sequenceCursor = 0;
    private int consecutiveHighClaims = 0;

    public PriorityQueues(int maxConsecutiveHigh) {
        this.maxConsecutiveHigh = Math.max(1, maxConsecutiveHigh);
        this.weightedSequence = defaultWeightedSequence();
        tiers.put(Priority.HIGH, new ArrayDeque<>());
        tiers.put(Priority.MEDIUM, new ArrayDeque<>());
        tiers.put(Priority.LOW, new ArrayDeque<>());
    }

    public synchronized void offer(Message message) {
        tierOf(message.priority()).addLast(message);
        notifyAll();
    }

    public synchronized Optional<Message> poll() {
        if (consecutiveHighClaims >= maxConsecutiveHigh) {
            Message forcedLow = tiers.get(Priority.LOW).pollFirst();
            if (forcedLow != null) {
                consecutiveHighClaims = 0;
                lowStarvationCount.incrementAndGet();
                return Optional.of(forcedLow);
            }
        }
        for (int i = 0; i < weightedSequence.size(); i++) {
            Priority nextPriority = weightedSequence.get(sequenceCursor % weightedSequence.size());
            sequenceCursor++;
            Message claimed = tiers.get(nextPriority).pollFirst();
            if (claimed != null) {
                if (nextPriority == Priority.HIGH) {
                    consecutiveHighClaims++;
                } else {
                    consecutiveHighClaims = 0;
                }
                return Optional.of(claimed);
            }
        }
        return Optional.empty();
    }

    /**
     * Waits up to {@code timeoutMs} for a message.
     */
    public synchronized Optional<Message> take(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (isEmpty()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            wait(remainingMs);
        }
        return poll();
    }

    public synchronized int size(Priority priority) {
        return tierOf(priority).size();
    }

    public synchronized int size() {
        return tiers.values().stream().mapToInt(Deque::size).sum();
    }

    public synchronized boolean isEmpty() {
        return size() == 0;
    }

    public synchronized List<Message> drainAll() {
        List<Message> out = new ArrayList<>();
        for (Deque<Message> tier : tiers.values()) {
            out.addAll(tier);
            tier.clear();
        }
        return out;
    }

    public long lowStarvationCount() {
        return lowStarvationCount.get();
    }

    private Deque<Message> tierOf(Priority priority) {
        // Critical only lands here when it is re-queued for retry; it rides with high.
        if (priority == null || priority == Priority.CRITICAL) {
            return tiers.get(priority == null ? Priority.MEDIUM : Priority.HIGH);
        }
        return tiers.get(priority);
    }

    private static List<Priority> defaultWeightedSequence() {
        List<Priority> sequence = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            sequence.add(Priority.HIGH);
        }
        for (int i = 0; i < 3; i++) {
            sequence.add(Priority.MEDIUM);
        }
        sequence.add(Priority.LOW);
        return sequence;
    }
}
