package io.agenthub.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe. Messages are delivered on one dispatcher thread, so every subscriber
 * sees messages in publish order.
 */
public final class ChangeFeed implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChangeFeed.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;
    private final AtomicLong published = new AtomicLong();
    private volatile boolean closed;

    public ChangeFeed() {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agenthub-change-feed");
            t.setDaemon(true);
            return t;
        });
    }

    public void publish(String channel, String message) {
        if (closed || channel == null) {
            return;
        }
        published.incrementAndGet();
        try {
            dispatcher.execute(() -> deliver(new FeedMessage(channel, message)));
        } catch (RejectedExecutionException e) {
            log.debug("change feed closed, dropped message channel={}", channel);
        }
    }

    public Subscription subscribe(String pattern, Consumer<FeedMessage> listener) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        Registration registration = new Registration(pattern.trim(), listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public long publishedCount() {
        return published.get();
    }

    /**
     * Blocks until every message published so far has been handed to its subscribers.
     */
    public void drain(long timeoutMs) {
        if (closed) {
            return;
        }
        try {
            dispatcher.submit(() -> { }).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            throw new IllegalStateException("Change feed did not drain within " + timeoutMs + "ms", e);
        }
    }

    private void deliver(FeedMessage message) {
        for (Registration registration : registrations) {
            if (!matches(registration.pattern(), message.channel())) {
                continue;
            }
            try {
                registration.listener().accept(message);
            } catch (RuntimeException e) {
                log.warn("change feed subscriber failed pattern={} channel={}", registration.pattern(), message.channel(), e);
            }
        }
    }

    static boolean matches(String pattern, String channel) {
        if (pattern.endsWith("*")) {
            return channel.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(channel);
    }

    @Override
    public void close() {
        closed = true;
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        registrations.clear();
    }

    public record FeedMessage(String channel, String payload) {
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Registration(String pattern, Consumer<FeedMessage> listener) {
    }
}
