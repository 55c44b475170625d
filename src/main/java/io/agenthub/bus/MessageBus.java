package io.agenthub.bus;

import io.agenthub.config.HubSettings;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.model.Message;
import io.agenthub.model.Priority;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.storage.DurableStore;
import io.agenthub.storage.StoredValue;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * In-process message bus between agents.
 *
 * <p>Critical messages are delivered inline on the caller's thread. Everything else is queued per
 * priority tier and drained by a dispatcher thread into one delivery lane per recipient, so a
 * recipient sees its messages in claim order while different recipients proceed concurrently.
 *
 * <p>A failed delivery bumps {@code retry_count} and waits {@code unit * 2^retry_count} before the
 * next attempt. Once the count reaches {@code max_retries} the message is dead-lettered when that
 * last backoff elapses instead of being attempted again.
 */
public final class MessageBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);
    public static final String MESSAGE_PREFIX = "message:";
    public static final String DEAD_LETTER_PREFIX = "dead_letter:";
    private static final long DISPATCH_POLL_MS = 200L;

    private final DurableStore store;
    private final AuditLogger audit;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final RetryPolicy retryPolicy;
    private final long handlerTimeoutMs;
    private final long retentionMs;
    private final PriorityQueues queues;

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Message> deadLetters = new ConcurrentHashMap<>();
    private final LinkedBlockingQueue<MessageRecord> deadLetterBacklog = new LinkedBlockingQueue<>();
    private final Map<String, CompletableFuture<Message>> replies = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();

    private final ExecutorService handlerPool;
    private final ExecutorService lanePool;
    private final ScheduledExecutorService retryScheduler;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger pendingRetries = new AtomicInteger();
    private final AtomicInteger unwrittenDeadLetters = new AtomicInteger();
    private Thread dispatcher;
    private Thread deadLetterWriter;

    public MessageBus(HubSettings settings, DurableStore store, AuditLogger audit, HubMetrics metrics) {
        this(settings, store, audit, metrics, System::currentTimeMillis);
    }

    public MessageBus(HubSettings settings, DurableStore store, AuditLogger audit, HubMetrics metrics,
                      LongSupplier clock) {
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.retryPolicy = RetryPolicy.fromSettings(settings);
        this.handlerTimeoutMs = settings.handlerTimeoutMs();
        this.retentionMs = settings.messageRetentionMs();
        this.queues = new PriorityQueues(settings.maxConsecutiveHigh());
        this.handlerPool = Executors.newCachedThreadPool(daemonFactory("agenthub-handler-"));
        this.lanePool = Executors.newCachedThreadPool(daemonFactory("agenthub-delivery-"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(daemonFactory("agenthub-retry-"));
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        dispatcher = new Thread(this::dispatchLoop, "agenthub-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        deadLetterWriter = new Thread(this::deadLetterLoop, "agenthub-dead-letters");
        deadLetterWriter.setDaemon(true);
        deadLetterWriter.start();
        log.info("message bus started (retry unit {}ms, handler timeout {}ms)",
                retryPolicy.unitMs(), handlerTimeoutMs);
    }

    public void registerHandler(String agentId, MessageHandler handler) {
        if (agentId == null || agentId.isBlank() || handler == null) {
            throw new HubException(ErrorKind.VALIDATION, "agentId and handler are required");
        }
        handlers.put(agentId, handler);
    }

    public void unregisterHandler(String agentId) {
        if (agentId == null) {
            return;
        }
        handlers.remove(agentId);
        subscriptions.remove(agentId);
    }

    public boolean hasHandler(String agentId) {
        return agentId != null && handlers.containsKey(agentId);
    }

    public void subscribe(String agentId, String... eventTypes) {
        Set<String> types = subscriptions.computeIfAbsent(agentId, ignored -> ConcurrentHashMap.newKeySet());
        for (String eventType : eventTypes) {
            if (eventType != null && !eventType.isBlank()) {
                types.add(eventType);
            }
        }
    }

    public void unsubscribe(String agentId, String eventType) {
        Set<String> types = subscriptions.get(agentId);
        if (types != null) {
            types.remove(eventType);
        }
    }

    public Set<String> subscriptionsOf(String agentId) {
        Set<String> types = subscriptions.get(agentId);
        return types == null ? Set.of() : Set.copyOf(types);
    }

    public SendOutcome send(Message message) {
        long nowMs = clock.getAsLong();
        String invalid = validate(message, nowMs);
        if (invalid != null) {
            String id = message == null ? null : message.id();
            metrics.increment(HubMetrics.MESSAGES_REJECTED);
            if (message != null && message.id() != null) {
                persist(message, MessageRecord.REJECTED, invalid);
            }
            failReply(id, ErrorKind.VALIDATION, invalid);
            log.debug("message {} rejected: {}", id, invalid);
            return SendOutcome.rejected(id, invalid);
        }
        metrics.increment(HubMetrics.MESSAGES_SENT);
        outstanding.incrementAndGet();
        if (message.priority() == Priority.CRITICAL) {
            return deliverInline(message);
        }
        persist(message, MessageRecord.QUEUED, null);
        enqueue(message);
        return SendOutcome.queued(message.id(), null);
    }

    /**
     * Sends {@code message} and returns a future completed with the recipient's reply. The future
     * fails with {@link ErrorKind#VALIDATION} on rejection and {@link ErrorKind#DEAD_LETTERED} once
     * retries are exhausted.
     */
    public CompletableFuture<Message> dispatch(Message message) {
        CompletableFuture<Message> reply = new CompletableFuture<>();
        if (message == null || message.id() == null) {
            reply.completeExceptionally(new HubException(ErrorKind.VALIDATION, "message id is required"));
            return reply;
        }
        replies.put(message.id(), reply);
        SendOutcome outcome = send(message);
        if (outcome.status() == SendOutcome.Status.REJECTED && !reply.isDone()) {
            replies.remove(message.id());
            reply.completeExceptionally(new HubException(ErrorKind.VALIDATION, outcome.reason()));
        }
        return reply;
    }

    /**
     * Sends {@code eventType} to every subscriber except the sender.
     *
     * @return number of subscribers the event was accepted for
     */
    public int broadcast(String eventType, Object payload, String fromAgent) {
        int accepted = 0;
        for (Map.Entry<String, Set<String>> entry : subscriptions.entrySet()) {
            String agentId = entry.getKey();
            if (agentId.equals(fromAgent) || !entry.getValue().contains(eventType)) {
                continue;
            }
            SendOutcome outcome = send(Message.event(fromAgent, agentId, eventType, payload, Priority.MEDIUM));
            if (outcome.accepted()) {
                accepted++;
            }
        }
        metrics.increment(HubMetrics.BROADCASTS);
        log.debug("broadcast {} from {} reached {} subscriber(s)", eventType, fromAgent, accepted);
        return accepted;
    }

    public Optional<MessageRecord> findRecord(String messageId) {
        return store.get(MESSAGE_PREFIX + messageId).map(row -> Jsons.fromJson(row.value(), MessageRecord.class));
    }

    public boolean isDeadLettered(String messageId) {
        return deadLetters.containsKey(messageId);
    }

    /** Persisted dead letters, oldest first. */
    public List<MessageRecord> deadLetters() {
        drainDeadLetters();
        List<MessageRecord> out = new ArrayList<>();
        for (StoredValue row : store.scanPrefix(DEAD_LETTER_PREFIX)) {
            out.add(Jsons.fromJson(row.value(), MessageRecord.class));
        }
        out.sort(Comparator.comparingLong(MessageRecord::updatedAtMs));
        return out;
    }

    /**
     * Puts a dead letter back on the bus with a fresh retry budget.
     */
    public SendOutcome replayDeadLetter(String messageId) {
        drainDeadLetters();
        Optional<StoredValue> row = store.get(DEAD_LETTER_PREFIX + messageId);
        if (row.isEmpty()) {
            return SendOutcome.rejected(messageId, "unknown dead letter");
        }
        MessageRecord record = Jsons.fromJson(row.get().value(), MessageRecord.class);
        Message replay = record.message().withRetryCount(0).withExpiresAt(null);
        store.delete(DEAD_LETTER_PREFIX + messageId);
        deadLetters.remove(messageId);
        audit.log(AuditLogger.AuditEvent.of("dead_letter.replay", "message_bus", messageId, "ok",
                Map.of("to", replay.to(), "action", replay.action())));
        log.info("replaying dead letter {} to {}", messageId, replay.to());
        return send(replay);
    }

    /**
     * Writes every pending dead letter to the store synchronously.
     *
     * @return number of rows written
     */
    public int drainDeadLetters() {
        int written = 0;
        MessageRecord record;
        while ((record = deadLetterBacklog.poll()) != null) {
            writeDeadLetter(record);
            written++;
        }
        return written;
    }

    public PriorityQueues queues() {
        return queues;
    }

    public int pendingRetries() {
        return pendingRetries.get();
    }

    /**
     * Blocks until every accepted message is settled and every dead letter is persisted.
     */
    public boolean awaitIdle(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (outstanding.get() == 0 && unwrittenDeadLetters.get() == 0) {
                return true;
            }
            try {
                Thread.sleep(5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return outstanding.get() == 0 && unwrittenDeadLetters.get() == 0;
    }

    @Override
    public void close() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        running.set(false);
        joinQuietly(dispatcher);
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(lanes.values());
        try {
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
                    .get(handlerTimeoutMs + 1000L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("delivery lanes did not settle before shutdown: {}", e.toString());
        }
        List<Runnable> cancelled = retryScheduler.shutdownNow();
        if (!cancelled.isEmpty()) {
            log.info("{} scheduled retr{} left persisted as retrying", cancelled.size(),
                    cancelled.size() == 1 ? "y" : "ies");
        }
        List<Message> leftover = queues.drainAll();
        if (!leftover.isEmpty()) {
            log.info("{} queued message(s) left persisted at shutdown", leftover.size());
        }
        lanePool.shutdown();
        handlerPool.shutdownNow();
        joinQuietly(deadLetterWriter);
        drainDeadLetters();
        for (String id : new ArrayList<>(replies.keySet())) {
            failReply(id, ErrorKind.DELIVERY_FAILURE, "message bus closed");
        }
        log.info("message bus stopped");
    }

    private String validate(Message message, long nowMs) {
        if (!accepting.get()) {
            return "message bus is closed";
        }
        if (message == null) {
            return "message is required";
        }
        if (message.id() == null || message.id().isBlank()) {
            return "message id is required";
        }
        if (message.from() == null || message.from().isBlank()) {
            return "sender is required";
        }
        if (message.to() == null || message.to().isBlank()) {
            return "recipient is required";
        }
        if (message.action() == null || message.action().isBlank()) {
            return "action is required";
        }
        if (!handlers.containsKey(message.to())) {
            return "no handler registered for " + message.to();
        }
        if (message.isExpired(nowMs)) {
            return "message expired";
        }
        return null;
    }

    private SendOutcome deliverInline(Message message) {
        String error = attempt(message);
        if (error == null) {
            return SendOutcome.delivered(message.id());
        }
        Message failed = scheduleRetry(message, error);
        if (failed.retriesExhausted()) {
            return SendOutcome.deadLettered(message.id(), error);
        }
        return SendOutcome.queued(message.id(), "delivery failed, retry scheduled");
    }

    private void enqueue(Message message) {
        queues.offer(message);
        metrics.setGauge(HubMetrics.QUEUE_DEPTH, tierLabel(message.priority()), queues.size(message.priority()));
    }

    private void dispatchLoop() {
        while (running.get()) {
            Optional<Message> next;
            try {
                next = queues.take(DISPATCH_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next.isEmpty()) {
                continue;
            }
            Message message = next.get();
            metrics.setGauge(HubMetrics.QUEUE_DEPTH, tierLabel(message.priority()), queues.size(message.priority()));
            long starved = queues.lowStarvationCount();
            if (starved > metrics.counter(HubMetrics.LOW_STARVATION)) {
                metrics.add(HubMetrics.LOW_STARVATION, starved - metrics.counter(HubMetrics.LOW_STARVATION));
            }
            try {
                lanes.compute(message.to(), (recipient, previous) ->
                        (previous == null ? CompletableFuture.<Void>completedFuture(null) : previous)
                                .thenRunAsync(() -> deliverQueued(message), lanePool));
            } catch (RejectedExecutionException e) {
                log.warn("delivery lane for {} rejected message {}", message.to(), message.id());
                outstanding.decrementAndGet();
            }
        }
    }

    private void deliverQueued(Message message) {
        try {
            if (message.isExpired(clock.getAsLong())) {
                persist(message, MessageRecord.EXPIRED, "expired before delivery");
                failReply(message.id(), ErrorKind.DELIVERY_FAILURE, "message expired before delivery");
                outstanding.decrementAndGet();
                return;
            }
            String error = attempt(message);
            if (error != null) {
                scheduleRetry(message, error);
            }
        } catch (RuntimeException e) {
            log.error("delivery of {} failed unexpectedly", message.id(), e);
            scheduleRetry(message, e.toString());
        }
    }

    /**
     * One delivery attempt. Settles the message on success.
     *
     * @return {@code null} on success, otherwise the failure reason
     */
    private String attempt(Message message) {
        MessageHandler handler = handlers.get(message.to());
        if (handler == null) {
            return "no handler registered for " + message.to();
        }
        Future<Message> call;
        try {
            call = handlerPool.submit(() -> handler.handle(message));
        } catch (RejectedExecutionException e) {
            return "handler pool is shut down";
        }
        Message reply;
        try {
            reply = call.get(handlerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            return "handler timed out after " + handlerTimeoutMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return "interrupted";
        }
        metrics.increment(HubMetrics.MESSAGES_DELIVERED);
        persist(message, MessageRecord.DELIVERED, null);
        CompletableFuture<Message> waiting = replies.remove(message.id());
        if (waiting != null) {
            waiting.complete(reply != null ? reply : message.reply(Jsons.object()));
        }
        outstanding.decrementAndGet();
        return null;
    }

    private Message scheduleRetry(Message message, String error) {
        int nextCount = Math.min(message.retryCount() + 1, Math.max(0, message.maxRetries()));
        Message failed = message.withRetryCount(nextCount);
        if (message.maxRetries() <= 0) {
            deadLetter(failed, error);
            return failed;
        }
        long delayMs = retryPolicy.backoffMs(nextCount);
        metrics.increment(HubMetrics.MESSAGES_RETRIED);
        persist(failed, MessageRecord.RETRYING, error);
        log.debug("delivery of {} to {} failed ({}), attempt {}/{}, next step in {}ms",
                message.id(), message.to(), error, nextCount, message.maxRetries(), delayMs);
        pendingRetries.incrementAndGet();
        try {
            retryScheduler.schedule(() -> {
                try {
                    if (failed.retriesExhausted()) {
                        deadLetter(failed, error);
                    } else if (accepting.get()) {
                        enqueue(failed);
                    } else {
                        outstanding.decrementAndGet();
                    }
                } finally {
                    pendingRetries.decrementAndGet();
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pendingRetries.decrementAndGet();
            outstanding.decrementAndGet();
            log.warn("retry of {} not scheduled, bus is shutting down", message.id());
        }
        return failed;
    }

    private void deadLetter(Message message, String reason) {
        if (deadLetters.putIfAbsent(message.id(), message) != null) {
            return;
        }
        long nowMs = clock.getAsLong();
        metrics.increment(HubMetrics.MESSAGES_DEAD_LETTERED);
        persist(message, MessageRecord.DEAD_LETTERED, reason);
        unwrittenDeadLetters.incrementAndGet();
        deadLetterBacklog.offer(new MessageRecord(message, MessageRecord.DEAD_LETTERED, reason, nowMs));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("to", message.to());
        details.put("action", message.action());
        details.put("retry_count", message.retryCount());
        details.put("reason", reason == null ? "" : reason);
        audit.log(AuditLogger.AuditEvent.correlated("message.dead_letter", message.from(), message.id(), "dead_lettered",
                message.correlationId(), details));
        log.warn("message {} to {} dead-lettered after {} attempt(s): {}",
                message.id(), message.to(), message.retryCount(), reason);
        failReply(message.id(), ErrorKind.DEAD_LETTERED, "message " + message.id() + " dead-lettered: " + reason);
        outstanding.decrementAndGet();
    }

    private void deadLetterLoop() {
        while (running.get()) {
            try {
                MessageRecord record = deadLetterBacklog.poll(DISPATCH_POLL_MS, TimeUnit.MILLISECONDS);
                if (record != null) {
                    writeDeadLetter(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("failed to persist dead letter", e);
            }
        }
    }

    private void writeDeadLetter(MessageRecord record) {
        try {
            store.put(DEAD_LETTER_PREFIX + record.message().id(), Jsons.toJson(record), 0L);
        } finally {
            unwrittenDeadLetters.decrementAndGet();
        }
    }

    private void persist(Message message, String state, String error) {
        try {
            store.put(MESSAGE_PREFIX + message.id(),
                    Jsons.toJson(new MessageRecord(message, state, error, clock.getAsLong())), retentionMs);
        } catch (RuntimeException e) {
            log.warn("failed to persist message {} as {}: {}", message.id(), state, e.toString());
        }
    }

    private void failReply(String messageId, ErrorKind kind, String reason) {
        if (messageId == null) {
            return;
        }
        CompletableFuture<Message> waiting = replies.remove(messageId);
        if (waiting != null) {
            waiting.completeExceptionally(new HubException(kind, reason));
        }
    }

    private static String tierLabel(Priority priority) {
        return priority == Priority.CRITICAL ? Priority.HIGH.wireName() : priority.wireName();
    }

    private static void joinQuietly(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(2000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
