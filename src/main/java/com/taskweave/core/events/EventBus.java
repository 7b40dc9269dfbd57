package com.taskweave.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Asynchronous in-memory pub/sub bus for workflow lifecycle messages.
 * <p>
 * {@link #publish} only enqueues. A single daemon consumer thread delivers each message to
 * every callback registered for {@code (type, subscriberId)}, honouring the recipient filter.
 * Since one thread delivers everything, each subscriber sees messages in publish order and
 * its callbacks are never invoked concurrently. Messages published before {@link #start()}
 * stay queued until the bus starts.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_LIMIT = 1000;
    public static final int DEFAULT_HISTORY_QUERY_LIMIT = 100;

    private record SubscriberKey(MessageType type, String subscriberId) {}

    private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
    private final Map<SubscriberKey, CopyOnWriteArrayList<Consumer<Message>>> subscribers =
            new ConcurrentHashMap<>();
    private final Deque<Message> history = new ArrayDeque<>();
    private final int historyLimit;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();
    private final Object idleMonitor = new Object();

    private volatile boolean running;
    private Thread consumer;

    public EventBus() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public EventBus(int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive, was " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Event bus already running");
            return;
        }
        running = true;
        consumer = new Thread(this::consumeLoop, "taskweave-event-bus");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Event bus started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumer.interrupt();
        try {
            consumer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        consumer = null;
        log.info("Event bus stopped ({} messages still queued)", queue.size());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Enqueues a message for delivery and records it in the bounded history.
     */
    public void publish(Message message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        published.incrementAndGet();
        queue.add(message);
        log.debug("Published {} {} from {}", message.type(), message.id(), message.sender());
    }

    /**
     * Registers a callback for one message type under a subscriber id.
     *
     * @return a {@link Subscription} handle that removes just this callback
     */
    public Subscription subscribe(MessageType type, String subscriberId, Consumer<Message> callback) {
        var key = new SubscriberKey(type, subscriberId);
        subscribers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(callback);
        log.debug("Subscriber {} registered for {}", subscriberId, type);
        return () -> {
            var callbacks = subscribers.get(key);
            if (callbacks != null) {
                callbacks.remove(callback);
            }
        };
    }

    /**
     * Removes every callback of a subscriber for one message type.
     */
    public void unsubscribe(MessageType type, String subscriberId) {
        subscribers.remove(new SubscriberKey(type, subscriberId));
        log.debug("Subscriber {} unsubscribed from {}", subscriberId, type);
    }

    public List<Message> history() {
        return history(null, null, DEFAULT_HISTORY_QUERY_LIMIT);
    }

    /**
     * Most recent messages, oldest first.
     *
     * @param type   optional type filter
     * @param sender optional sender filter
     * @param limit  maximum number of messages returned
     */
    public List<Message> history(MessageType type, String sender, int limit) {
        List<Message> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        var filtered = snapshot.stream()
                .filter(m -> type == null || m.type() == type)
                .filter(m -> sender == null || sender.equals(m.sender()))
                .toList();
        int from = Math.max(0, filtered.size() - Math.max(limit, 0));
        return filtered.subList(from, filtered.size());
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
        log.info("Message history cleared");
    }

    public BusStats stats() {
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        int subscriberCount = (int) subscribers.values().stream().filter(l -> !l.isEmpty()).count();
        return new BusStats(running, queue.size(), historySize, subscriberCount,
                delivered.get(), failedDeliveries.get());
    }

    /**
     * Blocks until every message published so far has been delivered, or the timeout passes.
     *
     * @return true if the bus drained in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (processed.get() < published.get()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
        }
        return true;
    }

    /**
     * Handle for cancelling a single subscription callback.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /**
     * Bus statistics snapshot.
     */
    public record BusStats(
        boolean running,
        int queueSize,
        int historySize,
        int subscribers,
        long delivered,
        long failedDeliveries
    ) {}

    private void consumeLoop() {
        while (running) {
            Message message;
            try {
                message = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
                continue;
            }
            if (message == null) {
                continue;
            }
            try {
                deliver(message);
            } finally {
                processed.incrementAndGet();
                synchronized (idleMonitor) {
                    idleMonitor.notifyAll();
                }
            }
        }
    }

    private void deliver(Message message) {
        int count = 0;
        for (var entry : subscribers.entrySet()) {
            var key = entry.getKey();
            if (key.type() != message.type()) {
                continue;
            }
            if (!message.isBroadcast() && !message.recipient().equals(key.subscriberId())) {
                continue;
            }
            for (var callback : entry.getValue()) {
                if (deliverSafely(key.subscriberId(), callback, message)) {
                    count++;
                }
            }
        }
        log.debug("Delivered {} to {} subscriber callback(s)", message.id(), count);
    }

    private boolean deliverSafely(String subscriberId, Consumer<Message> callback, Message message) {
        try {
            callback.accept(message);
            delivered.incrementAndGet();
            return true;
        } catch (Exception e) {
            failedDeliveries.incrementAndGet();
            log.warn("Subscriber {} threw exception processing {}: {}",
                    subscriberId, message.type(), e.getMessage(), e);
            return false;
        }
    }
}
