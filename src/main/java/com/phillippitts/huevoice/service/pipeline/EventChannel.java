package com.phillippitts.huevoice.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between two stages.
 *
 * <p>Producers never block: {@link #offer(Object)} drops and logs when the channel is full.
 * Consumers wait a short bounded time in {@link #poll(Duration)} so they can notice a stop request.
 *
 * @param <T> message type
 */
public class EventChannel<T> {

    private static final Logger LOG = LogManager.getLogger(EventChannel.class);

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;

    public EventChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues without blocking.
     *
     * @return false when the channel was full and the message was dropped
     */
    public boolean offer(T message) {
        Objects.requireNonNull(message, "message");
        boolean accepted = queue.offer(message);
        if (!accepted) {
            LOG.warn("Channel {} full (capacity={}); dropped {}", name, capacity,
                    message.getClass().getSimpleName());
        }
        return accepted;
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return next message, or null on timeout
     */
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Non-blocking take, null when empty. */
    public T poll() {
        return queue.poll();
    }

    /** Discards pending messages; returns how many were dropped. */
    public int clear() {
        int n = queue.size();
        queue.clear();
        return n;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }
}
