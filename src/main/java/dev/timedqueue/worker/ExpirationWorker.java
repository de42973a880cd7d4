package dev.timedqueue.worker;

import dev.timedqueue.api.ExpirationHandler;
import dev.timedqueue.api.TimedQueue;
import dev.timedqueue.config.TimedQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs {@link TimedQueue#waitUntilExpired} in a loop on one dedicated thread.
 *
 * <p>The loop ends when the queue reports cancellation on an empty store or when the thread is
 * interrupted. A handler that throws is logged and the loop keeps going with the next entry.
 *
 * <p>{@link #close()} cancels the queue and joins the thread for up to the configured shutdown timeout.
 * Cancellation does not cut short a wait on an entry that is already pending, so if the thread is still
 * alive after the timeout it is interrupted.
 *
 * @param <K> key type
 * @param <P> payload type
 */
public class ExpirationWorker<K, P> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExpirationWorker.class);

    private final TimedQueue<K, P> queue;
    private final ExpirationHandler<? super K, ? super P> handler;
    private final TimedQueueConfig config;
    private final Thread thread;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public ExpirationWorker(TimedQueue<K, P> queue, ExpirationHandler<? super K, ? super P> handler,
                            TimedQueueConfig config) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");

        this.thread = new Thread(this::runLoop, config.resolveWorkerThreadName());
        this.thread.setDaemon(config.isDaemonWorker());
    }

    /**
     * Starts the worker thread. Calling it again is a no-op.
     *
     * @return this worker
     * @throws IllegalStateException if the worker was already closed
     */
    public ExpirationWorker<K, P> start() {
        if (closed.get()) {
            throw new IllegalStateException("Worker is closed: " + thread.getName());
        }
        if (started.compareAndSet(false, true)) {
            thread.start();
            logger.info("Started expiration worker '{}'", thread.getName());
        }
        return this;
    }

    private void runLoop() {
        MDC.put("queueName", config.getName());
        try {
            while (true) {
                boolean more;
                try {
                    more = queue.waitUntilExpired(this::deliver);
                } catch (InterruptedException e) {
                    logger.info("Expiration worker '{}' interrupted, stopping", thread.getName());
                    Thread.currentThread().interrupt();
                    return;
                }
                if (!more) {
                    logger.info("Expiration worker '{}' stopping: queue cancelled and empty", thread.getName());
                    return;
                }
            }
        } finally {
            MDC.clear();
        }
    }

    private void deliver(K key, P payload) {
        try {
            handler.onExpired(key, payload);
            delivered.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            logger.error("Expiration handler failed for key '{}': {}", key, e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return thread.isAlive();
    }

    /**
     * Number of entries handed to the handler without it throwing.
     */
    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * Cancels the queue and waits for the worker thread to finish. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed worker '{}'", thread.getName());
            return;
        }

        queue.cancel();
        if (!started.get()) {
            return;
        }
        if (Thread.currentThread() == thread) {
            // closed from inside the handler; the loop ends on its own once the queue is empty
            logger.debug("Expiration worker '{}' closed from its own thread, not joining", thread.getName());
            return;
        }

        Duration timeout = config.getShutdownTimeout();
        long joinMillis = Math.max(1L, timeout.toMillis());
        try {
            thread.join(joinMillis);
            if (thread.isAlive()) {
                logger.warn("Expiration worker '{}' still waiting on a pending entry after {} ms, interrupting",
                        thread.getName(), timeout.toMillis());
                thread.interrupt();
                thread.join(joinMillis);
                if (thread.isAlive()) {
                    logger.warn("Expiration worker '{}' did not stop within {} ms of being interrupted, giving up",
                            thread.getName(), timeout.toMillis());
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while stopping expiration worker '{}'", thread.getName());
            Thread.currentThread().interrupt();
        }
        logger.info("Closed expiration worker '{}' (delivered: {}, failed: {})",
                thread.getName(), delivered.get(), failed.get());
    }
}
