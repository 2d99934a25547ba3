package com.trace.export.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe accumulator that groups items into bundles and hands each completed bundle
 * to a {@link BundleHandler}.
 *
 * <p>A pending bundle is handed off when it reaches the count threshold, when its first item
 * is older than the delay threshold, or on {@link #flush()}. Handed-off bundles are delivered
 * in hand-off order by a single daemon worker thread, so handler invocations never overlap and
 * producers never wait on the handler.</p>
 *
 * <p>Overflow policy is drop-newest: {@link #add} rejects an item with
 * {@link BundlerOverflowException} when the weight of items pending, queued for the worker or
 * being handled would exceed the buffered item limit. A bundle's weight is released only after
 * the handler returns.</p>
 *
 * <pre>
 * Bundler&lt;WireSpan&gt; bundler = new Bundler&lt;&gt;(BundlerConfig.defaults(), bundle -&gt; upload(bundle));
 * bundler.add(span, 1);
 * bundler.flush();
 * </pre>
 */
public class Bundler<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Bundler.class);
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    private final BundlerConfig config;
    private final BundleHandler<T> handler;
    private final ExecutorService worker;
    private final ScheduledExecutorService timer;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Thread workerThread;

    // guarded by lock
    private List<T> pending = new ArrayList<>();
    private long pendingWeight;
    private long generation;
    private long bufferedWeight;
    private ScheduledFuture<?> delayTask;
    private boolean closed;

    public Bundler(BundlerConfig config, BundleHandler<T> handler) {
        this.config = config != null ? config : BundlerConfig.defaults();
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        this.handler = handler;

        int instance = INSTANCE_COUNTER.incrementAndGet();
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = daemonThread(runnable, "bundler-" + instance + "-worker");
            workerThread = thread;
            return thread;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(
                runnable -> daemonThread(runnable, "bundler-" + instance + "-timer"));

        log.debug("Bundler initialized: {}", this.config);
    }

    /**
     * Buffers one item.
     *
     * @param item   the item to buffer
     * @param weight the item's share of the buffered item limit, must be &gt; 0
     * @throws BundlerOverflowException if accepting the item would exceed the buffered item limit
     * @throws IllegalStateException    if the bundler is closed
     */
    public void add(T item, int weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0");
        }

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Bundler is closed");
            }
            if (bufferedWeight + weight > config.getBufferedItemLimit()) {
                throw new BundlerOverflowException(bufferedWeight, config.getBufferedItemLimit());
            }

            bufferedWeight += weight;
            pendingWeight += weight;
            pending.add(item);

            if (pending.size() == 1) {
                long bundleGeneration = generation;
                delayTask = timer.schedule(() -> handOffIfCurrent(bundleGeneration),
                        config.getDelayThreshold().toNanos(), TimeUnit.NANOSECONDS);
            }
            if (pending.size() >= config.getBundleCountThreshold()) {
                handOffLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands off the pending bundle, if any, and waits until every bundle handed off before
     * this call has been delivered. Does nothing when nothing is buffered.
     *
     * <p>When called from the handler itself the pending bundle is handed off without waiting.</p>
     */
    public void flush() {
        Future<?> barrier;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            handOffLocked();
            barrier = worker.submit(() -> { });
        } finally {
            lock.unlock();
        }

        if (Thread.currentThread() == workerThread) {
            return;
        }
        await(barrier);
    }

    /**
     * Returns the weight of items pending, queued for the worker or being handled.
     */
    public long getBufferedWeight() {
        lock.lock();
        try {
            return bufferedWeight;
        } finally {
            lock.unlock();
        }
    }

    public BundlerConfig getConfig() {
        return config;
    }

    /**
     * Delivers everything buffered, then stops the worker and timer threads.
     * Further {@link #add} calls throw {@link IllegalStateException}.
     */
    @Override
    public void close() {
        Future<?> barrier;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            handOffLocked();
            barrier = worker.submit(() -> { });
            closed = true;
        } finally {
            lock.unlock();
        }

        if (Thread.currentThread() != workerThread) {
            await(barrier);
        }
        timer.shutdownNow();
        worker.shutdown();
        log.debug("Bundler closed");
    }

    private void handOffIfCurrent(long bundleGeneration) {
        lock.lock();
        try {
            if (!closed && bundleGeneration == generation) {
                handOffLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    private void handOffLocked() {
        if (delayTask != null) {
            delayTask.cancel(false);
            delayTask = null;
        }
        if (pending.isEmpty()) {
            return;
        }

        List<T> bundle = pending;
        long weight = pendingWeight;
        pending = new ArrayList<>();
        pendingWeight = 0;
        generation++;

        worker.execute(() -> deliver(bundle, weight));
    }

    private void deliver(List<T> bundle, long weight) {
        try {
            handler.handle(Collections.unmodifiableList(bundle));
        } catch (RuntimeException e) {
            log.error("Bundle handler failed for bundle of {} items: {}", bundle.size(), e.getMessage(), e);
        } finally {
            lock.lock();
            try {
                bufferedWeight -= weight;
            } finally {
                lock.unlock();
            }
        }
    }

    private static void await(Future<?> barrier) {
        try {
            barrier.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for bundles to be delivered");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Bundle delivery barrier failed", e.getCause());
        }
    }

    private static Thread daemonThread(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
