/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mapforge.pool;

import com.mapforge.MapforgeService;
import com.mapforge.common.MapforgeException;
import com.mapforge.internal.ExecutorServiceUtil;
import com.mapforge.internal.MfExecutors;
import com.mapforge.render.RenderingEngine;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed pool of renderers with thread affinity.
 * <p>
 * The pool keeps at most one live renderer per key. Each renderer is owned by a
 * {@link RenderWorker} running on its own thread, and callers talk to it through a
 * {@link RenderChannel}. The number of distinct live keys is bounded by
 * {@code pool.parallelism}; a new key beyond that bound waits for a slot or fails, depending
 * on the {@link AcquisitionPolicy}.
 * <p>
 * A single lock guards the key to entry mapping. It is held for lookups, inserts and removals
 * only, never while a renderer is constructed or rendering. Entries are removed by their own
 * worker when it exits, after which the {@link Reaper} cleans up the engine's global state if
 * the pool has become empty.
 */
public class RenderPool implements MapforgeService {
    public static final String NAME = "RenderPool";
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderPool.class);
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<String, PoolEntry> entries = new HashMap<>();
    private final RenderingEngine engine;
    private final PoolConfig config;
    private final Semaphore slots;
    private final ExecutorService workers;
    private final Reaper reaper;
    private final AtomicLong startedWorkers = new AtomicLong();
    private final AtomicLong evictedWorkers = new AtomicLong();
    private volatile boolean shutdown;

    public RenderPool(RenderingEngine engine, Config config) {
        this(engine, PoolConfig.fromConfig(config));
    }

    public RenderPool(RenderingEngine engine, PoolConfig config) {
        this(engine, config, MfExecutors.newBoundedExecutor(
                config.parallelism(),
                1,
                TimeUnit.MINUTES,
                MfExecutors.namedFactory("mf-render-worker-%d")
        ));
    }

    RenderPool(RenderingEngine engine, PoolConfig config, ExecutorService workers) {
        this.engine = engine;
        this.config = config;
        this.slots = new Semaphore(config.parallelism(), true);
        this.workers = workers;
        this.reaper = new Reaper(this, engine);
        this.reaper.start();
        LOGGER.info("Render pool initialized with config: {}", config);
    }

    /**
     * Returns the channel for {@code key}, starting a worker and constructing its renderer if the
     * key is not live yet.
     * <p>
     * Concurrent calls for the same new key start exactly one worker. The calls wait, outside the
     * pool lock, until that worker has constructed its renderer.
     *
     * @param key the renderer configuration, also its identity
     * @return the channel served by the key's worker
     * @throws PoolExhaustedException      if no worker slot can be obtained under the acquisition policy
     * @throws ConstructionFailedException if the renderer cannot be constructed
     * @throws PoolShutdownException       if the pool has been shut down
     */
    public RenderChannel acquireOrCreate(@Nonnull String key) {
        ensureRunning();

        PoolEntry entry = lookup(key);
        if (entry == null) {
            entry = create(key);
        }
        entry.worker().awaitReady();
        return entry.channel();
    }

    private PoolEntry lookup(String key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    private PoolEntry create(String key) {
        acquireSlot();
        lock.lock();
        try {
            if (shutdown) {
                slots.release();
                throw new PoolShutdownException();
            }
            PoolEntry existing = entries.get(key);
            if (existing != null) {
                // Another caller started this key while we were waiting for a slot.
                slots.release();
                return existing;
            }

            RenderChannel channel = new RenderChannel(key, config.handoffPollInterval());
            RenderWorker worker = new RenderWorker(this, engine, key, channel, config.idleTimeout());
            try {
                workers.execute(worker);
            } catch (RejectedExecutionException exp) {
                slots.release();
                throw new PoolShutdownException();
            }
            // The worker cannot evict itself before this insert, it needs the lock we hold.
            PoolEntry entry = new PoolEntry(key, channel, worker);
            entries.put(key, entry);
            startedWorkers.incrementAndGet();
            LOGGER.debug("Started render worker for key {}", PoolEntry.abbreviate(key));
            return entry;
        } finally {
            lock.unlock();
        }
    }

    private void acquireSlot() {
        try {
            switch (config.acquisitionPolicy()) {
                case FAIL_FAST -> {
                    if (!slots.tryAcquire()) {
                        throw new PoolExhaustedException(config.parallelism());
                    }
                }
                case BLOCK -> {
                    if (config.acquireTimeout().isZero()) {
                        slots.acquire();
                    } else if (!slots.tryAcquire(config.acquireTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                        throw new PoolExhaustedException(config.parallelism());
                    }
                }
            }
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new MapforgeException(exp);
        }
    }

    /**
     * Called by a worker on its way out. Removes the worker's entry, notifies the reaper and
     * frees the worker's slot.
     *
     * @throws IllegalStateException if the entry is missing, which means the pool bookkeeping is broken
     */
    void evict(String key, RenderChannel channel) {
        try {
            lock.lock();
            try {
                PoolEntry entry = entries.get(key);
                if (entry == null || entry.channel() != channel) {
                    LOGGER.error("Evicted key {} has no entry owned by its worker", PoolEntry.abbreviate(key));
                    throw new IllegalStateException("No pool entry for evicted key " + PoolEntry.abbreviate(key));
                }
                entries.remove(key);
                evictedWorkers.incrementAndGet();
            } finally {
                lock.unlock();
            }
            LOGGER.debug("Evicted render worker for key {}", PoolEntry.abbreviate(key));
            reaper.notifyEvicted(key);
        } finally {
            slots.release();
        }
    }

    /**
     * Runs {@code action} under the pool lock if, and only if, the pool has no entries.
     *
     * @return true if the action ran
     */
    boolean runIfEmpty(Runnable action) {
        lock.lock();
        try {
            if (!entries.isEmpty()) {
                return false;
            }
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of live keys.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(@Nonnull String key) {
        return lookup(key) != null;
    }

    /**
     * Returns a snapshot of the live keys.
     */
    public Set<String> keys() {
        lock.lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the lifecycle state of the worker serving {@code key}, if the key is live.
     */
    public Optional<RenderWorker.State> stateOf(@Nonnull String key) {
        PoolEntry entry = lookup(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(entry.worker().getState());
    }

    public PoolStats stats() {
        return new PoolStats(
                size(),
                slots.availablePermits(),
                startedWorkers.get(),
                evictedWorkers.get(),
                reaper.getCleanupCount()
        );
    }

    public PoolConfig getConfig() {
        return config;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new PoolShutdownException();
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Stops all workers, waits for them to release their renderers, stops the reaper and finally
     * terminates the rendering engine. Workers that were queued but never started are abandoned
     * and their callers fail with {@link PoolShutdownException}. Termination runs even if some
     * workers did not stop within {@code pool.shutdown_timeout}.
     */
    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (PoolEntry entry : entries.values()) {
                entry.channel().close();
            }
        } finally {
            lock.unlock();
        }

        // A worker submitted after another one freed its slot may still be queued behind it.
        boolean terminated = ExecutorServiceUtil.shutdownNowThenAwaitTermination(workers, config.shutdownTimeout(), (task) -> {
            if (task instanceof RenderWorker worker) {
                worker.abandon();
            }
        });
        if (!terminated) {
            LOGGER.warn("{} cannot be stopped gracefully, {} render workers still alive", NAME, size());
        }
        reaper.shutdown(config.shutdownTimeout());

        try {
            engine.terminate();
        } catch (RuntimeException exp) {
            LOGGER.error("Failed to terminate rendering engine", exp);
        }
        LOGGER.info("{} has been shut down", NAME);
    }
}
