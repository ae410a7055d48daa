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

import com.mapforge.internal.ExecutorServiceUtil;
import com.mapforge.internal.MfExecutors;
import com.mapforge.render.RenderingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains eviction notifications on a dedicated thread and releases the rendering engine's
 * global state once the pool is empty.
 * <p>
 * The emptiness check and {@link RenderingEngine#cleanup()} both run under the pool lock, and a
 * pool entry exists for every live renderer, so cleanup never overlaps with a live renderer.
 */
public class Reaper implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Reaper.class);
    private final RenderPool pool;
    private final RenderingEngine engine;
    private final LinkedBlockingQueue<String> evicted = new LinkedBlockingQueue<>();
    private final ExecutorService executor = MfExecutors.newDedicatedExecutor("mf-reaper");
    private final AtomicLong cleanups = new AtomicLong();
    private volatile boolean shutdown;

    Reaper(RenderPool pool, RenderingEngine engine) {
        this.pool = pool;
        this.engine = engine;
    }

    void start() {
        executor.execute(this);
    }

    /**
     * Queues an eviction notification. Never blocks.
     */
    void notifyEvicted(String key) {
        if (!evicted.offer(key)) {
            LOGGER.warn("Dropped eviction notification for key {}", PoolEntry.abbreviate(key));
        }
    }

    /**
     * Returns how many times the engine's global state has been cleaned up.
     */
    public long getCleanupCount() {
        return cleanups.get();
    }

    @Override
    public void run() {
        while (!shutdown) {
            String key;
            try {
                key = evicted.take();
            } catch (InterruptedException exp) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                pool.runIfEmpty(() -> cleanup(key));
            } catch (RuntimeException exp) {
                LOGGER.error("Global cleanup failed after evicting key {}", PoolEntry.abbreviate(key), exp);
            }
        }
        LOGGER.debug("Reaper stopped");
    }

    private void cleanup(String key) {
        LOGGER.debug("Pool is empty after evicting key {}, cleaning up global state", PoolEntry.abbreviate(key));
        engine.cleanup();
        cleanups.incrementAndGet();
    }

    void shutdown(Duration timeout) {
        shutdown = true;
        if (!ExecutorServiceUtil.shutdownNowThenAwaitTermination(executor, timeout)) {
            LOGGER.warn("Reaper cannot be stopped gracefully");
        }
    }
}
