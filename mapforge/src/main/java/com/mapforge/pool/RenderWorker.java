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

import com.mapforge.common.MapforgeException;
import com.mapforge.common.tile.Extent;
import com.mapforge.render.ConstructionException;
import com.mapforge.render.Renderer;
import com.mapforge.render.RenderingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Owns the renderer for one key and serves its channel from a single thread.
 * <p>
 * The renderer is constructed, used and closed on the worker thread only. The worker runs until
 * its channel stays idle for the configured timeout, until it is interrupted by a pool shutdown,
 * or until the renderer cannot be constructed. On every exit path it closes the channel, releases
 * the renderer, removes its own entry from the pool and notifies the reaper.
 */
public class RenderWorker implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderWorker.class);
    private final RenderPool pool;
    private final RenderingEngine engine;
    private final String key;
    private final RenderChannel channel;
    private final Duration idleTimeout;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile State state = State.INIT;

    RenderWorker(RenderPool pool, RenderingEngine engine, String key, RenderChannel channel, Duration idleTimeout) {
        this.pool = pool;
        this.engine = engine;
        this.key = key;
        this.channel = channel;
        this.idleTimeout = idleTimeout;
    }

    public State getState() {
        return state;
    }

    /**
     * Blocks until the renderer has been constructed.
     *
     * @throws ConstructionFailedException if construction failed; the entry is already gone
     */
    void awaitReady() {
        try {
            ready.get();
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new MapforgeException(exp);
        } catch (ExecutionException exp) {
            if (exp.getCause() instanceof MapforgeException cause) {
                throw cause;
            }
            throw new MapforgeException(exp.getCause());
        }
    }

    @Override
    public void run() {
        Renderer renderer = null;
        MapforgeException failure = null;
        try {
            renderer = engine.construct(key);
            if (renderer == null) {
                throw new ConstructionException("Rendering engine returned no renderer");
            }
            LOGGER.debug("Renderer constructed for key {} on {}", PoolEntry.abbreviate(key), Thread.currentThread().getName());
            state = State.RUNNING;
            ready.complete(null);
            serve(renderer);
        } catch (ConstructionException | RuntimeException exp) {
            if (renderer == null) {
                LOGGER.warn("Failed to construct renderer for key {}", PoolEntry.abbreviate(key), exp);
                failure = new ConstructionFailedException(key, exp);
            } else {
                LOGGER.error("Render worker for key {} terminated unexpectedly", PoolEntry.abbreviate(key), exp);
            }
        } catch (InterruptedException exp) {
            LOGGER.debug("Render worker for key {} interrupted", PoolEntry.abbreviate(key));
            Thread.currentThread().interrupt();
        } catch (Error exp) {
            if (renderer == null) {
                failure = new ConstructionFailedException(key, exp);
            }
            LOGGER.error("Render worker for key {} died", PoolEntry.abbreviate(key), exp);
            throw exp;
        } finally {
            state = State.EXIT;
            channel.close();
            release(renderer);
            try {
                pool.evict(key, channel);
            } finally {
                // Waiters observe the failure only after the entry is gone, so a retry constructs again.
                ready.completeExceptionally(failure != null ? failure : new WorkerUnavailableException(key));
            }
        }
    }

    /**
     * Retires a worker that was dropped by its executor before {@link #run()} started. No renderer
     * exists yet, so only the entry and the slot are given back.
     */
    void abandon() {
        state = State.EXIT;
        channel.close();
        try {
            pool.evict(key, channel);
        } finally {
            ready.completeExceptionally(new PoolShutdownException());
        }
        LOGGER.debug("Abandoned render worker for key {}", PoolEntry.abbreviate(key));
    }

    private void serve(Renderer renderer) throws InterruptedException {
        while (!channel.isClosed()) {
            RenderRequest request = channel.poll(idleTimeout);
            if (request == null) {
                LOGGER.debug("Render worker for key {} idle for {}, exiting", PoolEntry.abbreviate(key), idleTimeout);
                return;
            }
            handle(renderer, request);
        }
    }

    private void handle(Renderer renderer, RenderRequest request) {
        Extent extent = request.extent();
        try {
            byte[] image = renderer.render(extent);
            if (image == null) {
                request.fail(new RenderFailedException(key, extent, new IllegalStateException("renderer returned no image")));
                return;
            }
            request.complete(image);
        } catch (Exception exp) {
            LOGGER.warn("Failed to render {} for key {}", extent, PoolEntry.abbreviate(key), exp);
            request.fail(new RenderFailedException(key, extent, exp));
        } catch (Error exp) {
            // The caller is released before the worker goes down with the error.
            request.fail(new RenderFailedException(key, extent, exp));
            throw exp;
        }
    }

    private void release(Renderer renderer) {
        if (renderer == null) {
            return;
        }
        try {
            renderer.close();
        } catch (RuntimeException exp) {
            LOGGER.error("Failed to release renderer for key {}", PoolEntry.abbreviate(key), exp);
        }
    }

    @Override
    public String toString() {
        return String.format("RenderWorker{key=%s, state=%s}", PoolEntry.abbreviate(key), state);
    }

    public enum State {
        INIT,
        RUNNING,
        EXIT
    }
}
