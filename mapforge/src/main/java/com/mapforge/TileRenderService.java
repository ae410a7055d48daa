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

package com.mapforge;

import com.mapforge.common.tile.Extent;
import com.mapforge.common.tile.Tile;
import com.mapforge.common.tile.TileMath;
import com.mapforge.internal.ExecutorServiceUtil;
import com.mapforge.internal.MfExecutors;
import com.mapforge.pool.RenderChannel;
import com.mapforge.pool.RenderPool;
import com.mapforge.pool.WorkerUnavailableException;
import com.mapforge.render.RenderingEngine;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for callers that serve tiles, such as an HTTP layer.
 * <p>
 * A request names a renderer configuration and a ZXY tile. The service computes the tile's
 * extent, obtains the configuration's channel from the {@link RenderPool} and renders it. A
 * worker may be evicted between acquiring its channel and sending the request; such requests
 * are retried on a fresh channel up to {@code service.max_retries} times.
 * <p>
 * {@link #renderTileAsync(String, int, int, int)} runs the blocking call on a dedicated bridge
 * executor so that callers on an asynchronous scheduler are not stalled by it.
 */
public class TileRenderService implements MapforgeService {
    public static final String NAME = "TileRender";
    private static final Logger LOGGER = LoggerFactory.getLogger(TileRenderService.class);
    private final RenderingEngine engine;
    private final RenderPool pool;
    private final ExecutorService bridge;
    private final int maxRetries;

    public TileRenderService(RenderingEngine engine) {
        this(engine, ConfigFactory.load());
    }

    public TileRenderService(RenderingEngine engine, Config config) {
        this.engine = engine;
        this.maxRetries = config.getInt("service.max_retries");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("service.max_retries cannot be negative: " + maxRetries);
        }
        this.pool = new RenderPool(engine, config);
        this.bridge = MfExecutors.newBoundedExecutor(
                config.getInt("service.bridge_threads"),
                1,
                TimeUnit.MINUTES,
                MfExecutors.namedFactory("mf-render-bridge-%d")
        );
    }

    /**
     * Renders a tile with the renderer built from {@code key}. Blocks until the bytes are ready.
     *
     * @param key  the renderer configuration
     * @param zoom tile zoom level
     * @param x    tile column
     * @param y    tile row
     * @return the rendered tile
     * @throws IllegalArgumentException if the tile address is invalid
     */
    public RenderedTile renderTile(@Nonnull String key, int zoom, int x, int y) {
        Tile tile = Tile.fromZxy(zoom, x, y);
        Extent extent = TileMath.boundingBox(tile);

        int attempt = 0;
        while (true) {
            RenderChannel channel = pool.acquireOrCreate(key);
            try {
                byte[] content = channel.render(extent);
                return new RenderedTile(tile, content, engine.contentType());
            } catch (WorkerUnavailableException exp) {
                if (attempt++ >= maxRetries) {
                    throw exp;
                }
                LOGGER.debug("Render worker went away while rendering {}, retrying", tile);
            }
        }
    }

    /**
     * Runs {@link #renderTile(String, int, int, int)} on the bridge executor.
     *
     * @return a future completed with the tile, or exceptionally with the failure
     */
    public CompletableFuture<RenderedTile> renderTileAsync(@Nonnull String key, int zoom, int x, int y) {
        return CompletableFuture.supplyAsync(() -> renderTile(key, zoom, x, y), bridge);
    }

    public RenderPool getPool() {
        return pool;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void shutdown() {
        if (!ExecutorServiceUtil.shutdownNowThenAwaitTermination(bridge)) {
            LOGGER.warn("{} service cannot be stopped gracefully", NAME);
        }
        pool.shutdown();
    }
}
