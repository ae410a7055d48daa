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

import com.mapforge.common.tile.Extent;
import com.mapforge.internal.MfExecutors;
import com.mapforge.render.ConstructionException;
import com.mapforge.render.CountingRenderingEngine;
import com.mapforge.render.RenderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

public class RenderPoolTest extends BaseRenderPoolTest {

    @Test
    void same_key_is_constructed_once() {
        newPool();
        RenderChannel first = pool.acquireOrCreate("a");
        RenderChannel second = pool.acquireOrCreate("a");

        assertSame(first, second);
        assertEquals(1, engine.getConstructed());
        assertEquals(1, pool.size());

        Extent extent = extentOf(7, 26, 48);
        assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(first.render(extent)));
        assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(second.render(extent)));
    }

    @Test
    void concurrent_acquire_of_new_key_constructs_once() throws Exception {
        newPool();
        int numberOfCallers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(numberOfCallers);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<RenderChannel>> futures = new ArrayList<>();
            for (int i = 0; i < numberOfCallers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return pool.acquireOrCreate("a");
                }));
            }
            start.countDown();

            RenderChannel channel = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<RenderChannel> future : futures) {
                assertSame(channel, future.get(10, TimeUnit.SECONDS));
            }
            assertEquals(1, engine.getConstructed());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void idle_worker_is_evicted_and_recreated() {
        newPool(Map.of("pool.idle_timeout", "300ms"));
        Extent extent = extentOf(3, 1, 2);
        pool.acquireOrCreate("a").render(extent);
        assertEquals(1, engine.getConstructed());

        await().atMost(Duration.ofSeconds(5)).until(() -> !pool.contains("a"));
        assertEquals(1, engine.getReleased());

        RenderChannel channel = pool.acquireOrCreate("a");
        assertEquals(2, engine.getConstructed());
        assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(channel.render(extent)));
    }

    @Test
    void distinct_keys_render_concurrently() throws Exception {
        newPool();
        CountDownLatch bothRendering = new CountDownLatch(2);
        engine.setRenderHook((extent) -> {
            bothRendering.countDown();
            try {
                if (!bothRendering.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("renders of distinct keys did not overlap");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Extent extent = extentOf(1, 0, 0);
            Future<byte[]> first = executor.submit(() -> pool.acquireOrCreate("a").render(extent));
            Future<byte[]> second = executor.submit(() -> pool.acquireOrCreate("b").render(extent));

            assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(first.get(10, TimeUnit.SECONDS)));
            assertEquals(CountingRenderingEngine.expected("b", extent), CountingRenderingEngine.decode(second.get(10, TimeUnit.SECONDS)));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void excess_keys_wait_for_a_free_slot() throws Exception {
        newPool(Map.of("pool.parallelism", 2, "pool.idle_timeout", "1s"));
        pool.acquireOrCreate("a");
        pool.acquireOrCreate("b");
        assertEquals(0, pool.stats().freeSlots());

        CompletableFuture<RenderChannel> third = CompletableFuture.supplyAsync(() -> pool.acquireOrCreate("c"));
        await().during(Duration.ofMillis(300)).atMost(Duration.ofMillis(800)).until(() -> !third.isDone());

        RenderChannel channel = third.get(10, TimeUnit.SECONDS);
        assertNotNull(channel);
        assertTrue(pool.contains("c"));
        assertEquals(3, engine.getConstructed());
    }

    @Test
    void fail_fast_policy_rejects_excess_keys() {
        newPool(Map.of("pool.parallelism", 1, "pool.acquisition_policy", "fail_fast"));
        RenderChannel channel = pool.acquireOrCreate("a");

        assertThrows(PoolExhaustedException.class, () -> pool.acquireOrCreate("b"));
        assertSame(channel, pool.acquireOrCreate("a"));
        assertEquals(1, engine.getConstructed());
    }

    @Test
    void block_policy_gives_up_after_acquire_timeout() {
        newPool(Map.of("pool.parallelism", 1, "pool.acquire_timeout", "200ms"));
        pool.acquireOrCreate("a");

        assertThrows(PoolExhaustedException.class, () -> pool.acquireOrCreate("b"));
        assertFalse(pool.contains("b"));
    }

    @Test
    void construction_failure_fails_the_call_and_leaves_no_entry() {
        newPool(Map.of("pool.parallelism", 1));
        String key = CountingRenderingEngine.FAILING_KEY_PREFIX + "broken";

        ConstructionFailedException exp = assertThrows(ConstructionFailedException.class, () -> pool.acquireOrCreate(key));
        assertInstanceOf(ConstructionException.class, exp.getCause());
        assertEquals(key, exp.getKey());
        assertFalse(pool.contains(key));
        assertEquals(1, pool.stats().freeSlots());

        // The slot is free again and other keys still work.
        RenderChannel channel = pool.acquireOrCreate("a");
        assertNotNull(channel.render(extentOf(0, 0, 0)));
    }

    @Test
    void render_failure_does_not_stop_the_worker() {
        newPool();
        RenderChannel channel = pool.acquireOrCreate("a");
        Extent extent = extentOf(2, 1, 1);

        engine.failRendersFor("a");
        RenderFailedException exp = assertThrows(RenderFailedException.class, () -> channel.render(extent));
        assertInstanceOf(RenderException.class, exp.getCause());
        assertEquals(extent, exp.getExtent());

        engine.recoverRendersFor("a");
        assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(channel.render(extent)));
        assertEquals(1, engine.getConstructed());
    }

    @Test
    void concurrent_callers_of_one_channel_get_their_own_replies() throws Exception {
        newPool();
        RenderChannel channel = pool.acquireOrCreate("shared");

        int numberOfCallers = 8;
        int rendersPerCaller = 25;
        ExecutorService executor = Executors.newFixedThreadPool(numberOfCallers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int caller = 0; caller < numberOfCallers; caller++) {
                int row = caller;
                futures.add(executor.submit(() -> {
                    for (int column = 0; column < rendersPerCaller; column++) {
                        Extent extent = extentOf(5, column, row);
                        String actual = CountingRenderingEngine.decode(channel.render(extent));
                        assertEquals(CountingRenderingEngine.expected("shared", extent), actual);
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, engine.getConstructed());
        assertFalse(engine.isAffinityViolated());
    }

    @Test
    void cleanup_runs_only_when_pool_is_empty() throws InterruptedException {
        newPool(Map.of("pool.idle_timeout", "300ms"));
        RenderChannel a = pool.acquireOrCreate("a");
        pool.acquireOrCreate("b");

        // Keep "a" busy until "b" has been evicted.
        Extent extent = extentOf(0, 0, 0);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (pool.contains("b")) {
            a.render(extent);
            TimeUnit.MILLISECONDS.sleep(50);
            assertTrue(System.nanoTime() < deadline, "worker of b was not evicted");
        }
        assertTrue(pool.contains("a"));
        assertEquals(0, engine.getCleanups());

        await().atMost(Duration.ofSeconds(5)).until(() -> engine.getCleanups() >= 1);
        assertEquals(0, pool.size());
        assertEquals(0, engine.getLive());
        assertFalse(engine.isCleanupWhileLive());
        assertEquals(engine.getCleanups(), pool.stats().cleanups());
    }

    @Test
    void renderer_lifecycle_is_pinned_to_one_thread() throws Exception {
        newPool(Map.of("pool.idle_timeout", "300ms"));
        RenderChannel channel = pool.acquireOrCreate("a");

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            List<Future<byte[]>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                Extent extent = extentOf(2, i, i);
                futures.add(executor.submit(() -> channel.render(extent)));
            }
            for (Future<byte[]> future : futures) {
                assertNotNull(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> engine.getReleased() == 1);
        assertFalse(engine.isAffinityViolated());
    }

    @Test
    void worker_state_of_live_key() {
        newPool();
        pool.acquireOrCreate("a");

        assertEquals(Optional.of(RenderWorker.State.RUNNING), pool.stateOf("a"));
        assertEquals(Optional.empty(), pool.stateOf("missing"));
        assertEquals(Set.of("a"), pool.keys());
    }

    @Test
    void stats_track_started_and_evicted_workers() {
        newPool(Map.of("pool.idle_timeout", "300ms"));
        pool.acquireOrCreate("a");
        pool.acquireOrCreate("b");

        PoolStats stats = pool.stats();
        assertEquals(2, stats.liveWorkers());
        assertEquals(2, stats.startedWorkers());
        assertEquals(pool.getConfig().parallelism() - 2, stats.freeSlots());

        await().atMost(Duration.ofSeconds(5)).until(() -> pool.stats().evictedWorkers() == 2);
        assertEquals(0, pool.stats().liveWorkers());
        assertEquals(pool.getConfig().parallelism(), pool.stats().freeSlots());
    }

    @Test
    void shutdown_releases_renderers_and_terminates_engine() {
        newPool();
        RenderChannel channel = pool.acquireOrCreate("a");
        pool.acquireOrCreate("b");

        pool.shutdown();

        assertTrue(pool.isShutdown());
        assertEquals(2, engine.getReleased());
        assertEquals(1, engine.getTerminations());
        assertEquals(0, pool.size());
        assertThrows(PoolShutdownException.class, () -> pool.acquireOrCreate("a"));
        assertThrows(WorkerUnavailableException.class, () -> channel.render(extentOf(0, 0, 0)));

        pool.shutdown();
        assertEquals(1, engine.getTerminations());
    }

    @Test
    void shutdown_terminates_engine_without_live_workers() {
        newPool();
        pool.shutdown();
        assertEquals(1, engine.getTerminations());
        assertEquals(0, engine.getConstructed());
    }

    @Test
    void reaper_survives_a_failing_cleanup() {
        newPool(Map.of("pool.idle_timeout", "200ms"));
        engine.failNextCleanup();

        pool.acquireOrCreate("a");
        await().atMost(Duration.ofSeconds(5)).until(() -> !engine.isCleanupFailurePending());
        assertEquals(0, engine.getCleanups());

        pool.acquireOrCreate("b");
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.getCleanups() == 1);
    }

    @Test
    void error_from_renderer_fails_the_caller_instead_of_hanging() {
        newPool();
        RenderChannel channel = pool.acquireOrCreate("a");
        engine.setRenderHook((extent) -> {
            throw new AssertionError("native library crashed");
        });

        Extent extent = extentOf(4, 3, 5);
        RenderFailedException exp = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(RenderFailedException.class, () -> channel.render(extent)));
        assertInstanceOf(AssertionError.class, exp.getCause());
        assertEquals(extent, exp.getExtent());

        // The worker died with the error; its entry and renderer are gone.
        await().atMost(Duration.ofSeconds(5)).until(() -> !pool.contains("a"));
        assertEquals(1, engine.getReleased());
        assertThrows(WorkerUnavailableException.class, () -> channel.render(extent));

        engine.setRenderHook((e) -> {
        });
        RenderChannel fresh = pool.acquireOrCreate("a");
        assertEquals(CountingRenderingEngine.expected("a", extent), CountingRenderingEngine.decode(fresh.render(extent)));
        assertEquals(2, engine.getConstructed());
    }

    @Test
    void error_from_construction_is_a_construction_failure() {
        newPool(Map.of("pool.parallelism", 1));
        String key = CountingRenderingEngine.ERROR_KEY_PREFIX + "crash";

        ConstructionFailedException exp = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(ConstructionFailedException.class, () -> pool.acquireOrCreate(key)));
        assertInstanceOf(AssertionError.class, exp.getCause());
        assertFalse(pool.contains(key));
        await().atMost(Duration.ofSeconds(5)).until(() -> pool.stats().freeSlots() == 1);
        assertNotNull(pool.acquireOrCreate("a").render(extentOf(0, 0, 0)));
    }

    @Test
    void shutdown_fails_callers_of_a_worker_that_never_started() {
        PoolConfig config = PoolConfig.fromConfig(loadConfig(Map.of("pool.parallelism", 1)));
        ThreadPoolExecutor workers = (ThreadPoolExecutor) MfExecutors.newBoundedExecutor(
                1, 1, TimeUnit.MINUTES, MfExecutors.namedFactory("test-render-worker-%d"));
        // Keep the only thread busy so the next worker stays queued.
        CountDownLatch occupied = new CountDownLatch(1);
        workers.execute(() -> {
            try {
                occupied.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        pool = new RenderPool(engine, config, workers);

        CompletableFuture<RenderChannel> caller = CompletableFuture.supplyAsync(() -> pool.acquireOrCreate("a"));
        await().atMost(Duration.ofSeconds(5)).until(() -> workers.getQueue().size() == 1);
        assertTrue(pool.contains("a"));

        pool.shutdown();

        ExecutionException exp = assertThrows(ExecutionException.class, () -> caller.get(5, TimeUnit.SECONDS));
        assertInstanceOf(PoolShutdownException.class, exp.getCause());
        assertEquals(0, pool.size());
        assertEquals(1, pool.stats().freeSlots());
        assertEquals(0, engine.getConstructed());
        assertEquals(1, engine.getTerminations());
    }
}
