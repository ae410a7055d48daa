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

package com.mapforge.internal;

import com.mapforge.common.MapforgeException;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Utility class for shutting down {@link ExecutorService} instances.
 */
public class ExecutorServiceUtil {
    /**
     * Default time to wait for executor termination.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Immediately initiates shutdown and waits for termination with the default timeout.
     *
     * @param executor the executor service to shut down
     * @return true if the executor terminated within the timeout, false otherwise
     * @see #shutdownNowThenAwaitTermination(ExecutorService, Duration)
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor) {
        return shutdownNowThenAwaitTermination(executor, DEFAULT_TIMEOUT);
    }

    /**
     * Calls {@link ExecutorService#shutdownNow()}, which interrupts running tasks and rejects new
     * submissions, then blocks until termination completes or the timeout expires.
     *
     * @param executor the executor service to shut down; if null or already terminated, returns true immediately
     * @param timeout  how long to wait for termination
     * @return true if the executor terminated within the timeout, false otherwise
     * @throws MapforgeException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor, Duration timeout) {
        return shutdownNowThenAwaitTermination(executor, timeout, (task) -> {
        });
    }

    /**
     * Same as {@link #shutdownNowThenAwaitTermination(ExecutorService, Duration)}, but hands every
     * task that was queued and never started to {@code neverStarted} before waiting.
     *
     * @param executor     the executor service to shut down; if null or already terminated, returns true immediately
     * @param timeout      how long to wait for termination
     * @param neverStarted called once for each task drained from the executor's queue
     * @return true if the executor terminated within the timeout, false otherwise
     * @throws MapforgeException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor, Duration timeout, Consumer<Runnable> neverStarted) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }

        for (Runnable task : executor.shutdownNow()) {
            neverStarted.accept(task);
        }
        try {
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new MapforgeException(exp);
        }
    }
}
