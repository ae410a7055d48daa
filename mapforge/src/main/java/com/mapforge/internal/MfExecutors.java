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

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.*;

/**
 * Factory methods for the executors used by the render pool and its callers.
 * <p>
 * All executors run on named platform threads so that thread dumps show which worker owns which
 * renderer. Thread names follow the {@code mf-<role>-<n>} pattern.
 *
 * @see ThreadPoolExecutor
 */
public final class MfExecutors {

    private MfExecutors() {
    }

    /**
     * Returns a thread factory producing daemon threads named after the given format,
     * e.g. {@code mf-render-worker-%d}.
     *
     * @param nameFormat a {@link String#format(String, Object...)} compatible format with one {@code %d}
     * @return the thread factory
     */
    public static ThreadFactory namedFactory(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }

    /**
     * Creates an executor that scales from 0 to {@code maxThreads} threads and queues tasks once the
     * maximum is reached. Idle threads, core threads included, terminate after {@code keepAliveTime}.
     *
     * @param maxThreads    the maximum number of threads, must be greater than 0
     * @param keepAliveTime how long idle threads stay alive
     * @param timeUnit      the unit of {@code keepAliveTime}
     * @param factory       the thread factory
     * @return a new bounded {@link ExecutorService}
     * @throws IllegalArgumentException if {@code maxThreads} is less than or equal to 0
     */
    public static ExecutorService newBoundedExecutor(
            int maxThreads,
            long keepAliveTime,
            TimeUnit timeUnit,
            ThreadFactory factory
    ) {
        // With an unbounded queue the pool never grows past its core size, so core == max.
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                keepAliveTime,
                timeUnit,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Creates the single-threaded executor that hosts a long-running loop such as the reaper.
     *
     * @param name the thread name
     * @return a new single-threaded {@link ExecutorService}
     */
    public static ExecutorService newDedicatedExecutor(String name) {
        ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat(name).setDaemon(true).build();
        return Executors.newSingleThreadExecutor(factory);
    }
}
