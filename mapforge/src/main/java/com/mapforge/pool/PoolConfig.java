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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Typed view of the {@code pool} section of the configuration.
 *
 * @param parallelism         maximum number of live workers, one per distinct key
 * @param idleTimeout         inactivity after which a worker releases its renderer and exits
 * @param acquisitionPolicy   what to do when a new key finds every slot taken
 * @param acquireTimeout      upper bound for waiting on a slot under {@link AcquisitionPolicy#BLOCK}; zero waits forever
 * @param handoffPollInterval how often a waiting caller re-checks whether the worker is still alive
 * @param shutdownTimeout     how long shutdown waits for workers to release their renderers
 */
public record PoolConfig(
        int parallelism,
        Duration idleTimeout,
        AcquisitionPolicy acquisitionPolicy,
        Duration acquireTimeout,
        Duration handoffPollInterval,
        Duration shutdownTimeout
) {

    public PoolConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("pool.parallelism must be greater than 0: " + parallelism);
        }
        requirePositive("pool.idle_timeout", idleTimeout);
        requirePositive("pool.handoff_poll_interval", handoffPollInterval);
        requirePositive("pool.shutdown_timeout", shutdownTimeout);
        if (acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("pool.acquire_timeout cannot be negative: " + acquireTimeout);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    /**
     * Reads the pool settings from the given configuration.
     *
     * @param config the root configuration
     * @return the pool settings
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type
     * @throws IllegalArgumentException            if a value is out of range
     */
    public static PoolConfig fromConfig(Config config) {
        return new PoolConfig(
                config.getInt("pool.parallelism"),
                config.getDuration("pool.idle_timeout"),
                AcquisitionPolicy.of(config.getString("pool.acquisition_policy")),
                config.getDuration("pool.acquire_timeout"),
                config.getDuration("pool.handoff_poll_interval"),
                config.getDuration("pool.shutdown_timeout")
        );
    }

    /**
     * Returns the settings defined in {@code reference.conf}.
     */
    public static PoolConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public PoolConfig withIdleTimeout(Duration idleTimeout) {
        return new PoolConfig(parallelism, idleTimeout, acquisitionPolicy, acquireTimeout, handoffPollInterval, shutdownTimeout);
    }

    public PoolConfig withParallelism(int parallelism) {
        return new PoolConfig(parallelism, idleTimeout, acquisitionPolicy, acquireTimeout, handoffPollInterval, shutdownTimeout);
    }
}
