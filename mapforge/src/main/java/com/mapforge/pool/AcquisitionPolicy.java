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

/**
 * Decides what {@link RenderPool#acquireOrCreate(String)} does when a new key needs a worker and
 * every slot is taken.
 */
public enum AcquisitionPolicy {
    /**
     * Wait until a slot frees, optionally bounded by the acquire timeout.
     */
    BLOCK,

    /**
     * Throw {@link PoolExhaustedException} immediately.
     */
    FAIL_FAST;

    public static AcquisitionPolicy of(String value) {
        return switch (value.trim().toLowerCase()) {
            case "block" -> BLOCK;
            case "fail_fast" -> FAIL_FAST;
            default -> throw new IllegalArgumentException("Unsupported acquisition policy: " + value);
        };
    }
}
