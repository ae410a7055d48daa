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

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A live key in the pool: its channel and the worker that owns the renderer behind it.
 * Entries are created by {@link RenderPool} and removed only by their own worker.
 */
record PoolEntry(String key, RenderChannel channel, RenderWorker worker) {
    private static final int MAX_PRINTABLE_KEY_LENGTH = 48;

    /**
     * Returns a printable form of the key: the key itself when short, otherwise a digest of it.
     */
    static String abbreviate(String key) {
        if (key.length() <= MAX_PRINTABLE_KEY_LENGTH) {
            return key;
        }
        String digest = Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
        return "sha256:" + digest.substring(0, 12);
    }
}
