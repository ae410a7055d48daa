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

/**
 * Raised by {@link RenderPool#acquireOrCreate(String)} when the renderer for a key cannot be
 * constructed. No pool entry is left behind, so a later call for the same key tries again.
 */
public class ConstructionFailedException extends MapforgeException {
    private final String key;

    public ConstructionFailedException(String key, Throwable cause) {
        super(String.format("Failed to construct renderer for key %s", PoolEntry.abbreviate(key)), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
