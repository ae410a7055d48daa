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

/**
 * Raised by {@link RenderChannel#render(Extent)} when the renderer fails to draw an extent.
 * The worker stays alive and keeps serving subsequent requests.
 */
public class RenderFailedException extends MapforgeException {
    private final Extent extent;

    public RenderFailedException(String key, Extent extent, Throwable cause) {
        super(String.format("Failed to render %s with key %s", extent, PoolEntry.abbreviate(key)), cause);
        this.extent = extent;
    }

    public Extent getExtent() {
        return extent;
    }
}
