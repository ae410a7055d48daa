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

package com.mapforge.render;

import com.mapforge.common.tile.Extent;

/**
 * A stateful, non-thread-safe renderer built by a {@link RenderingEngine}.
 * <p>
 * A renderer must only be used from the thread that constructed it. {@link #close()} releases
 * the native resources behind it and is called exactly once, on that same thread.
 */
public interface Renderer extends AutoCloseable {
    /**
     * Renders the given extent.
     *
     * @param extent the area to draw, in EPSG:3857
     * @return the encoded image
     * @throws RenderException if drawing or encoding fails
     */
    byte[] render(Extent extent) throws RenderException;

    @Override
    void close();
}
