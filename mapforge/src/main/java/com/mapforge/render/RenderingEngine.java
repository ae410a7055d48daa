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

/**
 * The process-wide rendering library, seen as a singleton capability.
 * <p>
 * Implementations typically wrap a native library that keeps global state shared by every
 * {@link Renderer} it creates. None of the methods are required to be thread-safe with respect
 * to a single renderer: the render pool guarantees that a renderer is constructed, used and
 * closed on one thread, and that {@link #cleanup()} is never called while a renderer is alive.
 */
public interface RenderingEngine {
    /**
     * Default content type reported for rendered bytes.
     */
    String DEFAULT_CONTENT_TYPE = "image/png";

    /**
     * Builds a renderer from its configuration. The key is the complete construction input;
     * equal keys must produce renderers that behave identically.
     *
     * @param key the renderer configuration
     * @return a new renderer owned by the calling thread
     * @throws ConstructionException if the configuration cannot be loaded
     */
    Renderer construct(String key) throws ConstructionException;

    /**
     * Releases global state shared by all renderers. Called only when no renderer is alive.
     */
    void cleanup();

    /**
     * Final teardown of the library, called once when the owning pool shuts down.
     */
    default void terminate() {
        cleanup();
    }

    /**
     * Returns the content type of the bytes produced by this engine's renderers.
     */
    default String contentType() {
        return DEFAULT_CONTENT_TYPE;
    }
}
