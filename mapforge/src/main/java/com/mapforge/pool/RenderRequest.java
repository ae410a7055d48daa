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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One render call: the requested extent and the private slot its reply is delivered to.
 */
final class RenderRequest {
    private final Extent extent;
    private final CompletableFuture<byte[]> reply = new CompletableFuture<>();

    RenderRequest(Extent extent) {
        this.extent = extent;
    }

    Extent extent() {
        return extent;
    }

    void complete(byte[] image) {
        reply.complete(image);
    }

    void fail(MapforgeException cause) {
        reply.completeExceptionally(cause);
    }

    /**
     * Blocks until the worker has answered this request.
     *
     * @return the rendered bytes
     * @throws RenderFailedException if the renderer failed on this extent
     */
    byte[] await() {
        try {
            return reply.get();
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new MapforgeException(exp);
        } catch (ExecutionException exp) {
            if (exp.getCause() instanceof MapforgeException cause) {
                throw cause;
            }
            throw new MapforgeException(exp.getCause());
        }
    }
}
