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

import java.time.Duration;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous request/response channel between callers and the single worker that owns the
 * renderer for one key.
 * <p>
 * Requests travel over a zero-capacity {@link SynchronousQueue}: {@link #render(Extent)} returns
 * from the hand-off only when the worker has taken the request. Every request carries its own
 * reply slot, so concurrent callers sharing one channel are served one at a time and each of
 * them receives the bytes rendered for its own extent.
 * <p>
 * A channel is closed by its worker when the worker exits. Calls made after that fail with
 * {@link WorkerUnavailableException} instead of waiting for a worker that will never come.
 */
public class RenderChannel {
    private final String key;
    private final SynchronousQueue<RenderRequest> requests = new SynchronousQueue<>(true);
    private final long pollIntervalNanos;
    private volatile boolean closed;

    RenderChannel(String key, Duration pollInterval) {
        this.key = key;
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    /**
     * Renders an extent with the renderer behind this channel, blocking until the worker replies.
     *
     * @param extent the area to render
     * @return the rendered bytes
     * @throws WorkerUnavailableException if the worker has exited before taking the request
     * @throws RenderFailedException      if the renderer failed on this extent
     * @throws MapforgeException          if the calling thread is interrupted while waiting
     */
    public byte[] render(Extent extent) {
        RenderRequest request = new RenderRequest(extent);
        try {
            do {
                if (closed) {
                    throw new WorkerUnavailableException(key);
                }
            } while (!requests.offer(request, pollIntervalNanos, TimeUnit.NANOSECONDS));
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new MapforgeException(exp);
        }
        return request.await();
    }

    public String getKey() {
        return key;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Waits for the next request.
     *
     * @return the request, or null if none arrived within the timeout
     */
    RenderRequest poll(Duration timeout) throws InterruptedException {
        return requests.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    void close() {
        closed = true;
    }
}
