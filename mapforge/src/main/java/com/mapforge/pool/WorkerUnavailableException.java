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
 * Raised when a request is sent to a channel whose worker has already exited. Callers may retry
 * by acquiring a fresh channel for the same key.
 */
public class WorkerUnavailableException extends MapforgeException {
    public WorkerUnavailableException(String key) {
        super(String.format("Render worker for key %s is not available", PoolEntry.abbreviate(key)));
    }
}
