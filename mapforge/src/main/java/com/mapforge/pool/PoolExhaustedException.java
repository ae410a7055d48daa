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
 * Raised when no worker slot is available for a new key and the acquisition policy does not
 * allow waiting any longer.
 */
public class PoolExhaustedException extends MapforgeException {
    public PoolExhaustedException(int parallelism) {
        super(String.format("All %d render worker slots are in use", parallelism));
    }
}
