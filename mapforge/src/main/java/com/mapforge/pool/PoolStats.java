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
 * A point-in-time snapshot of a {@link RenderPool}.
 *
 * @param liveWorkers    workers currently registered, one per key
 * @param freeSlots      worker slots not in use
 * @param startedWorkers workers started since the pool was created
 * @param evictedWorkers workers that have exited and removed their entry
 * @param cleanups       global cleanups performed by the reaper
 */
public record PoolStats(int liveWorkers, int freeSlots, long startedWorkers, long evictedWorkers, long cleanups) {
}
