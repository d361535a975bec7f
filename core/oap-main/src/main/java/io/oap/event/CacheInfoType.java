/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.oap.event;

public enum CacheInfoType
{
    /**
     * Batch of per-file fiber cache status, sent with every executor heartbeat.
     */
    FIBER_CACHE_STATUS,
    /**
     * Snapshot of the executor's fiber cache statistics.
     */
    CACHE_STATS,
}
