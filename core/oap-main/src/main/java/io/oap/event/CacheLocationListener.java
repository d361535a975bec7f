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

import com.google.inject.Inject;
import io.oap.cache.CacheLocationRegistry;

import static java.util.Objects.requireNonNull;

/**
 * Feeds executor reports into the {@link CacheLocationRegistry}. Fiber cache status
 * decode failures are rethrown to the delivering side; stats parse failures are
 * absorbed by the registry.
 */
public class CacheLocationListener
        implements CacheInfoListener
{
    private final CacheLocationRegistry registry;

    @Inject
    public CacheLocationListener(CacheLocationRegistry registry)
    {
        this.registry = requireNonNull(registry, "registry is null");
    }

    @Override
    public void onCacheInfoUpdate(CacheInfoUpdateEvent event)
    {
        switch (event.type()) {
            case FIBER_CACHE_STATUS -> registry.recordLocationUpdate(event.hostName(), event.executorId(), event.customizedInfo());
            case CACHE_STATS -> registry.recordStatsUpdate(event.executorId(), event.hostName(), event.customizedInfo());
        }
    }
}
