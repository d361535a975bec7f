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
package io.oap.cache;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.MEGABYTE;

public class CacheLocationConfig
{
    private boolean cacheLocalityEnabled = true;
    private DataSize maxPayloadSize = DataSize.of(32, MEGABYTE);
    private int updateThreads = 4;

    public boolean isCacheLocalityEnabled()
    {
        return cacheLocalityEnabled;
    }

    @Config("cache-locality.enabled")
    @ConfigDescription("Hint the scheduler towards executors that hold the most cached fibers of a file")
    public CacheLocationConfig setCacheLocalityEnabled(boolean cacheLocalityEnabled)
    {
        this.cacheLocalityEnabled = cacheLocalityEnabled;
        return this;
    }

    @NotNull
    public DataSize getMaxPayloadSize()
    {
        return maxPayloadSize;
    }

    @Config("cache-status.max-payload-size")
    @ConfigDescription("Upper bound for a single fiber cache status report")
    public CacheLocationConfig setMaxPayloadSize(DataSize maxPayloadSize)
    {
        this.maxPayloadSize = maxPayloadSize;
        return this;
    }

    @Min(1)
    public int getUpdateThreads()
    {
        return updateThreads;
    }

    @Config("cache-status.update-threads")
    @ConfigDescription("Number of threads applying cache status reports from executors")
    public CacheLocationConfig setUpdateThreads(int updateThreads)
    {
        this.updateThreads = updateThreads;
        return this;
    }
}
