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

import com.google.common.collect.ImmutableList;
import io.airlift.json.ObjectMapperProvider;

import java.util.BitSet;

import static io.airlift.json.JsonCodec.jsonCodec;

public final class CacheTestUtils
{
    private CacheTestUtils() {}

    public static FileCacheStatus fileCacheStatus(String file, int cachedFibers, int fiberCount)
    {
        BitSet bitmask = new BitSet(fiberCount);
        bitmask.set(0, cachedFibers);
        return new FileCacheStatus(file, bitmask, 1, fiberCount);
    }

    public static FileCacheStatusSerde fileCacheStatusSerde()
    {
        return fileCacheStatusSerde(new CacheLocationConfig());
    }

    public static FileCacheStatusSerde fileCacheStatusSerde(CacheLocationConfig config)
    {
        return new FileCacheStatusSerde(new ObjectMapperProvider().get(), config);
    }

    public static CacheLocationRegistry cacheLocationRegistry()
    {
        return new CacheLocationRegistry(fileCacheStatusSerde(), jsonCodec(CacheStats.class));
    }

    public static String statusPayload(FileCacheStatus... statuses)
    {
        return fileCacheStatusSerde().serialize(ImmutableList.copyOf(statuses));
    }

    public static String statsPayload(CacheStats stats)
    {
        return jsonCodec(CacheStats.class).toJson(stats);
    }

    public static CacheStats cacheStats(long dataFiberCount, long dataFiberSize, long dataFiberHitCount, long dataFiberMissCount)
    {
        return new CacheStats(dataFiberCount, dataFiberSize, 0, 0, 0, 0, dataFiberHitCount, dataFiberMissCount, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
