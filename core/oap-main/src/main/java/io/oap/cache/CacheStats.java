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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Fiber cache utilization of one executor at the time of its last report.
 * Sizes are in bytes, load times in nanoseconds.
 */
public final class CacheStats
{
    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final long dataFiberCount;
    private final long dataFiberSize;
    private final long indexFiberCount;
    private final long indexFiberSize;
    private final long pendingFiberCount;
    private final long pendingFiberSize;
    private final long dataFiberHitCount;
    private final long dataFiberMissCount;
    private final long dataFiberLoadCount;
    private final long dataTotalLoadTime;
    private final long dataEvictionCount;
    private final long indexFiberHitCount;
    private final long indexFiberMissCount;
    private final long indexFiberLoadCount;
    private final long indexTotalLoadTime;
    private final long indexEvictionCount;

    @JsonCreator
    public CacheStats(
            @JsonProperty("dataFiberCount") long dataFiberCount,
            @JsonProperty("dataFiberSize") long dataFiberSize,
            @JsonProperty("indexFiberCount") long indexFiberCount,
            @JsonProperty("indexFiberSize") long indexFiberSize,
            @JsonProperty("pendingFiberCount") long pendingFiberCount,
            @JsonProperty("pendingFiberSize") long pendingFiberSize,
            @JsonProperty("dataFiberHitCount") long dataFiberHitCount,
            @JsonProperty("dataFiberMissCount") long dataFiberMissCount,
            @JsonProperty("dataFiberLoadCount") long dataFiberLoadCount,
            @JsonProperty("dataTotalLoadTime") long dataTotalLoadTime,
            @JsonProperty("dataEvictionCount") long dataEvictionCount,
            @JsonProperty("indexFiberHitCount") long indexFiberHitCount,
            @JsonProperty("indexFiberMissCount") long indexFiberMissCount,
            @JsonProperty("indexFiberLoadCount") long indexFiberLoadCount,
            @JsonProperty("indexTotalLoadTime") long indexTotalLoadTime,
            @JsonProperty("indexEvictionCount") long indexEvictionCount)
    {
        this.dataFiberCount = dataFiberCount;
        this.dataFiberSize = dataFiberSize;
        this.indexFiberCount = indexFiberCount;
        this.indexFiberSize = indexFiberSize;
        this.pendingFiberCount = pendingFiberCount;
        this.pendingFiberSize = pendingFiberSize;
        this.dataFiberHitCount = dataFiberHitCount;
        this.dataFiberMissCount = dataFiberMissCount;
        this.dataFiberLoadCount = dataFiberLoadCount;
        this.dataTotalLoadTime = dataTotalLoadTime;
        this.dataEvictionCount = dataEvictionCount;
        this.indexFiberHitCount = indexFiberHitCount;
        this.indexFiberMissCount = indexFiberMissCount;
        this.indexFiberLoadCount = indexFiberLoadCount;
        this.indexTotalLoadTime = indexTotalLoadTime;
        this.indexEvictionCount = indexEvictionCount;
    }

    @JsonProperty
    public long getDataFiberCount()
    {
        return dataFiberCount;
    }

    @JsonProperty
    public long getDataFiberSize()
    {
        return dataFiberSize;
    }

    @JsonProperty
    public long getIndexFiberCount()
    {
        return indexFiberCount;
    }

    @JsonProperty
    public long getIndexFiberSize()
    {
        return indexFiberSize;
    }

    @JsonProperty
    public long getPendingFiberCount()
    {
        return pendingFiberCount;
    }

    @JsonProperty
    public long getPendingFiberSize()
    {
        return pendingFiberSize;
    }

    @JsonProperty
    public long getDataFiberHitCount()
    {
        return dataFiberHitCount;
    }

    @JsonProperty
    public long getDataFiberMissCount()
    {
        return dataFiberMissCount;
    }

    @JsonProperty
    public long getDataFiberLoadCount()
    {
        return dataFiberLoadCount;
    }

    @JsonProperty
    public long getDataTotalLoadTime()
    {
        return dataTotalLoadTime;
    }

    @JsonProperty
    public long getDataEvictionCount()
    {
        return dataEvictionCount;
    }

    @JsonProperty
    public long getIndexFiberHitCount()
    {
        return indexFiberHitCount;
    }

    @JsonProperty
    public long getIndexFiberMissCount()
    {
        return indexFiberMissCount;
    }

    @JsonProperty
    public long getIndexFiberLoadCount()
    {
        return indexFiberLoadCount;
    }

    @JsonProperty
    public long getIndexTotalLoadTime()
    {
        return indexTotalLoadTime;
    }

    @JsonProperty
    public long getIndexEvictionCount()
    {
        return indexEvictionCount;
    }

    @JsonIgnore
    public long getTotalCacheSize()
    {
        return dataFiberSize + indexFiberSize;
    }

    @JsonIgnore
    public double getDataFiberHitRate()
    {
        return hitRate(dataFiberHitCount, dataFiberMissCount);
    }

    @JsonIgnore
    public double getIndexFiberHitRate()
    {
        return hitRate(indexFiberHitCount, indexFiberMissCount);
    }

    public CacheStats plus(CacheStats other)
    {
        return new CacheStats(
                dataFiberCount + other.dataFiberCount,
                dataFiberSize + other.dataFiberSize,
                indexFiberCount + other.indexFiberCount,
                indexFiberSize + other.indexFiberSize,
                pendingFiberCount + other.pendingFiberCount,
                pendingFiberSize + other.pendingFiberSize,
                dataFiberHitCount + other.dataFiberHitCount,
                dataFiberMissCount + other.dataFiberMissCount,
                dataFiberLoadCount + other.dataFiberLoadCount,
                dataTotalLoadTime + other.dataTotalLoadTime,
                dataEvictionCount + other.dataEvictionCount,
                indexFiberHitCount + other.indexFiberHitCount,
                indexFiberMissCount + other.indexFiberMissCount,
                indexFiberLoadCount + other.indexFiberLoadCount,
                indexTotalLoadTime + other.indexTotalLoadTime,
                indexEvictionCount + other.indexEvictionCount);
    }

    private static double hitRate(long hitCount, long missCount)
    {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 0.0 : (double) hitCount / requestCount;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CacheStats that = (CacheStats) o;
        return dataFiberCount == that.dataFiberCount &&
                dataFiberSize == that.dataFiberSize &&
                indexFiberCount == that.indexFiberCount &&
                indexFiberSize == that.indexFiberSize &&
                pendingFiberCount == that.pendingFiberCount &&
                pendingFiberSize == that.pendingFiberSize &&
                dataFiberHitCount == that.dataFiberHitCount &&
                dataFiberMissCount == that.dataFiberMissCount &&
                dataFiberLoadCount == that.dataFiberLoadCount &&
                dataTotalLoadTime == that.dataTotalLoadTime &&
                dataEvictionCount == that.dataEvictionCount &&
                indexFiberHitCount == that.indexFiberHitCount &&
                indexFiberMissCount == that.indexFiberMissCount &&
                indexFiberLoadCount == that.indexFiberLoadCount &&
                indexTotalLoadTime == that.indexTotalLoadTime &&
                indexEvictionCount == that.indexEvictionCount;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(
                dataFiberCount,
                dataFiberSize,
                indexFiberCount,
                indexFiberSize,
                pendingFiberCount,
                pendingFiberSize,
                dataFiberHitCount,
                dataFiberMissCount,
                dataFiberLoadCount,
                dataTotalLoadTime,
                dataEvictionCount,
                indexFiberHitCount,
                indexFiberMissCount,
                indexFiberLoadCount,
                indexTotalLoadTime,
                indexEvictionCount);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dataFiberCount", dataFiberCount)
                .add("dataFiberSize", dataFiberSize)
                .add("indexFiberCount", indexFiberCount)
                .add("indexFiberSize", indexFiberSize)
                .add("pendingFiberCount", pendingFiberCount)
                .add("pendingFiberSize", pendingFiberSize)
                .add("dataFiberHitCount", dataFiberHitCount)
                .add("dataFiberMissCount", dataFiberMissCount)
                .add("dataFiberLoadCount", dataFiberLoadCount)
                .add("dataTotalLoadTime", dataTotalLoadTime)
                .add("dataEvictionCount", dataEvictionCount)
                .add("indexFiberHitCount", indexFiberHitCount)
                .add("indexFiberMissCount", indexFiberMissCount)
                .add("indexFiberLoadCount", indexFiberLoadCount)
                .add("indexTotalLoadTime", indexTotalLoadTime)
                .add("indexEvictionCount", indexEvictionCount)
                .toString();
    }
}
