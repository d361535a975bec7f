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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.inject.Inject;
import io.airlift.json.JsonCodec;
import io.airlift.log.Logger;
import io.airlift.stats.CounterStat;
import io.oap.spi.OapException;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Strings.isNullOrEmpty;
import static io.oap.spi.StandardErrorCode.INVALID_CACHE_STATS;
import static java.util.Objects.requireNonNull;

/**
 * Driver side record of the fiber caches held by executors. For every file it keeps
 * the executor that reported the most cached fibers, which the scheduler uses as a
 * locality hint, and for every executor it keeps the cache statistics it last reported.
 * <p>
 * Entries are replaced but never removed: a file stays mapped to its best known
 * executor even after that executor is gone.
 */
@ThreadSafe
public class CacheLocationRegistry
{
    private static final Logger log = Logger.get(CacheLocationRegistry.class);

    private final FileCacheStatusSerde fileCacheStatusSerde;
    private final JsonCodec<CacheStats> cacheStatsCodec;

    private final ConcurrentHashMap<String, HostCacheRecord> fileToHost = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CacheStats> executorToStats = new ConcurrentHashMap<>();

    private final CounterStat locationUpdates = new CounterStat();
    private final CounterStat hostAssignments = new CounterStat();
    private final CounterStat rejectedLocationUpdates = new CounterStat();
    private final CounterStat statsUpdates = new CounterStat();
    private final CounterStat rejectedStatsUpdates = new CounterStat();

    @Inject
    public CacheLocationRegistry(FileCacheStatusSerde fileCacheStatusSerde, JsonCodec<CacheStats> cacheStatsCodec)
    {
        this.fileCacheStatusSerde = requireNonNull(fileCacheStatusSerde, "fileCacheStatusSerde is null");
        this.cacheStatsCodec = requireNonNull(cacheStatsCodec, "cacheStatsCodec is null");
    }

    /**
     * Applies a fiber cache status batch reported by an executor. A file moves to the
     * reporting executor only when the report caches strictly more fibers than the
     * recorded one. The payload is decoded before anything is applied, so a malformed
     * payload fails with {@link OapException} and leaves the registry untouched.
     */
    public void recordLocationUpdate(String hostName, String executorId, String rawStatusPayload)
    {
        requireNonNull(hostName, "hostName is null");
        requireNonNull(executorId, "executorId is null");

        List<FileCacheStatus> statuses;
        try {
            statuses = fileCacheStatusSerde.deserialize(rawStatusPayload);
        }
        catch (RuntimeException e) {
            rejectedLocationUpdates.update(1);
            throw e;
        }

        String host = new CacheLocation(hostName, executorId).toHostIdentifier();
        log.debug("Received fiber cache status of %s files from host %s, executor %s", statuses.size(), hostName, executorId);

        for (FileCacheStatus status : statuses) {
            HostCacheRecord candidate = new HostCacheRecord(host, status);
            HostCacheRecord recorded = fileToHost.compute(status.getFile(), (file, existing) -> {
                if (existing == null || status.hasMoreCacheThan(existing.getStatus())) {
                    return candidate;
                }
                return existing;
            });
            if (recorded == candidate) {
                hostAssignments.update(1);
            }
        }
        locationUpdates.update(1);
    }

    /**
     * Replaces the cache statistics of an executor. An empty payload is ignored. A payload
     * that cannot be parsed is logged and dropped; the previous statistics are kept and
     * the failure is not propagated to the caller.
     */
    public void recordStatsUpdate(String executorId, String hostName, String rawStatsPayload)
    {
        requireNonNull(executorId, "executorId is null");
        if (isNullOrEmpty(rawStatsPayload)) {
            return;
        }

        CacheStats cacheStats;
        try {
            cacheStats = parseCacheStats(rawStatsPayload);
        }
        catch (RuntimeException e) {
            rejectedStatsUpdates.update(1);
            log.error(e, "Failed to parse cache stats from executor %s on host %s", executorId, hostName);
            return;
        }

        executorToStats.put(executorId, cacheStats);
        statsUpdates.update(1);
        log.debug("Executor %s on host %s reported %s", executorId, hostName, cacheStats);
    }

    private CacheStats parseCacheStats(String payload)
    {
        CacheStats cacheStats;
        try {
            cacheStats = cacheStatsCodec.fromJson(payload);
        }
        catch (IllegalArgumentException e) {
            throw new OapException(INVALID_CACHE_STATS, "Invalid cache stats payload: " + e.getMessage(), e);
        }
        if (cacheStats == null) {
            throw new OapException(INVALID_CACHE_STATS, "Cache stats payload is null");
        }
        return cacheStats;
    }

    /**
     * Host identifiers of the executors holding cached fibers of the file, best first.
     * Only the single best executor is tracked, so the list has at most one element.
     */
    public List<String> hostsForFile(String filePath)
    {
        requireNonNull(filePath, "filePath is null");
        HostCacheRecord record = fileToHost.get(filePath);
        if (record == null) {
            return ImmutableList.of();
        }
        return ImmutableList.of(record.getHost());
    }

    public Optional<FileCacheStatus> cacheStatusForFile(String filePath)
    {
        requireNonNull(filePath, "filePath is null");
        return Optional.ofNullable(fileToHost.get(filePath))
                .map(HostCacheRecord::getStatus);
    }

    public Map<String, CacheStats> currentExecutorStats()
    {
        return ImmutableMap.copyOf(executorToStats);
    }

    public CacheStats clusterCacheStats()
    {
        return executorToStats.values().stream()
                .reduce(CacheStats.EMPTY, CacheStats::plus);
    }

    @Managed
    public int getTrackedFileCount()
    {
        return fileToHost.size();
    }

    @Managed
    public int getReportingExecutorCount()
    {
        return executorToStats.size();
    }

    @Managed
    @Nested
    public CounterStat getLocationUpdates()
    {
        return locationUpdates;
    }

    @Managed
    @Nested
    public CounterStat getHostAssignments()
    {
        return hostAssignments;
    }

    @Managed
    @Nested
    public CounterStat getRejectedLocationUpdates()
    {
        return rejectedLocationUpdates;
    }

    @Managed
    @Nested
    public CounterStat getStatsUpdates()
    {
        return statsUpdates;
    }

    @Managed
    @Nested
    public CounterStat getRejectedStatsUpdates()
    {
        return rejectedStatsUpdates;
    }
}
