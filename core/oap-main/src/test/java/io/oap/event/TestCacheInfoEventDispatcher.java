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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import io.oap.cache.CacheLocationRegistry;
import io.oap.spi.OapException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import static io.oap.cache.CacheTestUtils.cacheLocationRegistry;
import static io.oap.cache.CacheTestUtils.cacheStats;
import static io.oap.cache.CacheTestUtils.fileCacheStatus;
import static io.oap.cache.CacheTestUtils.statsPayload;
import static io.oap.cache.CacheTestUtils.statusPayload;
import static io.oap.event.CacheInfoType.CACHE_STATS;
import static io.oap.event.CacheInfoType.FIBER_CACHE_STATUS;
import static io.oap.spi.StandardErrorCode.INVALID_CACHE_STATUS;
import static java.util.concurrent.Executors.newFixedThreadPool;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestCacheInfoEventDispatcher
{
    private CacheLocationRegistry registry;
    private CacheInfoEventDispatcher dispatcher;

    @BeforeEach
    public void setUp()
    {
        registry = cacheLocationRegistry();
        dispatcher = new CacheInfoEventDispatcher(newFixedThreadPool(4));
        dispatcher.addListener(new CacheLocationListener(registry));
    }

    @AfterEach
    public void tearDown()
    {
        dispatcher.stop();
    }

    @Test
    public void testRoutesByType()
            throws Exception
    {
        dispatcher.post(new CacheInfoUpdateEvent("worker1", "3", FIBER_CACHE_STATUS, statusPayload(fileCacheStatus("/data/t.parquet", 5, 10))))
                .get(10, SECONDS);
        dispatcher.post(new CacheInfoUpdateEvent("worker1", "3", CACHE_STATS, statsPayload(cacheStats(1, 100, 0, 0))))
                .get(10, SECONDS);

        assertThat(registry.hostsForFile("/data/t.parquet")).containsExactly("OAP_HOST_worker1_OAP_EXECUTOR_3");
        assertThat(registry.currentExecutorStats()).containsOnlyKeys("3");
        assertThat(dispatcher.getDeliveredEvents().getTotalCount()).isEqualTo(2);
    }

    @Test
    public void testMalformedEventIsDropped()
            throws Exception
    {
        dispatcher.post(new CacheInfoUpdateEvent("worker1", "3", FIBER_CACHE_STATUS, "[{\"file\":")).get(10, SECONDS);
        dispatcher.post(new CacheInfoUpdateEvent("worker1", "3", CACHE_STATS, "{\"dataFiberCount\":")).get(10, SECONDS);
        dispatcher.post(new CacheInfoUpdateEvent("worker2", "4", FIBER_CACHE_STATUS, statusPayload(fileCacheStatus("/data/t.parquet", 5, 10))))
                .get(10, SECONDS);

        assertThat(registry.hostsForFile("/data/t.parquet")).containsExactly("OAP_HOST_worker2_OAP_EXECUTOR_4");
        assertThat(registry.currentExecutorStats()).isEmpty();
        // stats parse failures are absorbed by the registry, status decode failures reach the dispatcher
        assertThat(dispatcher.getDroppedEvents().getTotalCount()).isEqualTo(1);
        assertThat(dispatcher.getDeliveredEvents().getTotalCount()).isEqualTo(2);
    }

    @Test
    public void testFailingListenerDoesNotAffectOthers()
            throws Exception
    {
        ConcurrentLinkedQueue<CacheInfoUpdateEvent> seen = new ConcurrentLinkedQueue<>();
        dispatcher.addListener(event -> {
            throw new IllegalStateException("listener is broken");
        });
        dispatcher.addListener(seen::add);

        CacheInfoUpdateEvent event = new CacheInfoUpdateEvent("worker1", "3", FIBER_CACHE_STATUS, statusPayload(fileCacheStatus("/data/t.parquet", 5, 10)));
        dispatcher.post(event).get(10, SECONDS);

        assertThat(seen).containsExactly(event);
        assertThat(registry.hostsForFile("/data/t.parquet")).containsExactly("OAP_HOST_worker1_OAP_EXECUTOR_3");
        assertThat(dispatcher.getDroppedEvents().getTotalCount()).isEqualTo(1);
    }

    @Test
    public void testConcurrentDelivery()
            throws Exception
    {
        int executors = 50;
        List<ListenableFuture<Void>> futures = new ArrayList<>();
        for (int executor = 1; executor <= executors; executor++) {
            String executorId = String.valueOf(executor);
            futures.add(dispatcher.post(new CacheInfoUpdateEvent("worker" + executor, executorId, FIBER_CACHE_STATUS, statusPayload(fileCacheStatus("/data/t.parquet", executor, executors)))));
            futures.add(dispatcher.post(new CacheInfoUpdateEvent("worker" + executor, executorId, CACHE_STATS, statsPayload(cacheStats(executor, 0, 0, 0)))));
        }
        Futures.allAsList(futures).get(10, SECONDS);

        assertThat(registry.hostsForFile("/data/t.parquet")).containsExactly("OAP_HOST_worker50_OAP_EXECUTOR_50");
        assertThat(registry.currentExecutorStats()).hasSize(executors);
        assertThat(registry.clusterCacheStats().getDataFiberCount()).isEqualTo(executors * (executors + 1) / 2);
    }

    @Test
    public void testListenerPropagatesDecodeFailure()
    {
        CacheLocationListener listener = new CacheLocationListener(registry);

        assertThatThrownBy(() -> listener.onCacheInfoUpdate(new CacheInfoUpdateEvent("worker1", "3", FIBER_CACHE_STATUS, "not json")))
                .isInstanceOfSatisfying(OapException.class, e -> assertThat(e.getErrorCode()).isEqualTo(INVALID_CACHE_STATUS.toErrorCode()));

        // stats failures stay inside the registry
        listener.onCacheInfoUpdate(new CacheInfoUpdateEvent("worker1", "3", CACHE_STATS, "not json"));
        assertThat(registry.getRejectedStatsUpdates().getTotalCount()).isEqualTo(1);
    }

    @Test
    public void testEventToStringOmitsPayload()
    {
        CacheInfoUpdateEvent event = new CacheInfoUpdateEvent("worker1", "3", CACHE_STATS, "{\"dataFiberCount\": 1}");
        assertThat(event.toString())
                .isEqualTo("CacheInfoUpdateEvent[hostName=worker1, executorId=3, type=CACHE_STATS, payloadLength=21]");
    }
}
