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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.airlift.stats.CounterStat;
import io.oap.cache.CacheLocationConfig;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

import javax.annotation.PreDestroy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

import static com.google.common.util.concurrent.MoreExecutors.listeningDecorator;
import static io.airlift.concurrent.Threads.daemonThreadsNamed;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newFixedThreadPool;

/**
 * Delivers executor reports to the registered listeners on a pool of update threads,
 * so the reporting side never waits for the registry. A listener failure drops that
 * event for that listener only.
 */
@ThreadSafe
public class CacheInfoEventDispatcher
{
    private static final Logger log = Logger.get(CacheInfoEventDispatcher.class);

    private final ListeningExecutorService executor;
    private final List<CacheInfoListener> listeners = new CopyOnWriteArrayList<>();

    private final CounterStat deliveredEvents = new CounterStat();
    private final CounterStat droppedEvents = new CounterStat();

    @Inject
    public CacheInfoEventDispatcher(CacheLocationConfig config, CacheLocationListener cacheLocationListener)
    {
        this(newFixedThreadPool(config.getUpdateThreads(), daemonThreadsNamed("cache-info-update-%s")));
        addListener(cacheLocationListener);
    }

    @VisibleForTesting
    CacheInfoEventDispatcher(ExecutorService executor)
    {
        this.executor = listeningDecorator(requireNonNull(executor, "executor is null"));
    }

    @PreDestroy
    public void stop()
    {
        executor.shutdownNow();
    }

    public void addListener(CacheInfoListener listener)
    {
        listeners.add(requireNonNull(listener, "listener is null"));
    }

    /**
     * Schedules delivery of the event. The returned future completes once every
     * listener has seen the event; it does not fail when a listener does.
     */
    public ListenableFuture<Void> post(CacheInfoUpdateEvent event)
    {
        requireNonNull(event, "event is null");
        return executor.submit(() -> {
            deliver(event);
            return null;
        });
    }

    private void deliver(CacheInfoUpdateEvent event)
    {
        for (CacheInfoListener listener : listeners) {
            try {
                listener.onCacheInfoUpdate(event);
                deliveredEvents.update(1);
            }
            catch (RuntimeException e) {
                droppedEvents.update(1);
                log.warn(e, "Dropping %s for listener %s", event, listener.getClass().getSimpleName());
            }
        }
    }

    @Managed
    @Nested
    public CounterStat getDeliveredEvents()
    {
        return deliveredEvents;
    }

    @Managed
    @Nested
    public CounterStat getDroppedEvents()
    {
        return droppedEvents;
    }
}
