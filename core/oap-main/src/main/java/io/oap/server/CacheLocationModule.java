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
package io.oap.server;

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.oap.cache.CacheLocalityHints;
import io.oap.cache.CacheLocationConfig;
import io.oap.cache.CacheLocationRegistry;
import io.oap.cache.CacheStats;
import io.oap.cache.FileCacheStatusSerde;
import io.oap.event.CacheInfoEventDispatcher;
import io.oap.event.CacheLocationListener;

import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.jaxrs.JaxrsBinder.jaxrsBinder;
import static io.airlift.json.JsonCodecBinder.jsonCodecBinder;
import static org.weakref.jmx.guice.ExportBinder.newExporter;

public class CacheLocationModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(CacheLocationConfig.class);

        jsonCodecBinder(binder).bindJsonCodec(CacheStats.class);

        binder.bind(FileCacheStatusSerde.class).in(Scopes.SINGLETON);
        binder.bind(CacheLocationRegistry.class).in(Scopes.SINGLETON);
        newExporter(binder).export(CacheLocationRegistry.class).withGeneratedName();
        binder.bind(CacheLocalityHints.class).in(Scopes.SINGLETON);

        binder.bind(CacheLocationListener.class).in(Scopes.SINGLETON);
        binder.bind(CacheInfoEventDispatcher.class).in(Scopes.SINGLETON);
        newExporter(binder).export(CacheInfoEventDispatcher.class).withGeneratedName();

        jaxrsBinder(binder).bind(CacheStatusResource.class);
    }
}
