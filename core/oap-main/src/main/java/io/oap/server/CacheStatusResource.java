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

import com.google.inject.Inject;
import io.oap.cache.CacheLocationRegistry;
import io.oap.cache.CacheStats;

import javax.ws.rs.BadRequestException;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

/**
 * Fiber cache state of the cluster as seen by the driver
 */
@Path("/v1/cache")
public class CacheStatusResource
{
    private final CacheLocationRegistry registry;

    @Inject
    public CacheStatusResource(CacheLocationRegistry registry)
    {
        this.registry = requireNonNull(registry, "registry is null");
    }

    @GET
    @Path("executors")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, CacheStats> getExecutorStats()
    {
        return registry.currentExecutorStats();
    }

    @GET
    @Path("summary")
    @Produces(MediaType.APPLICATION_JSON)
    public CacheStats getSummary()
    {
        return registry.clusterCacheStats();
    }

    @GET
    @Path("locations")
    @Produces(MediaType.APPLICATION_JSON)
    public List<String> getLocations(@QueryParam("path") String path)
    {
        if (isNullOrEmpty(path)) {
            throw new BadRequestException("path is required");
        }
        return registry.hostsForFile(path);
    }
}
