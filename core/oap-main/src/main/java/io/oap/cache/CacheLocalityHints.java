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
import com.google.inject.Inject;
import io.airlift.log.Logger;

import java.util.List;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public class CacheLocalityHints
{
    private static final Logger log = Logger.get(CacheLocalityHints.class);

    private final CacheLocationRegistry registry;
    private final boolean enabled;

    @Inject
    public CacheLocalityHints(CacheLocationRegistry registry, CacheLocationConfig config)
    {
        this.registry = requireNonNull(registry, "registry is null");
        this.enabled = requireNonNull(config, "config is null").isCacheLocalityEnabled();
    }

    public List<CacheLocation> getPreferredLocations(String filePath)
    {
        if (!enabled) {
            return ImmutableList.of();
        }
        return registry.hostsForFile(filePath).stream()
                .map(CacheLocalityHints::toCacheLocation)
                .flatMap(Optional::stream)
                .collect(toImmutableList());
    }

    public List<String> getPreferredHosts(String filePath)
    {
        return getPreferredLocations(filePath).stream()
                .map(CacheLocation::hostName)
                .distinct()
                .collect(toImmutableList());
    }

    private static Optional<CacheLocation> toCacheLocation(String hostIdentifier)
    {
        Optional<CacheLocation> location = CacheLocation.fromHostIdentifier(hostIdentifier);
        if (location.isEmpty()) {
            log.warn("Ignoring malformed cache host identifier: %s", hostIdentifier);
        }
        return location;
    }
}
