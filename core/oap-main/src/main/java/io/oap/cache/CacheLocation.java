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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Executor that holds cached fibers, addressable through the host identifier
 * {@code OAP_HOST_<hostName>_OAP_EXECUTOR_<executorId>}. Any host name produces an
 * identifier, but only a non-empty host name without {@link #EXECUTOR_PREFIX} can be
 * parsed back.
 */
public record CacheLocation(String hostName, String executorId)
{
    public static final String HOST_PREFIX = "OAP_HOST_";
    public static final String EXECUTOR_PREFIX = "_OAP_EXECUTOR_";

    public CacheLocation
    {
        requireNonNull(hostName, "hostName is null");
        requireNonNull(executorId, "executorId is null");
    }

    public String toHostIdentifier()
    {
        return HOST_PREFIX + hostName + EXECUTOR_PREFIX + executorId;
    }

    public static Optional<CacheLocation> fromHostIdentifier(String hostIdentifier)
    {
        requireNonNull(hostIdentifier, "hostIdentifier is null");
        if (!hostIdentifier.startsWith(HOST_PREFIX)) {
            return Optional.empty();
        }
        // host names must not contain the separator, executor ids may
        int separator = hostIdentifier.indexOf(EXECUTOR_PREFIX, HOST_PREFIX.length());
        if (separator <= HOST_PREFIX.length()) {
            return Optional.empty();
        }
        String hostName = hostIdentifier.substring(HOST_PREFIX.length(), separator);
        String executorId = hostIdentifier.substring(separator + EXECUTOR_PREFIX.length());
        return Optional.of(new CacheLocation(hostName, executorId));
    }
}
