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

import static java.util.Objects.requireNonNull;

/**
 * Cache information reported by an executor. The payload is opaque here; its
 * encoding depends on {@link #type()}.
 */
public record CacheInfoUpdateEvent(String hostName, String executorId, CacheInfoType type, String customizedInfo)
{
    public CacheInfoUpdateEvent
    {
        requireNonNull(hostName, "hostName is null");
        requireNonNull(executorId, "executorId is null");
        requireNonNull(type, "type is null");
        requireNonNull(customizedInfo, "customizedInfo is null");
    }

    @Override
    public String toString()
    {
        // the payload can be large
        return "CacheInfoUpdateEvent[hostName=%s, executorId=%s, type=%s, payloadLength=%s]".formatted(hostName, executorId, type, customizedInfo.length());
    }
}
