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

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class HostCacheRecord
{
    private final String host;
    private final FileCacheStatus status;

    public HostCacheRecord(String host, FileCacheStatus status)
    {
        this.host = requireNonNull(host, "host is null");
        this.status = requireNonNull(status, "status is null");
    }

    public String getHost()
    {
        return host;
    }

    public FileCacheStatus getStatus()
    {
        return status;
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
        HostCacheRecord that = (HostCacheRecord) o;
        return host.equals(that.host) && status.equals(that.status);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(host, status);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("host", host)
                .add("status", status)
                .toString();
    }
}
