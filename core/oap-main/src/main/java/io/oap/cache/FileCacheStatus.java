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

import java.util.BitSet;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Fiber cache coverage of one file as reported by one executor. Fiber
 * {@code (groupId, fieldId)} is cached when bit {@code groupId * fieldCount + fieldId}
 * of the bitmask is set.
 */
public final class FileCacheStatus
{
    private final String file;
    private final BitSet bitmask;
    private final int groupCount;
    private final int fieldCount;
    private final int cachedFiberCount;

    public FileCacheStatus(String file, BitSet bitmask, int groupCount, int fieldCount)
    {
        this.file = requireNonNull(file, "file is null");
        this.bitmask = (BitSet) requireNonNull(bitmask, "bitmask is null").clone();
        checkArgument(groupCount >= 0, "groupCount is negative");
        checkArgument(fieldCount >= 0, "fieldCount is negative");
        this.groupCount = groupCount;
        this.fieldCount = fieldCount;
        this.cachedFiberCount = bitmask.cardinality();
    }

    @JsonCreator
    public static FileCacheStatus fromJson(
            @JsonProperty("file") String file,
            @JsonProperty("bitmask") long[] bitmask,
            @JsonProperty("groupCount") int groupCount,
            @JsonProperty("fieldCount") int fieldCount)
    {
        return new FileCacheStatus(file, BitSet.valueOf(requireNonNull(bitmask, "bitmask is null")), groupCount, fieldCount);
    }

    @JsonProperty
    public String getFile()
    {
        return file;
    }

    @JsonProperty("bitmask")
    public long[] getBitmaskWords()
    {
        return bitmask.toLongArray();
    }

    public BitSet toBitSet()
    {
        return (BitSet) bitmask.clone();
    }

    @JsonProperty
    public int getGroupCount()
    {
        return groupCount;
    }

    @JsonProperty
    public int getFieldCount()
    {
        return fieldCount;
    }

    @JsonIgnore
    public long getFiberCount()
    {
        return (long) groupCount * fieldCount;
    }

    @JsonIgnore
    public int getCachedFiberCount()
    {
        return cachedFiberCount;
    }

    public boolean isFiberCached(int groupId, int fieldId)
    {
        checkArgument(groupId >= 0 && groupId < groupCount, "groupId %s out of range [0, %s)", groupId, groupCount);
        checkArgument(fieldId >= 0 && fieldId < fieldCount, "fieldId %s out of range [0, %s)", fieldId, fieldCount);
        long bit = (long) groupId * fieldCount + fieldId;
        return bit < bitmask.length() && bitmask.get((int) bit);
    }

    /**
     * Returns true if this status has strictly more cached fibers than {@code other}.
     */
    public boolean hasMoreCacheThan(FileCacheStatus other)
    {
        return cachedFiberCount > other.cachedFiberCount;
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
        FileCacheStatus that = (FileCacheStatus) o;
        return groupCount == that.groupCount &&
                fieldCount == that.fieldCount &&
                file.equals(that.file) &&
                bitmask.equals(that.bitmask);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(file, bitmask, groupCount, fieldCount);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("file", file)
                .add("cachedFiberCount", cachedFiberCount)
                .add("groupCount", groupCount)
                .add("fieldCount", fieldCount)
                .toString();
    }
}
