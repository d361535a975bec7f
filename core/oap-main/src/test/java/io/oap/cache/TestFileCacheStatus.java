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

import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static io.oap.cache.CacheTestUtils.fileCacheStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestFileCacheStatus
{
    @Test
    public void testCachedFiberCount()
    {
        BitSet bitmask = new BitSet();
        bitmask.set(1);
        bitmask.set(4);
        bitmask.set(5);
        FileCacheStatus status = new FileCacheStatus("/data/a.orc", bitmask, 2, 3);

        assertThat(status.getCachedFiberCount()).isEqualTo(3);
        assertThat(status.getFiberCount()).isEqualTo(6);
    }

    @Test
    public void testFiberLayout()
    {
        BitSet bitmask = new BitSet();
        // group 1, field 2 with 3 fields per group
        bitmask.set(5);
        FileCacheStatus status = new FileCacheStatus("/data/a.orc", bitmask, 2, 3);

        assertThat(status.isFiberCached(1, 2)).isTrue();
        assertThat(status.isFiberCached(0, 2)).isFalse();
        assertThat(status.isFiberCached(1, 1)).isFalse();
        assertThatThrownBy(() -> status.isFiberCached(2, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("groupId 2 out of range [0, 2)");
        assertThatThrownBy(() -> status.isFiberCached(0, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("fieldId 3 out of range [0, 3)");
    }

    @Test
    public void testLargeFiberLayout()
    {
        BitSet bitmask = new BitSet();
        bitmask.set(7);
        FileCacheStatus status = new FileCacheStatus("/data/a.orc", bitmask, 100_000, 100_000);

        assertThat(status.getFiberCount()).isEqualTo(10_000_000_000L);
        assertThat(status.isFiberCached(0, 7)).isTrue();
        assertThat(status.isFiberCached(99_999, 99_999)).isFalse();
        assertThat(status.isFiberCached(30_000, 7)).isFalse();
    }

    @Test
    public void testHasMoreCacheThan()
    {
        FileCacheStatus five = fileCacheStatus("/data/a.orc", 5, 10);
        FileCacheStatus eight = fileCacheStatus("/data/a.orc", 8, 10);

        assertThat(eight.hasMoreCacheThan(five)).isTrue();
        assertThat(five.hasMoreCacheThan(eight)).isFalse();
        assertThat(five.hasMoreCacheThan(fileCacheStatus("/data/a.orc", 5, 10))).isFalse();
    }

    @Test
    public void testBitmaskIsCopied()
    {
        BitSet bitmask = new BitSet();
        bitmask.set(0);
        FileCacheStatus status = new FileCacheStatus("/data/a.orc", bitmask, 1, 4);

        bitmask.set(1);
        status.toBitSet().set(2);

        assertThat(status.getCachedFiberCount()).isEqualTo(1);
        assertThat(status.toBitSet().cardinality()).isEqualTo(1);
    }

    @Test
    public void testJsonBitmask()
    {
        FileCacheStatus status = FileCacheStatus.fromJson("/data/a.orc", new long[] {0b1011L, 1L}, 2, 40);

        assertThat(status.getCachedFiberCount()).isEqualTo(4);
        assertThat(status.isFiberCached(1, 24)).isTrue();
        assertThat(status.getBitmaskWords()).containsExactly(0b1011L, 1L);
    }
}
