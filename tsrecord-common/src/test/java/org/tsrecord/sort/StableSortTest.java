/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tsrecord.sort;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link StableSort}. */
public class StableSortTest {

    @Test
    public void testSortIsStable() {
        Random random = new Random(42);
        for (int n : new int[] {0, 1, 2, 19, 20, 21, 40, 41, 100, 1000, 4099}) {
            long[] keys = new long[n];
            for (int i = 0; i < n; i++) {
                keys[i] = random.nextInt(Math.max(1, n / 4));
            }
            Pairs pairs = new Pairs(keys);
            new StableSort().sort(pairs);

            Integer[] expected = new Integer[n];
            for (int i = 0; i < n; i++) {
                expected[i] = i;
            }
            Arrays.sort(expected, Comparator.comparingLong(i -> keys[i]));

            for (int i = 0; i < n; i++) {
                assertThat(pairs.ids[i]).as("n=%s, i=%s", n, i).isEqualTo(expected[i]);
                assertThat(pairs.keys[i]).isEqualTo(keys[expected[i]]);
            }
        }
    }

    @Test
    public void testSortRange() {
        Pairs pairs = new Pairs(new long[] {9, 5, 4, 3, 0});
        new StableSort().sort(pairs, 1, 4);
        assertThat(pairs.keys).containsExactly(9, 3, 4, 5, 0);
    }

    @Test
    public void testDescendingInput() {
        int n = 257;
        long[] keys = new long[n];
        for (int i = 0; i < n; i++) {
            keys[i] = n - i;
        }
        Pairs pairs = new Pairs(keys);
        new StableSort().sort(pairs);
        for (int i = 0; i < n; i++) {
            assertThat(pairs.keys[i]).isEqualTo(i + 1);
        }
    }

    private static class Pairs implements IndexedSortable {

        private final long[] keys;
        private final int[] ids;

        private Pairs(long[] source) {
            this.keys = source.clone();
            this.ids = new int[source.length];
            for (int i = 0; i < ids.length; i++) {
                ids[i] = i;
            }
        }

        @Override
        public int compare(int i, int j) {
            return Long.compare(keys[i], keys[j]);
        }

        @Override
        public void swap(int i, int j) {
            long k = keys[i];
            keys[i] = keys[j];
            keys[j] = k;
            int id = ids[i];
            ids[i] = ids[j];
            ids[j] = id;
        }

        @Override
        public int size() {
            return keys.length;
        }
    }
}
