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

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link SortAux}. */
public class SortAuxTest {

    @Test
    public void testInitIsIdentity() {
        SortAux aux = new SortAux();
        aux.init(new long[] {30, 10, 20});
        assertThat(aux.size()).isEqualTo(3);
        assertThat(aux.rowIds()).containsExactly(0, 1, 2);
        assertThat(aux.time(0)).isEqualTo(30);
        assertThat(aux.isSorted()).isFalse();
    }

    @Test
    public void testSectionsBreakOnDuplicateTimes() {
        SortAux aux = new SortAux();
        aux.init(new long[] {100, 100, 200, 300, 300});
        aux.initSections();

        assertThat(aux.sections()).containsExactly(0, 0, 1, 3, 4, 4);
        assertThat(aux.sectionCount()).isEqualTo(3);
        assertThat(aux.sortPosition(2)).isEqualTo(4);
        assertThat(aux.rowStart(1)).isEqualTo(1);
        assertThat(aux.rowEnd(1)).isEqualTo(4);
    }

    @Test
    public void testSectionsBreakOnNonContiguousRows() {
        SortAux aux = new SortAux();
        aux.init(new long[] {200, 100, 300, 400});
        new StableSort().sort(aux);
        aux.initSections();

        assertThat(aux.rowIds()).containsExactly(1, 0, 2, 3);
        assertThat(aux.sections()).containsExactly(0, 0, 1, 1, 2, 3);
        assertThat(aux.rowStart(2)).isEqualTo(2);
        assertThat(aux.rowEnd(2)).isEqualTo(4);
    }

    @Test
    public void testSortedInputIsOneSection() {
        SortAux aux = new SortAux();
        aux.init(new long[] {1, 2, 3, 4, 5});
        assertThat(aux.isSorted()).isTrue();
        aux.initSections();
        assertThat(aux.sections()).containsExactly(0, 4);
        assertThat(aux.rowStart(0)).isZero();
        assertThat(aux.rowEnd(0)).isEqualTo(5);
    }

    @Test
    public void testStableOrderForEqualTimes() {
        SortAux aux = new SortAux();
        aux.init(new long[] {5, 3, 5, 3});
        new StableSort().sort(aux);
        assertThat(aux.rowIds()).containsExactly(1, 3, 0, 2);
        assertThat(aux.isSorted()).isTrue();
    }

    @Test
    public void testReuse() {
        SortAux aux = new SortAux();
        aux.init(new long[] {3, 2, 1});
        new StableSort().sort(aux);
        aux.initSections();

        aux.init(new long[] {7});
        assertThat(aux.size()).isEqualTo(1);
        assertThat(aux.rowIds()).containsExactly(0);
        assertThat(aux.sectionCount()).isZero();
        aux.initSections();
        assertThat(aux.sections()).containsExactly(0, 0);

        aux.init(new long[0]);
        aux.initSections();
        assertThat(aux.sectionCount()).isZero();
    }
}
