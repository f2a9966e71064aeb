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

package org.tsrecord.record;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link NilCount}. */
public class NilCountTest {

    @Test
    public void testNoNullsLeavesIndexEmpty() {
        NilCount nilCount = new NilCount();
        nilCount.init(0, 10);
        assertThat(nilCount.total()).isZero();
        assertThat(nilCount.size()).isZero();
        assertThatThrownBy(() -> nilCount.value(0))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    public void testPrefixSum() {
        ColVal col = new ColVal();
        col.appendInteger(1);
        col.appendIntegerNull();
        col.appendInteger(2);
        col.appendIntegerNull();
        col.appendInteger(3);

        NilCount nilCount = new NilCount();
        nilCount.init(col);

        assertThat(nilCount.total()).isEqualTo(2);
        assertThat(nilCount.size()).isEqualTo(6);
        int[] expected = {0, 0, 1, 1, 2, 2};
        for (int j = 0; j < expected.length; j++) {
            assertThat(nilCount.value(j)).as("j=%s", j).isEqualTo(expected[j]);
        }
    }

    @Test
    public void testManualFill() {
        NilCount nilCount = new NilCount();
        nilCount.init(1, 3);
        assertThat(nilCount.value(0)).isZero();
        nilCount.setValue(1, 1);
        nilCount.setValue(2, 1);
        assertThat(nilCount.value(2)).isEqualTo(1);
        assertThatThrownBy(() -> nilCount.setValue(3, 1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    public void testReuseBackingArray() {
        NilCount nilCount = new NilCount();
        nilCount.init(3, 100);
        assertThat(nilCount.capacity()).isEqualTo(100);

        nilCount.init(1, 10);
        assertThat(nilCount.capacity()).isEqualTo(100);
        assertThat(nilCount.size()).isEqualTo(10);

        nilCount.init(0, 200);
        assertThat(nilCount.capacity()).isEqualTo(100);

        nilCount.init(1, 200);
        assertThat(nilCount.capacity()).isEqualTo(200);
    }

    @Test
    public void testNegativeTotal() {
        assertThatThrownBy(() -> new NilCount().init(-1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
