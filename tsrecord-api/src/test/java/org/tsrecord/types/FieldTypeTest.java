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

package org.tsrecord.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link FieldType}. */
public class FieldTypeTest {

    @Test
    public void testCodes() {
        assertThat(FieldType.UNKNOWN.code()).isEqualTo(0);
        assertThat(FieldType.INT.code()).isEqualTo(1);
        assertThat(FieldType.UINT.code()).isEqualTo(2);
        assertThat(FieldType.FLOAT.code()).isEqualTo(3);
        assertThat(FieldType.STRING.code()).isEqualTo(4);
        assertThat(FieldType.BOOLEAN.code()).isEqualTo(5);
        assertThat(FieldType.TAG.code()).isEqualTo(6);
    }

    @Test
    public void testFromCode() {
        for (FieldType type : FieldType.values()) {
            assertThat(FieldType.fromCode(type.code())).isSameAs(type);
        }
        assertThat(FieldType.fromCode(7)).isEqualTo(FieldType.UNKNOWN);
        assertThat(FieldType.fromCode(-1)).isEqualTo(FieldType.UNKNOWN);
    }

    @Test
    public void testSizes() {
        assertThat(FieldType.INT.fixedSize()).isEqualTo(8);
        assertThat(FieldType.UINT.fixedSize()).isEqualTo(8);
        assertThat(FieldType.FLOAT.fixedSize()).isEqualTo(8);
        assertThat(FieldType.BOOLEAN.fixedSize()).isEqualTo(1);

        assertThat(FieldType.STRING.isVariableSize()).isTrue();
        assertThat(FieldType.TAG.isVariableSize()).isTrue();
        assertThat(FieldType.TAG.isFixedSize()).isFalse();

        assertThat(FieldType.UNKNOWN.isFixedSize()).isFalse();
        assertThat(FieldType.UNKNOWN.isVariableSize()).isFalse();
    }

    @Test
    public void testLabels() {
        assertThat(FieldType.INT.label()).isEqualTo("Integer");
        assertThat(FieldType.TAG.label()).isEqualTo("Tag");
        assertThat(FieldType.UINT.label()).isEqualTo("Unsigned");
    }
}
