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

import org.tsrecord.types.FieldType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Record}. */
public class RecordTest {

    @Test
    public void testValidRecord() throws RecordValidationException {
        Record record = newRecord("a", FieldType.INT, "b", FieldType.STRING);
        record.column(0).appendIntegers(1, 2);
        record.column(1).appendString("x");
        record.column(1).appendStringNull();
        record.appendTime(10, 20);

        record.validate();

        assertThat(record.rowNums()).isEqualTo(2);
        assertThat(record.times()).containsExactly(10L, 20L);
        assertThat(record.schema())
                .containsExactly(
                        Field.of("a", FieldType.INT),
                        Field.of("b", FieldType.STRING),
                        Field.of(Record.TIME_FIELD, FieldType.INT));
    }

    @Test
    public void testReorderByName() throws RecordValidationException {
        Record record =
                newRecord("c", FieldType.FLOAT, "a", FieldType.INT, "b", FieldType.TAG);
        record.column(0).appendFloat(0.5);
        record.column(1).appendInteger(7);
        record.column(2).appendString("host");
        record.appendTime(1);

        record.validate();

        assertThat(record.field(0).name()).isEqualTo("a");
        assertThat(record.field(1).name()).isEqualTo("b");
        assertThat(record.field(2).name()).isEqualTo("c");
        assertThat(record.field(3).isTime()).isTrue();
        assertThat(record.column(0).integerValues()).containsExactly(7L);
        assertThat(record.column(1).stringValues()).containsExactly("host");
        assertThat(record.column(2).floatValues()).containsExactly(0.5);
        assertThat(record.column(3).integerValues()).containsExactly(1L);
    }

    @Test
    public void testTooFewColumns() {
        Record record = new Record(Collections.singletonList(Field.of("time", FieldType.INT)));
        record.appendTime(1);
        assertValidationFails(record, "invalid schema");
    }

    @Test
    public void testTimeNotLast() {
        Record record =
                new Record(
                        Arrays.asList(
                                Field.of(Record.TIME_FIELD, FieldType.INT),
                                Field.of("v", FieldType.INT)));
        assertValidationFails(record, "invalid schema");
    }

    @Test
    public void testTimeMustBeInteger() {
        Record record =
                new Record(
                        Arrays.asList(
                                Field.of("v", FieldType.INT),
                                Field.of(Record.TIME_FIELD, FieldType.FLOAT)));
        assertValidationFails(record, "time field must be Integer");
    }

    @Test
    public void testTimeColumnWithNulls() {
        Record record = newRecord("v", FieldType.INT);
        record.column(0).appendInteger(1);
        record.column(1).appendIntegerNull();
        assertValidationFails(record, "invalid colvals: time column has nulls");
    }

    @Test
    public void testAdjacentDuplicateNames() {
        Record record = newRecord("v", FieldType.INT, "v", FieldType.FLOAT);
        assertValidationFails(record, "same schema; idx: 1, name: v");
    }

    @Test
    public void testDuplicateNamesFoundAfterReorder() {
        Record record =
                newRecord("v", FieldType.INT, "a", FieldType.INT, "v", FieldType.STRING);
        List<Field> before = new ArrayList<>(record.schema());
        ColVal first = record.column(0);

        assertValidationFails(record, "same schema; idx: 2, name: v");

        // the rejected record keeps its original column order
        assertThat(record.schema()).isEqualTo(before);
        assertThat(record.column(0)).isSameAs(first);
    }

    @Test
    public void testTimeFieldInTheMiddle() {
        Record record =
                newRecord("a", FieldType.INT, Record.TIME_FIELD, FieldType.INT, "b", FieldType.INT);
        assertValidationFails(record, "time field at idx 1");
    }

    @Test
    public void testMismatchedLengths() {
        Record record = newRecord("a", FieldType.INT, "b", FieldType.INT);
        record.column(0).appendInteger(1);
        record.appendTime(1);
        assertValidationFails(record, "invalid colvals length");
    }

    @Test
    public void testIncorrectValueLength() {
        Record record = newRecord("a", FieldType.INT);
        record.appendTime(1);
        Record broken =
                new Record(
                        record.schema(),
                        Arrays.asList(
                                ColVal.wrap(1, 0, 0, new byte[4], new byte[] {1}, new int[0]),
                                record.column(1)));
        assertValidationFails(broken, "the length of colVals[0].val is incorrect. exp: 8, got: 4");
    }

    @Test
    public void testIncorrectOffsetLength() {
        Record record = newRecord("s", FieldType.STRING);
        record.appendTime(1);
        Record broken =
                new Record(
                        record.schema(),
                        Arrays.asList(
                                ColVal.wrap(1, 0, 0, new byte[2], new byte[] {1}, new int[0]),
                                record.column(1)));
        assertValidationFails(broken, "the length of colVals[0].offset is incorrect");
    }

    @Test
    public void testUnknownFieldType() {
        Record record = newRecord("u", FieldType.UNKNOWN);
        assertValidationFails(record, "unsupported field type UNKNOWN");
    }

    @Test
    public void testColumnCountMismatch() {
        Record record = newRecord("a", FieldType.INT);
        record.reserveColVal(1);
        assertValidationFails(record, "2 fields but 1 colVals");
    }

    @Test
    public void testEmptyRecord() {
        Record record = new Record();
        assertThat(record.rowNums()).isZero();
        assertThat(record.times()).isEmpty();
        assertThat(record.columnCount()).isZero();
        assertThatThrownBy(() -> record.appendTime(1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testResetWithSchemaReusesColumns() {
        Record record = newRecord("a", FieldType.INT);
        record.column(0).appendInteger(1);
        record.appendTime(1);
        ColVal first = record.column(0);

        record.resetWithSchema(
                Arrays.asList(
                        Field.of("x", FieldType.STRING),
                        Field.of("y", FieldType.STRING),
                        Field.of(Record.TIME_FIELD, FieldType.INT)));

        assertThat(record.columnCount()).isEqualTo(3);
        assertThat(record.column(0)).isSameAs(first);
        assertThat(first.len()).isZero();
        assertThat(record.rowNums()).isZero();
    }

    @Test
    public void testSwapColVals() {
        Record left = newRecord("a", FieldType.INT);
        Record right = newRecord("a", FieldType.INT);
        left.appendTime(5);
        ColVal leftTime = left.column(1);

        left.swapColVals(right);
        assertThat(right.column(1)).isSameAs(leftTime);
        assertThat(left.rowNums()).isZero();

        Record other = newRecord("b", FieldType.INT);
        assertThatThrownBy(() -> left.swapColVals(other))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testFieldDisplayName() {
        assertThat(Field.of("value", FieldType.INT)).hasToString("valueInteger");
        assertThat(Field.of("host", FieldType.TAG)).hasToString("hostTag");
        assertThat(Field.of("time", FieldType.INT).isTime()).isTrue();
    }

    private static void assertValidationFails(Record record, String message) {
        assertThatThrownBy(record::validate)
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining(message);
    }

    /** Builds an empty record of the given (name, type) pairs followed by the time column. */
    private static Record newRecord(Object... nameAndTypes) {
        Field[] fields = new Field[nameAndTypes.length / 2 + 1];
        for (int i = 0; i < nameAndTypes.length; i += 2) {
            fields[i / 2] = Field.of((String) nameAndTypes[i], (FieldType) nameAndTypes[i + 1]);
        }
        fields[fields.length - 1] = Field.of(Record.TIME_FIELD, FieldType.INT);
        return new Record(Arrays.asList(fields));
    }
}
