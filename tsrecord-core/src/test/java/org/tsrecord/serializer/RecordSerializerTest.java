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

package org.tsrecord.serializer;

import org.tsrecord.codec.BinaryCodec;
import org.tsrecord.io.DataInputDeserializer;
import org.tsrecord.io.DataOutputSerializer;
import org.tsrecord.record.ColVal;
import org.tsrecord.record.Field;
import org.tsrecord.record.Record;
import org.tsrecord.types.FieldType;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RecordSerializer}, {@link FieldSerializer} and {@link ColValSerializer}. */
public class RecordSerializerTest {

    @Test
    public void testFieldLayout() throws IOException {
        byte[] bytes = FieldSerializer.INSTANCE.serializeToBytes(Field.of("ab", FieldType.TAG));
        assertThat(bytes).containsExactly(0, 2, 'a', 'b', 0, 0, 0, 6);
        assertThat(FieldSerializer.INSTANCE.size(Field.of("ab", FieldType.TAG)))
                .isEqualTo(bytes.length);
    }

    @Test
    public void testUnknownFieldCode() throws IOException {
        byte[] unknownCode = {0, 1, 'x', 0, 0, 0, 99};
        assertThat(FieldSerializer.INSTANCE.deserializeFromBytes(unknownCode))
                .isEqualTo(Field.of("x", FieldType.UNKNOWN));
        byte[] maxCode = {0, 1, 'x', (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
        assertThat(FieldSerializer.INSTANCE.deserializeFromBytes(maxCode).type())
                .isEqualTo(FieldType.UNKNOWN);
    }

    @Test
    public void testColValLayout() throws IOException {
        ColVal col = new ColVal();
        col.appendInteger(1);

        byte[] bytes = ColValSerializer.INSTANCE.serializeToBytes(col);

        assertThat(bytes).hasSize(col.size());
        assertThat(Arrays.copyOfRange(bytes, 0, 8)).containsExactly(0, 0, 0, 0, 0, 0, 0, 2);
        // val: uint32 length followed by a little-endian int64
        assertThat(Arrays.copyOfRange(bytes, 24, 36))
                .containsExactly(0, 0, 0, 8, 1, 0, 0, 0, 0, 0, 0, 0);
        assertThat(Arrays.copyOfRange(bytes, 36, 45)).containsExactly(0, 0, 0, 1, 1, 0, 0, 0, 0);
        assertThat(ColValSerializer.INSTANCE.deserializeFromBytes(bytes)).isEqualTo(col);
    }

    @Test
    public void testStringOffsetsAreLittleEndian() throws IOException {
        ColVal col = new ColVal();
        col.appendString("ab");
        col.appendString("c");

        byte[] bytes = ColValSerializer.INSTANCE.serializeToBytes(col);

        int offsets = bytes.length - 12;
        assertThat(Arrays.copyOfRange(bytes, offsets, bytes.length))
                .containsExactly(0, 0, 0, 2, 0, 0, 0, 0, 2, 0, 0, 0);
    }

    @Test
    public void testRoundTrip() throws IOException {
        Record record = sampleRecord();

        byte[] bytes = RecordSerializer.INSTANCE.serializeToBytes(record);
        Record decoded = RecordSerializer.INSTANCE.deserializeFromBytes(bytes);

        assertThat(decoded).isEqualTo(record);
        assertThat(decoded.column(0).booleanValues()).containsExactly(true, false);
        assertThat(decoded.column(3).stringValue(1)).isNull();
        assertThat(decoded.column(3).stringValue(2)).isEqualTo("数据");
        assertThat(decoded.times()).containsExactly(1L, 2L, 3L);
    }

    @Test
    public void testEmptyRecordRoundTrip() throws IOException {
        byte[] bytes = RecordSerializer.INSTANCE.serializeToBytes(new Record());
        assertThat(bytes).containsExactly(0, 0, 0, 0, 0, 0, 0, 0);
        assertThat(RecordSerializer.INSTANCE.deserializeFromBytes(bytes).columnCount()).isZero();
    }

    @Test
    public void testTruncatedInput() throws IOException {
        byte[] bytes = RecordSerializer.INSTANCE.serializeToBytes(sampleRecord());
        for (int length = 0; length < bytes.length; length++) {
            DataInputDeserializer in = new DataInputDeserializer(bytes, 0, length);
            assertThatThrownBy(() -> RecordSerializer.INSTANCE.deserialize(in))
                    .as("truncated to %s bytes", length)
                    .isInstanceOf(EOFException.class);
        }
    }

    @Test
    public void testEntryShorterThanItsContent() throws IOException {
        byte[] bytes = RecordSerializer.INSTANCE.serializeToBytes(sampleRecord());
        // size prefix of the first field entry
        bytes[7]--;

        assertThatThrownBy(() -> RecordSerializer.INSTANCE.deserializeFromBytes(bytes))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(EOFException.class)
                .hasMessage("Corrupt field entry 0: content exceeds its size prefix.");
    }

    @Test
    public void testTrailingBytesInsideEntryAreSkipped() throws IOException {
        Field field = Field.of("v", FieldType.INT);
        ColVal values = new ColVal();
        values.appendInteger(5);
        ColVal times = new ColVal();
        times.appendInteger(10);

        DataOutputSerializer out = new DataOutputSerializer(64);
        BinaryCodec.writeUint32(out, 2);
        writePadded(out, FieldSerializer.INSTANCE.serializeToBytes(field));
        writePadded(
                out,
                FieldSerializer.INSTANCE.serializeToBytes(
                        Field.of(Record.TIME_FIELD, FieldType.INT)));
        BinaryCodec.writeUint32(out, 2);
        writePadded(out, ColValSerializer.INSTANCE.serializeToBytes(values));
        writePadded(out, ColValSerializer.INSTANCE.serializeToBytes(times));

        Record decoded = RecordSerializer.INSTANCE.deserializeFromBytes(out.getCopyOfBuffer());

        assertThat(decoded.schema()).containsExactly(field, Field.of("time", FieldType.INT));
        assertThat(decoded.column(0).integerValues()).containsExactly(5L);
        assertThat(decoded.times()).containsExactly(10L);
    }

    @Test
    public void testColumnCountMismatch() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(64);
        BinaryCodec.writeUint32(out, 1);
        byte[] field =
                FieldSerializer.INSTANCE.serializeToBytes(
                        Field.of(Record.TIME_FIELD, FieldType.INT));
        BinaryCodec.writeUint32(out, field.length);
        out.write(field);
        BinaryCodec.writeUint32(out, 0);

        assertThatThrownBy(
                        () -> RecordSerializer.INSTANCE.deserializeFromBytes(out.getCopyOfBuffer()))
                .isInstanceOf(IOException.class)
                .hasMessage("Corrupt record: 1 fields but 0 columns.");
    }

    @Test
    public void testCorruptColumnHeader() throws IOException {
        ColVal col = new ColVal();
        col.appendInteger(1);
        byte[] bytes = ColValSerializer.INSTANCE.serializeToBytes(col);
        // nilCount = 2 (zig-zag 4) exceeds len = 1
        bytes[15] = 4;

        assertThatThrownBy(() -> ColValSerializer.INSTANCE.deserializeFromBytes(bytes))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nilCount=2");
    }

    @Test
    public void testCopyIsDeep() {
        Record record = sampleRecord();
        Record copy = RecordSerializer.INSTANCE.copy(record);

        assertThat(copy).isEqualTo(record);
        copy.column(4).appendInteger(9);
        assertThat(record.column(4).len()).isEqualTo(3);
        assertThat(copy).isNotEqualTo(record);
    }

    @Test
    public void testRecordWithoutRowsRoundTrip() throws IOException {
        Record record =
                new Record(Collections.singletonList(Field.of(Record.TIME_FIELD, FieldType.INT)));
        byte[] bytes = RecordSerializer.INSTANCE.serializeToBytes(record);
        assertThat(RecordSerializer.INSTANCE.deserializeFromBytes(bytes)).isEqualTo(record);
    }

    // ------------------------------------------------------------------------

    private static void writePadded(DataOutputSerializer out, byte[] entry) throws IOException {
        BinaryCodec.writeUint32(out, entry.length + 3);
        out.write(entry);
        out.write(new byte[] {7, 7, 7});
    }

    private static Record sampleRecord() {
        Record record =
                new Record(
                        Arrays.asList(
                                Field.of("b", FieldType.BOOLEAN),
                                Field.of("f", FieldType.FLOAT),
                                Field.of("host", FieldType.TAG),
                                Field.of("s", FieldType.STRING),
                                Field.of("v", FieldType.INT),
                                Field.of(Record.TIME_FIELD, FieldType.INT)));
        record.column(0).appendBooleans(true, false);
        record.column(0).appendBooleanNull();
        record.column(1).appendFloatNull();
        record.column(1).appendFloats(1.5, -2.25);
        record.column(2).appendStrings("h1", "h1", "h2");
        record.column(3).appendString("");
        record.column(3).appendStringNull();
        record.column(3).appendString("数据");
        record.column(4).appendIntegers(-1, Long.MAX_VALUE, Long.MIN_VALUE);
        record.appendTime(1, 2, 3);
        return record;
    }
}
