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
import org.tsrecord.io.DataInputView;
import org.tsrecord.io.DataOutputView;
import org.tsrecord.record.ColVal;
import org.tsrecord.record.Field;
import org.tsrecord.record.Record;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Record} 的序列化器。
 *
 * <p>格式:
 *
 * <pre>
 * schemaCount(uint32)  { size(uint32) fieldBytes  } * schemaCount
 * colValCount(uint32)  { size(uint32) colValBytes } * colValCount
 * </pre>
 *
 * <p>每个条目以自身的字节数开头,解码时只从这段字节中读取,条目内多余的尾部字节被跳过。
 * 输入在条目中途耗尽时抛出 {@link EOFException};条目内容超出其声明的长度时视为损坏,
 * 抛出 {@link IOException}。
 */
public final class RecordSerializer implements Serializer<Record> {

    private static final long serialVersionUID = 1L;

    public static final RecordSerializer INSTANCE = new RecordSerializer();

    private final FieldSerializer fieldSerializer = FieldSerializer.INSTANCE;

    private final ColValSerializer colValSerializer = ColValSerializer.INSTANCE;

    @Override
    public RecordSerializer duplicate() {
        return this;
    }

    @Override
    public Record copy(Record from) {
        List<ColVal> colVals = new ArrayList<>(from.columnCount());
        for (int i = 0; i < from.columnCount(); i++) {
            colVals.add(from.column(i).copy());
        }
        return new Record(from.schema(), colVals);
    }

    @Override
    public void serialize(Record record, DataOutputView target) throws IOException {
        List<Field> schema = record.schema();
        BinaryCodec.writeUint32(target, schema.size());
        for (Field field : schema) {
            BinaryCodec.writeUint32(target, fieldSerializer.size(field));
            fieldSerializer.serialize(field, target);
        }

        BinaryCodec.writeUint32(target, record.columnCount());
        for (int i = 0; i < record.columnCount(); i++) {
            ColVal col = record.column(i);
            BinaryCodec.writeUint32(target, col.size());
            colValSerializer.serialize(col, target);
        }
    }

    @Override
    public Record deserialize(DataInputView source) throws IOException {
        DataInputDeserializer entry = new DataInputDeserializer();

        int schemaCount = BinaryCodec.readLength(source);
        List<Field> schema = new ArrayList<>(Math.min(schemaCount, 64));
        for (int i = 0; i < schemaCount; i++) {
            readEntry(source, entry);
            schema.add(decode(fieldSerializer, entry, "field", i));
        }

        int colValCount = BinaryCodec.readLength(source);
        if (colValCount != schemaCount) {
            throw new IOException(
                    String.format(
                            "Corrupt record: %d fields but %d columns.", schemaCount, colValCount));
        }
        List<ColVal> colVals = new ArrayList<>(colValCount);
        for (int i = 0; i < colValCount; i++) {
            readEntry(source, entry);
            colVals.add(decode(colValSerializer, entry, "column", i));
        }
        return new Record(schema, colVals);
    }

    /** 读取一个带长度前缀的条目,作为 {@code entry} 的数据源。 */
    private static void readEntry(DataInputView source, DataInputDeserializer entry)
            throws IOException {
        int size = BinaryCodec.readLength(source);
        BinaryCodec.ensureAvailable(source, size);
        byte[] bytes = new byte[size];
        source.readFully(bytes);
        entry.setBuffer(bytes);
    }

    private static <T> T decode(
            Serializer<T> serializer, DataInputDeserializer entry, String kind, int index)
            throws IOException {
        try {
            return serializer.deserialize(entry);
        } catch (EOFException e) {
            throw new IOException(
                    String.format(
                            "Corrupt %s entry %d: content exceeds its size prefix.", kind, index),
                    e);
        }
    }
}
