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
import org.tsrecord.io.DataInputView;
import org.tsrecord.io.DataOutputView;
import org.tsrecord.record.Field;
import org.tsrecord.types.FieldType;

import java.io.IOException;

/**
 * {@link Field} 的序列化器。
 *
 * <p>格式:{@code name(uint16 长度 + UTF-8) + type(uint32 编码)}。未识别的类型编码解码为
 * {@link FieldType#UNKNOWN}。
 */
public final class FieldSerializer implements Serializer<Field> {

    private static final long serialVersionUID = 1L;

    public static final FieldSerializer INSTANCE = new FieldSerializer();

    @Override
    public FieldSerializer duplicate() {
        return this;
    }

    @Override
    public Field copy(Field from) {
        return from;
    }

    @Override
    public void serialize(Field field, DataOutputView target) throws IOException {
        BinaryCodec.writeString(target, field.name());
        BinaryCodec.writeUint32(target, field.type().code());
    }

    @Override
    public Field deserialize(DataInputView source) throws IOException {
        String name = BinaryCodec.readString(source);
        long code = BinaryCodec.readUint32(source);
        if (code > Integer.MAX_VALUE) {
            return new Field(name, FieldType.UNKNOWN);
        }
        return new Field(name, FieldType.fromCode((int) code));
    }

    /** 序列化后的字节数。 */
    public int size(Field field) {
        return BinaryCodec.sizeOfString(field.name()) + BinaryCodec.SIZE_OF_UINT32;
    }
}
