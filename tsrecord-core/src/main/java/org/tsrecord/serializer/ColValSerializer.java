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
import org.tsrecord.record.ColVal;

import java.io.IOException;

/**
 * {@link ColVal} 的序列化器。
 *
 * <p>格式:
 *
 * <pre>
 * len(int64) nilCount(int64) bitMapOffset(int64)
 * val(byte slice) bitmap(byte slice) offset(uint32 slice)
 * </pre>
 *
 * <p>三个头部整数使用 zig-zag 定长 8 字节编码,见 {@link BinaryCodec#writeInt}。
 */
public final class ColValSerializer implements Serializer<ColVal> {

    private static final long serialVersionUID = 1L;

    public static final ColValSerializer INSTANCE = new ColValSerializer();

    @Override
    public ColValSerializer duplicate() {
        return this;
    }

    @Override
    public ColVal copy(ColVal from) {
        return from.copy();
    }

    @Override
    public void serialize(ColVal col, DataOutputView target) throws IOException {
        BinaryCodec.writeInt(target, col.len());
        BinaryCodec.writeInt(target, col.nilCount());
        BinaryCodec.writeInt(target, col.bitMapOffset());
        BinaryCodec.writeBytes(target, col.valBuffer(), 0, col.valLength());
        BinaryCodec.writeBytes(target, col.bitmapBuffer(), 0, col.bitmapLength());
        BinaryCodec.writeUint32Slice(target, col.offsetBuffer(), col.offsetLength());
    }

    @Override
    public ColVal deserialize(DataInputView source) throws IOException {
        int len = BinaryCodec.readInt(source);
        int nilCount = BinaryCodec.readInt(source);
        int bitMapOffset = BinaryCodec.readInt(source);
        byte[] val = BinaryCodec.readBytes(source);
        byte[] bitmap = BinaryCodec.readBytes(source);
        int[] offset = BinaryCodec.readUint32Slice(source);

        if (len < 0 || nilCount < 0 || nilCount > len || bitMapOffset < 0) {
            throw new IOException(
                    String.format(
                            "Corrupt column header: len=%d, nilCount=%d, bitMapOffset=%d.",
                            len, nilCount, bitMapOffset));
        }
        long bitmapBits = (long) bitmap.length * 8;
        if (len > 0 && bitmapBits < (long) bitMapOffset + len) {
            throw new IOException(
                    String.format(
                            "Corrupt column bitmap: %d bytes cannot hold %d rows from bit %d.",
                            bitmap.length, len, bitMapOffset));
        }
        for (int off : offset) {
            if (off < 0 || off > val.length) {
                throw new IOException(
                        String.format(
                                "Corrupt column offset %d for a value buffer of %d bytes.",
                                off & BinaryCodec.MAX_UINT32, val.length));
            }
        }
        return ColVal.wrap(len, nilCount, bitMapOffset, val, bitmap, offset);
    }
}
