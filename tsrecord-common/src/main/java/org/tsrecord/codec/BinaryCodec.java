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

package org.tsrecord.codec;

import org.tsrecord.io.DataInputDeserializer;
import org.tsrecord.io.DataInputView;
import org.tsrecord.io.DataOutputView;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.tsrecord.utils.Preconditions.checkArgument;

/**
 * 线格式的基础编解码原语。
 *
 * <p>除特别说明外,所有整数均按大端序写出:
 *
 * <table border="1">
 *   <tr><th>原语</th><th>布局</th></tr>
 *   <tr><td>uint16</td><td>2 字节</td></tr>
 *   <tr><td>uint32</td><td>4 字节</td></tr>
 *   <tr><td>int64</td><td>zig-zag 映射后写 8 字节(定长,非 varint)</td></tr>
 *   <tr><td>string</td><td>uint16 长度 + UTF-8 字节</td></tr>
 *   <tr><td>byte slice</td><td>uint32 长度 + 原始字节</td></tr>
 *   <tr><td>uint32 slice</td><td>uint32 元素个数 + 每个元素 4 字节小端序</td></tr>
 * </table>
 *
 * <p>zig-zag 映射 {@code (v << 1) ^ (v >> 63)} 让绝对值小的负数与正数拥有相同形状的字节模式,
 * 字段宽度仍然固定为 8 字节。
 */
public final class BinaryCodec {

    public static final int SIZE_OF_UINT16 = 2;
    public static final int SIZE_OF_UINT32 = 4;
    public static final int SIZE_OF_INT = 8;

    /** uint32 能表示的最大值。 */
    public static final long MAX_UINT32 = 0xFFFFFFFFL;

    private static final int MAX_STRING_LENGTH = 0xFFFF;

    // ------------------------------------------------------------------------
    //  Integers
    // ------------------------------------------------------------------------

    public static void writeUint16(DataOutputView out, int value) throws IOException {
        checkArgument(value >= 0 && value <= 0xFFFF, "Value %s out of uint16 range.", value);
        out.writeShort(value);
    }

    public static int readUint16(DataInputView in) throws IOException {
        return in.readUnsignedShort();
    }

    public static void writeUint32(DataOutputView out, long value) throws IOException {
        checkArgument(value >= 0 && value <= MAX_UINT32, "Value %s out of uint32 range.", value);
        out.writeInt((int) value);
    }

    public static long readUint32(DataInputView in) throws IOException {
        return in.readInt() & MAX_UINT32;
    }

    /**
     * 读取一个用作长度或个数的 uint32。
     *
     * @throws IOException 如果值超出 Java 数组可寻址范围
     */
    public static int readLength(DataInputView in) throws IOException {
        long length = readUint32(in);
        if (length > Integer.MAX_VALUE - 8) {
            throw new IOException("Length " + length + " exceeds the maximum array size.");
        }
        return (int) length;
    }

    public static long zigZagEncode(long value) {
        return (value << 1) ^ (value >> 63);
    }

    public static long zigZagDecode(long encoded) {
        return (encoded >>> 1) ^ -(encoded & 1);
    }

    public static void writeInt64(DataOutputView out, long value) throws IOException {
        out.writeLong(zigZagEncode(value));
    }

    public static long readInt64(DataInputView in) throws IOException {
        return zigZagDecode(in.readLong());
    }

    /** 以 int64 的形式写出一个 int。 */
    public static void writeInt(DataOutputView out, int value) throws IOException {
        writeInt64(out, value);
    }

    public static int readInt(DataInputView in) throws IOException {
        long value = readInt64(in);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IOException("Value " + value + " overflows int.");
        }
        return (int) value;
    }

    // ------------------------------------------------------------------------
    //  Strings and slices
    // ------------------------------------------------------------------------

    public static void writeString(DataOutputView out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        checkArgument(
                bytes.length <= MAX_STRING_LENGTH,
                "String of %s bytes exceeds the uint16 length prefix.",
                bytes.length);
        out.writeShort(bytes.length);
        out.write(bytes);
    }

    public static String readString(DataInputView in) throws IOException {
        int length = readUint16(in);
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static void writeBytes(DataOutputView out, byte[] bytes, int off, int len)
            throws IOException {
        writeUint32(out, len);
        out.write(bytes, off, len);
    }

    public static byte[] readBytes(DataInputView in) throws IOException {
        int length = readLength(in);
        ensureAvailable(in, length);
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    public static void writeUint32Slice(DataOutputView out, int[] values, int len)
            throws IOException {
        writeUint32(out, len);
        for (int i = 0; i < len; i++) {
            out.writeInt(Integer.reverseBytes(values[i]));
        }
    }

    public static int[] readUint32Slice(DataInputView in) throws IOException {
        int length = readLength(in);
        ensureAvailable(in, (long) length * SIZE_OF_UINT32);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = Integer.reverseBytes(in.readInt());
        }
        return values;
    }

    /**
     * 输入来自内存缓冲区时,提前确认剩余字节足够,避免按损坏的长度前缀分配大数组。
     *
     * @throws EOFException 剩余字节不足
     */
    public static void ensureAvailable(DataInputView in, long bytes) throws EOFException {
        if (in instanceof DataInputDeserializer
                && ((DataInputDeserializer) in).available() < bytes) {
            throw new EOFException(
                    "Need "
                            + bytes
                            + " bytes but only "
                            + ((DataInputDeserializer) in).available()
                            + " remain.");
        }
    }

    // ------------------------------------------------------------------------
    //  Sizes
    // ------------------------------------------------------------------------

    public static int sizeOfString(String value) {
        return utf8Length(value) + SIZE_OF_UINT16;
    }

    public static int sizeOfByteSlice(int length) {
        return length + SIZE_OF_UINT32;
    }

    public static int sizeOfUint32Slice(int length) {
        return length * SIZE_OF_UINT32 + SIZE_OF_UINT32;
    }

    /** 字符串按 UTF-8 编码后的字节数。 */
    public static int utf8Length(String value) {
        int length = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x80) {
                length++;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c)
                    && i + 1 < value.length()
                    && Character.isLowSurrogate(value.charAt(i + 1))) {
                length += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                // unpaired surrogates are replaced by '?'
                length++;
            } else {
                length += 3;
            }
        }
        return length;
    }

    private BinaryCodec() {}
}
