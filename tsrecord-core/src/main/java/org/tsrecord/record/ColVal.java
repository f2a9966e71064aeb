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

import org.tsrecord.annotation.Public;
import org.tsrecord.codec.BinaryCodec;
import org.tsrecord.types.FieldType;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.tsrecord.utils.Preconditions.checkArgument;
import static org.tsrecord.utils.Preconditions.checkNotNull;
import static org.tsrecord.utils.Preconditions.checkState;

/**
 * 单列的紧凑存储:一批行在某一列上的全部取值。
 *
 * <h2>内存布局</h2>
 *
 * <pre>
 * ColVal 结构:
 * ┌──────────────────────┐
 * │ val                  │  非 null 值按行顺序紧凑排列(小端序),null 不占空间
 * ├──────────────────────┤
 * │ offset (仅变长类型)   │  每行(含 null 行)在 val 中的起始位置,null 行与下一行共用起点
 * ├──────────────────────┤
 * │ bitmap               │  每行一位,1 有值 0 为 null;第 0 行从 bitMapOffset 位开始
 * └──────────────────────┘
 * len      = 逻辑行数(含 null)
 * nilCount = null 行数
 * </pre>
 *
 * <p>定长类型满足 {@code valLength == fixedSize * (len - nilCount)};变长类型满足
 * {@code offsetLength == len}。位图长度始终为 {@code ceil((bitMapOffset + len) / 8)} 个字节。
 *
 * <p>null 的判定以位图为准:空字符串与 null 在 val 中都不占字节,只能通过位图区分。
 *
 * <p>此类不是线程安全的。
 */
@Public
public class ColVal {

    private static final byte[] EMPTY_BYTES = new byte[0];
    private static final int[] EMPTY_INTS = new int[0];

    private byte[] val = EMPTY_BYTES;
    private int valLen;

    private int[] offset = EMPTY_INTS;
    private int offsetLen;

    private byte[] bitmap = EMPTY_BYTES;
    private int bitmapLen;

    /** 第 0 行在位图中的位偏移 */
    private int bitMapOffset;

    private int len;

    private int nilCount;

    public ColVal() {}

    /**
     * 用已有的缓冲区构造一列,缓冲区不会被复制。
     *
     * <p>调用方需保证各参数满足类注释中的约束。
     */
    public static ColVal wrap(
            int len, int nilCount, int bitMapOffset, byte[] val, byte[] bitmap, int[] offset) {
        ColVal col = new ColVal();
        col.len = len;
        col.nilCount = nilCount;
        col.bitMapOffset = bitMapOffset;
        col.val = checkNotNull(val);
        col.valLen = val.length;
        col.bitmap = checkNotNull(bitmap);
        col.bitmapLen = bitmap.length;
        col.offset = checkNotNull(offset);
        col.offsetLen = offset.length;
        return col;
    }

    /** 清空内容,保留已分配的缓冲区。 */
    public void init() {
        valLen = 0;
        offsetLen = 0;
        bitmapLen = 0;
        bitMapOffset = 0;
        len = 0;
        nilCount = 0;
    }

    // ------------------------------------------------------------------------
    //  Single value appends
    // ------------------------------------------------------------------------

    public void appendInteger(long v) {
        putLong(v);
        setBitMap();
        len++;
    }

    public void appendFloat(double v) {
        putLong(Double.doubleToRawLongBits(v));
        setBitMap();
        len++;
    }

    public void appendBoolean(boolean v) {
        reserveVal(1);
        val[valLen++] = (byte) (v ? 1 : 0);
        setBitMap();
        len++;
    }

    public void appendString(String v) {
        checkNotNull(v, "Use appendStringNull() to append a null string.");
        byte[] bytes = v.getBytes(StandardCharsets.UTF_8);
        appendStringBytes(bytes, 0, bytes.length);
    }

    /** 追加一个已编码为 UTF-8 的字符串值。 */
    public void appendStringBytes(byte[] bytes, int off, int length) {
        appendOffset(valLen);
        reserveVal(length);
        System.arraycopy(bytes, off, val, valLen, length);
        valLen += length;
        setBitMap();
        len++;
    }

    public void appendIntegerNull() {
        appendFixedNull();
    }

    public void appendFloatNull() {
        appendFixedNull();
    }

    public void appendBooleanNull() {
        appendFixedNull();
    }

    /** 追加一个 null 字符串,同样适用于标签列。 */
    public void appendStringNull() {
        appendOffset(valLen);
        resetBitMap();
        len++;
        nilCount++;
    }

    private void appendFixedNull() {
        resetBitMap();
        len++;
        nilCount++;
    }

    // ------------------------------------------------------------------------
    //  Bulk appends
    // ------------------------------------------------------------------------

    public void appendIntegers(long... values) {
        for (long v : values) {
            appendInteger(v);
        }
    }

    public void appendFloats(double... values) {
        for (double v : values) {
            appendFloat(v);
        }
    }

    public void appendBooleans(boolean... values) {
        for (boolean v : values) {
            appendBoolean(v);
        }
    }

    public void appendStrings(String... values) {
        for (String v : values) {
            appendString(v);
        }
    }

    public void appendNull(FieldType type) {
        appendNulls(type, 1);
    }

    /**
     * 按类型追加 {@code count} 个 null。
     *
     * @throws IllegalStateException 如果类型不是可存储的值类型
     */
    public void appendNulls(FieldType type, int count) {
        checkValueType(type);
        for (int i = 0; i < count; i++) {
            if (type.isVariableSize()) {
                appendStringNull();
            } else {
                appendFixedNull();
            }
        }
    }

    // ------------------------------------------------------------------------
    //  Range copy
    // ------------------------------------------------------------------------

    /**
     * 把 {@code src} 的逻辑行区间 {@code [start, end)} 追加到本列。
     *
     * <p>{@code nilCount} 必须是按 {@code src} 初始化的前缀和索引,用于把逻辑行换算为
     * {@code src.val} 中的物理位置。定长类型整段复制字节;变长类型复制字节并按本列当前长度
     * 重新计算偏移;位图按位复制。
     *
     * @throws IllegalStateException 如果类型不是可存储的值类型
     */
    public void appendWithNilCount(
            ColVal src, FieldType type, int start, int end, NilCount nilCount) {
        checkValueType(type);
        if (end <= start || src.len == 0) {
            return;
        }
        if (start == 0 && end == src.len && len == 0) {
            appendAll(src);
            return;
        }

        int startOffset = start;
        int endOffset = end;
        if (nilCount.total() > 0) {
            startOffset = start - nilCount.value(start);
            endOffset = end - nilCount.value(end);
        }

        if (type.isVariableSize()) {
            appendStringRange(src, start, end);
        } else {
            int size = type.fixedSize();
            appendVal(src.val, startOffset * size, endOffset * size);
        }

        appendBitmap(src.bitmap, src.bitMapOffset, start, end);
        len += end - start;
        this.nilCount += (end - start) - (endOffset - startOffset);
    }

    /**
     * 整列复制。要求本列为空,复制后沿用 {@code src} 在字节内的位偏移,位图按字节截取。
     */
    public void appendAll(ColVal src) {
        checkState(len == 0, "appendAll requires an empty column, but it has %s rows.", len);
        appendVal(src.val, 0, src.valLen);

        reserveOffset(src.offsetLen);
        System.arraycopy(src.offset, 0, offset, offsetLen, src.offsetLen);
        offsetLen += src.offsetLen;

        int from = src.bitMapOffset >> 3;
        int to = Bitmaps.byteCount(src.bitMapOffset + src.len);
        bitmapLen = 0;
        appendBitmapBytes(src.bitmap, from, to - from);

        bitMapOffset = src.bitMapOffset & 7;
        len = src.len;
        nilCount = src.nilCount;
    }

    private void appendStringRange(ColVal src, int start, int end) {
        int off = valLen;
        reserveOffset(end - start);
        for (int i = start; i < end; i++) {
            if (i != start) {
                off += src.offset[i] - src.offset[i - 1];
            }
            offset[offsetLen++] = off;
        }
        int valEnd = end == src.len ? src.valLen : src.offset[end];
        appendVal(src.val, src.offset[start], valEnd);
    }

    /**
     * 复制 {@code src} 中位 {@code [srcBitOffset + start, srcBitOffset + end)} 到本列位图末尾。
     *
     * <p>目标末尾与源起点都按字节对齐时整字节复制,否则逐位复制。
     */
    private void appendBitmap(byte[] src, int srcBitOffset, int start, int end) {
        int dstRowIdx = bitMapOffset + len;
        int srcStart = srcBitOffset + start;
        int srcEnd = srcBitOffset + end;

        if ((dstRowIdx & 7) == 0 && (srcStart & 7) == 0) {
            int from = srcStart >> 3;
            appendBitmapBytes(src, from, Bitmaps.byteCount(srcEnd) - from);
            return;
        }

        int addSize = Bitmaps.byteCount(dstRowIdx + end - start) - Bitmaps.byteCount(dstRowIdx);
        if (addSize > 0) {
            reserveBitmap(addSize);
            Arrays.fill(bitmap, bitmapLen, bitmapLen + addSize, (byte) 0);
            bitmapLen += addSize;
        }
        for (int i = srcStart; i < srcEnd; i++, dstRowIdx++) {
            if (Bitmaps.isSet(src, i)) {
                Bitmaps.set(bitmap, dstRowIdx);
            } else {
                Bitmaps.clear(bitmap, dstRowIdx);
            }
        }
    }

    /**
     * 删除最后一行,仅用于去重时撤销已追加的重复时间戳的值。空列上调用无效果。
     *
     * @throws IllegalStateException 如果类型不是可存储的值类型
     */
    public void deleteLast(FieldType type) {
        checkValueType(type);
        if (len == 0) {
            return;
        }

        boolean nil = isNil(len - 1);
        len--;
        if (((len + bitMapOffset) & 7) == 0) {
            bitmapLen--;
        }

        if (type.isVariableSize()) {
            if (!nil) {
                valLen = offset[len];
            }
            offsetLen = len;
        } else if (!nil) {
            valLen -= type.fixedSize();
        }

        if (nil) {
            nilCount--;
        }
    }

    // ------------------------------------------------------------------------
    //  Readers
    // ------------------------------------------------------------------------

    /** 第 {@code row} 行是否为 null。超出行数或位图为空时视为 null。 */
    public boolean isNil(int row) {
        if (row >= len || bitmapLen == 0) {
            return true;
        }
        if (nilCount == 0) {
            return false;
        }
        return !Bitmaps.isSet(bitmap, row + bitMapOffset);
    }

    /** 所有非 null 的整数值,按行顺序。 */
    public long[] integerValues() {
        long[] values = new long[valLen / 8];
        for (int i = 0; i < values.length; i++) {
            values[i] = getLong(i * 8);
        }
        return values;
    }

    public double[] floatValues() {
        double[] values = new double[valLen / 8];
        for (int i = 0; i < values.length; i++) {
            values[i] = Double.longBitsToDouble(getLong(i * 8));
        }
        return values;
    }

    public boolean[] booleanValues() {
        boolean[] values = new boolean[valLen];
        for (int i = 0; i < valLen; i++) {
            values[i] = val[i] != 0;
        }
        return values;
    }

    /** 所有非 null 的字符串值,按行顺序。 */
    public List<String> stringValues() {
        List<String> values = new ArrayList<>(len - nilCount);
        for (int row = 0; row < len; row++) {
            if (!isNil(row)) {
                values.add(stringAt(row));
            }
        }
        return values;
    }

    /** 第 {@code row} 行的字符串值,null 行返回 null。 */
    @Nullable
    public String stringValue(int row) {
        checkArgument(row >= 0 && row < len, "Row %s out of range [0, %s).", row, len);
        return isNil(row) ? null : stringAt(row);
    }

    private String stringAt(int row) {
        int from = offset[row];
        int to = row + 1 < offsetLen ? offset[row + 1] : valLen;
        return new String(val, from, to - from, StandardCharsets.UTF_8);
    }

    public int len() {
        return len;
    }

    public int nilCount() {
        return nilCount;
    }

    public int bitMapOffset() {
        return bitMapOffset;
    }

    /** 值缓冲区,有效部分为 {@code [0, valLength())}。调用方不得修改。 */
    public byte[] valBuffer() {
        return val;
    }

    public int valLength() {
        return valLen;
    }

    /** 位图缓冲区,有效部分为 {@code [0, bitmapLength())}。调用方不得修改。 */
    public byte[] bitmapBuffer() {
        return bitmap;
    }

    public int bitmapLength() {
        return bitmapLen;
    }

    /** 偏移表,有效部分为 {@code [0, offsetLength())}。调用方不得修改。 */
    public int[] offsetBuffer() {
        return offset;
    }

    public int offsetLength() {
        return offsetLen;
    }

    /** 序列化后的字节数。 */
    public int size() {
        return BinaryCodec.SIZE_OF_INT * 3
                + BinaryCodec.sizeOfByteSlice(valLen)
                + BinaryCodec.sizeOfByteSlice(bitmapLen)
                + BinaryCodec.sizeOfUint32Slice(offsetLen);
    }

    /** 深拷贝,新列的缓冲区大小恰好等于有效长度。 */
    public ColVal copy() {
        return wrap(
                len,
                nilCount,
                bitMapOffset,
                Arrays.copyOf(val, valLen),
                Arrays.copyOf(bitmap, bitmapLen),
                Arrays.copyOf(offset, offsetLen));
    }

    // ------------------------------------------------------------------------
    //  Internal buffers
    // ------------------------------------------------------------------------

    private static void checkValueType(FieldType type) {
        switch (type) {
            case INT:
            case UINT:
            case FLOAT:
            case BOOLEAN:
            case STRING:
            case TAG:
                return;
            default:
                throw new IllegalStateException(
                        "Unsupported field type " + type + " in column buffer.");
        }
    }

    private void setBitMap() {
        int index = len + bitMapOffset;
        if ((index >> 3) >= bitmapLen) {
            appendBitmapByte((byte) 1);
        } else {
            Bitmaps.set(bitmap, index);
        }
    }

    private void resetBitMap() {
        int index = len + bitMapOffset;
        if ((index >> 3) >= bitmapLen) {
            appendBitmapByte((byte) 0);
        } else {
            Bitmaps.clear(bitmap, index);
        }
    }

    private void putLong(long v) {
        reserveVal(8);
        for (int i = 0; i < 8; i++) {
            val[valLen + i] = (byte) (v >>> (i << 3));
        }
        valLen += 8;
    }

    private long getLong(int pos) {
        long v = 0;
        for (int i = 7; i >= 0; i--) {
            v = (v << 8) | (val[pos + i] & 0xFFL);
        }
        return v;
    }

    private void appendVal(byte[] src, int from, int to) {
        int n = to - from;
        reserveVal(n);
        System.arraycopy(src, from, val, valLen, n);
        valLen += n;
    }

    private void appendOffset(int off) {
        reserveOffset(1);
        offset[offsetLen++] = off;
    }

    private void appendBitmapByte(byte b) {
        reserveBitmap(1);
        bitmap[bitmapLen++] = b;
    }

    private void appendBitmapBytes(byte[] src, int from, int n) {
        reserveBitmap(n);
        System.arraycopy(src, from, bitmap, bitmapLen, n);
        bitmapLen += n;
    }

    private void reserveVal(int extra) {
        int required = valLen + extra;
        if (required > val.length) {
            val = Arrays.copyOf(val, newCapacity(val.length, required));
        }
    }

    private void reserveOffset(int extra) {
        int required = offsetLen + extra;
        if (required > offset.length) {
            offset = Arrays.copyOf(offset, newCapacity(offset.length, required));
        }
    }

    private void reserveBitmap(int extra) {
        int required = bitmapLen + extra;
        if (required > bitmap.length) {
            bitmap = Arrays.copyOf(bitmap, newCapacity(bitmap.length, required));
        }
    }

    private static int newCapacity(int current, int required) {
        return (int) Math.max(Math.min(2L * current, Integer.MAX_VALUE - 8), required);
    }

    // ------------------------------------------------------------------------

    /** 按逻辑内容比较:行数、null 分布、值与偏移,与位图的起始位偏移无关。 */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColVal that = (ColVal) o;
        if (len != that.len || nilCount != that.nilCount) {
            return false;
        }
        for (int row = 0; row < len; row++) {
            if (isNil(row) != that.isNil(row)) {
                return false;
            }
        }
        return Arrays.equals(val, 0, valLen, that.val, 0, that.valLen)
                && Arrays.equals(offset, 0, offsetLen, that.offset, 0, that.offsetLen);
    }

    @Override
    public int hashCode() {
        int result = 31 * len + nilCount;
        for (int i = 0; i < valLen; i++) {
            result = 31 * result + val[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return "ColVal{len="
                + len
                + ", nilCount="
                + nilCount
                + ", bitMapOffset="
                + bitMapOffset
                + ", val="
                + valLen
                + " bytes, offsets="
                + Arrays.toString(Arrays.copyOf(offset, offsetLen))
                + '}';
    }
}
