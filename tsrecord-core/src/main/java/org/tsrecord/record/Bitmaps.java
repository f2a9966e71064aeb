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

/**
 * 有效位图的位运算工具。
 *
 * <p>每行占一位,1 表示有值,0 表示 null。第 {@code i} 位位于第 {@code i >> 3} 个字节,
 * 字节内按低位在前排列。
 */
final class Bitmaps {

    static final byte[] BIT_MASK = {1, 2, 4, 8, 16, 32, 64, (byte) 128};

    static final byte[] FLIPPED_BIT_MASK = {
        (byte) 254, (byte) 253, (byte) 251, (byte) 247,
        (byte) 239, (byte) 223, (byte) 191, (byte) 127
    };

    static boolean isSet(byte[] bitmap, int bitIndex) {
        return (bitmap[bitIndex >> 3] & BIT_MASK[bitIndex & 7]) != 0;
    }

    static void set(byte[] bitmap, int bitIndex) {
        bitmap[bitIndex >> 3] |= BIT_MASK[bitIndex & 7];
    }

    static void clear(byte[] bitmap, int bitIndex) {
        bitmap[bitIndex >> 3] &= FLIPPED_BIT_MASK[bitIndex & 7];
    }

    /** 容纳 {@code bits} 个位所需的字节数。 */
    static int byteCount(int bits) {
        return (bits + 7) >>> 3;
    }

    private Bitmaps() {}
}
