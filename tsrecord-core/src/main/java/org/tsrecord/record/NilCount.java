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

import org.tsrecord.annotation.VisibleForTesting;

import static org.tsrecord.utils.Preconditions.checkArgument;

/**
 * 列的 null 个数前缀和索引。
 *
 * <p>{@code value(j)} 表示逻辑行 {@code [0, j)} 中 null 的个数,于是逻辑行号 {@code row}
 * 对应的物理位置(跳过 null 后的值下标)为 {@code row - value(row)},可以在 O(1) 内把逻辑行区间
 * 换算为物理字节区间。
 *
 * <p>当列中没有 null 时({@code total == 0})前缀和保持为空,调用方应直接使用逻辑行号。
 * 重复初始化时只在容量不足时重新分配数组,不会收缩。
 */
public class NilCount {

    private static final int[] EMPTY = new int[0];

    private int total;

    private int[] value = EMPTY;

    private int size;

    /**
     * 初始化索引。
     *
     * @param total 列中 null 的总数
     * @param size 前缀和数组的长度,通常为行数加一
     */
    public void init(int total, int size) {
        checkArgument(total >= 0, "Nil count must not be negative: %s", total);
        this.total = total;
        if (total == 0) {
            this.size = 0;
            return;
        }
        if (value.length < size) {
            value = new int[size];
        }
        this.size = size;
        value[0] = 0;
    }

    /**
     * 按列的有效位图填充前缀和。
     *
     * <p>{@code value[j] = value[j - 1] + (第 j - 1 行为 null ? 1 : 0)}。
     */
    public void init(ColVal col) {
        init(col.nilCount(), col.len() + 1);
        if (total == 0) {
            return;
        }
        for (int j = 1; j < size; j++) {
            value[j] = value[j - 1] + (col.isNil(j - 1) ? 1 : 0);
        }
    }

    public int total() {
        return total;
    }

    public int size() {
        return size;
    }

    /** 逻辑行 {@code [0, j)} 中 null 的个数。 */
    public int value(int j) {
        if (j >= size) {
            throw new IndexOutOfBoundsException("Index: " + j + ", Size: " + size);
        }
        return value[j];
    }

    public void setValue(int j, int nils) {
        if (j >= size) {
            throw new IndexOutOfBoundsException("Index: " + j + ", Size: " + size);
        }
        value[j] = nils;
    }

    @VisibleForTesting
    int capacity() {
        return value.length;
    }
}
