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

package org.tsrecord.sort;

import org.tsrecord.annotation.VisibleForTesting;
import org.tsrecord.utils.IntArrayList;

import java.util.Arrays;

/**
 * 按时间排序时使用的辅助结构:时间戳与原始行号组成的置换,以及置换中的连续段。
 *
 * <p>排序后第 {@code i} 个位置对应原始行 {@code rowId(i)}。{@link #initSections()} 把排序结果
 * 切分为若干段,每段内原始行号逐一递增且相邻两行时间戳不同,这样一段可以用一次缓冲区复制
 * 整体搬运,而不必逐行复制。
 *
 * <pre>
 * times  : 100 100 200 300 300
 * rowIds :   0   1   2   3   4
 * 分段   : [0,0] [1,2] [3,3] [4,4]
 * </pre>
 *
 * <p>数组在多次使用之间复用,只在容量不足时重新分配。
 */
public class SortAux implements IndexedSortable {

    private int[] rowIds = new int[0];

    private long[] times = new long[0];

    private int size;

    /** 扁平存放的 (start, end) 对,均为排序后的位置,闭区间 */
    private final IntArrayList sections = new IntArrayList(16);

    /** 以恒等置换初始化:{@code rowIds[i] = i},并复制时间戳。 */
    public void init(long[] src) {
        int n = src.length;
        if (rowIds.length < n) {
            rowIds = new int[n];
            times = new long[n];
        }
        for (int i = 0; i < n; i++) {
            rowIds[i] = i;
        }
        System.arraycopy(src, 0, times, 0, n);
        size = n;
        sections.clear();
    }

    /** 时间戳是否已经非递减,此时无需排序。 */
    public boolean isSorted() {
        for (int i = 1; i < size; i++) {
            if (times[i] < times[i - 1]) {
                return false;
            }
        }
        return true;
    }

    /** 在排序完成之后调用,生成所有连续段。 */
    public void initSections() {
        sections.clear();
        if (size == 0) {
            return;
        }
        int start = 0;
        for (int i = 0; i < size - 1; i++) {
            if (rowIds[i + 1] - rowIds[i] != 1 || times[i] == times[i + 1]) {
                sections.add(start, i);
                start = i + 1;
            }
        }
        sections.add(start, size - 1);
    }

    public int sectionCount() {
        return sections.size() / 2;
    }

    /** 第 {@code section} 段在排序结果中的起始位置。 */
    public int sortPosition(int section) {
        return sections.get(section * 2);
    }

    /** 第 {@code section} 段对应的原始起始行(包含)。 */
    public int rowStart(int section) {
        return rowIds[sections.get(section * 2)];
    }

    /** 第 {@code section} 段对应的原始结束行(不包含)。 */
    public int rowEnd(int section) {
        return rowIds[sections.get(section * 2 + 1)] + 1;
    }

    public int rowId(int i) {
        return rowIds[i];
    }

    public long time(int i) {
        return times[i];
    }

    @VisibleForTesting
    int[] sections() {
        return sections.toArray();
    }

    @VisibleForTesting
    int[] rowIds() {
        return Arrays.copyOf(rowIds, size);
    }

    // ------------------------------------------------------------------------

    @Override
    public int compare(int i, int j) {
        return Long.compare(times[i], times[j]);
    }

    @Override
    public void swap(int i, int j) {
        long t = times[i];
        times[i] = times[j];
        times[j] = t;

        int r = rowIds[i];
        rowIds[i] = rowIds[j];
        rowIds[j] = r;
    }

    @Override
    public int size() {
        return size;
    }
}
