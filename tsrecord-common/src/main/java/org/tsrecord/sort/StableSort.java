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

/**
 * 原地稳定排序 {@link IndexedSorter} 实现。
 *
 * <p>先对固定大小的块做插入排序,再自底向上逐轮合并相邻的有序块。合并使用对称归并
 * (SymMerge),通过旋转交换元素,不需要额外的辅助数组。相等的元素保持输入时的相对顺序。
 *
 * <p>比较次数为 O(n log n),交换次数为 O(n log² n)。
 */
public final class StableSort implements IndexedSorter {

    /** 插入排序块的大小 */
    private static final int BLOCK_SIZE = 20;

    public StableSort() {}

    @Override
    public void sort(IndexedSortable s) {
        sort(s, 0, s.size());
    }

    @Override
    public void sort(final IndexedSortable s, int l, int r) {
        int blockSize = BLOCK_SIZE;
        int a = l;
        int b = l + blockSize;
        while (b <= r) {
            insertionSort(s, a, b);
            a = b;
            b += blockSize;
        }
        insertionSort(s, a, r);

        int n = r - l;
        while (blockSize < n) {
            a = l;
            b = l + 2 * blockSize;
            while (b <= r) {
                symMerge(s, a, a + blockSize, b);
                a = b;
                b += 2 * blockSize;
            }
            int m = a + blockSize;
            if (m < r) {
                symMerge(s, a, m, r);
            }
            blockSize *= 2;
        }
    }

    private static boolean less(IndexedSortable s, int i, int j) {
        return s.compare(i, j) < 0;
    }

    private static void insertionSort(IndexedSortable s, int a, int b) {
        for (int i = a + 1; i < b; i++) {
            for (int j = i; j > a && less(s, j, j - 1); j--) {
                s.swap(j, j - 1);
            }
        }
    }

    /** 合并两个相邻的有序区间 {@code [a, m)} 与 {@code [m, b)}。 */
    private static void symMerge(IndexedSortable s, int a, int m, int b) {
        if (m - a == 1) {
            // binary search the insert position of s[a] in [m, b), then shift it there
            int i = m;
            int j = b;
            while (i < j) {
                int h = (i + j) >>> 1;
                if (less(s, h, a)) {
                    i = h + 1;
                } else {
                    j = h;
                }
            }
            for (int k = a; k < i - 1; k++) {
                s.swap(k, k + 1);
            }
            return;
        }

        if (b - m == 1) {
            int i = a;
            int j = m;
            while (i < j) {
                int h = (i + j) >>> 1;
                if (!less(s, m, h)) {
                    i = h + 1;
                } else {
                    j = h;
                }
            }
            for (int k = m; k > i; k--) {
                s.swap(k, k - 1);
            }
            return;
        }

        int mid = (a + b) >>> 1;
        int n = mid + m;
        int start;
        int r;
        if (m > mid) {
            start = n - b;
            r = mid;
        } else {
            start = a;
            r = m;
        }
        int p = n - 1;

        while (start < r) {
            int c = (start + r) >>> 1;
            if (!less(s, p - c, c)) {
                start = c + 1;
            } else {
                r = c;
            }
        }

        int end = n - start;
        if (start < m && m < end) {
            rotate(s, start, m, end);
        }
        if (a < start && start < mid) {
            symMerge(s, a, start, mid);
        }
        if (mid < end && end < b) {
            symMerge(s, mid, end, b);
        }
    }

    /** 将 {@code [a, m)} 与 {@code [m, b)} 两段互换位置。 */
    private static void rotate(IndexedSortable s, int a, int m, int b) {
        int i = m - a;
        int j = b - m;

        while (i != j) {
            if (i > j) {
                swapRange(s, m - i, m, j);
                i -= j;
            } else {
                swapRange(s, m - i, m + j - i, i);
                j -= i;
            }
        }
        swapRange(s, m - i, m, i);
    }

    private static void swapRange(IndexedSortable s, int a, int b, int n) {
        for (int i = 0; i < n; i++) {
            s.swap(a + i, b + i);
        }
    }
}
