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

package org.tsrecord.utils;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * 基于数组的 int 类型列表的最小实现。
 *
 * <p>避免自动装箱的开销,{@link #clear()} 只重置长度而保留底层数组,适合在池化对象中反复使用。
 */
public class IntArrayList {

    /** 列表中元素的数量 */
    private int size;

    /** 存储元素的数组 */
    private int[] array;

    public IntArrayList(final int capacity) {
        this.size = 0;
        this.array = new int[capacity];
    }

    public int size() {
        return size;
    }

    public boolean add(final int number) {
        grow(size + 1);
        array[size++] = number;
        return true;
    }

    /**
     * 追加两个元素,常用于记录 (start, end) 区间对。
     */
    public void add(final int first, final int second) {
        grow(size + 2);
        array[size++] = first;
        array[size++] = second;
    }

    /**
     * 移除并返回列表中的最后一个元素。
     *
     * @throws NoSuchElementException 如果列表为空
     */
    public int removeLast() {
        if (size == 0) {
            throw new NoSuchElementException();
        }
        --size;
        return array[size];
    }

    /** 清空列表,不释放底层数组。 */
    public void clear() {
        size = 0;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** 当前底层数组的容量。 */
    public int capacity() {
        return array.length;
    }

    private void grow(final int length) {
        if (length > array.length) {
            final int newLength =
                    (int) Math.max(Math.min(2L * array.length, Integer.MAX_VALUE - 8), length);
            final int[] t = new int[newLength];
            System.arraycopy(array, 0, t, 0, size);
            array = t;
        }
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    public int get(int i) {
        if (i >= size) {
            throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + size);
        }
        return array[i];
    }
}
