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
 * 可按下标排序的数据视图。
 *
 * <p>排序算法只通过比较与交换访问数据,因此可以在多组平行数组(例如时间戳与原始行号)上
 * 原地排序,而无需把它们包装成对象。
 */
public interface IndexedSortable {

    /**
     * 比较位置 {@code i} 与 {@code j} 的元素。
     *
     * @return 负数、零或正数,分别表示 i 小于、等于或大于 j
     */
    int compare(int i, int j);

    /** 交换位置 {@code i} 与 {@code j} 的元素。 */
    void swap(int i, int j);

    /** 元素个数。 */
    int size();
}
