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

/** 基于 {@link IndexedSortable} 的排序算法。 */
public interface IndexedSorter {

    /**
     * 对 {@code [l, r)} 区间内的元素排序。
     *
     * @param s 待排序的数据
     * @param l 起始位置(包含)
     * @param r 结束位置(不包含)
     */
    void sort(IndexedSortable s, int l, int r);

    /** 对全部元素排序。 */
    void sort(IndexedSortable s);
}
