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

import org.tsrecord.record.ColVal;
import org.tsrecord.record.NilCount;
import org.tsrecord.record.Record;
import org.tsrecord.types.FieldType;

/**
 * 把一条记录按时间升序排列并合并重复时间戳。
 *
 * <p>对同一时间戳的多行,每列独立地采用"最后一个非 null 值胜出"的规则:较晚追加的非 null 值
 * 覆盖之前的值,null 不会覆盖已有的值。结果中每个时间戳恰好保留一行。
 *
 * <p>排序结果先写入内部的暂存记录,最后与输入记录交换列缓冲区,原先属于输入记录的缓冲区
 * 成为下一次排序的暂存区。
 *
 * <p>此类不是线程安全的,通常通过 {@link ColumnSortHelperPool} 获取。
 */
public class ColumnSortHelper {

    private final SortAux aux = new SortAux();

    private final NilCount nilCount = new NilCount();

    private final IndexedSorter sorter = new StableSort();

    private final Record scratch = new Record();

    /**
     * 排序并去重。
     *
     * @return 传入的同一个记录实例;没有行时原样返回
     */
    public Record sort(Record rec) {
        if (rec.rowNums() == 0) {
            return rec;
        }

        scratch.resetWithSchema(rec.schema());
        aux.init(rec.times());
        if (!aux.isSorted()) {
            sorter.sort(aux);
        }
        aux.initSections();

        int timeIndex = rec.columnCount() - 1;
        for (int i = 0; i < timeIndex; i++) {
            ColVal src = rec.column(i);
            nilCount.init(src);
            sortColumn(src, scratch.column(i), rec.field(i).type());
        }

        ColVal timeCol = scratch.column(timeIndex);
        timeCol.appendInteger(aux.time(0));
        for (int i = 1; i < aux.size(); i++) {
            if (aux.time(i) != aux.time(i - 1)) {
                timeCol.appendInteger(aux.time(i));
            }
        }

        rec.swapColVals(scratch);
        return rec;
    }

    private void sortColumn(ColVal src, ColVal dst, FieldType type) {
        for (int section = 0; section < aux.sectionCount(); section++) {
            int idx = aux.sortPosition(section);
            int rowStart = aux.rowStart(section);
            int rowEnd = aux.rowEnd(section);

            // the first row repeats the timestamp just written
            if (idx > 0 && aux.time(idx) == aux.time(idx - 1)) {
                replace(src, dst, type, rowStart);
                rowStart++;
            }
            if (rowStart < rowEnd) {
                dst.appendWithNilCount(src, type, rowStart, rowEnd, nilCount);
            }
        }
    }

    private void replace(ColVal src, ColVal dst, FieldType type, int row) {
        if (src.isNil(row)) {
            return;
        }
        dst.deleteLast(type);
        dst.appendWithNilCount(src, type, row, row + 1, nilCount);
    }
}
