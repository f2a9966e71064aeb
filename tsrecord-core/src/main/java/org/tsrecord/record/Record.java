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
import org.tsrecord.types.FieldType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static org.tsrecord.utils.Preconditions.checkArgument;
import static org.tsrecord.utils.Preconditions.checkNotNull;

/**
 * 一批按列存储的时序数据:schema 加上与之一一对应的 {@link ColVal}。
 *
 * <p>合法的记录满足:
 *
 * <ul>
 *   <li>至少两列,最后一列是名为 {@link #TIME_FIELD} 的整数列,且没有 null
 *   <li>所有列的行数相同
 *   <li>非时间列的名字互不相同;规范顺序下按名字升序排列,时间列始终在最后
 *   <li>定长列的值字节数等于 {@code 定长 * (len - nilCount)}
 * </ul>
 *
 * <p>构造过程中不检查这些约束,需要在序列化之前调用 {@link #validate()}。
 *
 * <p>此类不是线程安全的。
 */
@Public
public class Record {

    private static final Logger LOG = LoggerFactory.getLogger(Record.class);

    /** 保留的时间列名。 */
    public static final String TIME_FIELD = "time";

    private static final Comparator<Field> FIELD_ORDER =
            (f1, f2) -> {
                if (f1.isTime() != f2.isTime()) {
                    return f1.isTime() ? 1 : -1;
                }
                return f1.name().compareTo(f2.name());
            };

    private final List<Field> schema;

    private List<ColVal> colVals;

    public Record() {
        this.schema = new ArrayList<>();
        this.colVals = new ArrayList<>();
    }

    /** 为 schema 中的每个字段分配一个空列。 */
    public Record(List<Field> schema) {
        this();
        resetWithSchema(schema);
    }

    /** 用已有的列构造记录,列对象不会被复制。 */
    public Record(List<Field> schema, List<ColVal> colVals) {
        checkArgument(
                schema.size() == colVals.size(),
                "Schema has %s fields but %s columns are given.",
                schema.size(),
                colVals.size());
        this.schema = new ArrayList<>(schema);
        this.colVals = new ArrayList<>(colVals);
    }

    public List<Field> schema() {
        return Collections.unmodifiableList(schema);
    }

    public Field field(int i) {
        return schema.get(i);
    }

    public ColVal column(int i) {
        return colVals.get(i);
    }

    public int columnCount() {
        return colVals.size();
    }

    /** 清空 schema 与所有列。 */
    public void reset() {
        schema.clear();
        colVals.clear();
    }

    /** 替换 schema,尽量复用已有的列缓冲区。 */
    public void resetWithSchema(List<Field> newSchema) {
        checkNotNull(newSchema);
        schema.clear();
        schema.addAll(newSchema);
        reserveColVal(newSchema.size());
        for (ColVal col : colVals) {
            col.init();
        }
    }

    /** 调整列数为 {@code size},保留前 {@code size} 个已有的列。 */
    public void reserveColVal(int size) {
        while (colVals.size() > size) {
            colVals.remove(colVals.size() - 1);
        }
        while (colVals.size() < size) {
            colVals.add(new ColVal());
        }
    }

    /** 向时间列(最后一列)追加时间戳。 */
    public void appendTime(long... times) {
        checkArgument(!colVals.isEmpty(), "Record has no columns.");
        colVals.get(colVals.size() - 1).appendIntegers(times);
    }

    /** 行数,以时间列为准;没有列时为 0。 */
    public int rowNums() {
        if (colVals.isEmpty()) {
            return 0;
        }
        return colVals.get(colVals.size() - 1).len();
    }

    public long[] times() {
        if (colVals.isEmpty()) {
            return new long[0];
        }
        return colVals.get(colVals.size() - 1).integerValues();
    }

    /**
     * 与 {@code other} 交换全部列缓冲区,schema 不变。
     *
     * <p>两条记录必须拥有相同的 schema。排序时用于把排好序的缓冲区转交给调用方的记录。
     */
    public void swapColVals(Record other) {
        checkArgument(
                schema.equals(other.schema),
                "Cannot swap columns between records of different schemas: %s vs %s.",
                schema,
                other.schema);
        List<ColVal> tmp = colVals;
        colVals = other.colVals;
        other.colVals = tmp;
    }

    // ------------------------------------------------------------------------
    //  Validation
    // ------------------------------------------------------------------------

    /**
     * 校验记录结构。非时间列不是按名字升序时,原地把 schema 与列按相同顺序重排。
     *
     * @throws RecordValidationException 如果记录不满足结构约束
     */
    public void validate() throws RecordValidationException {
        int colN = schema.size();
        if (colN != colVals.size()) {
            throw new RecordValidationException(
                    String.format(
                            "invalid schema: %d fields but %d colVals", colN, colVals.size()));
        }
        if (colN <= 1 || !schema.get(colN - 1).isTime()) {
            throw new RecordValidationException("invalid schema: " + schema);
        }
        if (schema.get(colN - 1).type() != FieldType.INT) {
            throw new RecordValidationException(
                    "invalid schema: time field must be Integer, got " + schema.get(colN - 1));
        }
        if (colVals.get(colN - 1).nilCount() != 0) {
            throw new RecordValidationException("invalid colvals: time column has nulls");
        }

        boolean ordered = true;
        for (int i = 0; i < colN; i++) {
            Field field = schema.get(i);
            if (i > 0 && field.name().equals(schema.get(i - 1).name())) {
                throw new RecordValidationException(
                        String.format("same schema; idx: %d, name: %s", i, field.name()));
            }
            if (i < colN - 1 && field.isTime()) {
                throw new RecordValidationException(
                        "invalid schema: time field at idx " + i + " is not the last one");
            }
            if (i > 0 && i < colN - 1 && field.name().compareTo(schema.get(i - 1).name()) < 0) {
                ordered = false;
            }
            if (i > 0 && colVals.get(i).len() != colVals.get(i - 1).len()) {
                throw new RecordValidationException(
                        String.format(
                                "invalid colvals length: colVals[%d] has %d rows, colVals[%d] has %d",
                                i - 1, colVals.get(i - 1).len(), i, colVals.get(i).len()));
            }
            checkColumnLength(i, field, colVals.get(i));
        }

        if (!ordered) {
            reorder();
        }
    }

    private static void checkColumnLength(int i, Field field, ColVal col)
            throws RecordValidationException {
        FieldType type = field.type();
        if (type == FieldType.UNKNOWN) {
            throw new RecordValidationException(
                    String.format("unsupported field type %s of field %s", type, field.name()));
        }
        if (type.isFixedSize()) {
            int expected = type.fixedSize() * (col.len() - col.nilCount());
            if (col.valLength() != expected) {
                throw new RecordValidationException(
                        String.format(
                                "the length of colVals[%d].val is incorrect. exp: %d, got: %d",
                                i, expected, col.valLength()));
            }
        } else if (col.offsetLength() != col.len()) {
            throw new RecordValidationException(
                    String.format(
                            "the length of colVals[%d].offset is incorrect. exp: %d, got: %d",
                            i, col.len(), col.offsetLength()));
        }
    }

    /** 按字段名稳定排序 schema 与列,时间列排在最后。 */
    private void reorder() throws RecordValidationException {
        LOG.debug("Reorder the schema {} by field name.", schema);
        Integer[] index = new Integer[schema.size()];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        Arrays.sort(index, (i, j) -> FIELD_ORDER.compare(schema.get(i), schema.get(j)));

        List<Field> sortedSchema = new ArrayList<>(index.length);
        List<ColVal> sortedColVals = new ArrayList<>(index.length);
        for (int i : index) {
            sortedSchema.add(schema.get(i));
            sortedColVals.add(colVals.get(i));
        }

        // names that were apart may be neighbours now; a rejected record keeps its order
        for (int i = 1; i < sortedSchema.size(); i++) {
            String name = sortedSchema.get(i).name();
            if (name.equals(sortedSchema.get(i - 1).name())) {
                throw new RecordValidationException(
                        String.format("same schema; idx: %d, name: %s", i, name));
            }
        }

        schema.clear();
        schema.addAll(sortedSchema);
        colVals = sortedColVals;
    }

    // ------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Record record = (Record) o;
        return schema.equals(record.schema) && colVals.equals(record.colVals);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + colVals.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < schema.size(); i++) {
            Field field = schema.get(i);
            sb.append(field).append(": ");
            if (i < colVals.size()) {
                appendValues(sb, field.type(), colVals.get(i));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendValues(StringBuilder sb, FieldType type, ColVal col) {
        switch (type) {
            case INT:
            case UINT:
                sb.append(Arrays.toString(col.integerValues()));
                break;
            case FLOAT:
                sb.append(Arrays.toString(col.floatValues()));
                break;
            case BOOLEAN:
                sb.append(Arrays.toString(col.booleanValues()));
                break;
            case STRING:
            case TAG:
                sb.append(col.stringValues());
                break;
            default:
                sb.append(col);
        }
        sb.append(" (nils: ").append(col.nilCount()).append(')');
    }
}
