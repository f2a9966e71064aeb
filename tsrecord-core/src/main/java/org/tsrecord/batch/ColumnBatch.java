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

package org.tsrecord.batch;

import org.tsrecord.RecordOptions;
import org.tsrecord.annotation.Public;
import org.tsrecord.annotation.VisibleForTesting;
import org.tsrecord.options.Options;
import org.tsrecord.record.ColVal;
import org.tsrecord.record.Field;
import org.tsrecord.record.Record;
import org.tsrecord.record.RecordValidationException;
import org.tsrecord.sort.ColumnSortHelperPool;
import org.tsrecord.types.FieldType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.LongSupplier;

import static org.tsrecord.utils.Preconditions.checkArgument;
import static org.tsrecord.utils.Preconditions.checkNotNull;
import static org.tsrecord.utils.Preconditions.checkState;

/**
 * 一个 measurement 下待写入的行,按列累积。
 *
 * <p>每次 {@link #appendRow} 写入一行:首次出现的列会为之前的行补齐 null,本行没有提供的列
 * 追加一个 null,因此所有列始终等长。时间戳为 0 时使用时钟的当前时间(纳秒)。
 *
 * <p>字段值的类型映射:
 *
 * <pre>
 * String                        -> STRING
 * Boolean                       -> BOOLEAN
 * Double, Float                 -> FLOAT
 * Long, Integer, Short, Byte    -> INT
 * 标签值                         -> TAG
 * </pre>
 *
 * <p>{@link #toRecord()} 输出按字段名排列、时间列在最后、已按时间排序去重的 {@link Record}。
 *
 * <p>此类不是线程安全的。
 */
@Public
public class ColumnBatch {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnBatch.class);

    private final String measurement;

    private final ColumnSortHelperPool sortHelpers;

    /** 0 表示不限制 */
    private final int maxRows;

    private final LongSupplier clock;

    /** 按列名排序,时间列单独存放 */
    private final TreeMap<String, Column> columns = new TreeMap<>();

    private final ColVal times = new ColVal();

    private int rowCount;

    private long minTime = Long.MAX_VALUE;

    private long maxTime = Long.MIN_VALUE;

    public ColumnBatch(String measurement, ColumnSortHelperPool sortHelpers, Options options) {
        this(
                measurement,
                sortHelpers,
                new RecordOptions(options).batchMaxRows(),
                ColumnBatch::nowNanos);
    }

    public ColumnBatch(
            String measurement, ColumnSortHelperPool sortHelpers, int maxRows, LongSupplier clock) {
        checkArgument(maxRows >= 0, "Max rows must not be negative, but is %s.", maxRows);
        this.measurement = checkNotNull(measurement);
        this.sortHelpers = checkNotNull(sortHelpers);
        this.maxRows = maxRows;
        this.clock = checkNotNull(clock);
    }

    /**
     * 追加一行。
     *
     * @param tags 标签,值不能为 null
     * @param fields 字段,值不能为 null
     * @param timestamp 纳秒时间戳,0 表示当前时间
     * @throws IllegalArgumentException 列名为空或为 {@code time}、值的类型不受支持、与已有列的类型
     *     冲突,或同一行中标签与字段同名
     * @throws IllegalStateException 行数已达到上限
     */
    public void appendRow(Map<String, String> tags, Map<String, Object> fields, long timestamp) {
        if (maxRows > 0 && rowCount >= maxRows) {
            LOG.warn("Batch of measurement {} is full with {} rows.", measurement, rowCount);
            throw new IllegalStateException(
                    String.format(
                            "Batch of measurement %s exceeds the max rows %d.",
                            measurement, maxRows));
        }

        // validate the whole row first so a rejected row leaves no partial columns
        Map<String, FieldType> rowTypes = new HashMap<>();
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            checkArgument(tag.getValue() != null, "Tag %s has a null value.", tag.getKey());
            checkColumn(tag.getKey(), FieldType.TAG, rowTypes);
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            checkArgument(field.getValue() != null, "Field %s has a null value.", field.getKey());
            FieldType type = fieldType(field.getValue());
            checkArgument(
                    type != null,
                    "Unsupported value type %s of field %s.",
                    field.getValue().getClass().getName(),
                    field.getKey());
            checkColumn(field.getKey(), type, rowTypes);
        }

        for (Map.Entry<String, String> tag : tags.entrySet()) {
            column(tag.getKey(), FieldType.TAG).values.appendString(tag.getValue());
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            Column column = column(field.getKey(), rowTypes.get(field.getKey()));
            appendValue(column, field.getValue());
        }

        long time = timestamp == 0 ? clock.getAsLong() : timestamp;
        times.appendInteger(time);
        rowCount++;
        minTime = Math.min(minTime, time);
        maxTime = Math.max(maxTime, time);

        for (Column column : columns.values()) {
            if (column.values.len() < rowCount) {
                column.values.appendNull(column.type);
            }
        }
    }

    private void checkColumn(String name, FieldType type, Map<String, FieldType> rowTypes) {
        checkArgument(name != null && !name.isEmpty(), "Column name must not be empty.");
        checkArgument(
                !Record.TIME_FIELD.equals(name),
                "Column name '%s' is reserved for the timestamp.",
                Record.TIME_FIELD);
        checkArgument(
                rowTypes.put(name, type) == null,
                "Column %s appears both as a tag and a field.",
                name);
        Column existing = columns.get(name);
        checkArgument(
                existing == null || existing.type == type,
                "Column %s of measurement %s is %s, cannot append a %s value.",
                name,
                measurement,
                existing == null ? null : existing.type,
                type);
    }

    private Column column(String name, FieldType type) {
        Column column = columns.get(name);
        if (column == null) {
            column = new Column(type);
            column.values.appendNulls(type, rowCount);
            columns.put(name, column);
        }
        return column;
    }

    private static void appendValue(Column column, Object value) {
        switch (column.type) {
            case STRING:
                column.values.appendString((String) value);
                break;
            case BOOLEAN:
                column.values.appendBoolean((Boolean) value);
                break;
            case FLOAT:
                column.values.appendFloat(((Number) value).doubleValue());
                break;
            case INT:
                column.values.appendInteger(((Number) value).longValue());
                break;
            default:
                throw new IllegalStateException("Unexpected field type " + column.type);
        }
    }

    /** 字段值对应的列类型,不支持的类型返回 null。 */
    @Nullable
    public static FieldType fieldType(Object value) {
        if (value instanceof String) {
            return FieldType.STRING;
        } else if (value instanceof Boolean) {
            return FieldType.BOOLEAN;
        } else if (value instanceof Double || value instanceof Float) {
            return FieldType.FLOAT;
        } else if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            return FieldType.INT;
        }
        return null;
    }

    /**
     * 组装记录,校验后按时间排序并去重。批次本身保持不变。
     *
     * @throws IllegalStateException 批次为空
     * @throws RecordValidationException 组装出的记录不满足结构约束
     */
    public Record toRecord() throws RecordValidationException {
        checkState(rowCount > 0, "Cannot build a record from the empty batch of %s.", measurement);

        List<Field> schema = new ArrayList<>(columns.size() + 1);
        List<ColVal> colVals = new ArrayList<>(columns.size() + 1);
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            schema.add(new Field(entry.getKey(), entry.getValue().type));
            colVals.add(entry.getValue().values.copy());
        }
        schema.add(new Field(Record.TIME_FIELD, FieldType.INT));
        colVals.add(times.copy());

        Record record = new Record(schema, colVals);
        record.validate();
        return sortHelpers.sort(record);
    }

    /** 清空所有行与列。 */
    public void clear() {
        columns.clear();
        times.init();
        rowCount = 0;
        minTime = Long.MAX_VALUE;
        maxTime = Long.MIN_VALUE;
    }

    public String measurement() {
        return measurement;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /** 最小时间戳,空批次为 {@link Long#MAX_VALUE}。 */
    public long minTime() {
        return minTime;
    }

    /** 最大时间戳,空批次为 {@link Long#MIN_VALUE}。 */
    public long maxTime() {
        return maxTime;
    }

    @VisibleForTesting
    @Nullable
    ColVal columnValues(String name) {
        Column column = columns.get(name);
        return column == null ? null : column.values;
    }

    private static long nowNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    private static final class Column {

        private final FieldType type;

        private final ColVal values = new ColVal();

        private Column(FieldType type) {
            this.type = type;
        }
    }
}
