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

import java.util.Objects;

import static org.tsrecord.utils.Preconditions.checkNotNull;

/**
 * 逻辑列的描述:字段名加字段类型。
 *
 * <p>不可变。{@link #toString()} 返回字段的显示名,即字段名后直接拼接类型标签,
 * 例如 {@code valueInteger}、{@code hostTag}。
 */
@Public
public final class Field {

    private final String name;
    private final FieldType type;

    public Field(String name, FieldType type) {
        this.name = checkNotNull(name, "Field name must not be null.");
        this.type = checkNotNull(type, "Field type must not be null.");
    }

    public static Field of(String name, FieldType type) {
        return new Field(name, type);
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    /** 是否为保留的时间列。 */
    public boolean isTime() {
        return Record.TIME_FIELD.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Field field = (Field) o;
        return name.equals(field.name) && type == field.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + type.label();
    }
}
