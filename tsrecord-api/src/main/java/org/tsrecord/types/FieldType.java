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

package org.tsrecord.types;

import org.tsrecord.annotation.Public;

/**
 * 列字段类型。
 *
 * <p>每个常量携带三项信息:
 *
 * <ul>
 *   <li><b>code</b>: 线格式中使用的整数编码,与存储端保持一致,不可改动
 *   <li><b>label</b>: 可读的类型名称,用于拼接字段显示名
 *   <li><b>fixedSize</b>: 定长类型单个值占用的字节数;变长类型为 {@link #VARIABLE_SIZE},
 *       无存储布局的类型为 {@link #NO_SIZE}
 * </ul>
 *
 * <h2>存储分类</h2>
 *
 * <pre>
 * 定长:   INT(8) UINT(8) FLOAT(8) BOOLEAN(1)
 * 变长:   STRING TAG     (值按行拼接,配合偏移表)
 * 无布局: UNKNOWN        (不能参与任何缓冲区操作)
 * </pre>
 */
@Public
public enum FieldType {
    UNKNOWN(0, "Unknown", FieldType.NO_SIZE),
    INT(1, "Integer", 8),
    UINT(2, "Unsigned", 8),
    FLOAT(3, "Float", 8),
    STRING(4, "String", FieldType.VARIABLE_SIZE),
    BOOLEAN(5, "Boolean", 1),
    TAG(6, "Tag", FieldType.VARIABLE_SIZE);

    /** 变长类型的宽度标记。 */
    public static final int VARIABLE_SIZE = -1;

    /** 无存储布局的宽度标记。 */
    public static final int NO_SIZE = 0;

    private static final FieldType[] BY_CODE = new FieldType[7];

    static {
        for (FieldType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;
    private final String label;
    private final int fixedSize;

    FieldType(int code, String label, int fixedSize) {
        this.code = code;
        this.label = label;
        this.fixedSize = fixedSize;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * 定长类型单个值的字节数。
     *
     * @return 定长字节数;变长类型返回 {@link #VARIABLE_SIZE},UNKNOWN 返回 {@link #NO_SIZE}
     */
    public int fixedSize() {
        return fixedSize;
    }

    /** 是否为定长类型。 */
    public boolean isFixedSize() {
        return fixedSize > 0;
    }

    /** 是否为变长类型(字符串或标签)。 */
    public boolean isVariableSize() {
        return fixedSize == VARIABLE_SIZE;
    }

    /**
     * 根据线格式编码查找类型。
     *
     * <p>未识别的编码返回 {@link #UNKNOWN},由上层决定是否拒绝。
     */
    public static FieldType fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return UNKNOWN;
        }
        return BY_CODE[code];
    }
}
