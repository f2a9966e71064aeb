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

/**
 * 记录不满足结构约束时抛出,例如缺少时间列、列长度不一致、定长列的字节数不正确。
 *
 * <p>这类错误来自数据本身,调用方不应序列化未通过校验的记录。
 */
@Public
public class RecordValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    public RecordValidationException(String message) {
        super(message);
    }
}
