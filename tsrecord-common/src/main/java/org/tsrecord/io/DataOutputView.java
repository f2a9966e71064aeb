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

package org.tsrecord.io;

import java.io.DataOutput;
import java.io.IOException;

/**
 * 数据输出视图。
 *
 * <p>在 {@link DataOutput} 的基础上增加了跳过字节和从输入视图直接拷贝的能力,是编码器写出
 * 线格式的统一目标。
 */
public interface DataOutputView extends DataOutput {

    /**
     * 跳过 {@code numBytes} 个字节不写,之后可通过回填写入。
     *
     * @param numBytes 要跳过的字节数
     * @throws IOException 如果剩余空间不足
     */
    void skipBytesToWrite(int numBytes) throws IOException;

    /**
     * 从输入视图中拷贝 {@code numBytes} 个字节到当前视图。
     *
     * @param source 源视图
     * @param numBytes 要拷贝的字节数
     * @throws IOException 如果源视图中的数据不足
     */
    void write(DataInputView source, int numBytes) throws IOException;
}
