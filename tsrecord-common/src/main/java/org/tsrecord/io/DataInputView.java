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

import java.io.DataInput;
import java.io.IOException;

/**
 * 数据输入视图。
 *
 * <p>在 {@link DataInput} 的基础上增加了按需跳过和部分读取,解码器借此跳过不需要的条目。
 */
public interface DataInputView extends DataInput {

    /**
     * 跳过 {@code numBytes} 个字节。
     *
     * <p>与 {@link #skipBytes(int)} 不同,该方法保证跳过全部字节,否则抛出异常。
     *
     * @throws java.io.EOFException 如果剩余数据不足
     */
    void skipBytesToRead(int numBytes) throws IOException;

    /**
     * 最多读取 {@code len} 个字节。
     *
     * @return 实际读取的字节数,没有数据时返回 -1
     */
    int read(byte[] b, int off, int len) throws IOException;

    int read(byte[] b) throws IOException;
}
