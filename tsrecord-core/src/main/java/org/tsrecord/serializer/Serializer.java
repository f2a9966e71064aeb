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

package org.tsrecord.serializer;

import org.tsrecord.io.DataInputDeserializer;
import org.tsrecord.io.DataInputView;
import org.tsrecord.io.DataOutputSerializer;
import org.tsrecord.io.DataOutputView;

import java.io.IOException;
import java.io.Serializable;

/**
 * 序列化器接口。
 *
 * <p>定义对象与线格式字节之间的转换。无状态的实现可以在多个线程间共享,
 * {@link #duplicate()} 直接返回自身即可。
 *
 * @param <T> 要序列化的对象类型
 */
public interface Serializer<T> extends Serializable {

    /**
     * 复制序列化器实例。有状态的序列化器需要返回深拷贝,无状态的可以返回自身。
     */
    Serializer<T> duplicate();

    /** 创建给定对象的深拷贝,不可变类型可以直接返回原对象。 */
    T copy(T from);

    /**
     * 将对象写入输出视图。
     *
     * @throws IOException 输出视图写入失败时抛出
     */
    void serialize(T record, DataOutputView target) throws IOException;

    /**
     * 从输入视图读取一个对象。
     *
     * @throws java.io.EOFException 输入在对象结束之前耗尽
     * @throws IOException 输入内容不是合法的编码
     */
    T deserialize(DataInputView source) throws IOException;

    default byte[] serializeToBytes(T record) throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(64);
        serialize(record, out);
        return out.getCopyOfBuffer();
    }

    default T deserializeFromBytes(byte[] bytes) throws IOException {
        return deserialize(new DataInputDeserializer(bytes));
    }
}
