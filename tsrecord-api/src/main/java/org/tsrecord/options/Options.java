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

package org.tsrecord.options;

import org.tsrecord.annotation.Public;

import javax.annotation.concurrent.ThreadSafe;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 键值对形式的配置集合。
 *
 * <p>所有值以字符串保存,通过 {@link ConfigOption} 读取时转换为声明的类型;键不存在时返回
 * 选项的默认值。所有方法同步,可在多个写入线程间共享。
 *
 * <pre>{@code
 * Options options = Options.fromMap(userProperties);
 * int capacity = options.get(RecordOptions.SORT_HELPER_POOL_CAPACITY);
 * }</pre>
 */
@Public
@ThreadSafe
public class Options {

    /** 存储具体键值对的映射 */
    private final HashMap<String, String> data;

    /** 创建一个新的空配置对象。 */
    public Options() {
        this.data = new HashMap<>();
    }

    /**
     * 从 Map 创建配置对象。
     *
     * @param map 初始键值对
     */
    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    /**
     * 设置类型化的选项值。
     *
     * @return 当前配置对象,便于链式调用
     */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /**
     * 读取选项值,未设置时返回默认值。
     *
     * @throws IllegalArgumentException 如果已设置的值无法解析为选项声明的类型
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<Object> rawValue = Optional.ofNullable(data.get(option.key()));
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.map(Object::toString).orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> configOption) {
        return data.containsKey(configOption.key());
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }
}
