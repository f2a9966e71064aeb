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

import static org.tsrecord.utils.Preconditions.checkNotNull;

/**
 * {@link ConfigOption} 的构建入口。
 *
 * <pre>{@code
 * ConfigOption<Integer> capacity =
 *         ConfigOptions.key("sort.helper-pool.capacity")
 *                 .intType()
 *                 .defaultValue(16)
 *                 .withDescription("Capacity of the sort helper pool.");
 * }</pre>
 */
@Public
public class ConfigOptions {

    /**
     * 以给定的键开始构建配置选项。
     *
     * @param key 配置键
     * @return 选项构建器
     */
    public static OptionBuilder key(String key) {
        checkNotNull(key);
        return new OptionBuilder(key);
    }

    // ------------------------------------------------------------------------

    /** 选项构建器的第一步:确定值类型。 */
    public static final class OptionBuilder {

        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        /** 定义选项值应为 {@link Integer} 类型。 */
        public TypedConfigOptionBuilder<Integer> intType() {
            return new TypedConfigOptionBuilder<>(key, Integer.class);
        }
    }

    /**
     * 选项构建器的第二步:确定默认值。
     *
     * @param <T> 选项值的类型
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, "", value);
        }
    }

    // ------------------------------------------------------------------------

    /** 不打算实例化的私有构造函数。 */
    private ConfigOptions() {}
}
