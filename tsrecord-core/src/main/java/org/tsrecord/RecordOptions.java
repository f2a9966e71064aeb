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

package org.tsrecord;

import org.tsrecord.annotation.Public;
import org.tsrecord.options.ConfigOption;
import org.tsrecord.options.Options;

import static org.tsrecord.options.ConfigOptions.key;
import static org.tsrecord.utils.Preconditions.checkArgument;

/** 记录编码链路的配置项。 */
@Public
public class RecordOptions {

    public static final ConfigOption<Integer> SORT_HELPER_POOL_CAPACITY =
            key("sort.helper-pool.capacity")
                    .intType()
                    .defaultValue(2 * Runtime.getRuntime().availableProcessors())
                    .withDescription(
                            "Maximum number of idle sort helpers kept in the pool. Acquiring "
                                    + "beyond it allocates a fresh helper instead of blocking.");

    public static final ConfigOption<Integer> SERIALIZER_INITIAL_BUFFER_SIZE =
            key("serializer.initial-buffer-size")
                    .intType()
                    .defaultValue(1024)
                    .withDescription("Initial capacity in bytes of the encoder's output buffer.");

    public static final ConfigOption<Integer> SERIALIZER_BUFFER_POOL_CAPACITY =
            key("serializer.buffer-pool.capacity")
                    .intType()
                    .defaultValue(2 * Runtime.getRuntime().availableProcessors())
                    .withDescription(
                            "Maximum number of idle output buffers an encoder keeps for reuse.");

    public static final ConfigOption<Integer> BATCH_MAX_ROWS =
            key("batch.max-rows")
                    .intType()
                    .defaultValue(0)
                    .withDescription(
                            "Maximum number of rows a batch accepts, 0 means unlimited.");

    private final Options options;

    public RecordOptions(Options options) {
        this.options = options;
    }

    public int sortHelperPoolCapacity() {
        int capacity = options.get(SORT_HELPER_POOL_CAPACITY);
        checkArgument(
                capacity > 0,
                "%s must be positive, but is %s.",
                SORT_HELPER_POOL_CAPACITY.key(),
                capacity);
        return capacity;
    }

    public int serializerInitialBufferSize() {
        int size = options.get(SERIALIZER_INITIAL_BUFFER_SIZE);
        checkArgument(
                size > 0,
                "%s must be positive, but is %s.",
                SERIALIZER_INITIAL_BUFFER_SIZE.key(),
                size);
        return size;
    }

    public int serializerBufferPoolCapacity() {
        int capacity = options.get(SERIALIZER_BUFFER_POOL_CAPACITY);
        checkArgument(
                capacity > 0,
                "%s must be positive, but is %s.",
                SERIALIZER_BUFFER_POOL_CAPACITY.key(),
                capacity);
        return capacity;
    }

    public int batchMaxRows() {
        int rows = options.get(BATCH_MAX_ROWS);
        checkArgument(rows >= 0, "%s must not be negative, but is %s.", BATCH_MAX_ROWS.key(), rows);
        return rows;
    }

    public Options toConfiguration() {
        return options;
    }
}
