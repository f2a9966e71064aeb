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

package org.tsrecord.sort;

import org.tsrecord.RecordOptions;
import org.tsrecord.annotation.Public;
import org.tsrecord.annotation.VisibleForTesting;
import org.tsrecord.options.Options;
import org.tsrecord.record.Record;
import org.tsrecord.utils.Pool;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import static org.tsrecord.utils.Preconditions.checkState;

/**
 * {@link ColumnSortHelper} 的有界对象池。
 *
 * <p>通过 {@link #acquire()} 取得一个 {@link Lease},在 try-with-resources 中使用,保证任何退出
 * 路径上辅助对象都会归还:
 *
 * <pre>{@code
 * try (ColumnSortHelperPool.Lease lease = pool.acquire()) {
 *     lease.helper().sort(record);
 * }
 * }</pre>
 *
 * <p>获取从不阻塞:池中名额用尽时新建一个辅助对象;归还时超出容量的对象被丢弃。
 */
@Public
@ThreadSafe
public class ColumnSortHelperPool {

    private final Pool<ColumnSortHelper> pool;

    public ColumnSortHelperPool(int capacity) {
        this.pool = new Pool<>(capacity, ColumnSortHelper::new);
    }

    public ColumnSortHelperPool(Options options) {
        this(new RecordOptions(options).sortHelperPoolCapacity());
    }

    public Lease acquire() {
        return new Lease(pool.get(), pool.recycler());
    }

    /** 取出一个辅助对象排序 {@code record},然后归还。 */
    public Record sort(Record record) {
        try (Lease lease = acquire()) {
            return lease.helper().sort(record);
        }
    }

    public int capacity() {
        return pool.capacity();
    }

    @VisibleForTesting
    int idleCount() {
        return pool.idleCount();
    }

    /** 持有一个辅助对象,关闭时归还到池中。重复关闭无效果。 */
    public static final class Lease implements AutoCloseable {

        @Nullable private ColumnSortHelper helper;

        private final Pool.Recycler<ColumnSortHelper> recycler;

        private Lease(ColumnSortHelper helper, Pool.Recycler<ColumnSortHelper> recycler) {
            this.helper = helper;
            this.recycler = recycler;
        }

        public ColumnSortHelper helper() {
            checkState(helper != null, "The lease has been closed.");
            return helper;
        }

        @Override
        public void close() {
            if (helper != null) {
                recycler.recycle(helper);
                helper = null;
            }
        }
    }
}
