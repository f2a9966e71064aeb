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

package org.tsrecord.batch;

import org.tsrecord.RecordOptions;
import org.tsrecord.annotation.Public;
import org.tsrecord.annotation.VisibleForTesting;
import org.tsrecord.io.DataOutputSerializer;
import org.tsrecord.options.Options;
import org.tsrecord.record.Record;
import org.tsrecord.record.RecordValidationException;
import org.tsrecord.serializer.RecordSerializer;
import org.tsrecord.utils.Pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;

/**
 * 把批次编码为线格式字节。
 *
 * <p>输出缓冲区从有界池中获取并在编码结束后归还,多个线程可以共享同一个编码器。
 */
@Public
@ThreadSafe
public class BatchEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(BatchEncoder.class);

    private final RecordSerializer serializer = RecordSerializer.INSTANCE;

    private final Pool<DataOutputSerializer> buffers;

    public BatchEncoder(Options options) {
        RecordOptions recordOptions = new RecordOptions(options);
        int initialSize = recordOptions.serializerInitialBufferSize();
        this.buffers =
                new Pool<>(
                        recordOptions.serializerBufferPoolCapacity(),
                        () -> new DataOutputSerializer(initialSize),
                        DataOutputSerializer::clear);
    }

    /**
     * 组装、校验、排序并编码一个批次。
     *
     * @throws RecordValidationException 批次组装出的记录不满足结构约束
     */
    public byte[] encode(ColumnBatch batch) throws IOException, RecordValidationException {
        return encode(batch.toRecord());
    }

    /** 编码一条已经校验过的记录。 */
    public byte[] encode(Record record) throws IOException {
        DataOutputSerializer out = buffers.get();
        try {
            out.clear();
            serializer.serialize(record, out);
            LOG.debug(
                    "Encoded {} rows of {} columns into {} bytes.",
                    record.rowNums(),
                    record.columnCount(),
                    out.length());
            return out.getCopyOfBuffer();
        } finally {
            buffers.recycler().recycle(out);
        }
    }

    @VisibleForTesting
    int bufferPoolCapacity() {
        return buffers.capacity();
    }
}
