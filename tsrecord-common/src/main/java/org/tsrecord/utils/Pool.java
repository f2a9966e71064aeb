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

package org.tsrecord.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.tsrecord.utils.Preconditions.checkArgument;
import static org.tsrecord.utils.Preconditions.checkNotNull;

/**
 * 有界对象池。
 *
 * <p>用于缓存和复用写入链路上的重量级对象(排序辅助对象、输出缓冲区),以减少高写入吞吐下的
 * 对象分配与 GC 压力。
 *
 * <h2>主要特性</h2>
 * <ul>
 *   <li><b>固定容量</b> - 池内同时被跟踪的对象不超过 {@code capacity} 个
 *   <li><b>从不阻塞</b> - 获取时若名额已满,直接新建一个不受跟踪的对象返回
 *   <li><b>超额丢弃</b> - 归还时若没有占用中的名额或空闲队列已满,对象被直接丢弃
 *   <li><b>归还前重置</b> - 可选的 reset 回调在对象入池前清理状态
 *   <li><b>线程安全</b> - 名额计数基于 CAS,空闲对象存放在 {@link ArrayBlockingQueue} 中
 * </ul>
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * Pool<DataOutputSerializer> pool = new Pool<>(8, () -> new DataOutputSerializer(1024));
 *
 * DataOutputSerializer out = pool.get();
 * try {
 *     // 使用 out
 * } finally {
 *     pool.recycler().recycle(out);
 * }
 * }</pre>
 *
 * <h2>注意事项</h2>
 * <ul>
 *   <li><b>状态重置</b> - 未配置 reset 回调时,调用方需在归还前自行清理
 *   <li><b>对象生命周期</b> - 归还后调用方不应继续持有该对象的引用
 * </ul>
 *
 * @param <T> 池中对象的类型
 */
public class Pool<T> {

    private static final Logger LOG = LoggerFactory.getLogger(Pool.class);

    /** 空闲对象队列。 */
    private final ArrayBlockingQueue<T> pool;

    /** 用于归还对象的回收器。 */
    private final Recycler<T> recycler;

    /** 池的最大容量。 */
    private final int poolCapacity;

    /** 新对象的创建方式。 */
    private final Supplier<T> factory;

    /** 入池前的状态重置,可能为 null。 */
    @Nullable private final Consumer<T> resetter;

    /** 当前占用的名额数。 */
    private final AtomicInteger slots;

    public Pool(int poolCapacity, Supplier<T> factory) {
        this(poolCapacity, factory, null);
    }

    /**
     * 创建指定容量的对象池。
     *
     * @param poolCapacity 池的最大容量,必须为正数
     * @param factory 新对象的创建方式
     * @param resetter 对象入池前的重置回调,可以为 null
     */
    public Pool(int poolCapacity, Supplier<T> factory, @Nullable Consumer<T> resetter) {
        checkArgument(poolCapacity > 0, "Pool capacity must be positive, but is %s.", poolCapacity);
        this.pool = new ArrayBlockingQueue<>(poolCapacity);
        this.recycler = this::addBack;
        this.poolCapacity = poolCapacity;
        this.factory = checkNotNull(factory);
        this.resetter = resetter;
        this.slots = new AtomicInteger(0);
    }

    public Recycler<T> recycler() {
        return recycler;
    }

    /**
     * 获取一个对象,从不阻塞。
     *
     * <p>名额未满时占用一个名额并优先复用空闲对象;名额已满时新建一个对象,该对象归还时
     * 只有在有名额可释放的情况下才会被收回。
     *
     * @return 可用的对象,不会为 null
     */
    public T get() {
        if (tryTakeSlot()) {
            T object = pool.poll();
            return object != null ? object : factory.get();
        }
        return factory.get();
    }

    /**
     * 内部回调,将对象放回池中。
     *
     * <p>此方法由 {@link Recycler} 调用,不应直接使用。
     */
    void addBack(T object) {
        if (!tryReleaseSlot()) {
            LOG.debug("Pool is full, discard {}.", object.getClass().getSimpleName());
            return;
        }
        if (resetter != null) {
            resetter.accept(object);
        }
        if (!pool.offer(object)) {
            LOG.debug("Idle queue is full, discard {}.", object.getClass().getSimpleName());
        }
    }

    public int capacity() {
        return poolCapacity;
    }

    /** 当前空闲对象的数量。 */
    public int idleCount() {
        return pool.size();
    }

    private boolean tryTakeSlot() {
        while (true) {
            int current = slots.get();
            if (current >= poolCapacity) {
                return false;
            }
            if (slots.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private boolean tryReleaseSlot() {
        while (true) {
            int current = slots.get();
            if (current <= 0) {
                return false;
            }
            if (slots.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    // --------------------------------------------------------------------------------------------

    /**
     * 回收器接口。
     *
     * @param <T> 池化和回收的对象类型
     */
    @FunctionalInterface
    public interface Recycler<T> {

        /**
         * 将给定对象回收到池中。
         *
         * <p>调用此方法后,调用者不应继续持有或使用该对象的引用。
         *
         * @param object 要回收的对象
         */
        void recycle(T object);
    }
}
