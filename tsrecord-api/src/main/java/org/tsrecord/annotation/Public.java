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

package org.tsrecord.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 公共稳定接口注解。
 *
 * <p>被标记的类型构成写入链路的稳定 API:列式记录模型、排序入口以及线格式编解码。
 * 这些类型在主版本内保持向后兼容,线格式的任何变化都必须同时保持旧数据可解码。
 *
 * <h2>不应标记的情况</h2>
 * <ul>
 *   <li>内部辅助类(如排序辅助结构、空值前缀和索引)
 *   <li>仅为测试放宽可见性的成员(应使用 {@link VisibleForTesting})
 * </ul>
 */
@Documented
@Target(ElementType.TYPE)
public @interface Public {}
