/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sluice.exec.workload.pool;

import org.apache.sluice.exec.workload.PoolKey;

/**
 * Durable record of every pool's settings. Writers never overwrite blindly:
 * creation fails if the pool exists and updates only apply on top of the
 * version they were derived from, so concurrent DDL on different nodes cannot
 * lose an update.
 */
public interface PoolConfigStore extends AutoCloseable {

  /**
   * @return the stored configuration or null if the pool does not exist
   */
  PoolConfig get(PoolKey key);

  /**
   * @return true if the pool was created, false if it already existed
   */
  boolean putIfAbsent(PoolConfig config);

  /**
   * Stores the configuration if the stored one has version {@code config.getVersion() - 1}.
   *
   * @return false if the pool is missing or was changed concurrently
   */
  boolean replace(PoolConfig config);

  /**
   * @return false if the pool did not exist
   */
  boolean delete(PoolKey key);

  @Override
  default void close() throws Exception {
  }
}
