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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.sluice.exec.workload.PoolKey;

/**
 * Pool configurations kept in memory, for nodes sharing one process.
 */
public class LocalPoolConfigStore implements PoolConfigStore {
  private final ConcurrentMap<PoolKey, PoolConfig> configs = new ConcurrentHashMap<>();

  @Override
  public PoolConfig get(PoolKey key) {
    return configs.get(key);
  }

  @Override
  public boolean putIfAbsent(PoolConfig config) {
    return configs.putIfAbsent(config.getKey(), config) == null;
  }

  @Override
  public boolean replace(PoolConfig config) {
    final PoolKey key = config.getKey();
    final PoolConfig current = configs.get(key);
    if (current == null || current.getVersion() != config.getVersion() - 1) {
      return false;
    }
    return configs.replace(key, current, config);
  }

  @Override
  public boolean delete(PoolKey key) {
    return configs.remove(key) != null;
  }
}
