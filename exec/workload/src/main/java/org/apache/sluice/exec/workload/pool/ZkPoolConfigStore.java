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

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.sluice.common.exceptions.SluiceRuntimeException;
import org.apache.sluice.exec.coord.zk.PathUtils;
import org.apache.sluice.exec.coord.zk.ZookeeperClient;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Pool configurations stored as JSON documents in Zookeeper, one znode per
 * pool under {@code <root>/<database>/<pool id>}. Both path segments are URL
 * encoded since database names usually contain slashes.
 */
public class ZkPoolConfigStore implements PoolConfigStore {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ZkPoolConfigStore.class);

  private final ZookeeperClient client;
  private final ObjectMapper mapper;

  public ZkPoolConfigStore(ZookeeperClient client, ObjectMapper mapper) {
    this.client = client;
    this.mapper = mapper;
  }

  @Override
  public PoolConfig get(PoolKey key) {
    return read(key, null);
  }

  @Override
  public boolean putIfAbsent(PoolConfig config) {
    return client.putIfAbsent(pathOf(config.getKey()), serialize(config));
  }

  @Override
  public boolean replace(PoolConfig config) {
    final DataChangeVersion version = new DataChangeVersion();
    final PoolConfig current = read(config.getKey(), version);
    if (current == null || current.getVersion() != config.getVersion() - 1) {
      logger.debug("Not replacing configuration of pool {}, stored version is {}", config.getKey(),
          current == null ? "missing" : current.getVersion());
      return false;
    }
    return client.put(pathOf(config.getKey()), serialize(config), version);
  }

  @Override
  public boolean delete(PoolKey key) {
    return client.delete(pathOf(key));
  }

  private PoolConfig read(PoolKey key, DataChangeVersion version) {
    final byte[] data = client.get(pathOf(key), version);
    if (data == null) {
      return null;
    }
    try {
      return mapper.readValue(data, PoolConfig.class);
    } catch (IOException e) {
      throw new SluiceRuntimeException(String.format("Unable to deserialize configuration of pool %s", key), e);
    }
  }

  private byte[] serialize(PoolConfig config) {
    try {
      return mapper.writeValueAsBytes(config);
    } catch (IOException e) {
      throw new SluiceRuntimeException(String.format("Unable to serialize configuration of pool %s",
          config.getKey()), e);
    }
  }

  private static String pathOf(PoolKey key) {
    return PathUtils.join(PathUtils.encodeSegment(key.getDatabase()), PathUtils.encodeSegment(key.getPoolId()));
  }
}
