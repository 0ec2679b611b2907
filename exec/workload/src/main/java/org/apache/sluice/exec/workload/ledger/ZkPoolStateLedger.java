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
package org.apache.sluice.exec.workload.ledger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.curator.framework.recipes.cache.CuratorCache;
import org.apache.sluice.common.AutoCloseables;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.coord.zk.PathUtils;
import org.apache.sluice.exec.coord.zk.ZookeeperClient;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Ledger persisted in Zookeeper: one znode per pool holding the JSON blob,
 * under {@code <root>/<database>/<pool id>}. Updates are conditional on the
 * znode data version, so there is no lock and no leader; any node may update
 * any pool. Changes made by other nodes are observed through a
 * {@link CuratorCache} on each pool that has listeners.
 */
public class ZkPoolStateLedger extends AbstractPoolStateLedger {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ZkPoolStateLedger.class);

  private final ZookeeperClient client;

  private final Map<PoolKey, CuratorCache> caches = new ConcurrentHashMap<>();

  public ZkPoolStateLedger(ZookeeperClient client, SluiceConfig config, ObjectMapper mapper) {
    super(config, mapper);
    this.client = client;
  }

  @Override
  protected byte[] readBlob(PoolKey pool, DataChangeVersion version) {
    return client.get(pathOf(pool), version);
  }

  @Override
  protected boolean writeBlob(PoolKey pool, byte[] data, DataChangeVersion version) {
    return client.put(pathOf(pool), data, version);
  }

  @Override
  protected void startWatching(PoolKey pool) {
    final CuratorCache cache = CuratorCache.build(client.getCurator(), client.resolve(pathOf(pool)));
    cache.listenable().addListener((type, oldData, data) -> fireListeners(pool));
    caches.put(pool, cache);
    cache.start();
    logger.debug("Watching state of pool {}", pool);
  }

  @Override
  protected void stopWatching(PoolKey pool) {
    final CuratorCache cache = caches.remove(pool);
    if (cache != null) {
      cache.close();
      logger.debug("Stopped watching state of pool {}", pool);
    }
  }

  @Override
  public void close() throws Exception {
    AutoCloseables.close(caches.values());
    caches.clear();
  }

  private static String pathOf(PoolKey pool) {
    return PathUtils.join(PathUtils.encodeSegment(pool.getDatabase()), PathUtils.encodeSegment(pool.getPoolId()));
  }
}
