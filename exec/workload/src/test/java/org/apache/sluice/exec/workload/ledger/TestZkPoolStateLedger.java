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

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.RetryNTimes;
import org.apache.curator.test.TestingServer;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.coord.zk.ZookeeperClient;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.test.SluiceTest;
import org.apache.zookeeper.CreateMode;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

/**
 * Two ledgers on separate Curator clients play two nodes sharing one pool.
 */
public class TestZkPoolStateLedger extends SluiceTest {
  private static final PoolKey POOL = new PoolKey("/Root/db", "sample");

  private TestingServer server;
  private final List<CuratorFramework> curators = new ArrayList<>();
  private ZkPoolStateLedger first;
  private ZkPoolStateLedger second;

  @Before
  public void setUp() throws Exception {
    server = new TestingServer();
    final Properties overrides = new Properties();
    overrides.put(ExecConstants.WORKLOAD_LEDGER_MAX_UPDATE_ATTEMPTS, "50");
    overrides.put(ExecConstants.WORKLOAD_LEDGER_RETRY_BACKOFF, "1ms");
    final SluiceConfig config = SluiceConfig.create(overrides);
    first = new ZkPoolStateLedger(client(), config, new ObjectMapper());
    second = new ZkPoolStateLedger(client(), config, new ObjectMapper());
  }

  private ZookeeperClient client() throws Exception {
    final CuratorFramework curator = CuratorFrameworkFactory.newClient(server.getConnectString(),
        new RetryNTimes(1, 1000));
    curator.start();
    curators.add(curator);
    final ZookeeperClient client = new ZookeeperClient(curator, "/ledger", CreateMode.PERSISTENT);
    client.start();
    return client;
  }

  @After
  public void tearDown() throws Exception {
    first.close();
    second.close();
    for (CuratorFramework curator : curators) {
      curator.close();
    }
    server.close();
  }

  private static SlotRequest request(String node, String requestId, int limit, int queue) {
    return new SlotRequest(node, requestId, System.currentTimeMillis(), 60_000, limit, queue, 1);
  }

  @Test
  public void testNodesShareOnePoolState() throws Exception {
    final Lease lease = first.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r1", 1, 1));
    assertNotNull(lease);
    assertNotNull(second.tryAcquireSlot(POOL, SlotKind.DELAYED, request("n2", "r2", 1, 1)));

    final PoolStateDescription state = second.readState(POOL);
    assertEquals(1, state.getRunningRequests());
    assertEquals(1, state.getDelayedRequests());

    assertTrue(second.releaseSlot(POOL, lease.getLeaseId()));
    assertEquals(0, first.readState(POOL).getRunningRequests());
  }

  @Test
  public void testChangesOfOtherNodesAreNotified() throws Exception {
    final CountDownLatch changed = new CountDownLatch(1);
    final LedgerListener listener = pool -> changed.countDown();
    first.addListener(POOL, listener);

    second.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n2", "r1", 1, 0));
    assertTrue("no notification of the remote write", changed.await(10, TimeUnit.SECONDS));
    first.removeListener(POOL, listener);
  }

  @Test
  public void testConcurrentAcquisitionsNeverExceedLimit() throws Exception {
    final int limit = 3;
    final int contenders = 12;
    final ExecutorService executor = Executors.newFixedThreadPool(contenders);
    try {
      final List<Future<Lease>> results = new ArrayList<>();
      for (int i = 0; i < contenders; i++) {
        final ZkPoolStateLedger ledger = i % 2 == 0 ? first : second;
        final String requestId = "r" + i;
        final String node = "n" + (i % 2);
        results.add(executor.submit((Callable<Lease>) () ->
            ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request(node, requestId, limit, 0))));
      }
      int granted = 0;
      for (Future<Lease> result : results) {
        if (result.get() != null) {
          granted++;
        }
      }
      assertEquals(limit, granted);
      assertEquals(limit, first.readState(POOL).getRunningRequests());
    } finally {
      executor.shutdownNow();
    }
  }
}
