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
package org.apache.sluice.exec.workload;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.google.common.collect.ImmutableMap;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.workload.request.AdmissionTicket;
import org.apache.sluice.exec.workload.request.QueryResult;
import org.apache.sluice.exec.workload.request.QueryStatus;
import org.apache.sluice.test.SluiceTest;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Nodes sharing one pool through the ledger.
 */
public class TestDistributedWorkloadService extends SluiceTest {
  private static final String POOL_ID = "sample_pool_id";

  @Override
  protected long getTimeoutMillis() {
    return 120_000;
  }

  @Test
  public void testDistributedQueue() throws Exception {
    try (WorkloadClusterFixture cluster = WorkloadClusterFixture.builder().nodeCount(2).build()) {
      runDistributedQueue(cluster);
    }
  }

  @Test
  public void testDistributedQueueOnZookeeper() throws Exception {
    try (WorkloadClusterFixture cluster = WorkloadClusterFixture.builder().nodeCount(2).withZookeeper().build()) {
      runDistributedQueue(cluster);
    }
  }

  private void runDistributedQueue(WorkloadClusterFixture cluster) throws Exception {
    cluster.createPool(POOL_ID, ImmutableMap.of("concurrent_query_limit", "1", "queue_size", "1"));
    final QueryRunner runner = new QueryRunner();

    final CompletableFuture<QueryResult> first = cluster.executeQuery(0, cluster.request(POOL_ID), runner);
    final AdmissionTicket running = runner.awaitStart();
    final CompletableFuture<QueryResult> second = cluster.executeQuery(1, cluster.request(POOL_ID), runner);
    cluster.waitPoolState(POOL_ID, 1, 1);

    // the queue is full for every node
    final QueryResult third = cluster.await(cluster.executeQuery(0, cluster.request(POOL_ID), runner));
    assertEquals(QueryStatus.OVERLOADED, third.getStatus());
    assertTrue(third.getMessage().contains("Too many pending requests for pool " + POOL_ID));

    runner.continueExecution(running);
    assertEquals(QueryStatus.SUCCESS, cluster.await(first).getStatus());

    // the request queued on the other node is promoted
    runner.continueExecution(runner.awaitStart());
    assertEquals(QueryStatus.SUCCESS, cluster.await(second).getStatus());
    cluster.waitPoolState(POOL_ID, 0, 0);
  }

  @Test
  public void testNodeDisconnect() throws Exception {
    try (WorkloadClusterFixture cluster = WorkloadClusterFixture.builder()
        .nodeCount(2)
        .configProperty(ExecConstants.WORKLOAD_LEASE_DURATION, "1s")
        .configProperty(ExecConstants.WORKLOAD_LEASE_RENEWAL_PERIOD, "100ms")
        .build()) {
      cluster.createPool(POOL_ID, ImmutableMap.of("concurrent_query_limit", "1", "queue_size", "1"));
      final QueryRunner runner = new QueryRunner();

      final CompletableFuture<QueryResult> first = cluster.executeQuery(0, cluster.request(POOL_ID), runner);
      runner.awaitStart();
      final CompletableFuture<QueryResult> second = cluster.executeQuery(1, cluster.request(POOL_ID), runner);
      cluster.waitPoolState(POOL_ID, 1, 1);

      cluster.haltNode(0);
      final QueryResult halted = cluster.await(first);
      assertEquals(QueryStatus.INTERNAL_ERROR, halted.getStatus());

      // the lease of the halted node expires and its slot goes to the queued request
      runner.continueExecution(runner.awaitStart());
      assertEquals(QueryStatus.SUCCESS, cluster.await(second).getStatus());
      WorkloadClusterFixture.waitFor("the pool to drain", () -> cluster.service(1)
          .getPoolDescription(WorkloadClusterFixture.DATABASE, POOL_ID).getAmountRequests() == 0);
    }
  }

  @Test
  public void testDistributedConcurrentQueryLimit() throws Exception {
    final int nodeCount = 3;
    final int activeCountLimit = 5;
    final int queueSize = 50;
    try (WorkloadClusterFixture cluster = WorkloadClusterFixture.builder().nodeCount(nodeCount).build()) {
      cluster.createPool(POOL_ID, ImmutableMap.of(
          "concurrent_query_limit", String.valueOf(activeCountLimit),
          "queue_size", String.valueOf(queueSize)));
      final InFlightCoordinator coordinator = new InFlightCoordinator(queueSize, activeCountLimit);

      final List<CompletableFuture<QueryResult>> results = new ArrayList<>();
      for (int i = 0; i < queueSize; i++) {
        results.add(cluster.executeQuery(i % nodeCount, cluster.request(POOL_ID), coordinator));
      }
      for (CompletableFuture<QueryResult> result : results) {
        final QueryResult outcome = cluster.await(result);
        assertEquals(outcome.getMessage(), QueryStatus.SUCCESS, outcome.getStatus());
      }
      coordinator.awaitAll(WorkloadClusterFixture.FUTURE_WAIT_TIMEOUT_MS);
    }
  }
}
