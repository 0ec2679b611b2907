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

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import org.apache.sluice.exec.workload.ledger.exception.StalePoolConfigException;
import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Pool state transitions with an explicit clock.
 */
public class TestPoolStateBlob {
  private static final long LEASE = 1_000;

  private PoolStateBlob blob;

  @Before
  public void setUp() {
    blob = PoolStateBlob.empty();
  }

  private static SlotRequest request(String node, String requestId, long arrival, int limit, int queue) {
    return new SlotRequest(node, requestId, arrival, LEASE, limit, queue, 1);
  }

  @Test
  public void testRunningSlotsAreBoundedByLimit() throws Exception {
    assertNotNull(blob.acquire(SlotKind.RUNNING, request("n1", "r1", 0, 2, 0), 0));
    assertNotNull(blob.acquire(SlotKind.RUNNING, request("n1", "r2", 1, 2, 0), 1));
    assertNull(blob.acquire(SlotKind.RUNNING, request("n1", "r3", 2, 2, 0), 2));
    assertEquals(2, blob.count(SlotKind.RUNNING, 2));
    assertTrue(blob.isModified());
  }

  @Test
  public void testZeroQueueDeniesDelayedSlots() throws Exception {
    assertNull(blob.acquire(SlotKind.DELAYED, request("n1", "r1", 0, 1, 0), 0));
    assertTrue(blob.getLeases().isEmpty());
  }

  @Test
  public void testUnlimitedBounds() throws Exception {
    for (int i = 0; i < 100; i++) {
      assertNotNull(blob.acquire(SlotKind.RUNNING,
          request("n1", "r" + i, i, PoolConfig.UNLIMITED, PoolConfig.UNLIMITED), i));
    }
    assertEquals(100, blob.describe(100).getRunningRequests());
  }

  @Test
  public void testNewcomerDoesNotOvertakeQueue() throws Exception {
    final LeaseRecord running = blob.acquire(SlotKind.RUNNING, request("n1", "r1", 0, 1, 5), 0);
    assertNotNull(blob.acquire(SlotKind.DELAYED, request("n2", "r2", 1, 1, 5), 1));
    blob.release(running.getLeaseId());

    assertNull("a waiting request must be served first",
        blob.acquire(SlotKind.RUNNING, request("n1", "r3", 2, 1, 5), 2));
  }

  @Test
  public void testPromotionFollowsArrivalOrder() throws Exception {
    final LeaseRecord running = blob.acquire(SlotKind.RUNNING, request("n1", "r1", 0, 1, 5), 0);
    final LeaseRecord later = blob.acquire(SlotKind.DELAYED, request("n1", "late", 20, 1, 5), 5);
    final LeaseRecord earlier = blob.acquire(SlotKind.DELAYED, request("n2", "early", 10, 1, 5), 6);

    assertFalse("no free running slot", blob.promote(earlier.getLeaseId(), 1, 100, 7));
    blob.release(running.getLeaseId());

    assertFalse("not first in queue", blob.promote(later.getLeaseId(), 1, 100, 8));
    assertTrue(blob.promote(earlier.getLeaseId(), 1, 100, 8));
    assertFalse("only one promotion per freed slot", blob.promote(later.getLeaseId(), 1, 100, 8));
    assertEquals(1, blob.count(SlotKind.RUNNING, 8));
    assertEquals(1, blob.count(SlotKind.DELAYED, 8));
  }

  @Test
  public void testEqualArrivalTimesUseCreationOrder() throws Exception {
    blob.acquire(SlotKind.RUNNING, request("n1", "r0", 0, 1, 5), 0);
    final LeaseRecord first = blob.acquire(SlotKind.DELAYED, request("n1", "r1", 10, 1, 5), 1);
    final LeaseRecord second = blob.acquire(SlotKind.DELAYED, request("n2", "r2", 10, 1, 5), 2);

    final List<LeaseRecord> queue = blob.queue(3);
    assertEquals(ImmutableList.of(first.getLeaseId(), second.getLeaseId()),
        ImmutableList.of(queue.get(0).getLeaseId(), queue.get(1).getLeaseId()));
  }

  @Test
  public void testReleaseIsIdempotent() throws Exception {
    final LeaseRecord lease = blob.acquire(SlotKind.RUNNING, request("n1", "r1", 0, 1, 0), 0);
    assertTrue(blob.release(lease.getLeaseId()));
    assertFalse(blob.release(lease.getLeaseId()));
    assertFalse(blob.release("unknown"));
    assertEquals(0, blob.describe(0).getAmountRequests());
  }

  @Test
  public void testExpiredLeasesAreReclaimed() throws Exception {
    blob.acquire(SlotKind.RUNNING, request("dead", "r1", 0, 1, 1), 0);
    assertNull(blob.acquire(SlotKind.RUNNING, request("n2", "r2", 10, 1, 1), 10));

    assertNotNull("the dead node's slot is free once its lease expired",
        blob.acquire(SlotKind.RUNNING, request("n2", "r3", LEASE, 1, 1), LEASE));
    assertEquals(1, blob.getLeases().size());
  }

  @Test
  public void testRenewReportsLostLeases() throws Exception {
    final LeaseRecord own = blob.acquire(SlotKind.RUNNING, request("n1", "r1", 0, 5, 0), 0);
    final LeaseRecord foreign = blob.acquire(SlotKind.RUNNING, request("n2", "r2", 0, 5, 0), 0);

    final Set<String> lost = blob.renew("n1",
        ImmutableList.of(own.getLeaseId(), foreign.getLeaseId(), "gone"), 5_000, 500);
    assertEquals(2, lost.size());
    assertTrue(lost.contains("gone"));
    assertTrue("leases of other nodes cannot be renewed", lost.contains(foreign.getLeaseId()));
    assertEquals(5_000, blob.getLeases().get(own.getLeaseId()).getExpiresAt());
  }

  @Test
  public void testTrimQueueRemovesOnlyOwnLeasesBeyondBound() throws Exception {
    blob.acquire(SlotKind.RUNNING, request("n1", "r0", 0, 1, 10), 0);
    final LeaseRecord a = blob.acquire(SlotKind.DELAYED, request("n1", "a", 1, 1, 10), 1);
    final LeaseRecord b = blob.acquire(SlotKind.DELAYED, request("n2", "b", 2, 1, 10), 2);
    final LeaseRecord c = blob.acquire(SlotKind.DELAYED, request("n1", "c", 3, 1, 10), 3);
    final LeaseRecord d = blob.acquire(SlotKind.DELAYED, request("n2", "d", 4, 1, 10), 4);

    final List<LeaseRecord> trimmed = blob.trimQueue("n1", 1, 5);
    assertEquals(1, trimmed.size());
    assertEquals(c.getLeaseId(), trimmed.get(0).getLeaseId());
    assertTrue(blob.getLeases().containsKey(a.getLeaseId()));
    assertTrue("other nodes trim their own leases", blob.getLeases().containsKey(b.getLeaseId()));
    assertTrue(blob.getLeases().containsKey(d.getLeaseId()));
  }

  @Test
  public void testStaleConfigurationIsRejected() throws Exception {
    blob.acquire(SlotKind.RUNNING, new SlotRequest("n1", "r1", 0, LEASE, 5, 5, 3), 0);
    assertEquals(3, blob.getPoolConfigVersion());
    try {
      blob.acquire(SlotKind.RUNNING, new SlotRequest("n2", "r2", 0, LEASE, 10, 5, 2), 0);
      fail();
    } catch (StalePoolConfigException e) {
      assertEquals(3, e.getLatestVersion());
    }
  }

  @Test
  public void testRecreatedPoolStartsOverAtVersionOne() throws Exception {
    final LeaseRecord dropped = blob.acquire(SlotKind.RUNNING, new SlotRequest("n1", "r1", 0, LEASE, 1, 1, 10, 2), 0);
    assertNotNull(blob.acquire(SlotKind.DELAYED, new SlotRequest("n1", "r2", 1, LEASE, 1, 1, 10, 2), 1));

    final LeaseRecord fresh = blob.acquire(SlotKind.RUNNING, new SlotRequest("n2", "r3", 2, LEASE, 1, 1, 20, 1), 2);
    assertNotNull("a newer generation is never stale", fresh);
    assertEquals(20, blob.getPoolConfigGeneration());
    assertEquals(1, blob.getPoolConfigVersion());
    assertEquals("leases of the dropped pool are gone", 1, blob.getLeases().size());
    assertFalse(blob.getLeases().containsKey(dropped.getLeaseId()));

    try {
      blob.acquire(SlotKind.RUNNING, new SlotRequest("n1", "r4", 3, LEASE, 5, 1, 10, 3), 3);
      fail();
    } catch (StalePoolConfigException e) {
      assertEquals(1, e.getLatestVersion());
    }
  }
}
