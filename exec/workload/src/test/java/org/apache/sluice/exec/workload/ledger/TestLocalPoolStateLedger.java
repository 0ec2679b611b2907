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
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.ledger.exception.LedgerUpdateException;
import org.apache.sluice.exec.workload.ledger.exception.StalePoolConfigException;
import org.apache.sluice.test.SluiceTest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestLocalPoolStateLedger extends SluiceTest {
  private static final PoolKey POOL = new PoolKey("/Root/db", "sample");

  private SluiceConfig config;
  private LocalPoolStateLedger ledger;

  /**
   * Loses the first {@code conflicts} writes to an imaginary concurrent writer.
   */
  private static class ConflictingLedger extends LocalPoolStateLedger {
    private final AtomicInteger conflicts;
    private final AtomicInteger writes = new AtomicInteger();

    ConflictingLedger(SluiceConfig config, int conflicts) {
      super(config, new ObjectMapper());
      this.conflicts = new AtomicInteger(conflicts);
    }

    @Override
    protected boolean writeBlob(PoolKey pool, byte[] data, DataChangeVersion version) {
      writes.incrementAndGet();
      if (conflicts.getAndDecrement() > 0) {
        return false;
      }
      return super.writeBlob(pool, data, version);
    }
  }

  @Before
  public void setUp() {
    final Properties overrides = new Properties();
    overrides.put(ExecConstants.WORKLOAD_LEDGER_MAX_UPDATE_ATTEMPTS, "3");
    overrides.put(ExecConstants.WORKLOAD_LEDGER_RETRY_BACKOFF, "1ms");
    config = SluiceConfig.create(overrides);
    ledger = new LocalPoolStateLedger(config, new ObjectMapper());
  }

  @After
  public void tearDown() {
    ledger.close();
  }

  private static SlotRequest request(String node, String requestId, int limit, int queue) {
    return new SlotRequest(node, requestId, System.currentTimeMillis(), 60_000, limit, queue, 1);
  }

  @Test
  public void testAcquireReleaseAndDescribe() throws Exception {
    final Lease running = ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r1", 1, 1));
    assertNotNull(running);
    assertEquals("n1", running.getOwnerNode());
    assertEquals("r1", running.getRequestId());
    assertEquals(SlotKind.RUNNING, running.getKind());
    assertEquals(POOL, running.getPool());

    assertNull(ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r2", 1, 1)));
    final Lease delayed = ledger.tryAcquireSlot(POOL, SlotKind.DELAYED, request("n1", "r2", 1, 1));
    assertNotNull(delayed);
    assertNull("queue is full", ledger.tryAcquireSlot(POOL, SlotKind.DELAYED, request("n1", "r3", 1, 1)));

    PoolStateDescription state = ledger.readState(POOL);
    assertEquals(1, state.getRunningRequests());
    assertEquals(1, state.getDelayedRequests());
    assertEquals(2, state.getAmountRequests());

    assertTrue(ledger.releaseSlot(POOL, running.getLeaseId()));
    assertFalse("release is idempotent", ledger.releaseSlot(POOL, running.getLeaseId()));
    assertTrue(ledger.promote(POOL, delayed.getLeaseId(), 1, System.currentTimeMillis() + 60_000));

    state = ledger.readState(POOL);
    assertEquals(1, state.getRunningRequests());
    assertEquals(0, state.getDelayedRequests());
  }

  @Test
  public void testReadStateOfUnknownPool() throws Exception {
    assertEquals(0, ledger.readState(new PoolKey("/Root/db", "missing")).getAmountRequests());
  }

  @Test
  public void testListenersSeeEveryWrite() throws Exception {
    final LedgerListener listener = Mockito.mock(LedgerListener.class);
    ledger.addListener(POOL, listener);

    final Lease lease = ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r1", 1, 0));
    ledger.releaseSlot(POOL, lease.getLeaseId());
    ledger.releaseSlot(POOL, lease.getLeaseId());
    Mockito.verify(listener, Mockito.times(2)).onPoolStateChanged(POOL);

    ledger.removeListener(POOL, listener);
    ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r2", 1, 0));
    Mockito.verifyNoMoreInteractions(listener);
  }

  @Test
  public void testConflictingWritesAreRetried() throws Exception {
    final ConflictingLedger conflicting = new ConflictingLedger(config, 2);
    assertNotNull(conflicting.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r1", 1, 0)));
    assertEquals(3, conflicting.writes.get());
    assertEquals(1, conflicting.readState(POOL).getRunningRequests());
  }

  @Test(expected = LedgerUpdateException.class)
  public void testPersistentConflictsFail() throws Exception {
    final ConflictingLedger conflicting = new ConflictingLedger(config, Integer.MAX_VALUE);
    conflicting.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r1", 1, 0));
  }

  @Test(expected = StalePoolConfigException.class)
  public void testStaleConfigurationVersion() throws Exception {
    ledger.tryAcquireSlot(POOL, SlotKind.RUNNING,
        new SlotRequest("n1", "r1", System.currentTimeMillis(), 60_000, 1, 1, 2));
    ledger.tryAcquireSlot(POOL, SlotKind.RUNNING,
        new SlotRequest("n2", "r2", System.currentTimeMillis(), 60_000, 5, 1, 1));
  }

  @Test
  public void testRenewAndTrim() throws Exception {
    final Lease running = ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n1", "r0", 1, 5));
    final Lease first = ledger.tryAcquireSlot(POOL, SlotKind.DELAYED, request("n1", "r1", 1, 5));
    final Lease second = ledger.tryAcquireSlot(POOL, SlotKind.DELAYED, request("n1", "r2", 1, 5));

    assertTrue(ledger.renewLease(POOL, "n1", running.getLeaseId(), System.currentTimeMillis() + 120_000));
    assertFalse("foreign leases cannot be renewed",
        ledger.renewLease(POOL, "n2", first.getLeaseId(), System.currentTimeMillis() + 120_000));

    final List<Lease> trimmed = ledger.trimQueue(POOL, "n1", 1);
    assertEquals(1, trimmed.size());
    assertEquals(second.getLeaseId(), trimmed.get(0).getLeaseId());
    assertEquals(ImmutableList.of(), ledger.reclaimExpired(POOL));
    assertEquals(1, ledger.readState(POOL).getDelayedRequests());
  }

  @Test
  public void testExpiredLeasesAreReclaimed() throws Exception {
    ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, new SlotRequest("dead", "r1", System.currentTimeMillis(), 1, 1, 0, 1));
    Thread.sleep(10);

    final List<Lease> reclaimed = ledger.reclaimExpired(POOL);
    assertEquals(1, reclaimed.size());
    assertEquals("dead", reclaimed.get(0).getOwnerNode());
    assertNotNull(ledger.tryAcquireSlot(POOL, SlotKind.RUNNING, request("n2", "r2", 1, 0)));
  }
}
