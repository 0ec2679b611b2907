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

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.ledger.exception.LedgerException;

/**
 * Shared, durable accounting of running and delayed slots of limited pools.
 *
 * <p>Every node admitting requests for a pool goes through the same ledger.
 * Each mutation is applied atomically to the pool's state with a conditional
 * write, so concurrent callers on different nodes never both take the last
 * slot. Leases that are not renewed expire, and any call touching a pool
 * first reclaims the expired leases of that pool.</p>
 *
 * <p>Implementations retry conflicting writes a bounded number of times and
 * then fail with a {@link org.apache.sluice.exec.workload.ledger.exception.LedgerUpdateException}.</p>
 */
public interface PoolStateLedger extends AutoCloseable {

  /**
   * Takes a slot of the given kind if its count is below the bound carried by the request.
   *
   * @return the new lease, or null if the pool is at its bound
   * @throws org.apache.sluice.exec.workload.ledger.exception.StalePoolConfigException
   *         if the request's configuration version is older than one already seen for this pool
   */
  Lease tryAcquireSlot(PoolKey pool, SlotKind kind, SlotRequest request) throws LedgerException;

  /**
   * @return false if the lease no longer exists
   */
  boolean renewLease(PoolKey pool, String ownerNode, String leaseId, long newExpiry) throws LedgerException;

  /**
   * Renews several leases of one owner in a single update.
   *
   * @return ids of the leases that were lost, e.g. reclaimed after expiring
   */
  Set<String> renewLeases(PoolKey pool, String ownerNode, Collection<String> leaseIds, long newExpiry)
      throws LedgerException;

  /**
   * Gives the slot back. Releasing an unknown, expired or already released lease is a no-op.
   *
   * @return true if a lease was actually removed
   */
  boolean releaseSlot(PoolKey pool, String leaseId) throws LedgerException;

  /**
   * Turns the delayed lease into a running one if a running slot is free and
   * the lease is first in queue order.
   */
  boolean promote(PoolKey pool, String leaseId, int concurrentQueryLimit, long newExpiry) throws LedgerException;

  /**
   * Removes the owner's delayed leases beyond the first {@code queueSize} positions of the queue.
   */
  List<Lease> trimQueue(PoolKey pool, String ownerNode, int queueSize) throws LedgerException;

  /**
   * Removes all expired leases of the pool, whoever owned them.
   */
  List<Lease> reclaimExpired(PoolKey pool) throws LedgerException;

  /**
   * Counts the unexpired leases of the pool. Not synchronized with concurrent
   * writers; the answer may be stale by the time it is returned.
   */
  PoolStateDescription readState(PoolKey pool) throws LedgerException;

  void addListener(PoolKey pool, LedgerListener listener);

  void removeListener(PoolKey pool, LedgerListener listener);
}
