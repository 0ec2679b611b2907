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
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.sluice.exec.workload.ledger.exception.StalePoolConfigException;
import org.apache.sluice.exec.workload.pool.PoolConfig;

/**
 * Shared state of one limited pool: the set of live leases plus the newest
 * configuration generation and version any node admitted with. The whole
 * blob is read, changed and written back conditionally, so all methods here
 * are plain, single threaded transitions on a private copy.
 *
 * <p>Queue order is arrival time, then lease creation sequence.</p>
 *
 * <p>A request of a newer generation means the pool was dropped and created
 * again. The leases left by the dropped pool are discarded at that point.</p>
 */
public class PoolStateBlob {

  public static final int POOL_STATE_BLOB_VERSION = 1;

  static final Comparator<LeaseRecord> QUEUE_ORDER =
      Comparator.comparingLong(LeaseRecord::getArrivalTime).thenComparingLong(LeaseRecord::getSequence);

  private final int blobVersion;

  private long poolConfigGeneration;

  private long poolConfigVersion;

  private long nextSequence;

  private final Map<String, LeaseRecord> leases;

  @JsonIgnore
  private boolean modified;

  @JsonCreator
  public PoolStateBlob(@JsonProperty("blobVersion") int blobVersion,
                       @JsonProperty("poolConfigGeneration") long poolConfigGeneration,
                       @JsonProperty("poolConfigVersion") long poolConfigVersion,
                       @JsonProperty("nextSequence") long nextSequence,
                       @JsonProperty("leases") Map<String, LeaseRecord> leases) {
    this.blobVersion = blobVersion;
    this.poolConfigGeneration = poolConfigGeneration;
    this.poolConfigVersion = poolConfigVersion;
    this.nextSequence = nextSequence;
    this.leases = leases == null ? new LinkedHashMap<>() : new LinkedHashMap<>(leases);
  }

  public static PoolStateBlob empty() {
    return new PoolStateBlob(POOL_STATE_BLOB_VERSION, 0, 0, 0, null);
  }

  public int getBlobVersion() {
    return blobVersion;
  }

  public long getPoolConfigGeneration() {
    return poolConfigGeneration;
  }

  public long getPoolConfigVersion() {
    return poolConfigVersion;
  }

  public long getNextSequence() {
    return nextSequence;
  }

  public Map<String, LeaseRecord> getLeases() {
    return leases;
  }

  /**
   * @return true if any transition changed this copy since it was read
   */
  @JsonIgnore
  public boolean isModified() {
    return modified;
  }

  /**
   * Drops every lease whose expiry passed. Called first by every transition
   * so that a dead node's slots are reclaimed by whoever touches the pool next.
   */
  public List<LeaseRecord> removeExpired(long now) {
    final List<LeaseRecord> expired = new ArrayList<>();
    final Iterator<LeaseRecord> iterator = leases.values().iterator();
    while (iterator.hasNext()) {
      final LeaseRecord lease = iterator.next();
      if (lease.isExpired(now)) {
        expired.add(lease);
        iterator.remove();
      }
    }
    if (!expired.isEmpty()) {
      modified = true;
    }
    return expired;
  }

  /**
   * Number of unexpired leases of the given kind.
   */
  public int count(SlotKind kind, long now) {
    int count = 0;
    for (LeaseRecord lease : leases.values()) {
      if (lease.getKind() == kind && !lease.isExpired(now)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Creates a lease of the given kind if the pool bounds allow it.
   *
   * <p>A running slot is only granted while nobody is queued, so a newcomer
   * never overtakes a waiting request. A delayed slot is granted while the
   * queue is below its size.</p>
   *
   * @return the new lease, or null if the relevant count is at its bound
   * @throws StalePoolConfigException if the request carries an older configuration
   *         than one already used against this pool
   */
  public LeaseRecord acquire(SlotKind kind, SlotRequest request, long now) throws StalePoolConfigException {
    checkConfig(request);
    removeExpired(now);

    final boolean granted;
    switch (kind) {
      case RUNNING:
        granted = belowBound(count(SlotKind.RUNNING, now), request.getConcurrentQueryLimit())
            && count(SlotKind.DELAYED, now) == 0;
        break;
      case DELAYED:
        granted = belowBound(count(SlotKind.DELAYED, now), request.getQueueSize());
        break;
      default:
        throw new IllegalArgumentException("Unknown slot kind " + kind);
    }
    if (!granted) {
      return null;
    }

    final LeaseRecord lease = new LeaseRecord(UUID.randomUUID().toString(), request.getOwnerNode(),
        request.getRequestId(), kind, request.getArrivalTime(), nextSequence++,
        now + request.getLeaseDurationMs());
    leases.put(lease.getLeaseId(), lease);
    modified = true;
    return lease;
  }

  private void checkConfig(SlotRequest request) throws StalePoolConfigException {
    if (request.getConfigGeneration() < poolConfigGeneration) {
      throw new StalePoolConfigException(String.format(
          "Configuration generation %d is older than generation %d already in use",
          request.getConfigGeneration(), poolConfigGeneration), poolConfigVersion);
    }
    if (request.getConfigGeneration() > poolConfigGeneration) {
      leases.clear();
      poolConfigGeneration = request.getConfigGeneration();
      poolConfigVersion = request.getConfigVersion();
      modified = true;
      return;
    }
    if (request.getConfigVersion() < poolConfigVersion) {
      throw new StalePoolConfigException(String.format(
          "Configuration version %d is older than version %d already in use",
          request.getConfigVersion(), poolConfigVersion), poolConfigVersion);
    }
    if (request.getConfigVersion() > poolConfigVersion) {
      poolConfigVersion = request.getConfigVersion();
      modified = true;
    }
  }

  /**
   * @return false if no such lease exists, e.g. it was already released or reclaimed
   */
  public boolean release(String leaseId) {
    if (leases.remove(leaseId) != null) {
      modified = true;
      return true;
    }
    return false;
  }

  /**
   * Extends the given leases of one owner.
   *
   * @return ids of the leases that no longer exist
   */
  public Set<String> renew(String ownerNode, Collection<String> leaseIds, long expiresAt, long now) {
    removeExpired(now);
    final Set<String> lost = new HashSet<>();
    for (String leaseId : leaseIds) {
      final LeaseRecord lease = leases.get(leaseId);
      if (lease == null || !lease.getOwnerNode().equals(ownerNode)) {
        lost.add(leaseId);
      } else if (lease.getExpiresAt() < expiresAt) {
        lease.setExpiresAt(expiresAt);
        modified = true;
      }
    }
    return lost;
  }

  /**
   * Turns a delayed lease into a running one. Succeeds only if a running slot
   * is free and the lease is the first in queue order, which allows at most
   * one promotion per freed slot across the cluster.
   */
  public boolean promote(String leaseId, int concurrentQueryLimit, long expiresAt, long now) {
    removeExpired(now);
    final LeaseRecord lease = leases.get(leaseId);
    if (lease == null || lease.getKind() != SlotKind.DELAYED) {
      return false;
    }
    if (!belowBound(count(SlotKind.RUNNING, now), concurrentQueryLimit)) {
      return false;
    }
    final List<LeaseRecord> queue = queue(now);
    if (queue.isEmpty() || !queue.get(0).getLeaseId().equals(leaseId)) {
      return false;
    }
    lease.setKind(SlotKind.RUNNING);
    lease.setExpiresAt(expiresAt);
    modified = true;
    return true;
  }

  /**
   * Removes the owner's delayed leases whose position in the queue is at or
   * beyond the given queue size.
   *
   * @return the removed leases
   */
  public List<LeaseRecord> trimQueue(String ownerNode, int queueSize, long now) {
    removeExpired(now);
    if (queueSize == PoolConfig.UNLIMITED) {
      return new ArrayList<>();
    }
    final List<LeaseRecord> queue = queue(now);
    final List<LeaseRecord> removed = new ArrayList<>();
    for (int position = queueSize; position < queue.size(); position++) {
      final LeaseRecord lease = queue.get(position);
      if (lease.getOwnerNode().equals(ownerNode)) {
        leases.remove(lease.getLeaseId());
        removed.add(lease);
      }
    }
    if (!removed.isEmpty()) {
      modified = true;
    }
    return removed;
  }

  /**
   * @return unexpired delayed leases in queue order
   */
  public List<LeaseRecord> queue(long now) {
    return leases.values().stream()
        .filter(lease -> lease.getKind() == SlotKind.DELAYED && !lease.isExpired(now))
        .sorted(QUEUE_ORDER)
        .collect(Collectors.toList());
  }

  public PoolStateDescription describe(long now) {
    return new PoolStateDescription(count(SlotKind.RUNNING, now), count(SlotKind.DELAYED, now));
  }

  private static boolean belowBound(int count, int bound) {
    return bound == PoolConfig.UNLIMITED || count < bound;
  }
}
