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

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.ledger.exception.LedgerException;
import org.apache.sluice.exec.workload.ledger.exception.LedgerUpdateException;

/**
 * Ledger operations expressed as transitions of a {@link PoolStateBlob}.
 *
 * <p>Each operation reads the pool's blob together with its data version,
 * applies the transition to that private copy and writes it back only if the
 * version is unchanged. A lost race re-reads and re-applies; transitions that
 * leave the blob untouched skip the write. Subclasses supply the versioned
 * byte storage and, where the store can, remote change notifications.</p>
 */
public abstract class AbstractPoolStateLedger implements PoolStateLedger {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractPoolStateLedger.class);

  private final ObjectMapper mapper;

  private final int maxUpdateAttempts;

  private final long retryBackoffMs;

  private final Map<PoolKey, Set<LedgerListener>> listeners = new ConcurrentHashMap<>();

  /**
   * A transition of a pool's state.
   */
  @FunctionalInterface
  protected interface BlobTransition<T> {
    T apply(PoolStateBlob blob, long now) throws LedgerException;
  }

  protected AbstractPoolStateLedger(SluiceConfig config, ObjectMapper mapper) {
    this.mapper = mapper;
    this.maxUpdateAttempts = config.getInt(ExecConstants.WORKLOAD_LEDGER_MAX_UPDATE_ATTEMPTS);
    this.retryBackoffMs = config.getDuration(ExecConstants.WORKLOAD_LEDGER_RETRY_BACKOFF).toMillis();
  }

  /**
   * @return serialized state of the pool or null if the pool has no state yet
   */
  protected abstract byte[] readBlob(PoolKey pool, DataChangeVersion version) throws Exception;

  /**
   * Writes the state only if it still has the given version, creating it if the version is not available.
   *
   * @return false if another writer got there first
   */
  protected abstract boolean writeBlob(PoolKey pool, byte[] data, DataChangeVersion version) throws Exception;

  /**
   * Called when the first listener for a pool is registered.
   */
  protected void startWatching(PoolKey pool) {
  }

  /**
   * Called when the last listener for a pool is removed.
   */
  protected void stopWatching(PoolKey pool) {
  }

  /**
   * Called after this ledger wrote a new state of the pool.
   */
  protected void onBlobWritten(PoolKey pool) {
  }

  @Override
  public Lease tryAcquireSlot(PoolKey pool, SlotKind kind, SlotRequest request) throws LedgerException {
    final LeaseRecord record = update(pool, "acquire " + kind + " slot",
        (blob, now) -> blob.acquire(kind, request, now));
    if (record == null) {
      logger.debug("No {} slot available in pool {} for request {}", kind, pool, request.getRequestId());
      return null;
    }
    final Lease lease = new Lease(pool, record);
    logger.debug("Acquired {}", lease);
    return lease;
  }

  @Override
  public boolean renewLease(PoolKey pool, String ownerNode, String leaseId, long newExpiry) throws LedgerException {
    return renewLeases(pool, ownerNode, Collections.singleton(leaseId), newExpiry).isEmpty();
  }

  @Override
  public Set<String> renewLeases(PoolKey pool, String ownerNode, Collection<String> leaseIds, long newExpiry)
      throws LedgerException {
    if (leaseIds.isEmpty()) {
      return Collections.emptySet();
    }
    return update(pool, "renew leases", (blob, now) -> blob.renew(ownerNode, leaseIds, newExpiry, now));
  }

  @Override
  public boolean releaseSlot(PoolKey pool, String leaseId) throws LedgerException {
    final boolean released = update(pool, "release slot", (blob, now) -> blob.release(leaseId));
    logger.debug("Release of lease {} in pool {}: {}", leaseId, pool, released ? "released" : "no such lease");
    return released;
  }

  @Override
  public boolean promote(PoolKey pool, String leaseId, int concurrentQueryLimit, long newExpiry)
      throws LedgerException {
    return update(pool, "promote lease",
        (blob, now) -> blob.promote(leaseId, concurrentQueryLimit, newExpiry, now));
  }

  @Override
  public List<Lease> trimQueue(PoolKey pool, String ownerNode, int queueSize) throws LedgerException {
    return toLeases(pool, update(pool, "trim queue", (blob, now) -> blob.trimQueue(ownerNode, queueSize, now)));
  }

  @Override
  public List<Lease> reclaimExpired(PoolKey pool) throws LedgerException {
    final List<Lease> reclaimed = toLeases(pool, update(pool, "reclaim expired leases",
        (blob, now) -> blob.removeExpired(now)));
    if (!reclaimed.isEmpty()) {
      logger.info("Reclaimed {} expired lease(s) in pool {}: {}", reclaimed.size(), pool, reclaimed);
    }
    return reclaimed;
  }

  @Override
  public PoolStateDescription readState(PoolKey pool) throws LedgerException {
    try {
      return deserialize(pool, readBlob(pool, new DataChangeVersion())).describe(System.currentTimeMillis());
    } catch (LedgerException e) {
      throw e;
    } catch (Exception e) {
      throw new LedgerUpdateException(String.format("Failed to read state of pool %s", pool), e);
    }
  }

  @Override
  public void addListener(PoolKey pool, LedgerListener listener) {
    synchronized (listeners) {
      final Set<LedgerListener> poolListeners = listeners.get(pool);
      if (poolListeners != null) {
        poolListeners.add(listener);
        return;
      }
      final Set<LedgerListener> created = ConcurrentHashMap.newKeySet();
      created.add(listener);
      listeners.put(pool, created);
      startWatching(pool);
    }
  }

  @Override
  public void removeListener(PoolKey pool, LedgerListener listener) {
    synchronized (listeners) {
      final Set<LedgerListener> poolListeners = listeners.get(pool);
      if (poolListeners == null || !poolListeners.remove(listener) || !poolListeners.isEmpty()) {
        return;
      }
      listeners.remove(pool);
      stopWatching(pool);
    }
  }

  /**
   * Delivers a change notification to all listeners of the pool.
   */
  protected void fireListeners(PoolKey pool) {
    final Set<LedgerListener> poolListeners = listeners.get(pool);
    if (poolListeners == null) {
      return;
    }
    for (LedgerListener listener : poolListeners) {
      try {
        listener.onPoolStateChanged(pool);
      } catch (RuntimeException e) {
        logger.warn("Listener {} failed on state change of pool {}", listener, pool, e);
      }
    }
  }

  @VisibleForTesting
  protected <T> T update(PoolKey pool, String operation, BlobTransition<T> transition) throws LedgerException {
    Exception lastFailure = null;
    for (int attempt = 1; attempt <= maxUpdateAttempts; attempt++) {
      try {
        final DataChangeVersion version = new DataChangeVersion();
        final PoolStateBlob blob = deserialize(pool, readBlob(pool, version));
        final T result = transition.apply(blob, System.currentTimeMillis());
        if (!blob.isModified()) {
          return result;
        }
        if (writeBlob(pool, serialize(pool, blob), version)) {
          onBlobWritten(pool);
          return result;
        }
        logger.debug("Conflicting update of pool {} while trying to {}, attempt {} of {}",
            pool, operation, attempt, maxUpdateAttempts);
      } catch (LedgerException e) {
        throw e;
      } catch (Exception e) {
        lastFailure = e;
        logger.warn("Failed to {} in pool {}, attempt {} of {}", operation, pool, attempt, maxUpdateAttempts, e);
      }
      backoff(attempt);
    }
    throw new LedgerUpdateException(String.format("Failed to %s in pool %s after %d attempts",
        operation, pool, maxUpdateAttempts), lastFailure);
  }

  private void backoff(int attempt) throws LedgerUpdateException {
    if (attempt == maxUpdateAttempts || retryBackoffMs <= 0) {
      return;
    }
    try {
      Thread.sleep(retryBackoffMs * attempt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LedgerUpdateException("Interrupted while waiting to retry a pool state update", e);
    }
  }

  private PoolStateBlob deserialize(PoolKey pool, byte[] data) throws LedgerUpdateException {
    if (data == null) {
      return PoolStateBlob.empty();
    }
    try {
      return mapper.readValue(data, PoolStateBlob.class);
    } catch (IOException e) {
      throw new LedgerUpdateException(String.format("Unable to deserialize state of pool %s", pool), e);
    }
  }

  private byte[] serialize(PoolKey pool, PoolStateBlob blob) throws LedgerUpdateException {
    try {
      return mapper.writeValueAsBytes(blob);
    } catch (IOException e) {
      throw new LedgerUpdateException(String.format("Unable to serialize state of pool %s", pool), e);
    }
  }

  private static List<Lease> toLeases(PoolKey pool, List<LeaseRecord> records) {
    return records.stream().map(record -> new Lease(pool, record)).collect(Collectors.toList());
  }
}
