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
package org.apache.sluice.exec.workload.handler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.workload.ledger.Lease;
import org.apache.sluice.exec.workload.ledger.LedgerListener;
import org.apache.sluice.exec.workload.ledger.PoolStateLedger;
import org.apache.sluice.exec.workload.ledger.SlotKind;
import org.apache.sluice.exec.workload.ledger.SlotRequest;
import org.apache.sluice.exec.workload.ledger.exception.LedgerException;
import org.apache.sluice.exec.workload.ledger.exception.StalePoolConfigException;
import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.apache.sluice.exec.workload.request.RequestState;
import org.apache.sluice.exec.workload.request.WorkloadRequest;

/**
 * Handler of a pool with a concurrent query limit. Every request holds a
 * lease in the shared ledger: a running slot while it executes, a delayed
 * slot while it waits. The handler renews its leases on every tick and
 * promotes its waiting requests when the ledger says a running slot is free
 * and they are first in line.
 */
public class LimitedPoolHandler extends PoolHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LimitedPoolHandler.class);

  private static final Comparator<WorkloadRequest> ARRIVAL_ORDER =
      Comparator.comparingLong(WorkloadRequest::getArrivalTime);

  private final PoolStateLedger ledger;
  private final LedgerListener ledgerListener = changedPool -> fireLedgerChanged();

  /** Requests waiting on a delayed slot, keyed by request id. Event thread only. */
  private final Map<String, WorkloadRequest> queued = new HashMap<>();

  private volatile ScheduledFuture<?> tick;

  public LimitedPoolHandler(HandlerContext context, PoolConfig config) {
    super(context, config);
    this.ledger = context.getLedger();
  }

  @Override
  public boolean isLimited() {
    return true;
  }

  @Override
  public void start() {
    ledger.addListener(pool, ledgerListener);
    final long period = context.getLeaseRenewalPeriodMs();
    tick = context.getScheduler().scheduleWithFixedDelay(this::fireTick, period, period, TimeUnit.MILLISECONDS);
  }

  @Override
  protected void stop() {
    ledger.removeListener(pool, ledgerListener);
    if (tick != null) {
      tick.cancel(false);
    }
  }

  @Override
  protected void doAdmit(WorkloadRequest request) {
    try {
      final Lease running = acquire(SlotKind.RUNNING, request);
      if (endedMeanwhile(request, running)) {
        return;
      }
      if (running != null) {
        request.attachLease(running);
        admitted(request);
        return;
      }

      final Lease delayed = acquire(SlotKind.DELAYED, request);
      if (endedMeanwhile(request, delayed)) {
        return;
      }
      if (delayed == null) {
        end(request, RequestState.REJECTED, overloaded());
        return;
      }
      request.attachLease(delayed);
      queued.put(request.getRequestId(), request);
      context.getMetrics().queued();
      logger.debug("Request {} waits in the queue of pool {}", request.getRequestId(), pool);

      // a running slot may have been freed between the two acquisitions
      promoteQueued();
    } catch (LedgerException e) {
      end(request, RequestState.REJECTED, ledgerFailure(e, request));
    }
  }

  /**
   * Takes a slot, refreshing the configuration once if the ledger already saw a newer one.
   */
  private Lease acquire(SlotKind kind, WorkloadRequest request) throws LedgerException {
    try {
      return ledger.tryAcquireSlot(pool, kind, slotRequest(request));
    } catch (StalePoolConfigException e) {
      logger.info("Configuration version {} of pool {} is stale, version {} is in use; refreshing",
          getConfigVersion(), pool, e.getLatestVersion());
      final PoolConfig latest = context.getConfigStore().get(pool);
      if (latest == null || !latest.isSameGeneration(getConfig())) {
        // dropped, and possibly created again since
        markDeleted();
        return null;
      }
      reconcile(latest);
      if (request.getState().isTerminal()) {
        return null;
      }
      return ledger.tryAcquireSlot(pool, kind, slotRequest(request));
    }
  }

  private SlotRequest slotRequest(WorkloadRequest request) {
    return new SlotRequest(context.getNodeId(), request.getRequestId(), request.getArrivalTime(),
        context.getLeaseDurationMs(), getConfig());
  }

  /**
   * Gives back a fresh lease of a request that ended while the lease was taken.
   */
  private boolean endedMeanwhile(WorkloadRequest request, Lease lease) throws LedgerException {
    if (!request.getState().isTerminal()) {
      return false;
    }
    if (lease != null) {
      ledger.releaseSlot(pool, lease.getLeaseId());
    }
    requests.remove(request.getRequestId());
    return true;
  }

  @Override
  protected SlotKind releaseLease(WorkloadRequest request) {
    queued.remove(request.getRequestId());
    final String leaseId = request.getLeaseId();
    final SlotKind kind = request.detachLease();
    if (leaseId == null) {
      return null;
    }
    try {
      ledger.releaseSlot(pool, leaseId);
    } catch (LedgerException e) {
      context.getMetrics().releaseFailed();
      logger.error("Failed to release lease {} of request {} in pool {}, its {} slot stays taken for up to {} ms",
          leaseId, request.getRequestId(), pool, kind, context.getLeaseDurationMs(), e);
    }
    return kind;
  }

  @Override
  protected void onRunningSlotFreed() {
    promoteQueued();
  }

  @Override
  protected void onLedgerChanged() {
    if (!queued.isEmpty()) {
      promoteQueued();
    }
  }

  /**
   * Promotes local waiting requests for as long as the ledger agrees. Only
   * the request first in the cluster wide queue can win, so the attempt stops
   * at the first refusal among candidates of different arrival times.
   */
  private void promoteQueued() {
    boolean promoted = true;
    while (promoted && !queued.isEmpty()) {
      promoted = false;
      final List<WorkloadRequest> candidates = queued.values().stream()
          .sorted(ARRIVAL_ORDER)
          .collect(Collectors.toList());
      final long firstArrival = candidates.get(0).getArrivalTime();
      for (WorkloadRequest candidate : candidates) {
        if (candidate.getArrivalTime() != firstArrival) {
          break;
        }
        if (promote(candidate)) {
          promoted = true;
          break;
        }
      }
    }
  }

  private boolean promote(WorkloadRequest request) {
    final long expiry = System.currentTimeMillis() + context.getLeaseDurationMs();
    try {
      if (!ledger.promote(pool, request.getLeaseId(), getConfig().getConcurrentQueryLimit(), expiry)) {
        return false;
      }
    } catch (LedgerException e) {
      logger.warn("Failed to promote request {} in pool {}, retrying on the next tick",
          request.getRequestId(), pool, e);
      return false;
    }
    queued.remove(request.getRequestId());
    request.markRunning();
    logger.debug("Promoted request {} in pool {}", request.getRequestId(), pool);
    admitted(request);
    return true;
  }

  @Override
  protected void onTick() {
    try {
      renewLeases();
      ledger.reclaimExpired(pool);
    } catch (LedgerException e) {
      logger.warn("Lease maintenance of pool {} failed, retrying on the next tick", pool, e);
      return;
    }
    promoteQueued();
  }

  private void renewLeases() throws LedgerException {
    final Map<String, WorkloadRequest> byLease = new HashMap<>();
    for (WorkloadRequest request : requests.values()) {
      final String leaseId = request.getLeaseId();
      if (leaseId != null) {
        byLease.put(leaseId, request);
      }
    }
    if (byLease.isEmpty()) {
      return;
    }
    final long expiry = System.currentTimeMillis() + context.getLeaseDurationMs();
    final Set<String> lost = ledger.renewLeases(pool, context.getNodeId(), byLease.keySet(), expiry);
    for (String leaseId : lost) {
      final WorkloadRequest request = byLease.get(leaseId);
      logger.warn("Lease {} of request {} in pool {} was lost", leaseId, request.getRequestId(), pool);
      queued.remove(request.getRequestId());
      request.detachLease();
      end(request, RequestState.REJECTED, UserException.systemError(null)
          .message("Lease of request %s in resource pool %s was lost", request.getRequestId(), pool.getPoolId())
          .addContext("Node", context.getNodeId())
          .build(logger));
    }
  }

  @Override
  protected void onConfigChanged(PoolConfig previous, PoolConfig current) {
    if (queueShrunk(previous, current)) {
      try {
        final List<Lease> trimmed = ledger.trimQueue(pool, context.getNodeId(), current.getQueueSize());
        for (Lease lease : trimmed) {
          final WorkloadRequest request = requests.get(lease.getRequestId());
          if (request == null) {
            continue;
          }
          queued.remove(request.getRequestId());
          request.detachLease();
          end(request, RequestState.REJECTED, overloaded());
        }
      } catch (LedgerException e) {
        logger.warn("Failed to trim the queue of pool {} to {}", pool, current.getQueueSize(), e);
      }
    }
    promoteQueued();
  }

  private static boolean queueShrunk(PoolConfig previous, PoolConfig current) {
    if (current.getQueueSize() == PoolConfig.UNLIMITED) {
      return false;
    }
    return previous.getQueueSize() == PoolConfig.UNLIMITED || current.getQueueSize() < previous.getQueueSize();
  }

  /**
   * An unlimited successor admits everything, so the waiting requests run right away.
   */
  @Override
  protected void onRetire(PoolConfig successor) {
    if (successor.isLimited()) {
      return;
    }
    for (WorkloadRequest request : new ArrayList<>(queued.values())) {
      releaseLease(request);
      admitted(request);
    }
  }

  private UserException ledgerFailure(LedgerException e, WorkloadRequest request) {
    return UserException.systemError(e)
        .addContext("Pool", pool.toString())
        .addContext("Request", request.getRequestId())
        .build(logger);
  }
}
