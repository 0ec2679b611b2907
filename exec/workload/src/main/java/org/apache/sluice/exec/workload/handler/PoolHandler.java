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
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.apache.sluice.common.EventProcessor;
import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.ledger.SlotKind;
import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.apache.sluice.exec.workload.request.AdmissionRequest;
import org.apache.sluice.exec.workload.request.RequestState;
import org.apache.sluice.exec.workload.request.WorkloadRequest;

/**
 * Admission state machine of one pool on one node.
 *
 * <p>Everything that happens to the pool's requests on this node arrives as
 * an event: new requests, completions, deadlines, configuration changes, pool
 * deletion, lease renewal ticks and ledger change notifications. Events run
 * on the service's worker pool but are processed one at a time, so a handler
 * is the single writer of its requests and never needs to lock its own
 * state.</p>
 *
 * <p>Subclasses decide how requests are admitted: {@link UnlimitedPoolHandler}
 * admits everything right away, {@link LimitedPoolHandler} takes slots from
 * the shared ledger.</p>
 */
public abstract class PoolHandler implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PoolHandler.class);

  enum EventType {
    ADMIT,
    COMPLETE,
    DEADLINE,
    CONFIG,
    RETIRE,
    DELETED,
    TICK,
    LEDGER_CHANGED,
    SHUTDOWN
  }

  static final class HandlerEvent {
    final EventType type;
    final WorkloadRequest request;
    final PoolConfig config;

    HandlerEvent(EventType type, WorkloadRequest request, PoolConfig config) {
      this.type = type;
      this.request = request;
      this.config = config;
    }

    @Override
    public String toString() {
      return type + (request == null ? "" : " of request " + request.getRequestId());
    }
  }

  private class HandlerEventProcessor extends EventProcessor<HandlerEvent> {
    @Override
    protected void processEvent(HandlerEvent event) {
      if (stopped) {
        logger.debug("Dropping {} in pool {}, handler is stopped", event, pool);
        return;
      }
      switch (event.type) {
        case ADMIT:
          admit(event.request);
          break;
        case COMPLETE:
          end(event.request, RequestState.COMPLETED, null);
          break;
        case DEADLINE:
          deadlineReached(event.request);
          break;
        case CONFIG:
          reconcile(event.config);
          break;
        case RETIRE:
          onRetire(event.config);
          break;
        case DELETED:
          markDeleted();
          break;
        case TICK:
          onTick();
          break;
        case LEDGER_CHANGED:
          onLedgerChanged();
          break;
        case SHUTDOWN:
          rejectAll(() -> UserException.systemError(null)
              .message("Workload service on node %s is shutting down", context.getNodeId())
              .addContext("Pool", pool.toString())
              .build(logger));
          stopped = true;
          stop();
          break;
        default:
          throw new IllegalStateException("Unknown handler event " + event.type);
      }
    }
  }

  protected final HandlerContext context;
  protected final PoolKey pool;

  /** Requests owned by this handler that did not reach a terminal state yet. */
  protected final Map<String, WorkloadRequest> requests = new ConcurrentHashMap<>();

  private final EventProcessor<HandlerEvent> events = new HandlerEventProcessor();

  private volatile PoolConfig config;
  private volatile long lastActivity = System.currentTimeMillis();
  private volatile boolean retired;
  private volatile boolean deleted;
  private volatile boolean stopped;

  protected PoolHandler(HandlerContext context, PoolConfig config) {
    this.context = context;
    this.pool = config.getKey();
    this.config = config;
  }

  /**
   * Limited handlers account their requests in the ledger.
   */
  public abstract boolean isLimited();

  /**
   * Tries to admit a request that passed the common checks. Runs on the event thread.
   */
  protected abstract void doAdmit(WorkloadRequest request);

  /**
   * Starts timers and subscriptions. Called once by the registry after construction.
   */
  public void start() {
  }

  /**
   * Stops timers and subscriptions. Must not touch the ledger.
   */
  protected void stop() {
  }

  /**
   * Hands back the lease of a request that is about to end.
   *
   * @return the kind of slot the request held, null if it held none
   */
  protected SlotKind releaseLease(WorkloadRequest request) {
    return request.detachLease();
  }

  protected void onRunningSlotFreed() {
  }

  protected void onConfigChanged(PoolConfig previous, PoolConfig current) {
  }

  protected void onRetire(PoolConfig successor) {
  }

  protected void onTick() {
  }

  protected void onLedgerChanged() {
  }

  public PoolKey getPool() {
    return pool;
  }

  public PoolConfig getConfig() {
    return config;
  }

  public long getConfigVersion() {
    return config.getVersion();
  }

  public boolean isRetired() {
    return retired;
  }

  public int getRequestCount() {
    return requests.size();
  }

  /**
   * @return the number of owned requests that are admitted and not finished yet
   */
  public int getAdmittedCount() {
    int admitted = 0;
    for (WorkloadRequest request : requests.values()) {
      if (request.getState() == RequestState.ADMITTED) {
        admitted++;
      }
    }
    return admitted;
  }

  /**
   * A handler is idle once it owns no request and nothing happened to it for the given time.
   */
  public boolean isIdle(long now, long idleTimeoutMs) {
    return requests.isEmpty() && events.getQueuedEventCount() == 0 && now - lastActivity >= idleTimeoutMs;
  }

  public void submit(WorkloadRequest request) {
    requests.put(request.getRequestId(), request);
    lastActivity = System.currentTimeMillis();
    request.setCompletionHandler(completed -> dispatch(new HandlerEvent(EventType.COMPLETE, completed, null)));
    dispatch(new HandlerEvent(EventType.ADMIT, request, null));
  }

  public void updateConfig(PoolConfig newConfig) {
    dispatch(new HandlerEvent(EventType.CONFIG, null, newConfig));
  }

  /**
   * Tells the handler that a handler of the other mode took over the pool.
   * The retired handler accepts no new requests but sees its own ones through.
   */
  public void retire(PoolConfig successor) {
    retired = true;
    lastActivity = System.currentTimeMillis();
    dispatch(new HandlerEvent(EventType.RETIRE, null, successor));
  }

  public void poolDeleted() {
    deleted = true;
    lastActivity = System.currentTimeMillis();
    dispatch(new HandlerEvent(EventType.DELETED, null, null));
  }

  protected void fireTick() {
    dispatch(new HandlerEvent(EventType.TICK, null, null));
  }

  protected void fireLedgerChanged() {
    dispatch(new HandlerEvent(EventType.LEDGER_CHANGED, null, null));
  }

  /**
   * Fails all owned requests and releases their leases. Processed in order
   * with the pending events, on the calling thread if the handler is idle.
   */
  public void shutdown() {
    events.sendEvent(new HandlerEvent(EventType.SHUTDOWN, null, null));
  }

  /**
   * Stops at once, the way a crashing node would: requests fail but leases
   * stay in the ledger until they expire.
   */
  public void halt() {
    stopped = true;
    stop();
    for (WorkloadRequest request : new ArrayList<>(requests.values())) {
      request.cancelDeadline();
      request.moveToState(RequestState.REJECTED, UserException.systemError(null)
          .message("Workload service on node %s was halted", context.getNodeId())
          .addContext("Pool", pool.toString())
          .build(logger));
    }
    requests.clear();
  }

  /**
   * Releases timers and subscriptions of a handler that owns no requests anymore.
   */
  @Override
  public void close() {
    stopped = true;
    stop();
  }

  private void dispatch(HandlerEvent event) {
    try {
      context.getExecutor().execute(() -> {
        try {
          events.sendEvent(event);
        } catch (RuntimeException e) {
          logger.error("Failure while processing {} in pool {}", event, pool, e);
        }
      });
    } catch (RejectedExecutionException e) {
      if (stopped) {
        logger.debug("Dropping {} in pool {}, handler is stopped", event, pool);
      } else {
        logger.warn("Dropping {} in pool {}, executor rejected it", event, pool, e);
      }
    }
  }

  private void admit(WorkloadRequest request) {
    if (request.getState().isTerminal()) {
      requests.remove(request.getRequestId());
      return;
    }
    if (deleted) {
      end(request, RequestState.REJECTED, notFound());
      return;
    }
    final PoolConfig current = config;
    if (current.isDisabled()) {
      end(request, RequestState.REJECTED, disabled());
      return;
    }
    if (current.hasQueryCancelAfter()) {
      scheduleDeadline(request, current.getQueryCancelAfterMs());
    }
    doAdmit(request);
  }

  private void scheduleDeadline(WorkloadRequest request, long cancelAfterMs) {
    final long delay = Math.max(0, request.getArrivalTime() + cancelAfterMs - System.currentTimeMillis());
    request.setDeadline(context.getScheduler().schedule(
        () -> dispatch(new HandlerEvent(EventType.DEADLINE, request, null)), delay, TimeUnit.MILLISECONDS));
  }

  private void deadlineReached(WorkloadRequest request) {
    if (request.getState().isTerminal()) {
      return;
    }
    end(request, RequestState.CANCELLED, UserException.cancellationError()
        .message("Request was cancelled after %d ms in resource pool %s",
            config.getQueryCancelAfterMs(), pool.getPoolId())
        .addContext("Request", request.getRequestId())
        .build(logger));
  }

  /**
   * Adopts a newer configuration and ends the requests it no longer allows.
   */
  protected void reconcile(PoolConfig newConfig) {
    final PoolConfig previous = config;
    if (!newConfig.isSameGeneration(previous) || !newConfig.isNewerThan(previous)) {
      return;
    }
    config = newConfig;
    logger.info("Pool {} moves from configuration version {} to {}", pool, previous.getVersion(),
        newConfig.getVersion());

    for (WorkloadRequest request : new ArrayList<>(requests.values())) {
      final AdmissionRequest principal = request.getRequest();
      if (!context.getAccessChecker().hasAccess(newConfig, principal.getUser(), principal.getGroups())) {
        end(request, RequestState.REJECTED, permissionDenied(principal.getUser()));
      }
    }
    if (newConfig.isDisabled()) {
      for (WorkloadRequest request : new ArrayList<>(requests.values())) {
        if (request.getState() == RequestState.QUEUED) {
          end(request, RequestState.REJECTED, disabled());
        }
      }
    }
    if (newConfig.isLimited() == isLimited()) {
      onConfigChanged(previous, newConfig);
    }
  }

  /**
   * Ends a request: gives back its lease, forgets it and moves it to its final state.
   */
  protected void end(WorkloadRequest request, RequestState state, UserException failure) {
    request.cancelDeadline();
    requests.remove(request.getRequestId());
    lastActivity = System.currentTimeMillis();
    final SlotKind released = releaseLease(request);
    if (request.moveToState(state, failure)) {
      context.getMetrics().entered(state);
    }
    if (released == SlotKind.RUNNING) {
      onRunningSlotFreed();
    }
  }

  /**
   * Moves a request that holds a running slot, or needs none, to ADMITTED.
   */
  protected void admitted(WorkloadRequest request) {
    if (request.moveToState(RequestState.ADMITTED, null)) {
      context.getMetrics().entered(RequestState.ADMITTED);
      logger.debug("Admitted request {} in pool {}", request.getRequestId(), pool);
    } else {
      // ended while the slot was taken
      requests.remove(request.getRequestId());
      if (releaseLease(request) == SlotKind.RUNNING) {
        onRunningSlotFreed();
      }
    }
  }

  protected void rejectAll(Supplier<UserException> failure) {
    final Collection<WorkloadRequest> owned = new ArrayList<>(requests.values());
    for (WorkloadRequest request : owned) {
      end(request, RequestState.REJECTED, failure.get());
    }
  }

  protected void markDeleted() {
    deleted = true;
    rejectAll(this::notFound);
  }

  protected UserException overloaded() {
    return UserException.overloadedError()
        .message("Too many pending requests for pool %s", pool.getPoolId())
        .addContext("Database", pool.getDatabase())
        .build(logger);
  }

  protected UserException disabled() {
    return UserException.preconditionError()
        .message("Resource pool %s was disabled due to zero concurrent query limit", pool.getPoolId())
        .addContext("Database", pool.getDatabase())
        .build(logger);
  }

  protected UserException notFound() {
    return UserException.notFoundError()
        .message("Resource pool %s not found", pool.getPoolId())
        .addContext("Database", pool.getDatabase())
        .build(logger);
  }

  protected UserException permissionDenied(String user) {
    return UserException.permissionError()
        .message("You don't have access permissions for resource pool %s", pool.getPoolId())
        .addContext("User", user)
        .build(logger);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{ Pool: " + pool + ", Version: " + getConfigVersion() +
        ", Requests: " + requests.size() + (retired ? ", retired" : "") + "}";
  }
}
