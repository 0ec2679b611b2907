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
package org.apache.sluice.exec.workload.request;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

import com.google.common.base.Preconditions;
import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.ledger.Lease;
import org.apache.sluice.exec.workload.ledger.SlotKind;

/**
 * One request travelling through a pool. The handler owning the pool is the
 * only writer of the lease and timer fields; state transitions are guarded by
 * the request itself so that a halting node can fail requests from outside
 * the handler.
 *
 * <p>Clients observe the request through two futures: the admission future
 * completes when the request may run, or exceptionally when it is turned away
 * while queued; the interruption future completes when an admitted request is
 * cancelled or rejected.</p>
 */
public class WorkloadRequest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(WorkloadRequest.class);

  private final String requestId = UUID.randomUUID().toString();
  private final AdmissionRequest request;
  private final PoolKey pool;
  private final long arrivalTime;
  private final AdmissionTicket ticket;
  private final CompletableFuture<AdmissionTicket> admission = new CompletableFuture<>();
  private final CompletableFuture<UserException> interruption = new CompletableFuture<>();

  private RequestState state = RequestState.QUEUED;

  private volatile Consumer<WorkloadRequest> completionHandler;
  private volatile String leaseId;
  private volatile SlotKind slotKind;
  private volatile ScheduledFuture<?> deadline;

  public WorkloadRequest(AdmissionRequest request, PoolKey pool, long arrivalTime) {
    this.request = Preconditions.checkNotNull(request);
    this.pool = Preconditions.checkNotNull(pool);
    this.arrivalTime = arrivalTime;
    this.ticket = new AdmissionTicket(this);
  }

  public String getRequestId() {
    return requestId;
  }

  public AdmissionRequest getRequest() {
    return request;
  }

  public PoolKey getPool() {
    return pool;
  }

  public long getArrivalTime() {
    return arrivalTime;
  }

  public AdmissionTicket getTicket() {
    return ticket;
  }

  public CompletableFuture<AdmissionTicket> getAdmission() {
    return admission;
  }

  public CompletableFuture<UserException> getInterruption() {
    return interruption;
  }

  public synchronized RequestState getState() {
    return state;
  }

  /**
   * Moves the request to a new state and completes the matching future.
   *
   * <p>Transitions out of a terminal state are dropped with a warning, since
   * timers, completions and pool events race to end a request and only the
   * first one counts.</p>
   *
   * @param newState the target state
   * @param failure  the reason for CANCELLED and REJECTED, ignored otherwise
   * @return true if the transition took place, false if it was dropped
   * @throws IllegalStateException if the transition is not allowed
   */
  public boolean moveToState(RequestState newState, UserException failure) {
    final Runnable notification;
    synchronized (this) {
      logger.debug("Request {} in pool {}: {} -> {}", requestId, pool, state, newState);
      notification = transition(newState, failure);
    }
    if (notification == null) {
      return false;
    }
    // futures complete outside the lock, their callbacks may call back into the request
    notification.run();
    return true;
  }

  private Runnable transition(RequestState newState, UserException failure) {
    switch (state) {
      case QUEUED:
        switch (newState) {
          case ADMITTED:
            state = newState;
            return () -> admission.complete(ticket);
          case CANCELLED:
          case REJECTED:
            Preconditions.checkNotNull(failure, "a failure is required to end a request as %s", newState);
            state = newState;
            return () -> admission.completeExceptionally(failure);
          default:
        }
        break;

      case ADMITTED:
        switch (newState) {
          case COMPLETED:
            state = newState;
            return () -> { };
          case CANCELLED:
          case REJECTED:
            Preconditions.checkNotNull(failure, "a failure is required to end a request as %s", newState);
            state = newState;
            return () -> interruption.complete(failure);
          default:
        }
        break;

      case COMPLETED:
      case CANCELLED:
      case REJECTED:
        logger.warn("Dropping state change of request {} in pool {} from {} to {}",
            requestId, pool, state, newState);
        return null;

      default:
    }
    throw new IllegalStateException(String.format("Illegal state change of request %s in pool %s from %s to %s",
        requestId, pool, state, newState));
  }

  /**
   * Sets who is told when the client completes the request.
   */
  public void setCompletionHandler(Consumer<WorkloadRequest> completionHandler) {
    this.completionHandler = completionHandler;
  }

  void complete() {
    if (getState().isTerminal()) {
      return;
    }
    final Consumer<WorkloadRequest> handler = completionHandler;
    if (handler != null) {
      handler.accept(this);
    } else {
      moveToState(RequestState.COMPLETED, null);
    }
  }

  public void attachLease(Lease lease) {
    this.leaseId = lease.getLeaseId();
    this.slotKind = lease.getKind();
  }

  public void markRunning() {
    Preconditions.checkState(leaseId != null, "request %s holds no lease", requestId);
    this.slotKind = SlotKind.RUNNING;
  }

  /**
   * Forgets the lease.
   *
   * @return the kind of the slot the lease held, or null if there was none
   */
  public SlotKind detachLease() {
    final SlotKind kind = slotKind;
    leaseId = null;
    slotKind = null;
    return kind;
  }

  /**
   * @return the id of the held lease or null
   */
  public String getLeaseId() {
    return leaseId;
  }

  /**
   * @return the kind of the held slot or null
   */
  public SlotKind getSlotKind() {
    return slotKind;
  }

  public void setDeadline(ScheduledFuture<?> deadline) {
    this.deadline = deadline;
  }

  public void cancelDeadline() {
    final ScheduledFuture<?> timer = deadline;
    if (timer != null) {
      timer.cancel(false);
      deadline = null;
    }
  }

  @Override
  public String toString() {
    return "{ RequestId: " + requestId + ", Pool: " + pool + ", User: " + request.getUser() +
        ", Arrival: " + arrivalTime + ", State: " + getState() + "}";
  }
}
