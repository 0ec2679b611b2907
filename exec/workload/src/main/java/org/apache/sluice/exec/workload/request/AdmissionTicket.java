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

import java.util.concurrent.CompletableFuture;

import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Handed to the caller once its request is admitted. The caller must call
 * {@link #complete()} when execution ends, successfully or not, so that the
 * slot goes back to the pool.
 */
public final class AdmissionTicket {
  private final WorkloadRequest request;

  AdmissionTicket(WorkloadRequest request) {
    this.request = request;
  }

  public String getRequestId() {
    return request.getRequestId();
  }

  public PoolKey getPool() {
    return request.getPool();
  }

  /**
   * Completes with the reason if the pool ends the request while it runs:
   * cancellation after the pool's timeout, pool deletion, revoked access or a
   * lost lease.
   */
  public CompletableFuture<UserException> getInterruption() {
    return request.getInterruption();
  }

  /**
   * Releases the slot. Calling it more than once, or after an interruption, has no effect.
   */
  public void complete() {
    request.complete();
  }

  @Override
  public String toString() {
    return "Ticket of request " + request.getRequestId() + " in pool " + request.getPool();
  }
}
