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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import org.apache.sluice.exec.workload.request.AdmissionRequest;
import org.apache.sluice.exec.workload.request.AdmissionTicket;
import org.apache.sluice.exec.workload.request.QueryExecutor;

import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Executor that holds started queries until exactly {@code expectedInFlight}
 * of them run at once, then lets the whole batch finish. A pool that admits
 * fewer queries than its limit stalls the coordinator; one that admits more
 * trips its assertion.
 */
public class InFlightCoordinator implements QueryExecutor {
  private final int expectedInFlight;
  private final CountDownLatch finished;

  private final List<CompletableFuture<Void>> pending = new ArrayList<>();
  private int remaining;
  private AssertionError failure;

  public InFlightCoordinator(int numberRequests, int expectedInFlight) {
    Preconditions.checkArgument(numberRequests > 0, "At least one request should be started");
    this.expectedInFlight = expectedInFlight;
    this.remaining = numberRequests;
    this.finished = new CountDownLatch(numberRequests);
  }

  @Override
  public CompletableFuture<?> execute(AdmissionRequest request, AdmissionTicket ticket) {
    final CompletableFuture<Void> execution = new CompletableFuture<>();
    final List<CompletableFuture<Void>> batch;
    synchronized (this) {
      pending.add(execution);
      if (pending.size() > expectedInFlight && failure == null) {
        failure = new AssertionError("Too many in flight requests: " + pending.size() + " > " + expectedInFlight);
      }
      batch = nextBatch();
    }
    for (CompletableFuture<Void> started : batch) {
      started.complete(null);
      finished.countDown();
    }
    return execution;
  }

  private List<CompletableFuture<Void>> nextBatch() {
    if (pending.size() < Math.min(expectedInFlight, remaining)) {
      return new ArrayList<>();
    }
    final List<CompletableFuture<Void>> batch = new ArrayList<>(pending);
    pending.clear();
    remaining -= batch.size();
    return batch;
  }

  /**
   * Waits for all requests to finish and rethrows a recorded violation.
   */
  public void awaitAll(long timeoutMs) throws InterruptedException {
    final boolean done = finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    synchronized (this) {
      if (failure != null) {
        throw failure;
      }
      if (!done) {
        fail("Stalled with " + pending.size() + " in flight requests and " + remaining + " remaining");
      }
      assertTrue("Too many requests started", pending.isEmpty());
    }
  }
}
