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

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

import org.apache.sluice.exec.metrics.WorkloadMetrics;
import org.apache.sluice.exec.workload.ledger.PoolStateLedger;
import org.apache.sluice.exec.workload.pool.PoolAccessChecker;
import org.apache.sluice.exec.workload.pool.PoolConfigStore;

/**
 * Node wide collaborators shared by all pool handlers of one workload service.
 */
public class HandlerContext {
  private final String nodeId;
  private final PoolStateLedger ledger;
  private final PoolConfigStore configStore;
  private final PoolAccessChecker accessChecker;
  private final Executor executor;
  private final ScheduledExecutorService scheduler;
  private final WorkloadMetrics metrics;
  private final long leaseDurationMs;
  private final long leaseRenewalPeriodMs;

  public HandlerContext(String nodeId, PoolStateLedger ledger, PoolConfigStore configStore,
                        PoolAccessChecker accessChecker, Executor executor, ScheduledExecutorService scheduler,
                        WorkloadMetrics metrics, long leaseDurationMs, long leaseRenewalPeriodMs) {
    this.nodeId = nodeId;
    this.ledger = ledger;
    this.configStore = configStore;
    this.accessChecker = accessChecker;
    this.executor = executor;
    this.scheduler = scheduler;
    this.metrics = metrics;
    this.leaseDurationMs = leaseDurationMs;
    this.leaseRenewalPeriodMs = leaseRenewalPeriodMs;
  }

  public String getNodeId() {
    return nodeId;
  }

  public PoolStateLedger getLedger() {
    return ledger;
  }

  public PoolConfigStore getConfigStore() {
    return configStore;
  }

  public PoolAccessChecker getAccessChecker() {
    return accessChecker;
  }

  /**
   * Runs handler events, including all ledger I/O.
   */
  public Executor getExecutor() {
    return executor;
  }

  /**
   * Runs timers only: deadlines, lease renewal ticks and the registry refresh.
   */
  public ScheduledExecutorService getScheduler() {
    return scheduler;
  }

  public WorkloadMetrics getMetrics() {
    return metrics;
  }

  public long getLeaseDurationMs() {
    return leaseDurationMs;
  }

  public long getLeaseRenewalPeriodMs() {
    return leaseRenewalPeriodMs;
  }
}
