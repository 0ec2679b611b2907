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
package org.apache.sluice.exec;

public final class ExecConstants {
  private ExecConstants() {
    // Don't allow instantiation
  }

  public static final String ZK_CONNECTION = "sluice.exec.zk.connect";
  public static final String ZK_TIMEOUT = "sluice.exec.zk.timeout";
  public static final String ZK_ROOT = "sluice.exec.zk.root";
  public static final String ZK_RETRY_TIMES = "sluice.exec.zk.retry.count";
  public static final String ZK_RETRY_DELAY = "sluice.exec.zk.retry.delay";

  public static final String METRICS_LOG_OUTPUT_ENABLED = "sluice.metrics.log_output.enabled";
  public static final String METRICS_LOG_OUTPUT_INTERVAL = "sluice.metrics.log_output.interval";

  /** When disabled every request bypasses resource pools and runs immediately. */
  public static final String WORKLOAD_ENABLED = "sluice.exec.workload.enabled";

  /** Validity of a slot lease; leases not renewed within this window may be reclaimed by any node. */
  public static final String WORKLOAD_LEASE_DURATION = "sluice.exec.workload.lease_duration";
  public static final String WORKLOAD_LEASE_RENEWAL_PERIOD = "sluice.exec.workload.lease_renewal_period";
  public static final String WORKLOAD_POOL_REFRESH_PERIOD = "sluice.exec.workload.pool_refresh_period";
  public static final String WORKLOAD_HANDLER_IDLE_TIMEOUT = "sluice.exec.workload.handler_idle_timeout";
  public static final String WORKLOAD_WORKER_THREADS = "sluice.exec.workload.worker_threads";
  public static final String WORKLOAD_LEDGER_MAX_UPDATE_ATTEMPTS = "sluice.exec.workload.ledger.max_update_attempts";
  public static final String WORKLOAD_LEDGER_RETRY_BACKOFF = "sluice.exec.workload.ledger.retry_backoff";

  public static final String DEFAULT_POOL_CONCURRENT_QUERY_LIMIT =
      "sluice.exec.workload.default_pool.concurrent_query_limit";
  public static final String DEFAULT_POOL_QUEUE_SIZE = "sluice.exec.workload.default_pool.queue_size";
  public static final String DEFAULT_POOL_QUERY_CANCEL_AFTER = "sluice.exec.workload.default_pool.query_cancel_after";
  public static final String DEFAULT_POOL_QUERY_MEMORY_LIMIT_PERCENT_PER_NODE =
      "sluice.exec.workload.default_pool.query_memory_limit_percent_per_node";
}
