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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.metrics.WorkloadMetrics;
import org.apache.sluice.exec.workload.handler.HandlerContext;
import org.apache.sluice.exec.workload.handler.PoolHandlerRegistry;
import org.apache.sluice.exec.workload.ledger.PoolStateDescription;
import org.apache.sluice.exec.workload.ledger.PoolStateLedger;
import org.apache.sluice.exec.workload.ledger.exception.LedgerException;
import org.apache.sluice.exec.workload.pool.PoolAccessChecker;
import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.apache.sluice.exec.workload.pool.PoolConfigStore;
import org.apache.sluice.exec.workload.pool.ResourcePoolDdl;
import org.apache.sluice.exec.workload.request.AdmissionRequest;
import org.apache.sluice.exec.workload.request.AdmissionTicket;
import org.apache.sluice.exec.workload.request.QueryExecutor;
import org.apache.sluice.exec.workload.request.QueryResult;
import org.apache.sluice.exec.workload.request.RequestState;
import org.apache.sluice.exec.workload.request.WorkloadRequest;

/**
 * Admission control of one node.
 *
 * <p>A request names a database and a resource pool. The service resolves the
 * pool's configuration, creating the database's {@code default} pool on first
 * use, checks that the principal may use the pool and hands the request to
 * the pool's handler, which admits, queues or rejects it. Limited pools are
 * accounted in a {@link PoolStateLedger} shared by all nodes, so their limits
 * hold across the cluster.</p>
 *
 * <p>The configuration store and the ledger are shared with other nodes and
 * stay open when the service closes.</p>
 */
public class WorkloadService implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(WorkloadService.class);

  private static final long TERMINATION_TIMEOUT_SECONDS = 10;

  private final String nodeId;
  private final PoolConfigStore configStore;
  private final PoolStateLedger ledger;
  private final PoolAccessChecker accessChecker;
  private final ResourcePoolDdl ddl;
  private final boolean enabled;
  private final long poolRefreshPeriodMs;
  private final ExecutorService executor;
  private final ScheduledThreadPoolExecutor scheduler;
  private final WorkloadMetrics metrics;
  private final PoolHandlerRegistry registry;
  private final Cache<PoolKey, PoolConfig> poolConfigs;

  private volatile boolean closed;

  public WorkloadService(SluiceConfig config, String nodeId, PoolConfigStore configStore, PoolStateLedger ledger,
                         PoolAccessChecker accessChecker, MetricRegistry metricRegistry) {
    this.nodeId = nodeId;
    this.configStore = configStore;
    this.ledger = ledger;
    this.accessChecker = accessChecker;
    this.ddl = new ResourcePoolDdl(configStore, config);
    this.enabled = config.getBoolean(ExecConstants.WORKLOAD_ENABLED);
    this.poolRefreshPeriodMs = config.getDuration(ExecConstants.WORKLOAD_POOL_REFRESH_PERIOD).toMillis();

    this.executor = Executors.newFixedThreadPool(config.getInt(ExecConstants.WORKLOAD_WORKER_THREADS),
        new ThreadFactoryBuilder()
            .setNameFormat("workload-" + nodeId + "-worker-%d")
            .setDaemon(true)
            .build());
    this.scheduler = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
        .setNameFormat("workload-" + nodeId + "-timer-%d")
        .setDaemon(true)
        .build());
    this.scheduler.setRemoveOnCancelPolicy(true);

    this.metrics = new WorkloadMetrics(metricRegistry, config);
    this.poolConfigs = CacheBuilder.newBuilder()
        .expireAfterWrite(poolRefreshPeriodMs, TimeUnit.MILLISECONDS)
        .build();

    final HandlerContext context = new HandlerContext(nodeId, ledger, configStore, accessChecker, executor,
        scheduler, metrics,
        config.getDuration(ExecConstants.WORKLOAD_LEASE_DURATION).toMillis(),
        config.getDuration(ExecConstants.WORKLOAD_LEASE_RENEWAL_PERIOD).toMillis());
    this.registry = new PoolHandlerRegistry(context,
        config.getDuration(ExecConstants.WORKLOAD_HANDLER_IDLE_TIMEOUT).toMillis());
  }

  public void start() {
    registry.start(poolRefreshPeriodMs);
    logger.info("Workload service started on node {}, resource pools {}", nodeId, enabled ? "enabled" : "disabled");
  }

  public String getNodeId() {
    return nodeId;
  }

  /**
   * Asks for admission of a request.
   *
   * @return a future completing with the ticket once the request may run, or
   *         exceptionally with a {@link UserException} if it is rejected or
   *         cancelled before that
   */
  public CompletableFuture<AdmissionTicket> admit(AdmissionRequest request) {
    final PoolKey key = new PoolKey(request.getDatabase(), request.getPoolId());
    if (closed) {
      return CompletableFuture.failedFuture(UserException.systemError(null)
          .message("Workload service on node %s is closed", nodeId)
          .build(logger));
    }
    final WorkloadRequest workloadRequest = new WorkloadRequest(request, key, System.currentTimeMillis());
    if (!enabled) {
      workloadRequest.moveToState(RequestState.ADMITTED, null);
      return workloadRequest.getAdmission();
    }

    try {
      final PoolConfig pool = resolvePool(key);
      if (!accessChecker.hasAccess(pool, request.getUser(), request.getGroups())) {
        throw UserException.permissionError()
            .message("You don't have access permissions for resource pool %s", key.getPoolId())
            .addContext("User", request.getUser())
            .build(logger);
      }
      registry.submit(pool, workloadRequest);
    } catch (UserException e) {
      return CompletableFuture.failedFuture(e);
    }
    return workloadRequest.getAdmission();
  }

  /**
   * Admits the request, runs it and completes its ticket when the execution ends.
   * Never completes exceptionally; failures are reported in the result.
   */
  public CompletableFuture<QueryResult> executeQuery(AdmissionRequest request, QueryExecutor queryExecutor) {
    final CompletableFuture<QueryResult> result = new CompletableFuture<>();
    admit(request).whenComplete((ticket, admissionFailure) -> {
      if (admissionFailure != null) {
        result.complete(QueryResult.failure(toUserException(admissionFailure)));
        return;
      }

      final CompletableFuture<?> execution;
      try {
        execution = queryExecutor.execute(request, ticket);
      } catch (RuntimeException e) {
        ticket.complete();
        result.complete(QueryResult.failure(toUserException(e)));
        return;
      }
      ticket.getInterruption().thenAccept(interruption -> result.complete(QueryResult.failure(interruption)));
      execution.whenComplete((ignored, executionFailure) -> {
        ticket.complete();
        result.complete(executionFailure == null
            ? QueryResult.success()
            : QueryResult.failure(toUserException(executionFailure)));
      });
    });
    return result;
  }

  /**
   * Running and delayed requests of a pool. Limited pools report the cluster
   * wide ledger state, unlimited pools the requests running on this node.
   */
  public PoolStateDescription getPoolDescription(String database, String poolId) {
    final PoolKey key = new PoolKey(database, poolId);
    final PoolConfig pool = configStore.get(key);
    if (pool == null) {
      throw UserException.notFoundError()
          .message("Resource pool %s not found", poolId)
          .addContext("Database", database)
          .build(logger);
    }
    if (!pool.isLimited()) {
      return new PoolStateDescription(registry.getAdmittedCount(key), 0);
    }
    try {
      return ledger.readState(key);
    } catch (LedgerException e) {
      throw UserException.systemError(e)
          .addContext("Pool", key.toString())
          .build(logger);
    }
  }

  public int getActiveHandlerCount() {
    return registry.getActiveHandlerCount();
  }

  @VisibleForTesting
  public MetricRegistry getMetricRegistry() {
    return metrics.getRegistry();
  }

  private PoolConfig resolvePool(PoolKey key) {
    final PoolConfig cached = poolConfigs.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    final PoolConfig pool = PoolConfig.DEFAULT_POOL_ID.equals(key.getPoolId())
        ? ddl.ensureDefaultPool(key.getDatabase())
        : configStore.get(key);
    if (pool == null) {
      throw UserException.notFoundError()
          .message("Resource pool %s not found", key.getPoolId())
          .addContext("Database", key.getDatabase())
          .build(logger);
    }
    poolConfigs.put(key, pool);
    return pool;
  }

  private static UserException toUserException(Throwable failure) {
    Throwable cause = failure;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof UserException) {
      return (UserException) cause;
    }
    return UserException.systemError(cause).build(logger);
  }

  /**
   * Stops the node as if it crashed: pending requests fail, leases stay in
   * the ledger until they expire.
   */
  public void halt() {
    closed = true;
    registry.halt();
    executor.shutdownNow();
    scheduler.shutdownNow();
    metrics.close();
    logger.info("Workload service on node {} halted", nodeId);
  }

  /**
   * Fails in-flight requests, releases their leases and stops the service.
   */
  @Override
  public void close() throws Exception {
    if (closed) {
      return;
    }
    closed = true;
    registry.close();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("Workload service on node {} did not finish pending work in {} seconds",
            nodeId, TERMINATION_TIMEOUT_SECONDS);
        executor.shutdownNow();
      }
    } finally {
      scheduler.shutdownNow();
      metrics.close();
    }
    logger.info("Workload service on node {} closed", nodeId);
  }
}
