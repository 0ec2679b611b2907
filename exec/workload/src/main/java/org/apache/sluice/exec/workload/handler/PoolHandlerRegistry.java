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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.apache.sluice.exec.workload.request.WorkloadRequest;

/**
 * Keeps one active handler per pool on this node.
 *
 * <p>A handler is created on the first request for its pool. When the pool
 * switches between limited and unlimited mode the active handler retires: it
 * finishes the requests it owns while a handler of the new mode takes the new
 * ones. A periodic refresh pushes configuration changes and pool deletion to
 * the handlers and closes handlers that went idle. The idle period of a
 * retired handler starts when it retires. A pool found with a new generation
 * was dropped and created again: its handler is treated as deleted and a
 * fresh one takes the new requests.</p>
 */
public class PoolHandlerRegistry implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PoolHandlerRegistry.class);

  private final HandlerContext context;
  private final long idleTimeoutMs;

  private final Map<PoolKey, PoolHandler> activeHandlers = new HashMap<>();
  private final List<PoolHandler> retiringHandlers = new ArrayList<>();

  private ScheduledFuture<?> refreshTask;

  public PoolHandlerRegistry(HandlerContext context, long idleTimeoutMs) {
    this.context = context;
    this.idleTimeoutMs = idleTimeoutMs;
  }

  public void start(long refreshPeriodMs) {
    context.getMetrics().registerActiveHandlers(this::getActiveHandlerCount);
    refreshTask = context.getScheduler().scheduleWithFixedDelay(this::refresh, refreshPeriodMs, refreshPeriodMs,
        TimeUnit.MILLISECONDS);
  }

  /**
   * Routes a request to the active handler of its pool.
   *
   * @param config the pool configuration the request was checked against
   */
  public synchronized void submit(PoolConfig config, WorkloadRequest request) {
    PoolHandler handler = activeHandlers.get(config.getKey());
    if (handler != null && config.getGeneration() > handler.getConfig().getGeneration()) {
      dropped(handler);
      handler = null;
    } else if (handler != null && config.isNewerThan(handler.getConfig())) {
      if (handler.isLimited() != config.isLimited()) {
        retire(handler, config);
        handler = null;
      } else {
        handler.updateConfig(config);
      }
    }
    if (handler == null) {
      handler = create(config);
    }
    handler.submit(request);
  }

  /**
   * @return active plus retiring handlers
   */
  public synchronized int getActiveHandlerCount() {
    return activeHandlers.size() + retiringHandlers.size();
  }

  /**
   * @return number of requests of the pool admitted on this node
   */
  public synchronized int getAdmittedCount(PoolKey pool) {
    int admitted = 0;
    final PoolHandler active = activeHandlers.get(pool);
    if (active != null) {
      admitted += active.getAdmittedCount();
    }
    for (PoolHandler retiring : retiringHandlers) {
      if (retiring.getPool().equals(pool)) {
        admitted += retiring.getAdmittedCount();
      }
    }
    return admitted;
  }

  void refresh() {
    try {
      final Map<PoolKey, PoolHandler> snapshot;
      synchronized (this) {
        snapshot = new HashMap<>(activeHandlers);
      }
      for (Map.Entry<PoolKey, PoolHandler> entry : snapshot.entrySet()) {
        final PoolConfig latest;
        try {
          latest = context.getConfigStore().get(entry.getKey());
        } catch (RuntimeException e) {
          logger.warn("Failed to refresh the configuration of pool {}", entry.getKey(), e);
          continue;
        }
        refresh(entry.getValue(), latest);
      }
      closeIdleHandlers(System.currentTimeMillis());
    } catch (RuntimeException e) {
      logger.error("Pool handler refresh failed", e);
    }
  }

  private synchronized void refresh(PoolHandler handler, PoolConfig latest) {
    final PoolKey pool = handler.getPool();
    if (activeHandlers.get(pool) != handler) {
      return;
    }
    if (latest == null || !latest.isSameGeneration(handler.getConfig())) {
      dropped(handler);
      return;
    }
    if (!latest.isNewerThan(handler.getConfig())) {
      return;
    }
    if (latest.isLimited() != handler.isLimited()) {
      retire(handler, latest);
      create(latest);
    } else {
      handler.updateConfig(latest);
    }
  }

  private synchronized void closeIdleHandlers(long now) {
    final Iterator<PoolHandler> active = activeHandlers.values().iterator();
    while (active.hasNext()) {
      final PoolHandler handler = active.next();
      if (handler.isIdle(now, idleTimeoutMs)) {
        active.remove();
        handler.close();
        logger.debug("Closed idle handler {}", handler);
      }
    }
    final Iterator<PoolHandler> retiring = retiringHandlers.iterator();
    while (retiring.hasNext()) {
      final PoolHandler handler = retiring.next();
      if (handler.isIdle(now, idleTimeoutMs)) {
        retiring.remove();
        handler.close();
        logger.debug("Closed retired handler {}", handler);
      }
    }
  }

  private PoolHandler create(PoolConfig config) {
    final PoolHandler handler = config.isLimited()
        ? new LimitedPoolHandler(context, config)
        : new UnlimitedPoolHandler(context, config);
    handler.start();
    activeHandlers.put(config.getKey(), handler);
    logger.info("Started {}", handler);
    return handler;
  }

  private void dropped(PoolHandler handler) {
    logger.info("Resource pool {} was dropped", handler.getPool());
    activeHandlers.remove(handler.getPool());
    retiringHandlers.add(handler);
    handler.poolDeleted();
  }

  private void retire(PoolHandler handler, PoolConfig successor) {
    activeHandlers.remove(handler.getPool());
    retiringHandlers.add(handler);
    handler.retire(successor);
    logger.info("Retiring {}, pool switches to {} mode", handler, successor.isLimited() ? "limited" : "unlimited");
  }

  private synchronized List<PoolHandler> takeAll() {
    if (refreshTask != null) {
      refreshTask.cancel(false);
    }
    final List<PoolHandler> handlers = new ArrayList<>(activeHandlers.values());
    handlers.addAll(retiringHandlers);
    activeHandlers.clear();
    retiringHandlers.clear();
    return handlers;
  }

  /**
   * Stops all handlers without touching the ledger.
   */
  public void halt() {
    for (PoolHandler handler : takeAll()) {
      handler.halt();
    }
  }

  /**
   * Fails the requests of all handlers and releases their leases.
   */
  @Override
  public void close() {
    for (PoolHandler handler : takeAll()) {
      try {
        handler.shutdown();
      } catch (RuntimeException e) {
        logger.warn("Failed to shut down {}", handler, e);
      }
    }
  }
}
