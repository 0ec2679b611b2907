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
package org.apache.sluice.exec.metrics;

import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.workload.request.RequestState;

/**
 * Metrics of one workload service. Each service gets its own registry so that
 * several nodes can live in one JVM.
 */
public class WorkloadMetrics implements AutoCloseable {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(WorkloadMetrics.class);

  public static final String ACTIVE_HANDLERS = "sluice.workload.pool_handlers.active";
  public static final String REQUESTS_ADMITTED = "sluice.workload.requests.admitted";
  public static final String REQUESTS_QUEUED = "sluice.workload.requests.queued";
  public static final String REQUESTS_REJECTED = "sluice.workload.requests.rejected";
  public static final String REQUESTS_CANCELLED = "sluice.workload.requests.cancelled";
  public static final String REQUESTS_COMPLETED = "sluice.workload.requests.completed";
  public static final String LEASE_RELEASE_FAILURES = "sluice.workload.leases.release_failures";

  private final MetricRegistry registry;
  private final Counter admitted;
  private final Counter queued;
  private final Counter rejected;
  private final Counter cancelled;
  private final Counter completed;
  private final Counter releaseFailures;
  private final Slf4jReporter logReporter;

  public WorkloadMetrics(MetricRegistry registry, SluiceConfig config) {
    this.registry = registry;
    this.admitted = registry.counter(REQUESTS_ADMITTED);
    this.queued = registry.counter(REQUESTS_QUEUED);
    this.rejected = registry.counter(REQUESTS_REJECTED);
    this.cancelled = registry.counter(REQUESTS_CANCELLED);
    this.completed = registry.counter(REQUESTS_COMPLETED);
    this.releaseFailures = registry.counter(LEASE_RELEASE_FAILURES);
    this.logReporter = getLogReporter(registry, config);
  }

  private static Slf4jReporter getLogReporter(MetricRegistry registry, SluiceConfig config) {
    if (config.getBoolean(ExecConstants.METRICS_LOG_OUTPUT_ENABLED)) {
      Slf4jReporter reporter = Slf4jReporter.forRegistry(registry).outputTo(logger)
          .convertRatesTo(TimeUnit.SECONDS).convertDurationsTo(TimeUnit.MILLISECONDS).build();
      reporter.start(config.getDuration(ExecConstants.METRICS_LOG_OUTPUT_INTERVAL).getSeconds(), TimeUnit.SECONDS);

      return reporter;
    } else {
      return null;
    }
  }

  public void registerActiveHandlers(IntSupplier activeHandlers) {
    registry.register(ACTIVE_HANDLERS, (Gauge<Integer>) activeHandlers::getAsInt);
  }

  public void queued() {
    queued.inc();
  }

  /**
   * Counts a lease that could not be given back and stays taken until it expires.
   */
  public void releaseFailed() {
    releaseFailures.inc();
  }

  /**
   * Counts a state a request entered.
   */
  public void entered(RequestState state) {
    switch (state) {
      case ADMITTED:
        admitted.inc();
        break;
      case COMPLETED:
        completed.inc();
        break;
      case CANCELLED:
        cancelled.inc();
        break;
      case REJECTED:
        rejected.inc();
        break;
      default:
    }
  }

  public MetricRegistry getRegistry() {
    return registry;
  }

  @Override
  public void close() {
    registry.remove(ACTIVE_HANDLERS);
    if (logReporter != null) {
      logReporter.close();
    }
  }
}
