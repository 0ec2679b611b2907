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
package org.apache.sluice.exec.workload.ledger;

import org.apache.sluice.exec.workload.pool.PoolConfig;

/**
 * Everything the ledger needs to decide on one slot request: who asks, when
 * the request arrived, how long the lease lives and the pool bounds as the
 * asking node knows them.
 */
public final class SlotRequest {
  private final String ownerNode;
  private final String requestId;
  private final long arrivalTime;
  private final long leaseDurationMs;
  private final int concurrentQueryLimit;
  private final int queueSize;
  private final long configGeneration;
  private final long configVersion;

  public SlotRequest(String ownerNode, String requestId, long arrivalTime, long leaseDurationMs,
                     PoolConfig config) {
    this(ownerNode, requestId, arrivalTime, leaseDurationMs, config.getConcurrentQueryLimit(),
        config.getQueueSize(), config.getGeneration(), config.getVersion());
  }

  public SlotRequest(String ownerNode, String requestId, long arrivalTime, long leaseDurationMs,
                     int concurrentQueryLimit, int queueSize, long configVersion) {
    this(ownerNode, requestId, arrivalTime, leaseDurationMs, concurrentQueryLimit, queueSize, 0, configVersion);
  }

  public SlotRequest(String ownerNode, String requestId, long arrivalTime, long leaseDurationMs,
                     int concurrentQueryLimit, int queueSize, long configGeneration, long configVersion) {
    this.ownerNode = ownerNode;
    this.requestId = requestId;
    this.arrivalTime = arrivalTime;
    this.leaseDurationMs = leaseDurationMs;
    this.concurrentQueryLimit = concurrentQueryLimit;
    this.queueSize = queueSize;
    this.configGeneration = configGeneration;
    this.configVersion = configVersion;
  }

  public String getOwnerNode() {
    return ownerNode;
  }

  public String getRequestId() {
    return requestId;
  }

  public long getArrivalTime() {
    return arrivalTime;
  }

  public long getLeaseDurationMs() {
    return leaseDurationMs;
  }

  public int getConcurrentQueryLimit() {
    return concurrentQueryLimit;
  }

  public int getQueueSize() {
    return queueSize;
  }

  public long getConfigGeneration() {
    return configGeneration;
  }

  public long getConfigVersion() {
    return configVersion;
  }
}
