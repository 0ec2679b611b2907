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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One lease as persisted inside a {@link PoolStateBlob}.
 */
public class LeaseRecord {
  private final String leaseId;
  private final String ownerNode;
  private final String requestId;
  private final long arrivalTime;
  private final long sequence;
  private SlotKind kind;
  private long expiresAt;

  @JsonCreator
  public LeaseRecord(@JsonProperty("leaseId") String leaseId,
                     @JsonProperty("ownerNode") String ownerNode,
                     @JsonProperty("requestId") String requestId,
                     @JsonProperty("kind") SlotKind kind,
                     @JsonProperty("arrivalTime") long arrivalTime,
                     @JsonProperty("sequence") long sequence,
                     @JsonProperty("expiresAt") long expiresAt) {
    this.leaseId = leaseId;
    this.ownerNode = ownerNode;
    this.requestId = requestId;
    this.kind = kind;
    this.arrivalTime = arrivalTime;
    this.sequence = sequence;
    this.expiresAt = expiresAt;
  }

  public String getLeaseId() {
    return leaseId;
  }

  public String getOwnerNode() {
    return ownerNode;
  }

  public String getRequestId() {
    return requestId;
  }

  public SlotKind getKind() {
    return kind;
  }

  public void setKind(SlotKind kind) {
    this.kind = kind;
  }

  /**
   * Arrival time of the request at its node; the primary queue order.
   */
  public long getArrivalTime() {
    return arrivalTime;
  }

  /**
   * Creation order within the pool; breaks ties between equal arrival times.
   */
  public long getSequence() {
    return sequence;
  }

  public long getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(long expiresAt) {
    this.expiresAt = expiresAt;
  }

  public boolean isExpired(long now) {
    return expiresAt <= now;
  }

  @Override
  public String toString() {
    return "{ LeaseId: " + leaseId + ", Owner: " + ownerNode + ", Request: " + requestId + ", Kind: " + kind +
        ", Arrival: " + arrivalTime + ", Sequence: " + sequence + ", ExpiresAt: " + expiresAt + "}";
  }
}
