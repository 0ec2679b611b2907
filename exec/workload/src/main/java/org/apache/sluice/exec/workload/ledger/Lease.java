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

import org.apache.sluice.exec.workload.PoolKey;

/**
 * A time-bounded claim on one running or delayed slot of a pool, as handed
 * out by the ledger. The holder must renew it before it expires, otherwise
 * any node may reclaim the slot.
 */
public final class Lease {
  private final PoolKey pool;
  private final String leaseId;
  private final String ownerNode;
  private final String requestId;
  private final SlotKind kind;
  private final long expiresAt;

  Lease(PoolKey pool, LeaseRecord record) {
    this.pool = pool;
    this.leaseId = record.getLeaseId();
    this.ownerNode = record.getOwnerNode();
    this.requestId = record.getRequestId();
    this.kind = record.getKind();
    this.expiresAt = record.getExpiresAt();
  }

  public PoolKey getPool() {
    return pool;
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

  public long getExpiresAt() {
    return expiresAt;
  }

  @Override
  public String toString() {
    return kind + " lease " + leaseId + " of request " + requestId + " on " + ownerNode + " in pool " + pool;
  }
}
