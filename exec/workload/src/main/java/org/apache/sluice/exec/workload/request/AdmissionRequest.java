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

import java.util.Collections;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import org.apache.sluice.exec.workload.pool.PoolConfig;

/**
 * A request for admission as submitted by a client session: the target pool,
 * the principal and an opaque payload handed to the query executor.
 */
public final class AdmissionRequest {
  private final String database;
  private final String poolId;
  private final String user;
  private final Set<String> groups;
  private final Object payload;

  private AdmissionRequest(Builder builder) {
    this.database = builder.database;
    this.poolId = builder.poolId;
    this.user = builder.user;
    this.groups = builder.groups;
    this.payload = builder.payload;
  }

  public static Builder builder(String database) {
    return new Builder(database);
  }

  public String getDatabase() {
    return database;
  }

  /**
   * @return the target pool, {@code default} unless set explicitly
   */
  public String getPoolId() {
    return poolId;
  }

  public String getUser() {
    return user;
  }

  public Set<String> getGroups() {
    return groups;
  }

  public Object getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return "{ Database: " + database + ", Pool: " + poolId + ", User: " + user + "}";
  }

  public static class Builder {
    private final String database;
    private String poolId = PoolConfig.DEFAULT_POOL_ID;
    private String user = "";
    private Set<String> groups = Collections.emptySet();
    private Object payload;

    private Builder(String database) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(database), "database is required");
      this.database = database;
    }

    public Builder poolId(String poolId) {
      this.poolId = Strings.isNullOrEmpty(poolId) ? PoolConfig.DEFAULT_POOL_ID : poolId;
      return this;
    }

    public Builder user(String user) {
      this.user = Strings.nullToEmpty(user);
      return this;
    }

    public Builder groups(Set<String> groups) {
      this.groups = groups == null ? Collections.emptySet() : ImmutableSet.copyOf(groups);
      return this;
    }

    public Builder payload(Object payload) {
      this.payload = payload;
      return this;
    }

    public AdmissionRequest build() {
      return new AdmissionRequest(this);
    }
  }
}
