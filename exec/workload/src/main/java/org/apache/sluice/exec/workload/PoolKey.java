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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Identity of a resource pool: pool ids are unique within a database.
 */
public final class PoolKey {
  private final String database;
  private final String poolId;

  @JsonCreator
  public PoolKey(@JsonProperty("database") String database,
                 @JsonProperty("poolId") String poolId) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(database), "database is required");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(poolId), "pool id is required");
    this.database = database;
    this.poolId = poolId;
  }

  public String getDatabase() {
    return database;
  }

  public String getPoolId() {
    return poolId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PoolKey other = (PoolKey) o;
    return database.equals(other.database) && poolId.equals(other.poolId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(database, poolId);
  }

  @Override
  public String toString() {
    return database + ":" + poolId;
  }
}
