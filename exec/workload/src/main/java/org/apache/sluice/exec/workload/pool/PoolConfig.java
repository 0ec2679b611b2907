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
package org.apache.sluice.exec.workload.pool;

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Durable settings of one resource pool. Instances are immutable; every
 * change produces a copy with a higher {@link #getVersion() version} so that
 * nodes holding a cached copy can tell which one is newer.
 *
 * <p>Versions restart at 1 when a pool is dropped and created again, so each
 * creation also stamps a new {@link #getGeneration() generation}. Copies are
 * ordered by generation first and version second.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PoolConfig {

  public static final String DEFAULT_POOL_ID = "default";

  /** Value of a limit meaning "no limit". */
  public static final int UNLIMITED = -1;

  /** Value of the memory share meaning "not set". */
  public static final double MEMORY_LIMIT_NOT_SET = -1;

  private final String database;
  private final String poolId;
  private final int concurrentQueryLimit;
  private final int queueSize;
  private final long queryCancelAfterMs;
  private final double queryMemoryLimitPercentPerNode;
  private final PoolAcl acl;
  private final long generation;
  private final long version;

  @JsonCreator
  public PoolConfig(@JsonProperty("database") String database,
                    @JsonProperty("poolId") String poolId,
                    @JsonProperty("concurrentQueryLimit") int concurrentQueryLimit,
                    @JsonProperty("queueSize") int queueSize,
                    @JsonProperty("queryCancelAfterMs") long queryCancelAfterMs,
                    @JsonProperty("queryMemoryLimitPercentPerNode") double queryMemoryLimitPercentPerNode,
                    @JsonProperty("acl") PoolAcl acl,
                    @JsonProperty("generation") long generation,
                    @JsonProperty("version") long version) {
    this.database = Preconditions.checkNotNull(database, "database is required");
    this.poolId = Preconditions.checkNotNull(poolId, "pool id is required");
    this.concurrentQueryLimit = concurrentQueryLimit;
    this.queueSize = queueSize;
    this.queryCancelAfterMs = queryCancelAfterMs;
    this.queryMemoryLimitPercentPerNode = queryMemoryLimitPercentPerNode;
    this.acl = acl;
    this.generation = generation;
    this.version = version;
  }

  public static Builder builder(String database, String poolId) {
    return new Builder(database, poolId);
  }

  public Builder toBuilder() {
    return new Builder(database, poolId)
        .concurrentQueryLimit(concurrentQueryLimit)
        .queueSize(queueSize)
        .queryCancelAfter(Duration.ofMillis(queryCancelAfterMs))
        .queryMemoryLimitPercentPerNode(queryMemoryLimitPercentPerNode)
        .acl(acl)
        .generation(generation)
        .version(version);
  }

  @JsonIgnore
  public PoolKey getKey() {
    return new PoolKey(database, poolId);
  }

  public String getDatabase() {
    return database;
  }

  public String getPoolId() {
    return poolId;
  }

  /**
   * @return {@link #UNLIMITED}, 0 for a disabled pool, or the maximum number of running requests
   */
  public int getConcurrentQueryLimit() {
    return concurrentQueryLimit;
  }

  /**
   * @return {@link #UNLIMITED}, 0 when requests are never queued, or the maximum number of queued requests
   */
  public int getQueueSize() {
    return queueSize;
  }

  /**
   * @return milliseconds after arrival at which a request is cancelled; 0 means never
   */
  public long getQueryCancelAfterMs() {
    return queryCancelAfterMs;
  }

  public double getQueryMemoryLimitPercentPerNode() {
    return queryMemoryLimitPercentPerNode;
  }

  /**
   * @return access control list, or null if everybody may use the pool
   */
  public PoolAcl getAcl() {
    return acl;
  }

  /**
   * @return creation stamp of the pool; a pool created after another one of the same name has a higher generation
   */
  public long getGeneration() {
    return generation;
  }

  public long getVersion() {
    return version;
  }

  /**
   * @return true if this copy was derived from the same creation of the pool as the other one
   */
  public boolean isSameGeneration(PoolConfig other) {
    return generation == other.generation;
  }

  /**
   * @return true if this copy supersedes the other one
   */
  public boolean isNewerThan(PoolConfig other) {
    return generation != other.generation ? generation > other.generation : version > other.version;
  }

  /**
   * Limited pools account their requests in the shared ledger; unlimited ones never touch it.
   */
  @JsonIgnore
  public boolean isLimited() {
    return concurrentQueryLimit != UNLIMITED;
  }

  @JsonIgnore
  public boolean isDisabled() {
    return concurrentQueryLimit == 0;
  }

  @JsonIgnore
  public boolean hasQueryCancelAfter() {
    return queryCancelAfterMs > 0;
  }

  @JsonIgnore
  public boolean isDefaultPool() {
    return DEFAULT_POOL_ID.equals(poolId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PoolConfig)) {
      return false;
    }
    PoolConfig that = (PoolConfig) o;
    return concurrentQueryLimit == that.concurrentQueryLimit
        && queueSize == that.queueSize
        && queryCancelAfterMs == that.queryCancelAfterMs
        && Double.compare(queryMemoryLimitPercentPerNode, that.queryMemoryLimitPercentPerNode) == 0
        && generation == that.generation
        && version == that.version
        && database.equals(that.database)
        && poolId.equals(that.poolId)
        && Objects.equals(acl, that.acl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(database, poolId, concurrentQueryLimit, queueSize, queryCancelAfterMs,
        queryMemoryLimitPercentPerNode, acl, generation, version);
  }

  @Override
  public String toString() {
    return "{ Pool: " + database + ":" + poolId + ", Generation: " + generation + ", Version: " + version +
        ", ConcurrentQueryLimit: " + concurrentQueryLimit + ", QueueSize: " + queueSize +
        ", QueryCancelAfterMs: " + queryCancelAfterMs +
        ", QueryMemoryLimitPercentPerNode: " + queryMemoryLimitPercentPerNode +
        ", Acl: " + acl + "}";
  }

  public static class Builder {
    private final String database;
    private final String poolId;
    private int concurrentQueryLimit = UNLIMITED;
    private int queueSize = UNLIMITED;
    private long queryCancelAfterMs;
    private double queryMemoryLimitPercentPerNode = MEMORY_LIMIT_NOT_SET;
    private PoolAcl acl;
    private long generation;
    private long version = 1;

    private Builder(String database, String poolId) {
      this.database = database;
      this.poolId = poolId;
    }

    public Builder concurrentQueryLimit(int concurrentQueryLimit) {
      this.concurrentQueryLimit = concurrentQueryLimit;
      return this;
    }

    public Builder queueSize(int queueSize) {
      this.queueSize = queueSize;
      return this;
    }

    public Builder queryCancelAfter(Duration queryCancelAfter) {
      this.queryCancelAfterMs = queryCancelAfter == null ? 0 : queryCancelAfter.toMillis();
      return this;
    }

    public Builder queryMemoryLimitPercentPerNode(double percent) {
      this.queryMemoryLimitPercentPerNode = percent;
      return this;
    }

    public Builder acl(PoolAcl acl) {
      this.acl = acl;
      return this;
    }

    public Builder generation(long generation) {
      this.generation = generation;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    public PoolConfig build() {
      return new PoolConfig(database, poolId, concurrentQueryLimit, queueSize, queryCancelAfterMs,
          queryMemoryLimitPercentPerNode, acl, generation, version);
    }
  }
}
