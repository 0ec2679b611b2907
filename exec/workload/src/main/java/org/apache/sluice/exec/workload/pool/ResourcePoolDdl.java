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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import com.google.common.annotations.VisibleForTesting;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Applies resource pool DDL ({@code CREATE / ALTER / DROP RESOURCE POOL},
 * {@code GRANT / REVOKE} of the use permission) to the configuration store.
 * Parsing of the statements themselves happens upstream; this class receives
 * the property maps.
 *
 * <p>The {@code default} pool of a database is created implicitly on first
 * use. It can be altered except for its concurrent query limit, and it can be
 * neither created nor dropped through DDL.</p>
 *
 * <p>Each creation stamps a new generation taken from the wall clock, so a
 * pool dropped and created again is never mistaken for an old copy of itself
 * by the ledger or by nodes caching the dropped one.</p>
 */
public class ResourcePoolDdl {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ResourcePoolDdl.class);

  private static final int MAX_UPDATE_ATTEMPTS = 5;

  private static final AtomicLong LAST_GENERATION = new AtomicLong();

  private final PoolConfigStore store;
  private final SluiceConfig config;

  public ResourcePoolDdl(PoolConfigStore store, SluiceConfig config) {
    this.store = store;
    this.config = config;
  }

  public PoolConfig createPool(String database, String poolId, Map<String, String> properties) {
    if (PoolConfig.DEFAULT_POOL_ID.equals(poolId)) {
      throw UserException.validationError()
          .message("Cannot create default pool manually, pool will be created automatically during first request execution")
          .addContext("Database", database)
          .build(logger);
    }

    final PoolConfig.Builder builder = PoolConfig.builder(database, poolId);
    for (Map.Entry<String, String> property : properties.entrySet()) {
      PoolProperty.fromName(property.getKey()).apply(builder, property.getValue());
    }
    final PoolConfig pool = builder.generation(nextGeneration()).version(1).build();

    if (!store.putIfAbsent(pool)) {
      throw UserException.validationError()
          .message("Resource pool %s already exists", poolId)
          .addContext("Database", database)
          .build(logger);
    }
    logger.info("Created resource pool {}", pool);
    return pool;
  }

  /**
   * Sets and resets properties of an existing pool in one new version.
   */
  public PoolConfig alterPool(String database, String poolId, Map<String, String> setProperties,
                              Collection<String> resetProperties) {
    final PoolKey key = new PoolKey(database, poolId);
    final Collection<String> resets = resetProperties == null ? Collections.emptyList() : resetProperties;
    return update(key, current -> {
      final PoolConfig.Builder builder = current.toBuilder();
      for (Map.Entry<String, String> property : setProperties.entrySet()) {
        final PoolProperty target = PoolProperty.fromName(property.getKey());
        checkAlterable(current, target);
        target.apply(builder, property.getValue());
      }
      for (String name : resets) {
        final PoolProperty target = PoolProperty.fromName(name);
        checkAlterable(current, target);
        target.reset(builder);
      }
      return builder.build();
    });
  }

  public void dropPool(String database, String poolId) {
    final PoolKey key = new PoolKey(database, poolId);
    if (PoolConfig.DEFAULT_POOL_ID.equals(poolId)) {
      throw UserException.validationError()
          .message("Cannot drop default pool")
          .addContext("Database", database)
          .build(logger);
    }
    if (!store.delete(key)) {
      throw notFound(key);
    }
    logger.info("Dropped resource pool {}", key);
  }

  /**
   * Allows the user to submit requests to the pool. Pools without an access
   * control list are public and stay unchanged.
   */
  public PoolConfig grantUse(String database, String poolId, String user) {
    return update(new PoolKey(database, poolId), current -> current.getAcl() == null
        ? current
        : current.toBuilder().acl(current.getAcl().withAllowedUser(user)).build());
  }

  /**
   * Denies the user the use of the pool. A public pool becomes open to everybody else.
   */
  public PoolConfig revokeUse(String database, String poolId, String user) {
    return update(new PoolKey(database, poolId), current -> {
      final PoolAcl acl = current.getAcl() == null ? PoolAcl.ofUsers(PoolAcl.ACL_ALLOW_ALL) : current.getAcl();
      return current.toBuilder().acl(acl.withDisallowedUser(user)).build();
    });
  }

  /**
   * Replaces the access control list; null makes the pool public.
   */
  public PoolConfig setAccessControl(String database, String poolId, PoolAcl acl) {
    return update(new PoolKey(database, poolId), current -> current.toBuilder().acl(acl).build());
  }

  /**
   * Returns the default pool of the database, creating it from the
   * {@code sluice.exec.workload.default_pool} settings if it does not exist.
   */
  public PoolConfig ensureDefaultPool(String database) {
    final PoolKey key = new PoolKey(database, PoolConfig.DEFAULT_POOL_ID);
    PoolConfig pool = store.get(key);
    if (pool != null) {
      return pool;
    }
    final PoolConfig defaults = defaultPoolConfig(database);
    if (store.putIfAbsent(defaults)) {
      logger.info("Created default resource pool for database {}", database);
      return defaults;
    }
    // another node created it concurrently
    pool = store.get(key);
    return pool == null ? defaults : pool;
  }

  @VisibleForTesting
  PoolConfig defaultPoolConfig(String database) {
    final PoolConfig.Builder builder = PoolConfig.builder(database, PoolConfig.DEFAULT_POOL_ID)
        .concurrentQueryLimit(config.getInt(ExecConstants.DEFAULT_POOL_CONCURRENT_QUERY_LIMIT))
        .queueSize(config.getInt(ExecConstants.DEFAULT_POOL_QUEUE_SIZE))
        .queryCancelAfter(config.getDuration(ExecConstants.DEFAULT_POOL_QUERY_CANCEL_AFTER))
        .queryMemoryLimitPercentPerNode(config.getDouble(ExecConstants.DEFAULT_POOL_QUERY_MEMORY_LIMIT_PERCENT_PER_NODE))
        .generation(nextGeneration())
        .version(1);
    return builder.build();
  }

  /**
   * @return current time in milliseconds, strictly increasing within this process
   */
  @VisibleForTesting
  static long nextGeneration() {
    final long now = System.currentTimeMillis();
    return LAST_GENERATION.updateAndGet(last -> Math.max(last + 1, now));
  }

  private PoolConfig update(PoolKey key, UnaryOperator<PoolConfig> change) {
    for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
      final PoolConfig current = store.get(key);
      if (current == null) {
        throw notFound(key);
      }
      final PoolConfig changed = change.apply(current);
      if (changed.equals(current)) {
        return current;
      }
      final PoolConfig next = changed.toBuilder().version(current.getVersion() + 1).build();
      if (store.replace(next)) {
        logger.info("Updated resource pool {}", next);
        return next;
      }
      logger.debug("Concurrent update of resource pool {}, attempt {} of {}", key, attempt, MAX_UPDATE_ATTEMPTS);
    }
    throw UserException.validationError()
        .message("Resource pool %s is being modified concurrently, retry the statement", key.getPoolId())
        .addContext("Database", key.getDatabase())
        .build(logger);
  }

  private void checkAlterable(PoolConfig current, PoolProperty property) {
    if (current.isDefaultPool() && property == PoolProperty.CONCURRENT_QUERY_LIMIT) {
      throw UserException.validationError()
          .message("Can not change property %s for default pool", property.getPropertyName())
          .addContext("Database", current.getDatabase())
          .build(logger);
    }
  }

  private static UserException notFound(PoolKey key) {
    return UserException.notFoundError()
        .message("Resource pool %s not found", key.getPoolId())
        .addContext("Database", key.getDatabase())
        .build(logger);
  }
}
