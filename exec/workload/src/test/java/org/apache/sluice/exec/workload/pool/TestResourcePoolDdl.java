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

import java.util.Collections;
import java.util.Properties;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.common.exceptions.ErrorType;
import org.apache.sluice.common.exceptions.UserException;
import org.apache.sluice.exec.ExecConstants;
import org.apache.sluice.exec.workload.PoolKey;
import org.apache.sluice.test.SluiceTest;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestResourcePoolDdl extends SluiceTest {
  private static final String DATABASE = "/Root/db";
  private static final String POOL = "sample_pool_id";

  private LocalPoolConfigStore store;
  private ResourcePoolDdl ddl;

  @Before
  public void setUp() {
    store = new LocalPoolConfigStore();
    ddl = new ResourcePoolDdl(store, SluiceConfig.create());
  }

  @Test
  public void testCreatePool() {
    final PoolConfig pool = ddl.createPool(DATABASE, POOL, ImmutableMap.of(
        "concurrent_query_limit", "10",
        "QUEUE_SIZE", "20",
        "query_cancel_after_seconds", "60"));

    assertEquals(10, pool.getConcurrentQueryLimit());
    assertEquals(20, pool.getQueueSize());
    assertEquals(60_000, pool.getQueryCancelAfterMs());
    assertEquals(1, pool.getVersion());
    assertNull("new pools are public", pool.getAcl());
    assertEquals(pool, store.get(new PoolKey(DATABASE, POOL)));
  }

  @Test
  public void testCreateExistingPool() {
    ddl.createPool(DATABASE, POOL, Collections.emptyMap());
    assertFailure(ErrorType.GENERIC_ERROR, "Resource pool sample_pool_id already exists",
        () -> ddl.createPool(DATABASE, POOL, Collections.emptyMap()));
  }

  @Test
  public void testCreateWithUnknownPropertyLeavesNoPool() {
    assertFailure(ErrorType.GENERIC_ERROR, "Unknown property: max_users",
        () -> ddl.createPool(DATABASE, POOL, ImmutableMap.of("max_users", "1")));
    assertNull(store.get(new PoolKey(DATABASE, POOL)));
  }

  @Test
  public void testDefaultPoolRestrictions() {
    assertFailure(ErrorType.GENERIC_ERROR,
        "Cannot create default pool manually, pool will be created automatically during first request execution",
        () -> ddl.createPool(DATABASE, PoolConfig.DEFAULT_POOL_ID, Collections.emptyMap()));

    ddl.ensureDefaultPool(DATABASE);
    assertFailure(ErrorType.GENERIC_ERROR, "Can not change property concurrent_query_limit for default pool",
        () -> ddl.alterPool(DATABASE, PoolConfig.DEFAULT_POOL_ID, ImmutableMap.of("concurrent_query_limit", "1"),
            null));
    assertFailure(ErrorType.GENERIC_ERROR, "Can not change property concurrent_query_limit for default pool",
        () -> ddl.alterPool(DATABASE, PoolConfig.DEFAULT_POOL_ID, Collections.emptyMap(),
            ImmutableList.of("CONCURRENT_QUERY_LIMIT")));
    assertFailure(ErrorType.GENERIC_ERROR, "Cannot drop default pool",
        () -> ddl.dropPool(DATABASE, PoolConfig.DEFAULT_POOL_ID));

    final PoolConfig altered = ddl.alterPool(DATABASE, PoolConfig.DEFAULT_POOL_ID,
        ImmutableMap.of("queue_size", "5"), null);
    assertEquals("other properties of the default pool may change", 5, altered.getQueueSize());
  }

  @Test
  public void testEnsureDefaultPoolUsesConfiguredDefaults() {
    final Properties overrides = new Properties();
    overrides.put(ExecConstants.DEFAULT_POOL_CONCURRENT_QUERY_LIMIT, "3");
    overrides.put(ExecConstants.DEFAULT_POOL_QUERY_CANCEL_AFTER, "15s");
    final ResourcePoolDdl configured = new ResourcePoolDdl(store, SluiceConfig.create(overrides));

    final PoolConfig pool = configured.ensureDefaultPool(DATABASE);
    assertEquals(3, pool.getConcurrentQueryLimit());
    assertEquals(PoolConfig.UNLIMITED, pool.getQueueSize());
    assertEquals(15_000, pool.getQueryCancelAfterMs());
    assertSame("second call returns the stored pool", store.get(pool.getKey()), configured.ensureDefaultPool(DATABASE));
  }

  @Test
  public void testAlterPoolBumpsVersion() {
    ddl.createPool(DATABASE, POOL, ImmutableMap.of("concurrent_query_limit", "1", "queue_size", "1"));

    final PoolConfig altered = ddl.alterPool(DATABASE, POOL, ImmutableMap.of("queue_size", "3"),
        ImmutableList.of("concurrent_query_limit"));
    assertEquals(2, altered.getVersion());
    assertEquals(3, altered.getQueueSize());
    assertEquals(PoolConfig.UNLIMITED, altered.getConcurrentQueryLimit());

    final PoolConfig unchanged = ddl.alterPool(DATABASE, POOL, ImmutableMap.of("queue_size", "3"), null);
    assertEquals("a no-op alter keeps the version", 2, unchanged.getVersion());
  }

  @Test
  public void testAlterMissingPool() {
    assertFailure(ErrorType.NOT_FOUND, "Resource pool sample_pool_id not found",
        () -> ddl.alterPool(DATABASE, POOL, ImmutableMap.of("queue_size", "3"), null));
  }

  @Test
  public void testDropPool() {
    ddl.createPool(DATABASE, POOL, Collections.emptyMap());
    ddl.dropPool(DATABASE, POOL);
    assertNull(store.get(new PoolKey(DATABASE, POOL)));
    assertFailure(ErrorType.NOT_FOUND, "Resource pool sample_pool_id not found", () -> ddl.dropPool(DATABASE, POOL));
  }

  @Test
  public void testRecreatedPoolSupersedesDroppedOne() {
    ddl.createPool(DATABASE, POOL, ImmutableMap.of("concurrent_query_limit", "1"));
    final PoolConfig altered = ddl.alterPool(DATABASE, POOL, ImmutableMap.of("concurrent_query_limit", "2"), null);
    assertEquals(2, altered.getVersion());
    ddl.dropPool(DATABASE, POOL);

    final PoolConfig recreated = ddl.createPool(DATABASE, POOL, ImmutableMap.of("concurrent_query_limit", "1"));
    assertEquals(1, recreated.getVersion());
    assertTrue(recreated.getGeneration() > altered.getGeneration());
    assertFalse(recreated.isSameGeneration(altered));
    assertTrue(recreated.isNewerThan(altered));
    assertFalse(altered.isNewerThan(recreated));

    final PoolConfig realtered = ddl.alterPool(DATABASE, POOL, ImmutableMap.of("queue_size", "3"), null);
    assertEquals("alters keep the generation", recreated.getGeneration(), realtered.getGeneration());
    assertTrue(realtered.isNewerThan(recreated));
  }

  @Test
  public void testGrantAndRevoke() {
    ddl.createPool(DATABASE, POOL, Collections.emptyMap());
    assertEquals("granting on a public pool changes nothing", 1, ddl.grantUse(DATABASE, POOL, "alice").getVersion());

    PoolConfig pool = ddl.revokeUse(DATABASE, POOL, "alice");
    assertEquals(2, pool.getVersion());
    assertFalse(PoolAccessChecker.ACL.hasAccess(pool, "alice", ImmutableSet.of()));
    assertTrue(PoolAccessChecker.ACL.hasAccess(pool, "bob", ImmutableSet.of()));

    pool = ddl.grantUse(DATABASE, POOL, "alice");
    assertEquals(3, pool.getVersion());
    assertTrue(PoolAccessChecker.ACL.hasAccess(pool, "alice", ImmutableSet.of()));

    pool = ddl.setAccessControl(DATABASE, POOL, PoolAcl.ofUsers("bob"));
    assertFalse(PoolAccessChecker.ACL.hasAccess(pool, "alice", ImmutableSet.of()));
    assertTrue(PoolAccessChecker.ACL.hasAccess(pool, "bob", ImmutableSet.of()));
  }

  private static void assertFailure(ErrorType type, String message, Runnable statement) {
    try {
      statement.run();
      fail("Expected " + type + ": " + message);
    } catch (UserException e) {
      assertEquals(type, e.getErrorType());
      assertEquals(message, e.getOriginalMessage());
    }
  }
}
