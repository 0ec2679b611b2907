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
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestPoolAcl {
  private static final Set<String> NO_GROUPS = Collections.emptySet();

  @Test
  public void testShortAndLongFormUsers() {
    final PoolAcl acl = new PoolAcl(ImmutableList.of("alice", "bob:+", "carol:-"), null);
    assertTrue(acl.allows("alice", NO_GROUPS));
    assertTrue(acl.allows("bob", NO_GROUPS));
    assertFalse(acl.allows("carol", NO_GROUPS));
    assertFalse("unknown users are denied", acl.allows("dave", NO_GROUPS));
  }

  @Test
  public void testUserRulesWinOverWildcard() {
    final PoolAcl acl = PoolAcl.ofUsers("*", "eve:-");
    assertTrue(acl.allows("alice", NO_GROUPS));
    assertFalse(acl.allows("eve", NO_GROUPS));
  }

  @Test
  public void testGroupRules() {
    final PoolAcl acl = new PoolAcl(null, ImmutableList.of("analysts", "interns:-"));
    assertTrue(acl.allows("alice", ImmutableSet.of("analysts")));
    assertFalse("disallowed group wins", acl.allows("bob", ImmutableSet.of("analysts", "interns")));
    assertFalse(acl.allows("carol", NO_GROUPS));
  }

  @Test
  public void testUserInBothListsIsDisallowed() {
    final PoolAcl acl = PoolAcl.ofUsers("alice", "alice:-");
    assertFalse(acl.allows("alice", NO_GROUPS));
  }

  @Test
  public void testAllowAndDisallowReplaceEarlierEntries() {
    final PoolAcl revoked = PoolAcl.ofUsers("*").withDisallowedUser("bob");
    assertFalse(revoked.allows("bob", NO_GROUPS));
    assertTrue(revoked.allows("alice", NO_GROUPS));

    final PoolAcl granted = revoked.withAllowedUser("bob");
    assertTrue(granted.allows("bob", NO_GROUPS));
    assertEquals(ImmutableList.of("*", "bob"), granted.getUsers());
  }

  @Test
  public void testJsonRoundTripKeepsRules() throws Exception {
    final ObjectMapper mapper = new ObjectMapper();
    final PoolAcl acl = new PoolAcl(ImmutableList.of("alice", "bob:-"), ImmutableList.of("ops"));
    final PoolAcl read = mapper.readValue(mapper.writeValueAsBytes(acl), PoolAcl.class);
    assertEquals(acl, read);
    assertFalse(read.allows("bob", ImmutableSet.of("ops")));
  }
}
