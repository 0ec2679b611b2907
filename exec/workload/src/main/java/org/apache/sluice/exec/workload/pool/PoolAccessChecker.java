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

import java.util.Set;

/**
 * Decides whether a principal may submit requests to a pool.
 */
public interface PoolAccessChecker {

  boolean hasAccess(PoolConfig pool, String user, Set<String> groups);

  /**
   * Evaluates the pool's {@link PoolAcl}; pools without one are public.
   */
  PoolAccessChecker ACL = (pool, user, groups) -> pool.getAcl() == null || pool.getAcl().allows(user, groups);
}
