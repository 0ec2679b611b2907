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
package org.apache.sluice.exec.workload.handler;

import org.apache.sluice.exec.workload.pool.PoolConfig;
import org.apache.sluice.exec.workload.request.WorkloadRequest;

/**
 * Handler of a pool without a concurrent query limit. Requests are admitted
 * as soon as they arrive and the ledger is never consulted.
 */
public class UnlimitedPoolHandler extends PoolHandler {

  public UnlimitedPoolHandler(HandlerContext context, PoolConfig config) {
    super(context, config);
  }

  @Override
  public boolean isLimited() {
    return false;
  }

  @Override
  protected void doAdmit(WorkloadRequest request) {
    admitted(request);
  }
}
