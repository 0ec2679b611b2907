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
package org.apache.sluice.exec.workload.ledger.exception;

/**
 * A slot was requested with bounds taken from a pool configuration that is
 * older than one another node already used against the same pool state. The
 * caller should refresh its configuration and retry.
 */
public class StalePoolConfigException extends LedgerException {
  private static final long serialVersionUID = 6009130147781243302L;

  private final long latestVersion;

  public StalePoolConfigException(String message, long latestVersion) {
    super(message);
    this.latestVersion = latestVersion;
  }

  public long getLatestVersion() {
    return latestVersion;
  }
}
