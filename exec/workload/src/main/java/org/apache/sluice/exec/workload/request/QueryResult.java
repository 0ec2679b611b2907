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

import org.apache.sluice.common.exceptions.UserException;

/**
 * Outcome of {@code WorkloadService.executeQuery}.
 */
public final class QueryResult {
  private static final QueryResult SUCCESS = new QueryResult(QueryStatus.SUCCESS, "", null);

  private final QueryStatus status;
  private final String message;
  private final UserException error;

  private QueryResult(QueryStatus status, String message, UserException error) {
    this.status = status;
    this.message = message;
    this.error = error;
  }

  public static QueryResult success() {
    return SUCCESS;
  }

  public static QueryResult failure(UserException error) {
    return new QueryResult(QueryStatus.of(error.getErrorType()), error.getOriginalMessage(), error);
  }

  public QueryStatus getStatus() {
    return status;
  }

  /**
   * @return the error message without type and context, empty on success
   */
  public String getMessage() {
    return message;
  }

  /**
   * @return the failure, or null on success
   */
  public UserException getError() {
    return error;
  }

  @Override
  public String toString() {
    return status + (message.isEmpty() ? "" : ": " + message);
  }
}
