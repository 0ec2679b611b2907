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

import org.apache.sluice.common.exceptions.ErrorType;

/**
 * Final status of a request as reported to the client.
 */
public enum QueryStatus {
  SUCCESS,
  OVERLOADED,
  PRECONDITION_FAILED,
  CANCELLED,
  UNAUTHORIZED,
  NOT_FOUND,
  GENERIC_ERROR,
  INTERNAL_ERROR;

  public static QueryStatus of(ErrorType errorType) {
    switch (errorType) {
      case OVERLOADED:
        return OVERLOADED;
      case PRECONDITION_FAILED:
        return PRECONDITION_FAILED;
      case CANCELLED:
        return CANCELLED;
      case UNAUTHORIZED:
        return UNAUTHORIZED;
      case NOT_FOUND:
        return NOT_FOUND;
      case GENERIC_ERROR:
        return GENERIC_ERROR;
      case SYSTEM:
      default:
        return INTERNAL_ERROR;
    }
  }
}
