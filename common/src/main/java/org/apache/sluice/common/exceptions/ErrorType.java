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
package org.apache.sluice.common.exceptions;

/**
 * Category of a {@link UserException}. Each admission outcome other than
 * success maps to exactly one category, so callers can branch on it without
 * parsing messages.
 */
public enum ErrorType {
  /** Queue of the pool is full. */
  OVERLOADED,
  /** Pool cannot accept work in its current configuration, e.g. a zero limit. */
  PRECONDITION_FAILED,
  /** Request outlived the cancel-after timeout of its pool. */
  CANCELLED,
  /** Principal may not use the pool. */
  UNAUTHORIZED,
  /** Pool does not exist or was dropped. */
  NOT_FOUND,
  /** Misuse of a pool management operation. */
  GENERIC_ERROR,
  /** Internal failure, such as the shared state store being unreachable. */
  SYSTEM
}
