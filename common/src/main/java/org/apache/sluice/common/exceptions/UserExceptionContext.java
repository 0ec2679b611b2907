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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Holds context information about a UserException. We can add structured
 * context information that will be displayed to the client as part of the
 * message, after the error id.
 */
class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  UserExceptionContext() {
    errorId = UUID.randomUUID().toString();
    contextList = new ArrayList<>();
  }

  UserExceptionContext add(String context) {
    contextList.add(context);
    return this;
  }

  UserExceptionContext add(String context, String value) {
    return add(context + ": " + value);
  }

  UserExceptionContext add(String context, long value) {
    return add(context + ": " + value);
  }

  UserExceptionContext push(String context) {
    contextList.add(0, context);
    return this;
  }

  String getErrorId() {
    return errorId;
  }

  /**
   * generate a context message
   * @return string containing all context information concatenated
   */
  String generateContextMessage() {
    StringBuilder sb = new StringBuilder();

    for (String context : contextList) {
      sb.append(context).append("\n");
    }

    sb.append("\n[Error Id: ").append(errorId).append("]");
    return sb.toString();
  }
}
