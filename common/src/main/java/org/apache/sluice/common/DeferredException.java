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
package org.apache.sluice.common;

import com.google.common.base.Preconditions;

/**
 * Collects exceptions so they can be thrown together later. The first one
 * added is thrown on {@link #close()}; later ones ride along as suppressed.
 */
public class DeferredException implements AutoCloseable {
  private Exception exception = null;
  private boolean isClosed = false;

  public void addException(final Exception exception) {
    Preconditions.checkNotNull(exception);

    synchronized (this) {
      Preconditions.checkState(!isClosed);

      if (this.exception == null) {
        this.exception = exception;
      } else {
        this.exception.addSuppressed(exception);
      }
    }
  }

  public synchronized Exception getAndClear() {
    Preconditions.checkState(!isClosed);

    final Exception local = exception;
    exception = null;
    return local;
  }

  /**
   * Throws the collected exception, if any, and forgets it so that a reused
   * instance does not report the same failure twice.
   */
  public synchronized void throwAndClear() throws Exception {
    final Exception e = getAndClear();
    if (e != null) {
      throw e;
    }
  }

  @Override
  public synchronized void close() throws Exception {
    try {
      throwAndClear();
    } finally {
      isClosed = true;
    }
  }
}
