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

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.base.Preconditions;

/**
 * Single consumer mailbox for state owned by one object, such as a resource
 * pool handler. Events may be sent from timers, ledger watchers, completion
 * callbacks or the object's own event handling; they are handled one at a
 * time in the order they were accepted.
 *
 * <p>There is no dedicated thread. A sender that finds the mailbox empty
 * drains it, including events that other senders append meanwhile, and the
 * rest just append. Failures of single events do not stop the drain; they are
 * rethrown to the draining sender once the mailbox is empty.</p>
 *
 * @param <T> the event type
 */
public abstract class EventProcessor<T> {
  private final Object lock = new Object();
  private final Deque<T> pending = new ArrayDeque<>();
  private boolean draining;

  /**
   * Handles the event now if nobody is draining, otherwise appends it.
   *
   * @throws RuntimeException wrapping the failures of the events drained by this call
   */
  public void sendEvent(final T event) {
    Preconditions.checkNotNull(event, "event");
    synchronized (lock) {
      if (draining) {
        pending.addLast(event);
        return;
      }
      draining = true;
    }
    drain(event);
  }

  /**
   * @return number of events waiting behind the one being handled
   */
  public int getQueuedEventCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /**
   * Handles one event. Never runs concurrently with itself for one instance.
   *
   * @param event the event to handle
   */
  protected abstract void processEvent(T event);

  private void drain(T first) {
    @SuppressWarnings("resource")
    final DeferredException failures = new DeferredException();
    for (T event = first; event != null; event = takeNext()) {
      try {
        processEvent(event);
      } catch (Exception e) {
        failures.addException(e);
      } catch (AssertionError e) {
        failures.addException(new RuntimeException("Assertion failed while processing " + event, e));
      }
    }
    try {
      failures.close();
    } catch (Exception e) {
      throw new RuntimeException("Exceptions caught during event processing", e);
    }
  }

  /**
   * @return the next pending event, or null after giving up the drain
   */
  private T takeNext() {
    synchronized (lock) {
      final T next = pending.pollFirst();
      if (next == null) {
        draining = false;
      }
      return next;
    }
  }
}
