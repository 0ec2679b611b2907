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
package org.apache.sluice.exec.store;

/**
 * Holder of the data version observed on read, handed back on a conditional
 * write. {@link #NOT_AVAILABLE} marks data that did not exist when read.
 */
public class DataChangeVersion {

  public static final int NOT_AVAILABLE = -1;

  private int version = NOT_AVAILABLE;

  public void setVersion(int version) {
    this.version = version;
  }

  public int getVersion() {
    return version;
  }

  public boolean isAvailable() {
    return version != NOT_AVAILABLE;
  }

  @Override
  public String toString() {
    return "DataChangeVersion{version=" + version + "}";
  }
}
