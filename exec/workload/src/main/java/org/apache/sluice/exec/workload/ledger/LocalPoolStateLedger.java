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
package org.apache.sluice.exec.workload.ledger;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.sluice.exec.workload.PoolKey;

/**
 * Ledger kept in the memory of one process. Nodes that share an instance see
 * one consistent pool state, which makes it the store of single process
 * deployments and of most tests. State is kept serialized, exactly as the
 * Zookeeper ledger keeps it, and listeners are notified synchronously after
 * each successful write.
 */
public class LocalPoolStateLedger extends AbstractPoolStateLedger {

  private static class VersionedBlob {
    final byte[] data;
    final int version;

    VersionedBlob(byte[] data, int version) {
      this.data = data;
      this.version = version;
    }
  }

  private final Map<PoolKey, VersionedBlob> blobs = new HashMap<>();

  public LocalPoolStateLedger(SluiceConfig config, ObjectMapper mapper) {
    super(config, mapper);
  }

  @Override
  protected byte[] readBlob(PoolKey pool, DataChangeVersion version) {
    synchronized (blobs) {
      final VersionedBlob blob = blobs.get(pool);
      if (blob == null) {
        version.setVersion(DataChangeVersion.NOT_AVAILABLE);
        return null;
      }
      version.setVersion(blob.version);
      return blob.data;
    }
  }

  @Override
  protected boolean writeBlob(PoolKey pool, byte[] data, DataChangeVersion version) {
    synchronized (blobs) {
      final VersionedBlob current = blobs.get(pool);
      final int currentVersion = current == null ? DataChangeVersion.NOT_AVAILABLE : current.version;
      if (currentVersion != version.getVersion()) {
        return false;
      }
      blobs.put(pool, new VersionedBlob(data, currentVersion + 1));
      return true;
    }
  }

  @Override
  protected void onBlobWritten(PoolKey pool) {
    fireListeners(pool);
  }

  @Override
  public void close() {
    synchronized (blobs) {
      blobs.clear();
    }
  }
}
