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
package org.apache.sluice.exec.coord.zk;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.apache.curator.framework.CuratorFramework;
import org.apache.sluice.common.exceptions.SluiceRuntimeException;
import org.apache.sluice.exec.store.DataChangeVersion;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException.BadVersionException;
import org.apache.zookeeper.KeeperException.NoNodeException;
import org.apache.zookeeper.KeeperException.NodeExistsException;
import org.apache.zookeeper.data.Stat;

/**
 * A namespace aware Zookeeper client.
 *
 * The implementation only operates under the root path it was created with:
 * every path passed to it is relative to that root. Reads always go to the
 * server, so a value obtained together with its {@link DataChangeVersion} can
 * be safely used for a conditional write afterwards.
 *
 * Infrastructure failures are rethrown as {@link SluiceRuntimeException};
 * lost races (node exists, node missing, version moved on) are reported
 * through return values instead.
 */
public class ZookeeperClient {
  private final CuratorFramework curator;
  private final String root;
  private final CreateMode mode;

  public ZookeeperClient(final CuratorFramework curator, final String root, final CreateMode mode) {
    this.curator = Preconditions.checkNotNull(curator, "curator is required");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(root), "root path is required");
    Preconditions.checkArgument(root.charAt(0) == '/', "root path must be absolute");
    this.root = root;
    this.mode = Preconditions.checkNotNull(mode, "mode is required");
  }

  /**
   * Creates the root path if it does not exist yet.
   */
  public void start() throws Exception {
    curator.createContainers(root);
  }

  public CuratorFramework getCurator() {
    return curator;
  }

  public String getRoot() {
    return root;
  }

  /**
   * @return absolute (namespace relative) path of the given relative path
   */
  public String resolve(final String path) {
    return PathUtils.join(root, path);
  }

  public boolean hasPath(final String path) {
    Preconditions.checkNotNull(path, "path is required");

    final String target = resolve(path);
    try {
      return curator.checkExists().forPath(target) != null;
    } catch (final Exception e) {
      throw new SluiceRuntimeException("error while checking path on zookeeper", e);
    }
  }

  public byte[] get(final String path) {
    return get(path, null);
  }

  /**
   * Returns the value stored at the given path, or null if there is none.
   *
   * @param version when given, receives the data version of the returned value,
   *                or {@link DataChangeVersion#NOT_AVAILABLE} if the node is missing
   */
  public byte[] get(final String path, final DataChangeVersion version) {
    Preconditions.checkNotNull(path, "path is required");

    final String target = resolve(path);
    try {
      final Stat stat = new Stat();
      final byte[] data = curator.getData().storingStatIn(stat).forPath(target);
      if (version != null) {
        version.setVersion(stat.getVersion());
      }
      return data;
    } catch (final NoNodeException e) {
      if (version != null) {
        version.setVersion(DataChangeVersion.NOT_AVAILABLE);
      }
      return null;
    } catch (final Exception ex) {
      throw SluiceRuntimeException.format(ex, "error retrieving value for [%s]", path);
    }
  }

  /**
   * Creates the node with the given value unless it already exists. Missing
   * parents are created as containers.
   *
   * @return true if this call created the node
   */
  public boolean putIfAbsent(final String path, final byte[] data) {
    Preconditions.checkNotNull(path, "path is required");
    Preconditions.checkNotNull(data, "data is required");

    final String target = resolve(path);
    try {
      curator.create().creatingParentContainersIfNeeded().withMode(mode).forPath(target, data);
      return true;
    } catch (final NodeExistsException e) {
      return false;
    } catch (final Exception e) {
      throw SluiceRuntimeException.format(e, "unable to create node at %s", target);
    }
  }

  /**
   * Replaces the value only if the node still has the given data version.
   *
   * @return true if the value was written, false if the node changed or vanished since it was read
   */
  public boolean put(final String path, final byte[] data, final DataChangeVersion version) {
    Preconditions.checkNotNull(path, "path is required");
    Preconditions.checkNotNull(data, "data is required");
    Preconditions.checkNotNull(version, "version is required");

    if (!version.isAvailable()) {
      return putIfAbsent(path, data);
    }

    final String target = resolve(path);
    try {
      curator.setData().withVersion(version.getVersion()).forPath(target, data);
      return true;
    } catch (final BadVersionException | NoNodeException e) {
      return false;
    } catch (final Exception e) {
      throw SluiceRuntimeException.format(e, "unable to put value at %s", target);
    }
  }

  /**
   * Writes the value regardless of what is stored, creating the node if needed.
   */
  public void put(final String path, final byte[] data) {
    Preconditions.checkNotNull(path, "path is required");
    Preconditions.checkNotNull(data, "data is required");

    final String target = resolve(path);
    try {
      if (!putIfAbsent(path, data)) {
        curator.setData().forPath(target, data);
      }
    } catch (final SluiceRuntimeException e) {
      throw e;
    } catch (final Exception e) {
      throw SluiceRuntimeException.format(e, "unable to put value at %s", target);
    }
  }

  /**
   * Deletes the node.
   *
   * @return false if there was nothing to delete
   */
  public boolean delete(final String path) {
    Preconditions.checkNotNull(path, "path is required");

    final String target = resolve(path);
    try {
      curator.delete().forPath(target);
      return true;
    } catch (final NoNodeException e) {
      return false;
    } catch (final Exception e) {
      throw SluiceRuntimeException.format(e, "unable to delete node at %s", target);
    }
  }

  /**
   * @return names of the children of the given node; empty if the node does not exist
   */
  public List<String> getChildren(final String path) {
    Preconditions.checkNotNull(path, "path is required");

    final String target = resolve(path);
    try {
      return curator.getChildren().forPath(target);
    } catch (final NoNodeException e) {
      return Collections.emptyList();
    } catch (final Exception e) {
      throw SluiceRuntimeException.format(e, "unable to list children of %s", target);
    }
  }
}
