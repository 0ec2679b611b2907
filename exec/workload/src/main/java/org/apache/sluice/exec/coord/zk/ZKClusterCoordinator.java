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

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.state.ConnectionState;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.apache.curator.retry.RetryNTimes;
import org.apache.sluice.common.config.SluiceConfig;
import org.apache.sluice.exec.ExecConstants;

/**
 * Owns the Curator connection of one node. The connect string may carry the
 * namespace as a path suffix, e.g. {@code zk1:2181,zk2:2181/my_cluster}, in
 * which case it overrides {@code sluice.exec.zk.root}.
 */
public class ZKClusterCoordinator implements AutoCloseable {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ZKClusterCoordinator.class);

  private static final Pattern ZK_COMPLEX_STRING = Pattern.compile("(^.*?)/(.*)$");

  private final CuratorFramework curator;
  private final CountDownLatch initialConnection = new CountDownLatch(1);

  public ZKClusterCoordinator(SluiceConfig config) {
    this(config, null);
  }

  public ZKClusterCoordinator(SluiceConfig config, String connect) {
    connect = connect == null || connect.isEmpty() ? config.getString(ExecConstants.ZK_CONNECTION) : connect;
    String zkRoot = config.getString(ExecConstants.ZK_ROOT);

    // check if this is a complex zk string.  If so, parse into components.
    Matcher m = ZK_COMPLEX_STRING.matcher(connect);
    if (m.matches()) {
      connect = m.group(1);
      zkRoot = m.group(2);
    }

    logger.debug("Connect {}, zkRoot {}", connect, zkRoot);

    RetryPolicy rp = new RetryNTimes(config.getInt(ExecConstants.ZK_RETRY_TIMES),
      config.getInt(ExecConstants.ZK_RETRY_DELAY));
    curator = CuratorFrameworkFactory.builder()
      .namespace(zkRoot)
      .connectionTimeoutMs(config.getInt(ExecConstants.ZK_TIMEOUT))
      .retryPolicy(rp)
      .connectString(connect)
      .build();
    curator.getConnectionStateListenable().addListener(new InitialConnectionListener());
    curator.start();
  }

  public CuratorFramework getCurator() {
    return curator;
  }

  /**
   * Blocks until the first connection to the ensemble is established.
   *
   * @param millisToWait maximum wait, 0 to wait forever
   */
  public void start(long millisToWait) throws Exception {
    logger.debug("Starting ZKClusterCoordinator.");
    if (millisToWait != 0) {
      boolean success = this.initialConnection.await(millisToWait, TimeUnit.MILLISECONDS);
      if (!success) {
        throw new IOException(String.format("Failure to connect to the zookeeper cluster service within the allotted time of %d milliseconds.", millisToWait));
      }
    } else {
      this.initialConnection.await();
    }
  }

  private class InitialConnectionListener implements ConnectionStateListener {

    @Override
    public void stateChanged(CuratorFramework client, ConnectionState newState) {
      if (newState == ConnectionState.CONNECTED) {
        ZKClusterCoordinator.this.initialConnection.countDown();
        client.getConnectionStateListenable().removeListener(this);
      }
    }
  }

  @Override
  public void close() {
    curator.close();
  }
}
