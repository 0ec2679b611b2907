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
package org.apache.sluice.common.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.Properties;

import org.apache.sluice.test.SluiceTest;
import org.junit.Test;

public class TestSluiceConfig extends SluiceTest {

  @Test
  public void testDefaultsAreLoaded() {
    final SluiceConfig config = SluiceConfig.create();
    assertFalse(config.getBoolean("sluice.metrics.log_output.enabled"));
    assertEquals(Duration.ofSeconds(60), config.getDuration("sluice.metrics.log_output.interval"));
  }

  @Test
  public void testPropertiesOverrideFiles() {
    final Properties props = new Properties();
    props.put("sluice.metrics.log_output.enabled", "true");
    props.put("sluice.test.extra", "42");

    final SluiceConfig config = SluiceConfig.create(props);
    assertTrue(config.getBoolean("sluice.metrics.log_output.enabled"));
    assertEquals(42, config.getInt("sluice.test.extra"));
  }

  @Test
  public void testWithValue() {
    final SluiceConfig config = SluiceConfig.create().withValue("sluice.metrics.log_output.interval", "5s");
    assertEquals(Duration.ofSeconds(5), config.getDuration("sluice.metrics.log_output.interval"));
  }
}
