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

import java.io.IOException;
import java.net.URL;
import java.time.Duration;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;

import org.apache.sluice.common.exceptions.SluiceRuntimeException;

/**
 * Immutable, resolved configuration of a Sluice node.
 *
 * <p>Layers, from lowest to highest precedence:</p>
 * <ol>
 *   <li>{@code sluice-default.conf} from the common jar,</li>
 *   <li>every {@code sluice-module.conf} found on the classpath,</li>
 *   <li>the override file ({@code sluice-override.conf} unless another name is given)
 *       together with JVM system properties,</li>
 *   <li>properties passed programmatically, mostly by tests.</li>
 * </ol>
 */
public class SluiceConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SluiceConfig.class);

  private final Config config;

  @VisibleForTesting
  public SluiceConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}",
        config.root().render(ConfigRenderOptions.defaults().setOriginComments(false)));
  }

  /**
   * Creates a configuration using the default override file.
   */
  public static SluiceConfig create() {
    return create(null, null);
  }

  public static SluiceConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * Creates a configuration with the given properties applied on top of all
   * configuration files.
   *
   * @param testConfigurations properties that override every other layer
   */
  @VisibleForTesting
  public static SluiceConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  private static SluiceConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;

    final ClassLoader classLoader = SluiceConfig.class.getClassLoader();

    // 1. Load defaults configuration file.
    Config fallback = ConfigFactory.empty();
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
      fallback = ConfigFactory.parseURL(defaultUrl);
    }

    // 2. Load per-module configuration files.
    logString.append("\nIntermediate Configuration files, in order of precedence:\n");
    for (URL url : getModuleConfigURLs(classLoader)) {
      logString.append("\t- ").append(url).append("\n");
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }
    logString.append("\n");

    // 3. Load the override file along with JVM system properties (-Dname=value).
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig =
        ConfigFactory.load(classLoader, overrideFileResourcePathname).withFallback(fallback);

    // 4. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      logString.append("\n");
      effectiveConfig =
          ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new SluiceConfig(effectiveConfig.resolve());
  }

  private static List<URL> getModuleConfigURLs(ClassLoader classLoader) {
    try {
      final Enumeration<URL> urls = classLoader.getResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME);
      return Collections.list(urls);
    } catch (IOException e) {
      throw new SluiceRuntimeException("Failure while scanning the classpath for " +
          CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME, e);
    }
  }

  /**
   * @return a copy of this configuration with one value replaced
   */
  public SluiceConfig withValue(String path, Object value) {
    return new SluiceConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public double getDouble(String path) {
    return config.getDouble(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public Duration getDuration(String path) {
    return config.getDuration(path);
  }

  public List<String> getStringList(String path) {
    return config.getStringList(path);
  }

  public Config getConfig(String path) {
    return config.getConfig(path);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
