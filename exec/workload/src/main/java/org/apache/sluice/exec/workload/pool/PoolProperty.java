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
package org.apache.sluice.exec.workload.pool;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.sluice.common.exceptions.UserException;

/**
 * Settable properties of a resource pool, as named in pool DDL. Names are
 * matched case-insensitively.
 */
public enum PoolProperty {

  CONCURRENT_QUERY_LIMIT("concurrent_query_limit") {
    @Override
    void apply(PoolConfig.Builder builder, String value) {
      builder.concurrentQueryLimit(parseLimit(this, value));
    }

    @Override
    void reset(PoolConfig.Builder builder) {
      builder.concurrentQueryLimit(PoolConfig.UNLIMITED);
    }
  },

  QUEUE_SIZE("queue_size") {
    @Override
    void apply(PoolConfig.Builder builder, String value) {
      builder.queueSize(parseLimit(this, value));
    }

    @Override
    void reset(PoolConfig.Builder builder) {
      builder.queueSize(PoolConfig.UNLIMITED);
    }
  },

  QUERY_CANCEL_AFTER("query_cancel_after") {
    @Override
    void apply(PoolConfig.Builder builder, String value) {
      builder.queryCancelAfter(parseDuration(this, value));
    }

    @Override
    void reset(PoolConfig.Builder builder) {
      builder.queryCancelAfter(Duration.ZERO);
    }
  },

  QUERY_MEMORY_LIMIT_PERCENT_PER_NODE("query_memory_limit_percent_per_node") {
    @Override
    void apply(PoolConfig.Builder builder, String value) {
      final double percent;
      try {
        percent = Double.parseDouble(value.trim());
      } catch (NumberFormatException e) {
        throw invalidValue(this, value, "expected a number");
      }
      if (percent != PoolConfig.MEMORY_LIMIT_NOT_SET && (percent <= 0 || percent > 100)) {
        throw invalidValue(this, value, "expected -1 or a percentage in (0, 100]");
      }
      builder.queryMemoryLimitPercentPerNode(percent);
    }

    @Override
    void reset(PoolConfig.Builder builder) {
      builder.queryMemoryLimitPercentPerNode(PoolConfig.MEMORY_LIMIT_NOT_SET);
    }
  };

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PoolProperty.class);

  private static final Pattern DURATION_PATTERN = Pattern.compile("^\\s*([0-9]+)\\s*(ms|s|m|h)?\\s*$");

  private static final String LEGACY_CANCEL_AFTER_SECONDS = "query_cancel_after_seconds";

  private final String propertyName;

  PoolProperty(String propertyName) {
    this.propertyName = propertyName;
  }

  public String getPropertyName() {
    return propertyName;
  }

  abstract void apply(PoolConfig.Builder builder, String value);

  /**
   * Restores the value a freshly created pool has.
   */
  abstract void reset(PoolConfig.Builder builder);

  /**
   * @throws UserException GENERIC_ERROR if no property has this name
   */
  public static PoolProperty fromName(String name) {
    final String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    if (LEGACY_CANCEL_AFTER_SECONDS.equals(normalized)) {
      return QUERY_CANCEL_AFTER;
    }
    for (PoolProperty property : values()) {
      if (property.propertyName.equals(normalized)) {
        return property;
      }
    }
    throw UserException.validationError()
        .message("Unknown property: %s", name)
        .build(logger);
  }

  private static int parseLimit(PoolProperty property, String value) {
    final int limit;
    try {
      limit = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw invalidValue(property, value, "expected an integer");
    }
    if (limit < PoolConfig.UNLIMITED) {
      throw invalidValue(property, value, "expected -1 for unlimited or a non negative number");
    }
    return limit;
  }

  /**
   * Parses durations such as {@code 10s}, {@code 500ms}, {@code 2m} or {@code 1h}.
   * A bare number is taken as seconds.
   */
  static Duration parseDuration(PoolProperty property, String value) {
    final Matcher matcher = DURATION_PATTERN.matcher(value);
    if (!matcher.matches()) {
      throw invalidValue(property, value, "supported format is [0-9]+(ms|s|m|h)?");
    }
    final long amount = Long.parseLong(matcher.group(1));
    // group 2 can be optional
    final String unit = matcher.group(2);
    if (unit == null) {
      return Duration.ofSeconds(amount);
    }
    switch (unit) {
      case "ms":
        return Duration.ofMillis(amount);
      case "m":
        return Duration.ofMinutes(amount);
      case "h":
        return Duration.ofHours(amount);
      default:
        return Duration.ofSeconds(amount);
    }
  }

  private static UserException invalidValue(PoolProperty property, String value, String reason) {
    return UserException.validationError()
        .message("Invalid value %s for property %s, %s", value, property.propertyName, reason)
        .build(logger);
  }
}
