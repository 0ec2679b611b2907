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

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A convenience class used to expedite zookeeper paths manipulations.
 */
public final class PathUtils {

  private PathUtils() {
  }

  /**
   * Returns a normalized, combined path out of the given path segments.
   *
   * @param parts  path segments to combine
   * @see #normalize(String)
   */
  public static String join(final String... parts) {
    final StringBuilder sb = new StringBuilder();
    for (final String part : parts) {
      Preconditions.checkNotNull(part, "parts cannot contain null");
      if (!Strings.isNullOrEmpty(part)) {
        sb.append(part).append("/");
      }
    }
    if (sb.length() > 0) {
      sb.deleteCharAt(sb.length() - 1);
    }
    return normalize(sb.toString());
  }

  /**
   * Normalizes the given path eliminating repeated forward slashes.
   *
   * @return  normalized path
   */
  public static String normalize(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      return "/";
    }

    final StringBuilder builder = new StringBuilder();
    char last = 0;
    for (int i = 0; i < path.length(); i++) {
      final char current = path.charAt(i);
      if (current == '/' && last == '/') {
        continue;
      }
      builder.append(current);
      last = current;
    }
    if (builder.charAt(0) != '/') {
      builder.insert(0, '/');
    }
    if (builder.length() > 1 && builder.charAt(builder.length() - 1) == '/') {
      builder.deleteCharAt(builder.length() - 1);
    }
    return builder.toString();
  }

  /**
   * Turns an arbitrary name, such as a database path, into a single znode name.
   */
  public static String encodeSegment(final String name) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "name is required");
    return URLEncoder.encode(name, StandardCharsets.UTF_8);
  }

  public static String decodeSegment(final String segment) {
    return URLDecoder.decode(segment, StandardCharsets.UTF_8);
  }
}
