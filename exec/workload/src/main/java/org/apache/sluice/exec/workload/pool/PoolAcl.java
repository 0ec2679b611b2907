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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Access control list of a resource pool.
 *
 * <p>Entries of the users and groups lists use either the short form
 * {@code name} (allowed) or the long form {@code name:+} / {@code name:-}
 * (allowed / disallowed). {@code *} matches everybody. Rules are evaluated in
 * this order, the first match wins:</p>
 * <ol>
 *   <li>user is disallowed, then user is allowed,</li>
 *   <li>{@code *} disallowed users, then {@code *} allowed users,</li>
 *   <li>one of the user's groups is disallowed, then allowed,</li>
 *   <li>{@code *} disallowed groups, then {@code *} allowed groups.</li>
 * </ol>
 * <p>Anything else is denied. A name present in both the allowed and the
 * disallowed list is treated as disallowed.</p>
 */
public final class PoolAcl {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PoolAcl.class);

  private static final String ACL_LONG_SYNTAX_SEPARATOR = ":";

  private static final String ACL_LONG_ALLOWED_IDENTIFIER = "+";

  private static final String ACL_LONG_DISALLOWED_IDENTIFIER = "-";

  public static final String ACL_ALLOW_ALL = "*";

  private final List<String> users;

  private final List<String> groups;

  private final Set<String> allowedUsers = Sets.newHashSet();

  private final Set<String> allowedGroups = Sets.newHashSet();

  private final Set<String> disAllowedUsers = Sets.newHashSet();

  private final Set<String> disAllowedGroups = Sets.newHashSet();

  @JsonCreator
  public PoolAcl(@JsonProperty("users") List<String> users,
                 @JsonProperty("groups") List<String> groups) {
    this.users = users == null ? ImmutableList.of() : ImmutableList.copyOf(users);
    this.groups = groups == null ? ImmutableList.of() : ImmutableList.copyOf(groups);
    parseACLInput(this.users, allowedUsers, disAllowedUsers);
    parseACLInput(this.groups, allowedGroups, disAllowedGroups);

    Set<String> wrongConfig = Sets.intersection(allowedUsers, disAllowedUsers).immutableCopy();
    if (!wrongConfig.isEmpty()) {
      logger.warn("These users are configured both in allowed and disallowed list. They will be treated as disallowed" +
        ". [Details: users: {}]", wrongConfig);
      allowedUsers.removeAll(wrongConfig);
    }

    wrongConfig = Sets.intersection(allowedGroups, disAllowedGroups).immutableCopy();
    if (!wrongConfig.isEmpty()) {
      logger.warn("These groups are configured both in allowed and disallowed list. They will be treated as " +
        "disallowed. [Details: groups: {}]", wrongConfig);
      allowedGroups.removeAll(wrongConfig);
    }
  }

  public static PoolAcl ofUsers(String... users) {
    return new PoolAcl(ImmutableList.copyOf(users), null);
  }

  @JsonProperty("users")
  public List<String> getUsers() {
    return users;
  }

  @JsonProperty("groups")
  public List<String> getGroups() {
    return groups;
  }

  public boolean allows(String user, Set<String> userGroups) {
    final Set<String> queryGroups = userGroups == null ? Collections.emptySet() : userGroups;
    if (disAllowedUsers.contains(user)) {
      logger.debug("User {} is present in configured ACL -ve users list", user);
      return false;
    } else if (allowedUsers.contains(user)) {
      logger.debug("User {} is present in configured ACL +ve users list", user);
      return true;
    } else if (disAllowedUsers.contains(ACL_ALLOW_ALL)) {
      logger.debug("User {} is absent in configured ACL +ve/-ve users list but * is in -ve users list", user);
      return false;
    } else if (allowedUsers.contains(ACL_ALLOW_ALL)) {
      logger.debug("User {} is absent in configured ACL +ve/-ve users list but * is in +ve users list", user);
      return true;
    }

    if (!Sets.intersection(queryGroups, disAllowedGroups).isEmpty()) {
      logger.debug("Groups of user {} are present in configured ACL -ve groups list", user);
      return false;
    } else if (!Sets.intersection(queryGroups, allowedGroups).isEmpty()) {
      logger.debug("Groups of user {} are present in configured ACL +ve groups list", user);
      return true;
    } else if (disAllowedGroups.contains(ACL_ALLOW_ALL)) {
      logger.debug("Groups of user {} are absent in configured ACL lists but * is in -ve groups list", user);
      return false;
    } else if (allowedGroups.contains(ACL_ALLOW_ALL)) {
      logger.debug("Groups of user {} are absent in configured ACL lists but * is in +ve groups list", user);
      return true;
    }

    logger.debug("Neither user {} nor its groups are present in configured ACL users/groups list", user);
    return false;
  }

  /**
   * @return a copy in which the user is explicitly allowed
   */
  public PoolAcl withAllowedUser(String user) {
    final List<String> newUsers = withoutEntriesOf(users, user);
    newUsers.add(user);
    return new PoolAcl(newUsers, groups);
  }

  /**
   * @return a copy in which the user is explicitly disallowed
   */
  public PoolAcl withDisallowedUser(String user) {
    final List<String> newUsers = withoutEntriesOf(users, user);
    newUsers.add(user + ACL_LONG_SYNTAX_SEPARATOR + ACL_LONG_DISALLOWED_IDENTIFIER);
    return new PoolAcl(newUsers, groups);
  }

  @JsonIgnore
  public Set<String> getAllowedUsers() {
    return Collections.unmodifiableSet(allowedUsers);
  }

  @JsonIgnore
  public Set<String> getDisAllowedUsers() {
    return Collections.unmodifiableSet(disAllowedUsers);
  }

  private static List<String> withoutEntriesOf(List<String> entries, String name) {
    final List<String> result = new ArrayList<>();
    for (String entry : entries) {
      if (!entry.split(ACL_LONG_SYNTAX_SEPARATOR)[0].equals(name)) {
        result.add(entry);
      }
    }
    return result;
  }

  private static void parseACLInput(List<String> acls, Set<String> allowedIdentity, Set<String> disAllowedIdentity) {
    for (String aclValue : acls) {

      if (aclValue.isEmpty()) {
        continue;
      }
      // Check if it's long form syntax or shortForm syntax
      String[] aclValueSplits = aclValue.split(ACL_LONG_SYNTAX_SEPARATOR);
      if (aclValueSplits.length == 1) {
        if (!allowedIdentity.add(aclValueSplits[0])) {
          logger.info("Duplicate acl identity: {} found in configured list will be ignored", aclValueSplits[0]);
        }
      } else {
        final String identifier = aclValueSplits[1];
        if (identifier.equals(ACL_LONG_ALLOWED_IDENTIFIER)) {
          if (!allowedIdentity.add(aclValueSplits[0])) {
            logger.info("Duplicate acl identity: {} found in configured list will be ignored", aclValueSplits[0]);
          }
        } else if (identifier.equals(ACL_LONG_DISALLOWED_IDENTIFIER)) {
          if (!disAllowedIdentity.add(aclValueSplits[0])) {
            logger.info("Duplicate acl identity: {} found in configured list will be ignored", aclValueSplits[0]);
          }
        } else {
          logger.error("Invalid long form syntax encountered hence ignoring ACL string {} . Details[Allowed " +
            "identifiers are `+` and `-`. Encountered: {}]", aclValue, identifier);
        }
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PoolAcl)) {
      return false;
    }
    PoolAcl other = (PoolAcl) o;
    return users.equals(other.users) && groups.equals(other.groups);
  }

  @Override
  public int hashCode() {
    return 31 * users.hashCode() + groups.hashCode();
  }

  @Override
  public String toString() {
    return "{ AllowedUsers: " + allowedUsers + ", AllowedGroups: " + allowedGroups +
      ", DisallowedUsers: " + disAllowedUsers + ", DisallowedGroups: " + disAllowedGroups + "}";
  }
}
