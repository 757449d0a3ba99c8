package com.guildperms.model;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * A guild member as seen by the resolver: the user and the roles they hold.
 *
 * <p>The {@code @everyone} role is held implicitly and need not be listed. Role identifiers are
 * deduplicated; their order carries no meaning.
 *
 * @param userId The member's user identifier
 * @param roleIds The roles explicitly assigned to the member
 */
public record Member(UserId userId, Set<RoleId> roleIds) {

  public Member {
    Objects.requireNonNull(userId, "userId");
    roleIds = ImmutableSet.copyOf(Objects.requireNonNull(roleIds, "roleIds"));
  }

  /** Creates a member holding the given roles. */
  public static Member of(UserId userId, Collection<RoleId> roleIds) {
    return new Member(userId, ImmutableSet.copyOf(roleIds));
  }

  /** Creates a member holding the given roles. */
  public static Member of(UserId userId, RoleId... roleIds) {
    return new Member(userId, ImmutableSet.copyOf(roleIds));
  }

  /** Returns true if the member is explicitly assigned {@code roleId}. */
  public boolean hasRole(RoleId roleId) {
    return roleIds.contains(roleId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("userId", userId)
        .add("roleCount", roleIds.size())
        .toString();
  }
}
