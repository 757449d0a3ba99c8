package com.guildperms.model;

import com.guildperms.permission.Permissions;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/**
 * Channel-level permission delta for one role or member.
 *
 * <p>{@code deny} is applied before {@code allow}, so a flag present in both ends up allowed.
 *
 * @param target The role or member this overwrite applies to
 * @param allow Flags forcibly granted
 * @param deny Flags forcibly removed
 */
public record PermissionOverwrite(OverwriteTarget target, Permissions allow, Permissions deny) {

  public PermissionOverwrite {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(allow, "allow");
    Objects.requireNonNull(deny, "deny");
  }

  /** Creates an overwrite for a role. */
  public static PermissionOverwrite forRole(RoleId roleId, Permissions allow, Permissions deny) {
    return new PermissionOverwrite(OverwriteTarget.role(roleId), allow, deny);
  }

  /** Creates an overwrite for a member. */
  public static PermissionOverwrite forMember(UserId userId, Permissions allow, Permissions deny) {
    return new PermissionOverwrite(OverwriteTarget.member(userId), allow, deny);
  }

  /** Removes {@code deny} from {@code permissions}, then adds {@code allow}. */
  public Permissions applyTo(Permissions permissions) {
    return permissions.difference(deny).union(allow);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("target", target)
        .add("allow", "0x" + Long.toHexString(allow.bits()))
        .add("deny", "0x" + Long.toHexString(deny.bits()))
        .toString();
  }
}
