package com.guildperms.resolver;

import com.guildperms.common.status.StatusOr;
import com.guildperms.config.PermissionDependencies;
import com.guildperms.model.GuildId;
import com.guildperms.model.Member;
import com.guildperms.model.PermissionOverwrite;
import com.guildperms.model.RoleId;
import com.guildperms.model.UserId;
import com.guildperms.permission.ChannelType;
import com.guildperms.permission.Permissions;
import com.google.common.base.MoreObjects;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Variant of {@link PermissionResolver} that ignores missing roles instead of failing.
 *
 * <p><b>Using this is dangerous:</b> when the role snapshot is stale, a member may appear to hold
 * a permission they lack, or lack one they hold. Roles missing from the role map, including
 * {@code @everyone}, are treated as granting nothing.
 */
public final class InfallibleResolver {

  private final PermissionResolver delegate;

  private InfallibleResolver(PermissionResolver delegate) {
    this.delegate = delegate;
  }

  /**
   * Creates an infallible resolver with the bundled dependency table.
   *
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if the role map contains a null key or value
   */
  public static InfallibleResolver create(
      GuildId guildId, UserId ownerId, Map<RoleId, Permissions> roles) {
    return create(guildId, ownerId, roles, PermissionDependencies.defaults());
  }

  /**
   * Creates an infallible resolver with a custom dependency table.
   *
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if the role map contains a null key or value
   */
  public static InfallibleResolver create(
      GuildId guildId,
      UserId ownerId,
      Map<RoleId, Permissions> roles,
      PermissionDependencies dependencies) {
    Objects.requireNonNull(guildId, "guildId");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(roles, "roles");
    Objects.requireNonNull(dependencies, "dependencies");
    StatusOr<PermissionResolver> resolverOr =
        PermissionResolver.builder(guildId, ownerId, roles)
            .continueOnMissingItems(true)
            .dependencies(dependencies)
            .build();
    return new InfallibleResolver(expectOk(resolverOr));
  }

  /** Guild-level permissions of {@code member}. See {@link PermissionResolver#memberPermissions}. */
  public Permissions memberPermissions(Member member) {
    return expectOk(delegate.memberPermissions(member));
  }

  /** Channel permissions of {@code member}. See {@link PermissionResolver#inContext}. */
  public Permissions inContext(
      Member member, ChannelType channelType, List<PermissionOverwrite> overwrites) {
    return expectOk(delegate.inContext(member, channelType, overwrites));
  }

  private static <T> T expectOk(StatusOr<T> result) {
    if (result.isNotOk()) {
      throw new IllegalArgumentException(
          "Lenient resolver reported a failure: " + result.getStatus());
    }
    return result.getValue();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("delegate", delegate).toString();
  }
}
