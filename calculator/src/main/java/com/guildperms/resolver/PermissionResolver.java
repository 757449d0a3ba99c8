package com.guildperms.resolver;

import com.guildperms.common.status.ErrorReason;
import com.guildperms.common.status.StatusOr;
import com.guildperms.config.PermissionDependencies;
import com.guildperms.config.ResolverConfig;
import com.guildperms.model.GuildId;
import com.guildperms.model.Member;
import com.guildperms.model.OverwriteTarget;
import com.guildperms.model.PermissionOverwrite;
import com.guildperms.model.RoleId;
import com.guildperms.model.UserId;
import com.guildperms.permission.ChannelType;
import com.guildperms.permission.Permission;
import com.guildperms.permission.Permissions;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Calculates the effective permissions of guild members, across the guild and inside a channel.
 *
 * <p>A resolver is built once per snapshot of a guild's roles and then queried per member. It
 * copies the role map on construction and holds no mutable state, so one instance may be shared
 * across threads.
 *
 * <h2>Guild level</h2>
 *
 * <p>{@link #memberPermissions} unions the {@code @everyone} grant with the grant of every role the
 * member holds. The guild owner, and any member whose union contains
 * {@link Permission#ADMINISTRATOR}, receives {@link Permissions#all()}.
 *
 * <h2>Channel level</h2>
 *
 * <p>{@link #inContext} starts from the guild-level result and applies, in order:
 *
 * <ol>
 *   <li>the {@code @everyone} overwrites (deny union, then allow union)
 *   <li>the union of overwrites for roles the member holds (deny union, then allow union)
 *   <li>the member's own overwrites (deny union, then allow union)
 *   <li>the channel type mask
 *   <li>the {@link PermissionDependencies} table
 * </ol>
 *
 * <p>Owner and administrator results skip every channel step.
 *
 * <h2>Errors</h2>
 *
 * <p>Failures are reported through {@link StatusOr} with an {@link ErrorReason}. With
 * {@link Builder#continueOnMissingItems(boolean)} enabled, missing roles are logged and ignored.
 */
public final class PermissionResolver {

  private final GuildId guildId;
  private final UserId ownerId;
  private final ImmutableMap<RoleId, Permissions> roles;
  private final ResolverConfig config;

  private PermissionResolver(
      GuildId guildId, UserId ownerId, ImmutableMap<RoleId, Permissions> roles, ResolverConfig config) {
    this.guildId = guildId;
    this.ownerId = ownerId;
    this.roles = roles;
    this.config = config;
  }

  /**
   * Creates a strict resolver with the default configuration.
   *
   * @param guildId the guild, whose id is also the {@code @everyone} role id
   * @param ownerId the guild owner, who bypasses every check
   * @param roles the guild-level grant of every role in the guild
   * @return the resolver, or INVALID_ARGUMENT if an argument is null or {@code @everyone} is absent
   */
  public static StatusOr<PermissionResolver> create(
      GuildId guildId, UserId ownerId, Map<RoleId, Permissions> roles) {
    return builder(guildId, ownerId, roles).build();
  }

  /** Starts building a resolver for the given guild snapshot. */
  public static Builder builder(GuildId guildId, UserId ownerId, Map<RoleId, Permissions> roles) {
    return new Builder(guildId, ownerId, roles);
  }

  /** Builder for {@link PermissionResolver}. */
  public static final class Builder {
    private final GuildId guildId;
    private final UserId ownerId;
    private final Map<RoleId, Permissions> roles;
    private boolean continueOnMissingItems;
    private PermissionDependencies dependencies;

    private Builder(GuildId guildId, UserId ownerId, Map<RoleId, Permissions> roles) {
      this.guildId = guildId;
      this.ownerId = ownerId;
      this.roles = roles;
    }

    /**
     * Whether to continue when a referenced role is missing from the role map.
     *
     * <p>When true, calculated permissions may be incomplete. The default is false.
     */
    public Builder continueOnMissingItems(boolean continueOnMissingItems) {
      this.continueOnMissingItems = continueOnMissingItems;
      return this;
    }

    /** Replaces the bundled dependency table. */
    public Builder dependencies(PermissionDependencies dependencies) {
      this.dependencies = dependencies;
      return this;
    }

    /** Applies every setting of {@code config}. */
    public Builder config(ResolverConfig config) {
      this.continueOnMissingItems = config.continueOnMissingItems();
      this.dependencies = config.dependencies();
      return this;
    }

    /**
     * Validates the inputs and builds the resolver.
     *
     * @return the resolver, or INVALID_ARGUMENT if an argument is null or, in strict mode, the
     *     {@code @everyone} role is missing
     */
    public StatusOr<PermissionResolver> build() {
      if (guildId == null || ownerId == null || roles == null) {
        return StatusOr.ofError(
            ErrorReason.INVALID_INPUT, "guildId, ownerId and roles must not be null");
      }
      for (Map.Entry<RoleId, Permissions> entry : roles.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          return StatusOr.ofError(
              ErrorReason.INVALID_INPUT, "Role map must not contain null keys or values");
        }
      }
      if (!roles.containsKey(guildId.everyoneRole())) {
        if (!continueOnMissingItems) {
          return StatusOr.ofError(
              ErrorReason.EVERYONE_ROLE_MISSING,
              "The @everyone role is missing for guild " + guildId);
        }
        Logger.debug("Everyone role not in guild {}", guildId);
      }
      PermissionDependencies deps =
          dependencies != null ? dependencies : PermissionDependencies.defaults();
      return StatusOr.ofValue(
          new PermissionResolver(
              guildId,
              ownerId,
              ImmutableMap.copyOf(roles),
              new ResolverConfig(continueOnMissingItems, deps)));
    }
  }

  /** Returns the guild this resolver evaluates. */
  public GuildId guildId() {
    return guildId;
  }

  /** Returns the guild owner. */
  public UserId ownerId() {
    return ownerId;
  }

  /** Returns the configuration in effect. */
  public ResolverConfig config() {
    return config;
  }

  /**
   * Calculates the guild-level permissions of a member.
   *
   * @param member the member to evaluate
   * @return the permissions, or NOT_FOUND ({@link ErrorReason#MEMBER_ROLE_MISSING}) if a held
   *     role is absent from the role map in strict mode
   */
  @Nonnull
  public StatusOr<Permissions> memberPermissions(@Nonnull Member member) {
    if (member.userId().equals(ownerId)) {
      return StatusOr.ofValue(Permissions.all());
    }

    Permissions permissions = roles.getOrDefault(guildId.everyoneRole(), Permissions.empty());

    for (RoleId roleId : member.roleIds()) {
      Permissions grant = roles.get(roleId);
      if (grant == null) {
        if (!config.continueOnMissingItems()) {
          return StatusOr.ofError(
              ErrorReason.MEMBER_ROLE_MISSING,
              "Member " + member.userId() + " is missing role " + roleId);
        }
        Logger.debug("User {} has role {} but it was not provided", member.userId(), roleId);
        continue;
      }
      permissions = permissions.union(grant);
    }

    if (permissions.contains(Permission.ADMINISTRATOR)) {
      return StatusOr.ofValue(Permissions.all());
    }
    return StatusOr.ofValue(permissions);
  }

  /**
   * Calculates the permissions of a member inside a channel.
   *
   * <p>Overwrites targeting other members, or roles the member does not hold, do not affect the
   * result. In strict mode a role overwrite naming a role missing from the role map still fails
   * the calculation, since it means the channel and role snapshots disagree.
   *
   * @param member the member to evaluate
   * @param channelType kind of channel, which decides the flags that may appear in the result
   * @param overwrites the channel's permission overwrites, in any order
   * @return the permissions, or NOT_FOUND if a held or overwritten role is missing in strict mode
   */
  @Nonnull
  public StatusOr<Permissions> inContext(
      @Nonnull Member member,
      @Nonnull ChannelType channelType,
      @Nonnull List<PermissionOverwrite> overwrites) {
    return memberPermissions(member)
        .flatMap(
            root -> {
              if (root.isAll()) {
                // owner or administrator
                return StatusOr.ofValue(root);
              }
              return applyOverwrites(member, root, overwrites)
                  .map(channel -> finish(channelType, channel));
            });
  }

  /**
   * Calculates the permissions a single role grants inside a channel, ignoring member-specific
   * state.
   *
   * @param roleId the role to evaluate
   * @param channelType kind of channel
   * @param overwrite the channel's overwrite for {@code roleId}
   * @return the permissions, INVALID_ARGUMENT ({@link ErrorReason#OVERWRITE_NOT_ROLE}) if the
   *     overwrite targets anything other than {@code roleId}, or NOT_FOUND if the role is unknown
   */
  @Nonnull
  public StatusOr<Permissions> rolePermissions(
      @Nonnull RoleId roleId,
      @Nonnull ChannelType channelType,
      @Nonnull PermissionOverwrite overwrite) {
    if (overwrite.target().kind() != OverwriteTarget.Kind.ROLE) {
      return StatusOr.ofError(
          ErrorReason.OVERWRITE_NOT_ROLE, "Permission overwrite is not a role overwrite");
    }
    if (!overwrite.target().roleId().equals(roleId)) {
      return StatusOr.ofError(
          ErrorReason.OVERWRITE_NOT_ROLE,
          "Permission overwrite targets role " + overwrite.target().roleId()
              + ", not role " + roleId);
    }

    Permissions grant = roles.get(roleId);
    if (grant == null) {
      return StatusOr.ofError(
          ErrorReason.OVERWRITE_ROLE_MISSING, "Role " + roleId + " is not in guild " + guildId);
    }
    if (grant.contains(Permission.ADMINISTRATOR)) {
      return StatusOr.ofValue(Permissions.all());
    }
    return StatusOr.ofValue(finish(channelType, overwrite.applyTo(grant)));
  }

  private StatusOr<Permissions> applyOverwrites(
      Member member, Permissions root, List<PermissionOverwrite> overwrites) {
    RoleId everyone = guildId.everyoneRole();
    Permissions everyoneAllow = Permissions.empty();
    Permissions everyoneDeny = Permissions.empty();
    Permissions rolesAllow = Permissions.empty();
    Permissions rolesDeny = Permissions.empty();
    Permissions memberAllow = Permissions.empty();
    Permissions memberDeny = Permissions.empty();

    for (PermissionOverwrite overwrite : overwrites) {
      switch (overwrite.target().kind()) {
        case ROLE -> {
          RoleId roleId = overwrite.target().roleId();
          if (roleId.equals(everyone)) {
            everyoneAllow = everyoneAllow.union(overwrite.allow());
            everyoneDeny = everyoneDeny.union(overwrite.deny());
            continue;
          }
          if (!roles.containsKey(roleId)) {
            if (!config.continueOnMissingItems()) {
              return StatusOr.ofError(
                  ErrorReason.OVERWRITE_ROLE_MISSING,
                  "Channel overwrite targets role " + roleId + " which is not in guild " + guildId);
            }
            Logger.debug("Overwrite for role {} ignored, role was not provided", roleId);
            continue;
          }
          if (member.hasRole(roleId)) {
            rolesAllow = rolesAllow.union(overwrite.allow());
            rolesDeny = rolesDeny.union(overwrite.deny());
          }
        }
        case MEMBER -> {
          if (overwrite.target().userId().equals(member.userId())) {
            memberAllow = memberAllow.union(overwrite.allow());
            memberDeny = memberDeny.union(overwrite.deny());
          }
        }
      }
    }

    Permissions permissions = root.difference(everyoneDeny).union(everyoneAllow);
    permissions = permissions.difference(rolesDeny).union(rolesAllow);
    permissions = permissions.difference(memberDeny).union(memberAllow);
    return StatusOr.ofValue(permissions);
  }

  private Permissions finish(ChannelType channelType, Permissions permissions) {
    return config.dependencies().apply(channelType.restrict(permissions));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("guildId", guildId)
        .add("ownerId", ownerId)
        .add("roleCount", roles.size())
        .add("config", config)
        .toString();
  }
}
