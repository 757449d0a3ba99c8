package com.guildperms.model;

import java.util.Objects;

/**
 * Target of a channel permission overwrite: either a role or a single member.
 *
 * <p>The variant is carried by {@link #kind()}; the identifier is exposed through the accessor
 * matching that variant.
 *
 * @param kind Whether {@link #id()} names a role or a user
 * @param id The raw identifier of the role or user
 */
public record OverwriteTarget(Kind kind, long id) {

  /** The two overwrite target variants. */
  public enum Kind {
    ROLE,
    MEMBER
  }

  public OverwriteTarget {
    Objects.requireNonNull(kind, "kind");
  }

  /** Targets every member holding {@code roleId}. */
  public static OverwriteTarget role(RoleId roleId) {
    return new OverwriteTarget(Kind.ROLE, roleId.value());
  }

  /** Targets the single member {@code userId}. */
  public static OverwriteTarget member(UserId userId) {
    return new OverwriteTarget(Kind.MEMBER, userId.value());
  }

  /**
   * Returns the targeted role.
   *
   * @throws IllegalStateException if this targets a member
   */
  public RoleId roleId() {
    if (kind != Kind.ROLE) {
      throw new IllegalStateException("Overwrite targets a member, not a role: " + this);
    }
    return new RoleId(id);
  }

  /**
   * Returns the targeted user.
   *
   * @throws IllegalStateException if this targets a role
   */
  public UserId userId() {
    if (kind != Kind.MEMBER) {
      throw new IllegalStateException("Overwrite targets a role, not a member: " + this);
    }
    return new UserId(id);
  }

  @Override
  public String toString() {
    return kind + ":" + Long.toUnsignedString(id);
  }
}
