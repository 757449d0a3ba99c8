package com.guildperms.permission;

import com.guildperms.common.status.Status;
import com.guildperms.common.status.StatusOr;
import com.google.common.base.MoreObjects;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * Immutable set of {@link Permission} flags packed into a 64-bit mask.
 *
 * <p>Bits that do not belong to a declared {@link Permission} are always zero. Instances are
 * obtained from the factories ({@link #of}, {@link #fromBits}, {@link #fromBitsTruncate}) and
 * combined with the set operations, each of which returns a new instance.
 *
 * <pre>
 * Permissions base = Permissions.of(Permission.VIEW_CHANNEL, Permission.SEND_MESSAGES);
 * Permissions muted = base.difference(Permissions.of(Permission.SEND_MESSAGES));
 * muted.contains(Permission.VIEW_CHANNEL); // true
 * </pre>
 */
public final class Permissions implements PermissionChecker {

  private static final long KNOWN_BITS;

  static {
    long bits = 0L;
    for (Permission p : Permission.values()) {
      bits |= p.mask();
    }
    KNOWN_BITS = bits;
  }

  private static final Permissions EMPTY = new Permissions(0L);
  private static final Permissions ALL = new Permissions(KNOWN_BITS);

  private final long bits;

  private Permissions(long bits) {
    this.bits = bits;
  }

  /** Returns the set with no flags. */
  public static Permissions empty() {
    return EMPTY;
  }

  /** Returns the set with every declared flag. */
  public static Permissions all() {
    return ALL;
  }

  /** Returns the set holding exactly the given flags. */
  public static Permissions of(Permission... permissions) {
    long bits = 0L;
    for (Permission p : permissions) {
      bits |= p.mask();
    }
    return fromKnownBits(bits);
  }

  /** Returns the set holding exactly the given flags. */
  public static Permissions of(Collection<Permission> permissions) {
    long bits = 0L;
    for (Permission p : permissions) {
      bits |= p.mask();
    }
    return fromKnownBits(bits);
  }

  /**
   * Parses a raw mask, rejecting it if any bit does not correspond to a declared flag.
   *
   * @param bits the raw mask
   * @return the permission set, or INVALID_ARGUMENT if unknown bits are set
   */
  public static StatusOr<Permissions> fromBits(long bits) {
    long unknown = bits & ~KNOWN_BITS;
    if (unknown != 0L) {
      return StatusOr.ofStatus(
          Status.invalidArgument(
              "Unknown permission bits: 0x" + Long.toHexString(unknown)));
    }
    return StatusOr.ofValue(fromKnownBits(bits));
  }

  /** Builds a set from a raw mask, silently dropping bits with no declared flag. */
  public static Permissions fromBitsTruncate(long bits) {
    return fromKnownBits(bits & KNOWN_BITS);
  }

  private static Permissions fromKnownBits(long bits) {
    if (bits == 0L) {
      return EMPTY;
    }
    if (bits == KNOWN_BITS) {
      return ALL;
    }
    return new Permissions(bits);
  }

  /** Returns the raw mask. */
  public long bits() {
    return bits;
  }

  /** Returns the flags in this set or in {@code other}. */
  public Permissions union(Permissions other) {
    return fromKnownBits(bits | other.bits);
  }

  /** Returns the flags present in both this set and {@code other}. */
  public Permissions intersection(Permissions other) {
    return fromKnownBits(bits & other.bits);
  }

  /** Returns the flags in this set that are not in {@code other}. */
  public Permissions difference(Permissions other) {
    return fromKnownBits(bits & ~other.bits);
  }

  /** Returns a copy with {@code permission} added. */
  public Permissions with(Permission permission) {
    return fromKnownBits(bits | permission.mask());
  }

  /** Returns a copy with {@code permission} removed. */
  public Permissions without(Permission permission) {
    return fromKnownBits(bits & ~permission.mask());
  }

  /** Returns true if every flag of {@code other} is in this set. */
  public boolean contains(Permissions other) {
    return (bits & other.bits) == other.bits;
  }

  /** Returns true if {@code permission} is in this set. */
  public boolean contains(Permission permission) {
    return (bits & permission.mask()) != 0L;
  }

  /** Returns true if this set shares at least one flag with {@code other}. */
  public boolean intersects(Permissions other) {
    return (bits & other.bits) != 0L;
  }

  /** Returns true if this set has no flags. */
  public boolean isEmpty() {
    return bits == 0L;
  }

  /** Returns true if this set has every declared flag. */
  public boolean isAll() {
    return bits == KNOWN_BITS;
  }

  @Override
  public boolean hasPermission(Permission permission) {
    return contains(permission);
  }

  /** Returns the flags of this set as a new mutable {@link EnumSet}. */
  @Nonnull
  public Set<Permission> toSet() {
    EnumSet<Permission> set = EnumSet.noneOf(Permission.class);
    for (Permission p : Permission.values()) {
      if (contains(p)) {
        set.add(p);
      }
    }
    return set;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Permissions)) {
      return false;
    }
    return bits == ((Permissions) obj).bits;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(bits);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("bits", "0x" + Long.toHexString(bits))
        .add("flags", toSet())
        .toString();
  }
}
