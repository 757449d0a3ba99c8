package com.guildperms.permission;

/**
 * Contract for anything that can answer whether a permission flag is granted.
 *
 * <p>{@link Permissions} implements it directly; callers wrapping a resolved permission set in
 * their own principal types can implement it as well and get the any/all helpers for free.
 */
public interface PermissionChecker {
  /**
   * Checks if the given permission is granted.
   *
   * @param permission The permission to check
   * @return true if the permission is granted, false otherwise
   */
  boolean hasPermission(Permission permission);

  /**
   * Checks if at least one of the given permissions is granted.
   *
   * @param permissions The permissions to check
   * @return true if any permission is granted, false if none (or none were given)
   */
  default boolean hasAnyPermission(Permission... permissions) {
    for (Permission p : permissions) {
      if (hasPermission(p)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Checks if every one of the given permissions is granted.
   *
   * @param permissions The permissions to check
   * @return true if all permissions are granted (vacuously true for none), false otherwise
   */
  default boolean hasAllPermissions(Permission... permissions) {
    for (Permission p : permissions) {
      if (!hasPermission(p)) {
        return false;
      }
    }
    return true;
  }
}
