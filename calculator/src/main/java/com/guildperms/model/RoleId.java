package com.guildperms.model;

/**
 * Identifier of a guild role.
 *
 * @param value The raw identifier, interpreted as an unsigned 64-bit integer
 */
public record RoleId(long value) {

  /** Returns the identifier of the {@code @everyone} role of {@code guildId}. */
  public static RoleId everyone(GuildId guildId) {
    return guildId.everyoneRole();
  }

  /** Returns true if this is the {@code @everyone} role of {@code guildId}. */
  public boolean isEveryoneOf(GuildId guildId) {
    return value == guildId.value();
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
