package com.guildperms.model;

/**
 * Identifier of a guild. Doubles as the identifier of the guild's {@code @everyone} role.
 *
 * @param value The raw identifier, interpreted as an unsigned 64-bit integer
 */
public record GuildId(long value) {

  /** Returns the identifier of this guild's {@code @everyone} role. */
  public RoleId everyoneRole() {
    return new RoleId(value);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
