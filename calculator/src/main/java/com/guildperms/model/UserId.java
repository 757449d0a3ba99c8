package com.guildperms.model;

/**
 * Identifier of a user.
 *
 * @param value The raw identifier, interpreted as an unsigned 64-bit integer
 */
public record UserId(long value) {

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
