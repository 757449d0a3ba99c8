package com.guildperms.permission;

/**
 * Kind of channel a permission set is evaluated in.
 *
 * <p>Each kind carries the mask of flags that are meaningful in it; anything else is cleared from
 * a channel result regardless of grants.
 */
public enum ChannelType {
  GUILD_TEXT(Family.TEXT),
  GUILD_VOICE(Family.VOICE),
  GUILD_CATEGORY(Family.NONE),
  GUILD_ANNOUNCEMENT(Family.TEXT),
  GUILD_STAGE_VOICE(Family.VOICE),
  GUILD_FORUM(Family.TEXT),
  ANNOUNCEMENT_THREAD(Family.TEXT),
  PUBLIC_THREAD(Family.TEXT),
  PRIVATE_THREAD(Family.TEXT);

  private enum Family {
    TEXT,
    VOICE,
    NONE
  }

  private final Family family;

  ChannelType(Family family) {
    this.family = family;
  }

  /** Returns true for channels whose members exchange messages. */
  public boolean isTextBased() {
    return family == Family.TEXT;
  }

  /** Returns true for channels members connect to for audio. */
  public boolean isVoiceBased() {
    return family == Family.VOICE;
  }

  /** Returns true for thread channels. */
  public boolean isThread() {
    return this == ANNOUNCEMENT_THREAD || this == PUBLIC_THREAD || this == PRIVATE_THREAD;
  }

  /** Returns the flags that are meaningful in this kind of channel. */
  public Permissions mask() {
    return switch (family) {
      case TEXT -> PermissionGroups.GENERAL_CHANNEL.union(PermissionGroups.TEXT);
      case VOICE -> PermissionGroups.GENERAL_CHANNEL.union(PermissionGroups.VOICE);
      case NONE -> PermissionGroups.GENERAL_CHANNEL;
    };
  }

  /** Clears every flag of {@code permissions} that is not meaningful in this kind of channel. */
  public Permissions restrict(Permissions permissions) {
    return permissions.intersection(mask());
  }
}
