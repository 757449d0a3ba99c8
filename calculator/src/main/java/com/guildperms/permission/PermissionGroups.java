package com.guildperms.permission;

import static com.guildperms.permission.Permission.*;

/**
 * Named groupings of {@link Permission} flags used to mask channel results.
 */
public final class PermissionGroups {

  private PermissionGroups() {
    // Constants only
  }

  /** Flags that only make sense at the guild level and never appear in a channel result. */
  public static final Permissions GUILD_ONLY =
      Permissions.of(
          ADMINISTRATOR,
          BAN_MEMBERS,
          CHANGE_NICKNAME,
          KICK_MEMBERS,
          MANAGE_EMOJIS,
          MANAGE_GUILD,
          MANAGE_NICKNAMES,
          VIEW_AUDIT_LOG,
          VIEW_GUILD_INSIGHTS);

  /** Flags specific to text-like channels. */
  public static final Permissions TEXT =
      Permissions.of(
          ADD_REACTIONS,
          ATTACH_FILES,
          EMBED_LINKS,
          MANAGE_MESSAGES,
          MENTION_EVERYONE,
          READ_MESSAGE_HISTORY,
          SEND_MESSAGES,
          SEND_TTS_MESSAGES,
          USE_EXTERNAL_EMOJIS);

  /** Flags specific to voice-like channels. */
  public static final Permissions VOICE =
      Permissions.of(
          CONNECT,
          DEAFEN_MEMBERS,
          MOVE_MEMBERS,
          MUTE_MEMBERS,
          PRIORITY_SPEAKER,
          SPEAK,
          STREAM,
          USE_VAD);

  /** Message features that are meaningless without {@link Permission#SEND_MESSAGES}. */
  public static final Permissions MESSAGING =
      Permissions.of(ATTACH_FILES, EMBED_LINKS, MENTION_EVERYONE, SEND_TTS_MESSAGES);

  /** Channel flags shared by every channel kind. */
  public static final Permissions GENERAL_CHANNEL =
      Permissions.all().difference(GUILD_ONLY).difference(TEXT).difference(VOICE);

  /** Every flag that can appear in some channel result. */
  public static final Permissions ANY_CHANNEL = Permissions.all().difference(GUILD_ONLY);
}
