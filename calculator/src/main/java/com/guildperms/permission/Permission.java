package com.guildperms.permission;

/**
 * Enumeration of the permission flags a guild role or channel overwrite can grant.
 *
 * <p>Each constant occupies a fixed bit of the 64-bit mask held by {@link Permissions}. The bit
 * positions follow the platform's published permission layout and must not be renumbered.
 *
 * <p>Flags fall into three broad scopes:
 * <ul>
 *   <li>guild-wide flags (e.g. {@link #BAN_MEMBERS}) that have no meaning inside a channel
 *   <li>channel flags shared by every channel kind (e.g. {@link #VIEW_CHANNEL})
 *   <li>flags specific to text or voice channels
 * </ul>
 *
 * <p>See {@link PermissionGroups} for the named groupings used by the resolver.
 */
public enum Permission {

  /** Allows creation of instant invites. */
  CREATE_INVITE(0),

  /** Allows kicking members. */
  KICK_MEMBERS(1),

  /** Allows banning members. */
  BAN_MEMBERS(2),

  /** Grants every permission and bypasses channel overwrites. */
  ADMINISTRATOR(3),

  /** Allows management and editing of channels. */
  MANAGE_CHANNELS(4),

  /** Allows management and editing of the guild. */
  MANAGE_GUILD(5),

  /** Allows adding reactions to messages. */
  ADD_REACTIONS(6),

  /** Allows viewing the guild audit log. */
  VIEW_AUDIT_LOG(7),

  /** Allows using priority speaker in a voice channel. */
  PRIORITY_SPEAKER(8),

  /** Allows streaming video in a voice channel. */
  STREAM(9),

  /** Allows viewing a channel, reading its messages or joining its voice session. */
  VIEW_CHANNEL(10),

  /** Allows sending messages in a channel. */
  SEND_MESSAGES(11),

  /** Allows sending text-to-speech messages. */
  SEND_TTS_MESSAGES(12),

  /** Allows deletion of other users' messages. */
  MANAGE_MESSAGES(13),

  /** Links sent by users with this permission are auto-embedded. */
  EMBED_LINKS(14),

  /** Allows uploading images and files. */
  ATTACH_FILES(15),

  /** Allows reading message history. */
  READ_MESSAGE_HISTORY(16),

  /** Allows mentioning the {@code @everyone} and {@code @here} groups. */
  MENTION_EVERYONE(17),

  /** Allows the usage of custom emojis from other guilds. */
  USE_EXTERNAL_EMOJIS(18),

  /** Allows viewing guild insights. */
  VIEW_GUILD_INSIGHTS(19),

  /** Allows joining a voice channel. */
  CONNECT(20),

  /** Allows speaking in a voice channel. */
  SPEAK(21),

  /** Allows muting members in a voice channel. */
  MUTE_MEMBERS(22),

  /** Allows deafening members in a voice channel. */
  DEAFEN_MEMBERS(23),

  /** Allows moving members between voice channels. */
  MOVE_MEMBERS(24),

  /** Allows using voice activity detection. */
  USE_VAD(25),

  /** Allows changing one's own nickname. */
  CHANGE_NICKNAME(26),

  /** Allows changing other members' nicknames. */
  MANAGE_NICKNAMES(27),

  /** Allows management and editing of roles. */
  MANAGE_ROLES(28),

  /** Allows management and editing of webhooks. */
  MANAGE_WEBHOOKS(29),

  /** Allows management and editing of emojis. */
  MANAGE_EMOJIS(30);

  private final int bit;

  Permission(int bit) {
    this.bit = bit;
  }

  /** Returns the zero-based bit position of this flag. */
  public int bit() {
    return bit;
  }

  /** Returns the single-bit mask of this flag. */
  public long mask() {
    return 1L << bit;
  }
}
