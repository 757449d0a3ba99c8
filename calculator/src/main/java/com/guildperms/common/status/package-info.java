/**
 * Status reporting for permission calculations.
 *
 * <ul>
 *   <li>{@link com.guildperms.common.status.StatusCode} - canonical failure codes</li>
 *   <li>{@link com.guildperms.common.status.ErrorReason} - typed resolver failure reasons</li>
 *   <li>{@link com.guildperms.common.status.Status} - a code with optional message and reason</li>
 *   <li>{@link com.guildperms.common.status.StatusOr} - either a value or a failed status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Permissions&gt; result = resolver.inContext(member, ChannelType.GUILD_TEXT, overwrites);
 * if (result.isOk()) {
 *     boolean canSend = result.getValue().contains(Permission.SEND_MESSAGES);
 * } else if (result.getStatus().hasReason(ErrorReason.MEMBER_ROLE_MISSING)) {
 *     // role cache is stale, refetch and retry
 * }
 * </pre>
 */
package com.guildperms.common.status;
