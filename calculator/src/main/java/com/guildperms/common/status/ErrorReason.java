package com.guildperms.common.status;

/**
 * Typed reason attached to a failed {@link Status}, so callers can tell the resolver failures
 * apart without parsing messages.
 */
public enum ErrorReason {
  /** A construction argument was null or otherwise malformed. */
  INVALID_INPUT(StatusCode.INVALID_ARGUMENT),

  /** The guild's {@code @everyone} role is missing from the role map. */
  EVERYONE_ROLE_MISSING(StatusCode.INVALID_ARGUMENT),

  /** A role held by the member is missing from the role map. */
  MEMBER_ROLE_MISSING(StatusCode.NOT_FOUND),

  /** A channel overwrite targets a role that is missing from the role map. */
  OVERWRITE_ROLE_MISSING(StatusCode.NOT_FOUND),

  /** A role evaluation received an overwrite that does not target that role. */
  OVERWRITE_NOT_ROLE(StatusCode.INVALID_ARGUMENT);

  private final StatusCode code;

  ErrorReason(StatusCode code) {
    this.code = code;
  }

  /** Returns the status code reported for this reason. */
  public StatusCode code() {
    return code;
  }

  /** Creates a failed status for this reason with the given message. */
  public Status toStatus(String message) {
    return Status.of(this, message);
  }
}
