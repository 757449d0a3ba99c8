package com.guildperms.common.status;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of a permission calculation step: either OK or a failure code with a message and, for
 * resolver failures, the {@link ErrorReason} that produced it.
 */
public final class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  private final StatusCode code;
  private final String message;
  private final ErrorReason reason;

  private Status(StatusCode code, @Nullable String message, @Nullable ErrorReason reason) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.reason = reason;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  /** Creates a failed status for a resolver error reason. */
  public static Status of(ErrorReason reason, String message) {
    return new Status(reason.code(), message, reason);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new INTERNAL status with the given message. */
  public static Status internal(String message) {
    return new Status(StatusCode.INTERNAL, message, null);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  @Nullable
  public String getMessage() {
    return message;
  }

  /** Returns the resolver error reason, if this failure came from the resolver. */
  @Nonnull
  public Optional<ErrorReason> getReason() {
    return Optional.ofNullable(reason);
  }

  /** Returns true if this status carries the given reason. */
  public boolean hasReason(ErrorReason expected) {
    return reason == expected;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code.isError();
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code.isSuccess();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(code.toString());
    if (reason != null) {
      sb.append('[').append(reason).append(']');
    }
    if (message != null) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code && reason == other.reason && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, reason);
  }
}
