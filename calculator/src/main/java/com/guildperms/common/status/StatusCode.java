package com.guildperms.common.status;

/**
 * Status codes returned by permission calculations. The names follow the gRPC canonical codes so
 * that callers bridging into an RPC layer can map them one to one.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,   // malformed construction input or overwrite
    NOT_FOUND,          // referenced role is absent from the role map
    INTERNAL;

    /**
     * Returns whether this status code represents a successful calculation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }
}
