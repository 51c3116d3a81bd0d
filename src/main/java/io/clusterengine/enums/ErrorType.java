package io.clusterengine.enums;

/**
 * Structured reason attached to an action that did not succeed.
 */
public enum ErrorType {
    LOCK_BUSY,
    POLICY_REJECTED,
    DRIVER_ERROR,
    CANCELLED,
    TIMEOUT,
    INCONSISTENT_LOCK_RELEASE,
    TARGET_NOT_FOUND,
    INVALID_INPUT,
    INTERNAL
}
