package io.clusterengine.policies;

/**
 * Thrown when a policy document or binding request is malformed. Raised at creation or bind
 * time, before any action runs with the policy.
 */
public class InvalidPolicyConfigException extends Exception {

    public InvalidPolicyConfigException(String message) {
        super(message);
    }

    public InvalidPolicyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
