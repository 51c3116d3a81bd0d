package io.clusterengine.policies;

import io.clusterengine.models.PolicyRecord;

/**
 * Builds a policy object from its stored record, validating the spec document on the way.
 */
@FunctionalInterface
public interface PolicyFactory {

    Policy create(PolicyRecord record) throws InvalidPolicyConfigException;
}
