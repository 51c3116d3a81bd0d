package io.clusterengine.policies.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.DeletionCriteria;
import lombok.Getter;

/**
 * Spec document of a deletion policy. Values are fixed once the policy is created.
 */
@Getter
public class DeletionPolicySpec {

    @JsonProperty("criteria")
    private DeletionCriteria criteria = DeletionCriteria.OLDEST_FIRST;

    @JsonProperty("destroy_after_deletion")
    private boolean destroyAfterDeletion = true;

    // Seconds between leaving the cluster and the destroy
    @JsonProperty("grace_period")
    private int gracePeriod = 0;

    @JsonProperty("reduce_desired_capacity")
    private boolean reduceDesiredCapacity = false;

    public DeletionPolicySpec() {
    }

    public DeletionPolicySpec(DeletionCriteria criteria, boolean destroyAfterDeletion, int gracePeriod,
                              boolean reduceDesiredCapacity) {
        this.criteria = criteria;
        this.destroyAfterDeletion = destroyAfterDeletion;
        this.gracePeriod = gracePeriod;
        this.reduceDesiredCapacity = reduceDesiredCapacity;
    }
}
