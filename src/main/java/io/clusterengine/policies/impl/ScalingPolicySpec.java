package io.clusterengine.policies.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.AdjustmentType;
import lombok.Getter;

/**
 * Spec document of a scaling policy.
 */
@Getter
public class ScalingPolicySpec {

    @JsonProperty("event")
    private ActionType event;

    @JsonProperty("adjustment")
    private Adjustment adjustment = new Adjustment();

    @Getter
    public static class Adjustment {

        @JsonProperty("type")
        private AdjustmentType type = AdjustmentType.CHANGE_IN_CAPACITY;

        @JsonProperty("number")
        private double number = 1;

        // Smallest count a percentage adjustment may produce
        @JsonProperty("min_step")
        private int minStep = 1;

        @JsonProperty("best_effort")
        private boolean bestEffort = false;
    }
}
