package io.clusterengine.policies.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public class HealthPolicySpec {

    // 0..100
    @JsonProperty("max_unhealthy_percentage")
    private int maxUnhealthyPercentage = 0;

    @JsonProperty("mark_cluster_warning")
    private boolean markClusterWarning = true;
}
