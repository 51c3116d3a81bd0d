package io.clusterengine.enums;

/**
 * How a scaling policy interprets its adjustment number.
 */
public enum AdjustmentType {
    EXACT_CAPACITY,
    CHANGE_IN_CAPACITY,
    CHANGE_IN_PERCENTAGE
}
