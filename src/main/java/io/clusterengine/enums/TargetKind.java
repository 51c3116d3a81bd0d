package io.clusterengine.enums;

/**
 * Kind of object an action operates on. The target is the unit of mutual exclusion.
 */
public enum TargetKind {
    CLUSTER,
    NODE
}
