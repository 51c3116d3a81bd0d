package io.clusterengine.enums;

/**
 * Point in an action's execution at which policy hooks run.
 */
public enum PolicyPhase {
    PRE,
    POST
}
