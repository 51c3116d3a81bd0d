package io.clusterengine.enums;

public enum ClusterStatus {
    INIT,
    ACTIVE,
    WARNING,
    ERROR,
    DELETING,
    DELETED
}
