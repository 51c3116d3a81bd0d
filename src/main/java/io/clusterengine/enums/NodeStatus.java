package io.clusterengine.enums;

public enum NodeStatus {
    INIT,
    ACTIVE,
    WARNING,
    ERROR,
    DELETING,
    DELETED
}
