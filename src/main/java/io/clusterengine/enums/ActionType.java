package io.clusterengine.enums;

/**
 * Operations the engine can run against clusters and nodes.
 */
public enum ActionType {
    CLUSTER_CREATE(TargetKind.CLUSTER),
    CLUSTER_DELETE(TargetKind.CLUSTER),
    CLUSTER_SCALE_OUT(TargetKind.CLUSTER),
    CLUSTER_SCALE_IN(TargetKind.CLUSTER),
    CLUSTER_ADD_NODES(TargetKind.CLUSTER),
    CLUSTER_DEL_NODES(TargetKind.CLUSTER),
    CLUSTER_CHECK(TargetKind.CLUSTER),
    CLUSTER_ATTACH_POLICY(TargetKind.CLUSTER),
    CLUSTER_DETACH_POLICY(TargetKind.CLUSTER),
    CLUSTER_UPDATE_POLICY(TargetKind.CLUSTER),

    NODE_CREATE(TargetKind.NODE),
    NODE_DELETE(TargetKind.NODE),
    NODE_JOIN(TargetKind.NODE),
    NODE_LEAVE(TargetKind.NODE),
    NODE_CHECK(TargetKind.NODE);

    private final TargetKind targetKind;

    ActionType(TargetKind targetKind) {
        this.targetKind = targetKind;
    }

    public TargetKind getTargetKind() {
        return targetKind;
    }
}
