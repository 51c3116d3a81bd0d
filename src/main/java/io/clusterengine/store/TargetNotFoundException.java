package io.clusterengine.store;

import lombok.Getter;

/**
 * Thrown when a cluster, node or policy referenced by an operation does not exist.
 */
@Getter
public class TargetNotFoundException extends StoreException {

    private final String kind;
    private final String targetId;

    public TargetNotFoundException(String kind, String targetId) {
        super(kind + " " + targetId + " not found");
        this.kind = kind;
        this.targetId = targetId;
    }
}
