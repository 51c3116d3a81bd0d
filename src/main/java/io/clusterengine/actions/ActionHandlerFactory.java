package io.clusterengine.actions;

import io.clusterengine.enums.ActionType;

/**
 * Picks the handler that runs the body of an action type.
 */
public class ActionHandlerFactory {

    private final ClusterActionHandler clusterHandler;
    private final NodeActionHandler nodeHandler;

    public ActionHandlerFactory() {
        this(new ClusterActionHandler(), new NodeActionHandler());
    }

    public ActionHandlerFactory(ClusterActionHandler clusterHandler, NodeActionHandler nodeHandler) {
        this.clusterHandler = clusterHandler;
        this.nodeHandler = nodeHandler;
    }

    public ActionHandler getHandler(ActionType type) {
        return switch (type.getTargetKind()) {
            case CLUSTER -> clusterHandler;
            case NODE -> nodeHandler;
        };
    }
}
