package io.clusterengine.dispatcher;

/**
 * Base for the ways an action can stop at a checkpoint without failing on its own.
 */
public abstract class ActionAbortedException extends Exception {

    protected ActionAbortedException(String message) {
        super(message);
    }
}
