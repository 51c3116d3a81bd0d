package io.clusterengine.notification;

/**
 * Receives action lifecycle events. Emission is fire-and-forget: callers never wait on it and
 * a failing sink never affects the action.
 */
public interface NotificationSink extends AutoCloseable {

    void emit(ActionEvent event);

    @Override
    default void close() {
    }
}
