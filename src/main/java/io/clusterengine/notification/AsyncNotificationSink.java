package io.clusterengine.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Hands events to a delegate sink on a background thread so emitters never block on it.
 */
@Slf4j
public class AsyncNotificationSink implements NotificationSink {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final NotificationSink delegate;
    private final ExecutorService executor;

    public AsyncNotificationSink(NotificationSink delegate) {
        this.delegate = delegate;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("engine-notify-" + t.getId());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void emit(ActionEvent event) {
        try {
            executor.execute(() -> {
                try {
                    delegate.emit(event);
                } catch (RuntimeException e) {
                    log.warn("Notification sink failed for action {}: {}", event.getActionId(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Notification sink closed, dropping event for action {}", event.getActionId());
        }
    }

    /**
     * Delivers queued events, waiting a bounded time, then closes the delegate.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Notification executor did not terminate in time, dropping remaining events");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        delegate.close();
    }
}
