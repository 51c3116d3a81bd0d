package io.clusterengine.dispatcher;

/**
 * Cooperative cancellation signal passed down the execution call chain.
 *
 * Nothing is ever interrupted: code doing long or multi-step work polls the token at safe
 * checkpoints, cleans up partial effects, and reports the abort by throwing.
 */
public interface CancellationToken {

    boolean isCancelled();

    boolean isTimedOut();

    /**
     * @throws ActionCancelledException if cancellation was requested
     * @throws ActionTimeoutException if the action's deadline has passed
     */
    void checkpoint() throws ActionAbortedException;

    /**
     * A token that never fires.
     */
    static CancellationToken none() {
        return NoCancellation.INSTANCE;
    }

    final class NoCancellation implements CancellationToken {
        private static final NoCancellation INSTANCE = new NoCancellation();

        private NoCancellation() {
        }

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public boolean isTimedOut() {
            return false;
        }

        @Override
        public void checkpoint() {
            // never fires
        }
    }
}
