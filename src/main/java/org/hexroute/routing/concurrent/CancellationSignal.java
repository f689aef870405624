package org.hexroute.routing.concurrent;

/**
 * Read side of a cooperative cancellation handle.
 *
 * <p>Long-running work polls {@link #isCancelled()} at safe points; owners of derived
 * handles subscribe with {@link #onCancel(Runnable)}.</p>
 */
public interface CancellationSignal {

    /**
     * Signal that never fires.
     */
    CancellationSignal NONE = new CancellationSignal() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable callback) {
            return Registration.EMPTY;
        }

        @Override
        public String toString() {
            return "CancellationSignal.NONE";
        }
    };

    /**
     * @return whether cancellation has been requested.
     */
    boolean isCancelled();

    /**
     * Registers a callback that runs once when this signal fires.
     *
     * <p>If the signal already fired, the callback runs immediately on the calling thread.</p>
     *
     * @param callback action to run on cancellation.
     * @return handle that unregisters the callback when closed.
     */
    Registration onCancel(Runnable callback);

    /**
     * Callback registration handle. Closing is idempotent.
     */
    @FunctionalInterface
    interface Registration extends AutoCloseable {
        Registration EMPTY = () -> { };

        @Override
        void close();
    }
}
