package org.hexroute.routing.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner side of a cancellation handle, optionally linked to parent signals.
 *
 * <p>A linked source is the logical OR of its own {@link #cancel()} and every parent:
 * whichever fires first cancels it. {@link #close()} detaches it from its parents exactly
 * once, no matter how many times or from which thread it is called.</p>
 *
 * <p>Thread-safe.</p>
 */
public final class CancellationSource implements CancellationSignal, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationSource.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ConcurrentLinkedQueue<Runnable> callbacks = new ConcurrentLinkedQueue<>();
    private final List<Registration> parentRegistrations = new ArrayList<>();

    private CancellationSource() {
    }

    /**
     * Creates an unlinked source.
     */
    public static CancellationSource create() {
        return new CancellationSource();
    }

    /**
     * Creates a source that also fires when any of {@code parents} fires.
     *
     * <p>A parent that has already fired cancels the new source before it is returned.</p>
     *
     * @param parents parent signals; null entries are treated as {@link CancellationSignal#NONE}.
     */
    public static CancellationSource linkedTo(CancellationSignal... parents) {
        CancellationSource source = new CancellationSource();
        if (parents != null) {
            synchronized (source.parentRegistrations) {
                for (CancellationSignal parent : parents) {
                    if (parent == null || parent == CancellationSignal.NONE) {
                        continue;
                    }
                    source.parentRegistrations.add(parent.onCancel(source::cancel));
                }
            }
        }
        return source;
    }

    /**
     * Requests cancellation. Only the first call runs callbacks.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        Runnable callback;
        while ((callback = callbacks.poll()) != null) {
            runCallback(callback);
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        Runnable entry = callback::run;
        callbacks.add(entry);
        if (cancelled.get() && callbacks.remove(entry)) {
            runCallback(entry);
            return Registration.EMPTY;
        }
        return () -> callbacks.remove(entry);
    }

    /**
     * @return whether {@link #close()} has been called.
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Detaches from parent signals and drops pending callbacks.
     *
     * <p>Cancellation state is kept: a closed source that was cancelled still reports so.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (parentRegistrations) {
            for (Registration registration : parentRegistrations) {
                registration.close();
            }
            parentRegistrations.clear();
        }
        callbacks.clear();
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Cancellation callback failed", ex);
        }
    }

    @Override
    public String toString() {
        return "CancellationSource{cancelled=" + cancelled.get() + ", closed=" + closed.get() + '}';
    }
}
