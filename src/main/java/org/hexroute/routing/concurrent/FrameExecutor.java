package org.hexroute.routing.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * Executor drained by the host's per-frame update loop.
 *
 * <p>Any thread may submit; tasks run only when the owning loop calls {@link #runFrame()},
 * so continuations posted here resume on the host's own thread. A task submitted while a
 * frame is running waits for the next frame.</p>
 */
public final class FrameExecutor implements Executor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameExecutor.class);

    private final ConcurrentLinkedQueue<Runnable> pending = new ConcurrentLinkedQueue<>();

    @Override
    public void execute(Runnable command) {
        pending.add(Objects.requireNonNull(command, "command"));
    }

    /**
     * Runs the tasks queued before this call. A failing task is logged and does not stop
     * the frame.
     *
     * @return number of tasks executed.
     */
    public int runFrame() {
        int budget = pending.size();
        int executed = 0;
        while (executed < budget) {
            Runnable task = pending.poll();
            if (task == null) {
                break;
            }
            executed++;
            try {
                task.run();
            } catch (RuntimeException ex) {
                LOGGER.error("Frame task failed", ex);
            }
        }
        return executed;
    }

    /**
     * @return number of tasks waiting for a frame.
     */
    public int pendingCount() {
        return pending.size();
    }
}
