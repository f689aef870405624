package org.hexroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.hexroute.routing.strategy.PathfindingAlgorithm;

import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Runtime configuration used to bind search coordinator behavior once at startup.
 */
@Value
@Builder
public class PathfindingRuntimeConfig {
    public static final String PROP_OFFLOAD = "hexroute.pathfinding.offload";

    /**
     * Whether searches run on the worker executor (true) or on the caller's thread (false).
     */
    @Builder.Default
    boolean offloadEnabled = true;

    /**
     * Strategy built when the coordinator is created without an explicit one.
     */
    @Builder.Default
    PathfindingAlgorithm algorithm = PathfindingAlgorithm.A_STAR;

    /**
     * Executor for offloaded searches. Null makes the coordinator own a single daemon worker.
     */
    Executor workerExecutor;

    /**
     * Executor that delivers results back to the host, typically a
     * {@link org.hexroute.routing.concurrent.FrameExecutor}. Null delivers on the completing thread.
     */
    Executor callbackExecutor;

    /**
     * Returns the default runtime: offloaded A* with an owned worker and direct delivery.
     */
    public static PathfindingRuntimeConfig defaultRuntime() {
        return PathfindingRuntimeConfig.builder().build();
    }

    /**
     * Returns the default runtime with offloading read from {@code hexroute.pathfinding.offload}.
     */
    public static PathfindingRuntimeConfig fromSystemProperties() {
        return PathfindingRuntimeConfig.builder()
                .offloadEnabled(readBoolean(PROP_OFFLOAD, true))
                .build();
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                return fallback;
        }
    }
}
