package org.hexroute.routing.core;

import lombok.Builder;
import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.grid.HexGridLoader;
import org.hexroute.grid.TileMap;
import org.hexroute.routing.concurrent.CancellationSignal;
import org.hexroute.routing.concurrent.CancellationSource;
import org.hexroute.routing.strategy.HexPath;
import org.hexroute.routing.strategy.PathfindingException;
import org.hexroute.routing.strategy.PathfindingStrategies;
import org.hexroute.routing.strategy.PathfindingStrategy;
import org.hexroute.routing.strategy.SearchResult;
import org.hexroute.routing.strategy.SearchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Search coordinator entry point.
 *
 * <p>Owns the active strategy and schedules searches against one grid. Execution flow of
 * {@link #searchAsync}:</p>
 * <ul>
 * <li>Cancel and release the outstanding search of this coordinator, if any.</li>
 * <li>Link the caller's signal and a fresh internal source into one cancellation source.</li>
 * <li>Run the strategy on the worker executor, or inline when offloading is disabled.</li>
 * <li>Deliver on the callback executor; a search cancelled by then completes as {@code CANCELLED}.</li>
 * <li>Close the cancellation source on every exit path.</li>
 * </ul>
 *
 * <p>At most one search is current. Strategy execution is serialized by an internal lock, so
 * a superseded search still unwinding never overlaps its successor on the shared strategy
 * instance, and {@link #rebuildGrid} never mutates the grid under a running search.</p>
 *
 * <p><strong>Delivery thread:</strong> without a configured callback executor, results complete
 * on whichever thread finished the search: the {@code hexroute-pathfinding} worker when
 * offloading, the caller itself when inline. Hosts with a frame loop should configure a
 * {@link org.hexroute.routing.concurrent.FrameExecutor} so results resume on their own thread
 * no earlier than the next frame.</p>
 */
public final class PathfindingSystem implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathfindingSystem.class);

    public static final String REASON_STRATEGY_REQUIRED = "HEX_STRATEGY_REQUIRED";
    public static final String REASON_SEARCH_FAILED = "HEX_SEARCH_FAILED";
    public static final String REASON_COORDINATOR_CLOSED = "HEX_COORDINATOR_CLOSED";

    private static final Executor DIRECT_EXECUTOR = Runnable::run;

    private final HexGrid grid;
    private final PathfindingRuntimeConfig config;
    private final Executor workerExecutor;
    private final Executor callbackExecutor;
    private final ExecutorService ownedWorker;

    private final ReentrantLock searchLock = new ReentrantLock();
    private final Object stateLock = new Object();

    private volatile PathfindingStrategy strategy;
    private CancellationSource currentSearch;
    private boolean closed;

    /**
     * Creates a coordinator bound to one grid.
     *
     * @param grid tile index searched by every request.
     * @param strategy optional initial strategy; defaults to the algorithm named by {@code config}.
     * @param config optional runtime config; defaults to {@link PathfindingRuntimeConfig#fromSystemProperties()}.
     */
    @Builder
    public PathfindingSystem(HexGrid grid, PathfindingStrategy strategy, PathfindingRuntimeConfig config) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.config = config == null ? PathfindingRuntimeConfig.fromSystemProperties() : config;
        this.strategy = strategy == null ? PathfindingStrategies.create(this.config.getAlgorithm()) : strategy;
        this.callbackExecutor = this.config.getCallbackExecutor() == null
                ? DIRECT_EXECUTOR
                : this.config.getCallbackExecutor();
        if (this.config.getWorkerExecutor() != null) {
            this.workerExecutor = this.config.getWorkerExecutor();
            this.ownedWorker = null;
        } else if (this.config.isOffloadEnabled()) {
            this.ownedWorker = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "hexroute-pathfinding");
                thread.setDaemon(true);
                return thread;
            });
            this.workerExecutor = ownedWorker;
        } else {
            this.workerExecutor = DIRECT_EXECUTOR;
            this.ownedWorker = null;
        }
        LOGGER.info("Pathfinding system initialized with {} (offload={})", this.strategy.name(), this.config.isOffloadEnabled());
    }

    /**
     * @return grid searched by this coordinator.
     */
    public HexGrid grid() {
        return grid;
    }

    /**
     * @return strategy used by the next search.
     */
    public PathfindingStrategy strategy() {
        return strategy;
    }

    /**
     * Replaces the strategy. Takes effect on the next search; an in-flight search keeps its own.
     *
     * @throws PathfindingException with {@link #REASON_STRATEGY_REQUIRED} when {@code strategy} is null.
     */
    public void setStrategy(PathfindingStrategy strategy) {
        if (strategy == null) {
            LOGGER.error("Cannot set a null pathfinding strategy");
            throw new PathfindingException(REASON_STRATEGY_REQUIRED, "pathfinding strategy must be provided");
        }
        this.strategy = strategy;
        LOGGER.info("Pathfinding strategy set to {}", strategy.name());
    }

    /**
     * Asynchronous path query.
     *
     * @return future of the path, completing with null when there is no path or the search was cancelled.
     * @see #searchAsync(HexCoordinates, HexCoordinates, CancellationSignal)
     */
    public CompletableFuture<HexPath> findPathAsync(HexCoordinates start, HexCoordinates goal, CancellationSignal signal) {
        return searchAsync(start, goal, signal).thenApply(SearchResult::path);
    }

    /**
     * Starts a search, superseding any outstanding one.
     *
     * <p>Cancellation never surfaces as an exception: a search cancelled through {@code signal},
     * {@link #cancelCurrent()}, a newer request or {@link #close()} completes with
     * {@link SearchStatus#CANCELLED}. Unexpected faults complete the future exceptionally with
     * {@link #REASON_SEARCH_FAILED}.</p>
     *
     * @param start start cell.
     * @param goal goal cell.
     * @param signal optional caller cancellation.
     * @return future completed on the configured callback executor.
     * @throws PathfindingException with {@link #REASON_COORDINATOR_CLOSED} after {@link #close()}, or
     *         {@link #REASON_SEARCH_FAILED} when the worker executor rejects the search. The search
     *         slot is released before either is thrown.
     */
    public CompletableFuture<SearchResult> searchAsync(HexCoordinates start, HexCoordinates goal, CancellationSignal signal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        CancellationSource source = beginSearch(signal == null ? CancellationSignal.NONE : signal);
        PathfindingStrategy selected = strategy;

        CompletableFuture<SearchResult> computed;
        try {
            computed = dispatch(start, goal, selected, source);
        } catch (RuntimeException ex) {
            finishSearch(source);
            throw dispatchFailure(start, goal, selected, ex);
        }

        return computed
                .thenApplyAsync(result -> deliver(result, source), callbackExecutor)
                .whenComplete((result, error) -> finishSearch(source));
    }

    /**
     * Synchronous path query on the caller's thread.
     *
     * @return path, or null when none exists.
     */
    public HexPath findPath(HexCoordinates start, HexCoordinates goal) {
        return search(start, goal).path();
    }

    /**
     * Synchronous search on the caller's thread, serialized with asynchronous searches.
     *
     * <p>Does not supersede the current asynchronous search and is not cancellable.</p>
     */
    public SearchResult search(HexCoordinates start, HexCoordinates goal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        ensureOpen();
        PathfindingStrategy selected = strategy;
        searchLock.lock();
        try {
            return selected.search(start, goal, grid, CancellationSignal.NONE);
        } finally {
            searchLock.unlock();
        }
    }

    /**
     * Cancels and releases the current search. No-op when none is outstanding.
     */
    public void cancelCurrent() {
        synchronized (stateLock) {
            cancelCurrentLocked();
        }
    }

    /**
     * @return whether a search is outstanding.
     */
    public boolean isSearching() {
        synchronized (stateLock) {
            return currentSearch != null;
        }
    }

    /**
     * Repopulates the grid from a parsed map.
     *
     * <p>Cancels the outstanding search and waits for any running strategy to unwind before
     * touching the grid.</p>
     *
     * @return number of walkable tiles in the new grid.
     */
    public int rebuildGrid(TileMap tileMap, double hexSize) {
        Objects.requireNonNull(tileMap, "tileMap");
        ensureOpen();
        cancelCurrent();
        searchLock.lock();
        try {
            return HexGridLoader.populate(grid, tileMap, hexSize);
        } finally {
            searchLock.unlock();
        }
    }

    /**
     * Cancels the outstanding search and rejects later requests. Idempotent.
     *
     * <p>A worker executor created by this coordinator is shut down; supplied executors are
     * left to their owners.</p>
     */
    @Override
    public void close() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            cancelCurrentLocked();
        }
        if (ownedWorker != null) {
            ownedWorker.shutdown();
        }
        LOGGER.info("Pathfinding system closed");
    }

    private CancellationSource beginSearch(CancellationSignal callerSignal) {
        synchronized (stateLock) {
            ensureOpenLocked();
            cancelCurrentLocked();
            CancellationSource source = CancellationSource.linkedTo(callerSignal);
            currentSearch = source;
            return source;
        }
    }

    private CompletableFuture<SearchResult> dispatch(
            HexCoordinates start,
            HexCoordinates goal,
            PathfindingStrategy selected,
            CancellationSource source
    ) {
        if (config.isOffloadEnabled()) {
            return CompletableFuture.supplyAsync(() -> execute(start, goal, selected, source), workerExecutor);
        }
        CompletableFuture<SearchResult> computed = new CompletableFuture<>();
        try {
            computed.complete(execute(start, goal, selected, source));
        } catch (RuntimeException ex) {
            computed.completeExceptionally(ex);
        }
        return computed;
    }

    /**
     * Maps a worker hand-off failure (typically a rejected submission) to a reason-coded exception.
     */
    private PathfindingException dispatchFailure(
            HexCoordinates start,
            HexCoordinates goal,
            PathfindingStrategy selected,
            RuntimeException cause
    ) {
        synchronized (stateLock) {
            if (closed) {
                return new PathfindingException(REASON_COORDINATOR_CLOSED, "pathfinding system closed during dispatch", cause);
            }
        }
        LOGGER.error("Could not dispatch search from {} to {} with {}", start, goal, selected.name(), cause);
        return new PathfindingException(
                REASON_SEARCH_FAILED,
                "search from " + start + " to " + goal + " with " + selected.name() + " could not be dispatched",
                cause
        );
    }

    private SearchResult execute(
            HexCoordinates start,
            HexCoordinates goal,
            PathfindingStrategy selected,
            CancellationSource source
    ) {
        searchLock.lock();
        try {
            if (source.isCancelled()) {
                return SearchResult.cancelled(0);
            }
            return selected.search(start, goal, grid, source);
        } catch (RuntimeException ex) {
            if (source.isCancelled()) {
                LOGGER.debug("Search from {} to {} failed after cancellation", start, goal, ex);
                return SearchResult.cancelled(0);
            }
            LOGGER.error("Error during pathfinding from {} to {} with {}", start, goal, selected.name(), ex);
            throw new PathfindingException(
                    REASON_SEARCH_FAILED,
                    "search from " + start + " to " + goal + " with " + selected.name() + " failed",
                    ex
            );
        } finally {
            searchLock.unlock();
        }
    }

    private static SearchResult deliver(SearchResult result, CancellationSource source) {
        if (source.isCancelled() && result.status() != SearchStatus.CANCELLED) {
            return SearchResult.cancelled(result.expandedNodes());
        }
        return result;
    }

    private void finishSearch(CancellationSource source) {
        synchronized (stateLock) {
            if (currentSearch == source) {
                currentSearch = null;
            }
        }
        source.close();
    }

    private void cancelCurrentLocked() {
        CancellationSource previous = currentSearch;
        if (previous == null) {
            return;
        }
        currentSearch = null;
        previous.cancel();
        previous.close();
    }

    private void ensureOpen() {
        synchronized (stateLock) {
            ensureOpenLocked();
        }
    }

    private void ensureOpenLocked() {
        if (closed) {
            throw new PathfindingException(REASON_COORDINATOR_CLOSED, "pathfinding system is closed");
        }
    }
}
