package org.hexroute.routing.strategy;

import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.routing.concurrent.CancellationSignal;

/**
 * Pluggable hex-grid search algorithm.
 *
 * <p>Implementations may keep reusable scratch state and are then not safe for concurrent
 * re-entry: parallel searches need separate instances.</p>
 */
public interface PathfindingStrategy {

    /**
     * @return display name of this strategy.
     */
    String name();

    /**
     * Searches for a path on {@code grid}.
     *
     * @param start start cell.
     * @param goal goal cell.
     * @param grid tile index, read-only for the duration of the call.
     * @param signal cancellation polled between node expansions.
     * @return search outcome; expected failures are statuses, not exceptions.
     * @throws PathfindingException on configuration errors or contract violations.
     */
    SearchResult search(HexCoordinates start, HexCoordinates goal, HexGrid grid, CancellationSignal signal);

    /**
     * Convenience form of {@link #search} without cancellation.
     *
     * @return path from start to goal, or null when none exists.
     */
    default HexPath findPath(HexCoordinates start, HexCoordinates goal, HexGrid grid) {
        return search(start, goal, grid, CancellationSignal.NONE).path();
    }
}
