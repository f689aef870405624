package org.hexroute.routing.heuristic;

import org.hexroute.core.hex.HexCoordinates;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimateFrom(HexCoordinates)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining steps from a cell to a pre-bound goal.
     *
     * @param coordinates source cell.
     * @return admissible lower-bound estimate.
     */
    int estimateFrom(HexCoordinates coordinates);
}
