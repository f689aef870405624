package org.hexroute.routing.heuristic;

import org.hexroute.core.hex.HexCoordinates;

/**
 * Heuristic provider contract used by search strategies.
 *
 * <p>Providers are immutable and thread-safe.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal and returns a reusable estimator.
     *
     * @param goal goal cell.
     * @return immutable estimator bound to the provided goal.
     */
    GoalBoundHeuristic bindGoal(HexCoordinates goal);
}
