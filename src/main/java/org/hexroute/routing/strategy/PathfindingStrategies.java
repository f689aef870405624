package org.hexroute.routing.strategy;

import lombok.experimental.UtilityClass;
import org.hexroute.routing.heuristic.HeuristicType;
import org.hexroute.routing.search.SearchBudget;

import java.util.Objects;

/**
 * Strategy factory.
 */
@UtilityClass
public final class PathfindingStrategies {

    /**
     * Builds a fresh strategy instance bounded by {@link SearchBudget#defaults()}.
     *
     * <p>Instances are never shared: every call returns new scratch state.</p>
     */
    public static PathfindingStrategy create(PathfindingAlgorithm algorithm) {
        return create(algorithm, SearchBudget.defaults());
    }

    /**
     * Builds a fresh strategy instance with an explicit budget.
     */
    public static PathfindingStrategy create(PathfindingAlgorithm algorithm, SearchBudget budget) {
        Objects.requireNonNull(algorithm, "algorithm");
        return switch (algorithm) {
            case A_STAR -> new AStarPathfinding(HeuristicType.HEX_DISTANCE, budget);
            case DIJKSTRA -> new AStarPathfinding(HeuristicType.NONE, budget);
        };
    }
}
