package org.hexroute.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.hexroute.core.hex.HexCoordinates;

import java.util.Objects;

/**
 * Heuristic provider factory.
 */
@UtilityClass
public final class HeuristicFactory {
    private static final HeuristicProvider NULL_PROVIDER = new NullHeuristicProvider();
    private static final HeuristicProvider HEX_DISTANCE_PROVIDER = new HexDistanceHeuristicProvider();

    /**
     * Returns the shared provider for one heuristic mode.
     *
     * @param type requested heuristic type.
     * @return stateless provider.
     */
    public static HeuristicProvider create(HeuristicType type) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case NONE -> NULL_PROVIDER;
            case HEX_DISTANCE -> HEX_DISTANCE_PROVIDER;
        };
    }

    /**
     * Always estimates zero, turning A* into Dijkstra.
     */
    private static final class NullHeuristicProvider implements HeuristicProvider {
        private static final GoalBoundHeuristic ZERO = coordinates -> 0;

        @Override
        public HeuristicType type() {
            return HeuristicType.NONE;
        }

        @Override
        public GoalBoundHeuristic bindGoal(HexCoordinates goal) {
            Objects.requireNonNull(goal, "goal");
            return ZERO;
        }
    }

    private static final class HexDistanceHeuristicProvider implements HeuristicProvider {
        @Override
        public HeuristicType type() {
            return HeuristicType.HEX_DISTANCE;
        }

        @Override
        public GoalBoundHeuristic bindGoal(HexCoordinates goal) {
            Objects.requireNonNull(goal, "goal");
            return goal::distanceTo;
        }
    }
}
