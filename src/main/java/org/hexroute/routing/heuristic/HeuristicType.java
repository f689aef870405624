package org.hexroute.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (pure Dijkstra behavior).</p>
 * <p>{@code HEX_DISTANCE} uses exact hex distance, admissible and consistent for unit step cost.</p>
 */
public enum HeuristicType {
    NONE,
    HEX_DISTANCE
}
