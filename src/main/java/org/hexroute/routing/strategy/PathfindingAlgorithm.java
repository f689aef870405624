package org.hexroute.routing.strategy;

/**
 * Search strategy selector.
 */
public enum PathfindingAlgorithm {
    A_STAR,
    DIJKSTRA
}
