package org.hexroute.routing.strategy;

/**
 * Outcome of one search invocation.
 */
public enum SearchStatus {
    /** A path from start to goal was produced. */
    FOUND,
    /** The start cell is missing or blocked. */
    START_UNREACHABLE,
    /** The goal cell is missing or blocked. */
    GOAL_UNREACHABLE,
    /** The frontier was exhausted without reaching the goal. */
    NO_PATH,
    /** The search was cancelled before it completed. */
    CANCELLED
}
