package org.hexroute.routing.strategy;

import java.util.Objects;

/**
 * Search output.
 *
 * @param status outcome discriminator.
 * @param path path from start to goal when {@code status == FOUND}, otherwise null.
 * @param expandedNodes number of nodes finalized during the search.
 */
public record SearchResult(SearchStatus status, HexPath path, int expandedNodes) {

    public SearchResult {
        Objects.requireNonNull(status, "status");
        if ((status == SearchStatus.FOUND) != (path != null)) {
            throw new IllegalArgumentException("path must be present exactly when status is FOUND, got " + status);
        }
        if (expandedNodes < 0) {
            throw new IllegalArgumentException("expandedNodes must be >= 0");
        }
    }

    public static SearchResult found(HexPath path, int expandedNodes) {
        return new SearchResult(SearchStatus.FOUND, Objects.requireNonNull(path, "path"), expandedNodes);
    }

    public static SearchResult startUnreachable() {
        return new SearchResult(SearchStatus.START_UNREACHABLE, null, 0);
    }

    public static SearchResult goalUnreachable() {
        return new SearchResult(SearchStatus.GOAL_UNREACHABLE, null, 0);
    }

    public static SearchResult noPath(int expandedNodes) {
        return new SearchResult(SearchStatus.NO_PATH, null, expandedNodes);
    }

    public static SearchResult cancelled(int expandedNodes) {
        return new SearchResult(SearchStatus.CANCELLED, null, expandedNodes);
    }

    /**
     * @return whether a path was found.
     */
    public boolean isFound() {
        return status == SearchStatus.FOUND;
    }
}
