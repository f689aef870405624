package org.hexroute.routing.search;

import org.hexroute.core.hex.HexCoordinates;

import java.util.Objects;

/**
 * Mutable per-search node of the hex graph.
 *
 * <p>Created and discarded within one search invocation. {@code g} is the step count
 * from start, {@code h} the heuristic estimate to goal, and {@code parent} the
 * predecessor used for path reconstruction.</p>
 */
public final class SearchNode implements Comparable<SearchNode> {

    /** Cell this node stands for. */
    public final HexCoordinates coordinates;

    /** Accumulated cost from start. */
    public int g;

    /** Heuristic estimate to goal. */
    public int h;

    /** Predecessor on the best known path, null for the start node. */
    public SearchNode parent;

    // 1-based slot in the owning OpenSet heap, 0 when not queued.
    int heapIndex;

    public SearchNode(HexCoordinates coordinates) {
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates");
    }

    /**
     * @return estimated total cost {@code g + h}.
     */
    public int f() {
        return g + h;
    }

    /**
     * @return whether this node currently sits in an open set.
     */
    public boolean isQueued() {
        return heapIndex > 0;
    }

    /**
     * Orders by ascending f only. Equal-f ordering is left to heap position.
     */
    @Override
    public int compareTo(SearchNode other) {
        return Integer.compare(f(), other.f());
    }

    @Override
    public String toString() {
        return "SearchNode{" +
                "coords=" + coordinates +
                ", g=" + g +
                ", h=" + h +
                ", parent=" + (parent == null ? "-" : parent.coordinates) +
                '}';
    }
}
