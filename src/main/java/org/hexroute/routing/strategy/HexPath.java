package org.hexroute.routing.strategy;

import org.hexroute.core.hex.HexCoordinates;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered path of cells from start to goal, both inclusive.
 *
 * <p>Never empty and never holds the same cell twice in a row. A single-element path means
 * start and goal coincide. Absence of a path is expressed by a null {@code HexPath},
 * not by an empty one.</p>
 */
public final class HexPath implements Iterable<HexCoordinates> {
    private final List<HexCoordinates> waypoints;

    private HexPath(List<HexCoordinates> waypoints) {
        this.waypoints = waypoints;
    }

    /**
     * Creates a path from ordered waypoints.
     *
     * @throws IllegalArgumentException if the list is empty or repeats a cell consecutively.
     */
    public static HexPath of(List<HexCoordinates> waypoints) {
        Objects.requireNonNull(waypoints, "waypoints");
        List<HexCoordinates> copy = List.copyOf(waypoints);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one waypoint");
        }
        for (int i = 1; i < copy.size(); i++) {
            if (copy.get(i).equals(copy.get(i - 1))) {
                throw new IllegalArgumentException("duplicate consecutive waypoint " + copy.get(i) + " at index " + i);
            }
        }
        return new HexPath(copy);
    }

    /**
     * Creates the single-element path for a search whose start equals its goal.
     */
    public static HexPath of(HexCoordinates only) {
        return new HexPath(List.of(Objects.requireNonNull(only, "only")));
    }

    /**
     * @return immutable waypoint list.
     */
    public List<HexCoordinates> waypoints() {
        return waypoints;
    }

    public HexCoordinates start() {
        return waypoints.get(0);
    }

    public HexCoordinates goal() {
        return waypoints.get(waypoints.size() - 1);
    }

    public HexCoordinates get(int index) {
        return waypoints.get(index);
    }

    /**
     * @return number of waypoints.
     */
    public int size() {
        return waypoints.size();
    }

    /**
     * @return number of steps (edges), i.e. {@code size() - 1}.
     */
    public int stepCount() {
        return waypoints.size() - 1;
    }

    @Override
    public Iterator<HexCoordinates> iterator() {
        return waypoints.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HexPath)) return false;
        return waypoints.equals(((HexPath) o).waypoints);
    }

    @Override
    public int hashCode() {
        return waypoints.hashCode();
    }

    @Override
    public String toString() {
        return "HexPath" + waypoints;
    }
}
