package org.hexroute.core.hex;

import java.util.List;
import java.util.Objects;

/**
 * Axial coordinates of one cell in a pointy-top hexagonal grid.
 *
 * <p>Only {@code q} and {@code r} are stored. The cube axis {@code s} is derived as
 * {@code -q - r}, so {@code q + r + s == 0} holds for every instance. Equality and hashing
 * use {@code (q, r)} only.</p>
 *
 * @param q column axis.
 * @param r row axis.
 */
public record HexCoordinates(int q, int r) {
    private static final double SQRT_3 = Math.sqrt(3.0d);

    /** Direction count of a hex cell. */
    public static final int DIRECTION_COUNT = 6;

    // E, NE, NW, W, SW, SE
    private static final int[] DIRECTION_Q = {1, 1, 0, -1, -1, 0};
    private static final int[] DIRECTION_R = {0, -1, -1, 0, 1, 1};

    /**
     * Returns the derived cube axis {@code s = -q - r}.
     */
    public int s() {
        return -q - r;
    }

    /**
     * Converts these coordinates to a world position using the pointy-top layout.
     *
     * <p>The grid lies on the x/z plane; {@code y} is always zero.</p>
     *
     * @param hexSize hex pitch scale (center to corner).
     * @return world-space center of the cell.
     */
    public WorldPosition toWorldPosition(double hexSize) {
        double x = hexSize * (SQRT_3 * q + SQRT_3 / 2.0d * r);
        double z = hexSize * (3.0d / 2.0d * r);
        return new WorldPosition(x, 0.0d, z);
    }

    /**
     * Converts a world position to the nearest hex cell.
     *
     * @param position world-space position (only x and z are read).
     * @param hexSize hex pitch scale used for the forward conversion.
     * @return nearest axial coordinates.
     */
    public static HexCoordinates fromWorldPosition(WorldPosition position, double hexSize) {
        Objects.requireNonNull(position, "position");
        double q = (SQRT_3 / 3.0d * position.x() - 1.0d / 3.0d * position.z()) / hexSize;
        double r = (2.0d / 3.0d * position.z()) / hexSize;
        return round(q, r);
    }

    /**
     * Rounds fractional axial coordinates to the nearest cell.
     *
     * <p>Each cube axis is rounded independently; the axis with the largest rounding error
     * is then recomputed from the other two. When errors tie, r is corrected before q.</p>
     *
     * @param q fractional q.
     * @param r fractional r.
     * @return rounded coordinates satisfying the cube invariant.
     */
    public static HexCoordinates round(double q, double r) {
        double s = -q - r;

        int rq = (int) Math.rint(q);
        int rr = (int) Math.rint(r);
        int rs = (int) Math.rint(s);

        double qDiff = Math.abs(rq - q);
        double rDiff = Math.abs(rr - r);
        double sDiff = Math.abs(rs - s);

        if (qDiff > rDiff && qDiff > sDiff) {
            rq = -rr - rs;
        } else if (rDiff > sDiff) {
            rr = -rq - rs;
        }
        return new HexCoordinates(rq, rr);
    }

    /**
     * Converts odd-r offset coordinates (column, row) to axial coordinates.
     *
     * @param column offset column.
     * @param row offset row.
     * @return axial coordinates of the same cell.
     */
    public static HexCoordinates fromOffset(int column, int row) {
        return new HexCoordinates(column - Math.floorDiv(row, 2), row);
    }

    /**
     * Returns exact hex distance in steps: {@code (|dq| + |dr| + |ds|) / 2}.
     */
    public int distanceTo(HexCoordinates other) {
        Objects.requireNonNull(other, "other");
        return (Math.abs(q - other.q) + Math.abs(r - other.r) + Math.abs(s() - other.s())) / 2;
    }

    /**
     * Returns all six neighbors in direction order E, NE, NW, W, SW, SE.
     */
    public List<HexCoordinates> neighbors() {
        return List.of(
                neighbor(0),
                neighbor(1),
                neighbor(2),
                neighbor(3),
                neighbor(4),
                neighbor(5)
        );
    }

    /**
     * Returns the neighbor in one direction.
     *
     * @param direction direction index; taken modulo 6, negative values wrap forward.
     * @return adjacent coordinates.
     */
    public HexCoordinates neighbor(int direction) {
        int index = Math.floorMod(direction, DIRECTION_COUNT);
        return new HexCoordinates(q + DIRECTION_Q[index], r + DIRECTION_R[index]);
    }

    /**
     * Packs {@code (q, r)} into one long key for primitive-keyed maps.
     */
    public long packedKey() {
        return ((long) q << 32) | (r & 0xFFFF_FFFFL);
    }

    /**
     * Inverse of {@link #packedKey()}.
     */
    public static HexCoordinates fromPackedKey(long key) {
        return new HexCoordinates((int) (key >> 32), (int) key);
    }

    @Override
    public String toString() {
        return "Hex(" + q + ", " + r + ")";
    }
}
