package org.hexroute.grid;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.core.hex.WorldPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tile index of the currently loaded map.
 *
 * <p>Tiles are keyed by axial coordinates (packed into a primitive long key), giving O(1)
 * existence and walkability lookups. Callers convert offset layouts to axial coordinates
 * before insertion (see {@link HexCoordinates#fromOffset(int, int)}).</p>
 *
 * <p><strong>Threading:</strong> concurrent reads are safe while no thread mutates the
 * grid. Mutations ({@link #initialize}, {@link #addTile}, {@link #clear}) must be
 * serialized against in-flight searches by the caller.</p>
 */
public final class HexGrid {
    private static final Logger LOGGER = LoggerFactory.getLogger(HexGrid.class);

    public static final double DEFAULT_HEX_SIZE = 1.0d;

    private final Long2ObjectOpenHashMap<HexTile> tiles = new Long2ObjectOpenHashMap<>();

    @Getter
    @Accessors(fluent = true)
    private int width;
    @Getter
    @Accessors(fluent = true)
    private int height;
    @Getter
    @Accessors(fluent = true)
    private double hexSize = DEFAULT_HEX_SIZE;

    /**
     * Resets storage and map metadata.
     *
     * @param width map width in offset columns (metadata only).
     * @param height map height in offset rows (metadata only).
     * @param hexSize hex pitch scale used for world conversion.
     * @throws IllegalArgumentException if dimensions are negative or hex size is not positive.
     */
    public void initialize(int width, int height, double hexSize) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("grid dimensions must be non-negative: " + width + "x" + height);
        }
        if (!Double.isFinite(hexSize) || hexSize <= 0.0d) {
            throw new IllegalArgumentException("hexSize must be finite and > 0, got " + hexSize);
        }
        this.width = width;
        this.height = height;
        this.hexSize = hexSize;
        tiles.clear();
    }

    /**
     * Inserts a tile at its own coordinates.
     *
     * @see #addTile(HexCoordinates, HexTile)
     */
    public boolean addTile(HexTile tile) {
        Objects.requireNonNull(tile, "tile");
        return addTile(tile.coordinates(), tile);
    }

    /**
     * Inserts or replaces the tile at {@code coords}.
     *
     * <p>Replacement retires the previous tile and is logged, never rejected.</p>
     *
     * @return true if a new coordinate was inserted, false if an existing tile was replaced.
     * @throws IllegalArgumentException if the tile belongs to different coordinates.
     */
    public boolean addTile(HexCoordinates coords, HexTile tile) {
        Objects.requireNonNull(coords, "coords");
        Objects.requireNonNull(tile, "tile");
        if (!coords.equals(tile.coordinates())) {
            throw new IllegalArgumentException(
                    "tile coordinates " + tile.coordinates() + " do not match insertion key " + coords);
        }
        HexTile previous = tiles.put(coords.packedKey(), tile);
        if (previous != null) {
            LOGGER.warn("Tile at {} already exists ({}). Replacing with {}.", coords, previous.tileType(), tile.tileType());
            return false;
        }
        return true;
    }

    /**
     * Returns the tile at {@code coords}, or null when none is present.
     */
    public HexTile getTile(HexCoordinates coords) {
        if (coords == null) {
            return null;
        }
        return tiles.get(coords.packedKey());
    }

    /**
     * Returns whether a tile exists at {@code coords}.
     */
    public boolean hasTile(HexCoordinates coords) {
        return coords != null && tiles.containsKey(coords.packedKey());
    }

    /**
     * Returns whether {@code coords} is walkable.
     *
     * <p>Unknown coordinates are not walkable: search never paths onto ungenerated space.</p>
     */
    public boolean isWalkable(HexCoordinates coords) {
        HexTile tile = getTile(coords);
        return tile != null && tile.isWalkable();
    }

    /**
     * Returns walkable neighbors of {@code coords} in direction order.
     *
     * @return up to six coordinates.
     */
    public List<HexCoordinates> walkableNeighbors(HexCoordinates coords) {
        Objects.requireNonNull(coords, "coords");
        List<HexCoordinates> walkable = new ArrayList<>(HexCoordinates.DIRECTION_COUNT);
        for (int direction = 0; direction < HexCoordinates.DIRECTION_COUNT; direction++) {
            HexCoordinates neighbor = coords.neighbor(direction);
            if (isWalkable(neighbor)) {
                walkable.add(neighbor);
            }
        }
        return walkable;
    }

    /**
     * Returns present tiles within hex distance {@code radius} of {@code center}.
     *
     * <p>Uses the axial range scan: {@code dq} in {@code [-R, R]} and {@code dr} in
     * {@code [max(-R, -dq-R), min(R, -dq+R)]}. A negative radius yields an empty list.</p>
     */
    public List<HexTile> tilesInRadius(HexCoordinates center, int radius) {
        Objects.requireNonNull(center, "center");
        List<HexTile> result = new ArrayList<>();
        for (int dq = -radius; dq <= radius; dq++) {
            int minDr = Math.max(-radius, -dq - radius);
            int maxDr = Math.min(radius, -dq + radius);
            for (int dr = minDr; dr <= maxDr; dr++) {
                HexTile tile = tiles.get(new HexCoordinates(center.q() + dq, center.r() + dr).packedKey());
                if (tile != null) {
                    result.add(tile);
                }
            }
        }
        return result;
    }

    /**
     * Finds the walkable tile closest to {@code center}, scanning rings outward.
     *
     * <p>Within one ring, cells are visited starting from the south-west corner and
     * walking directions E, NE, NW, W, SW, SE, so the result is deterministic.</p>
     *
     * @param center search origin.
     * @param maxRadius largest ring to scan.
     * @return nearest walkable coordinates, or null when none lies within {@code maxRadius}.
     */
    public HexCoordinates findNearestWalkable(HexCoordinates center, int maxRadius) {
        Objects.requireNonNull(center, "center");
        if (isWalkable(center)) {
            return center;
        }
        for (int radius = 1; radius <= maxRadius; radius++) {
            HexCoordinates cursor = new HexCoordinates(center.q() - radius, center.r() + radius);
            for (int direction = 0; direction < HexCoordinates.DIRECTION_COUNT; direction++) {
                for (int step = 0; step < radius; step++) {
                    if (isWalkable(cursor)) {
                        return cursor;
                    }
                    cursor = cursor.neighbor(direction);
                }
            }
        }
        return null;
    }

    /**
     * Picks a walkable spawn cell as close to the middle of the map as possible.
     *
     * <p>Starts from the offset center {@code (width / 2, height / 2)}. If that cell is blocked,
     * square rings of offset cells are scanned outward (row by row, ring edge only, in-bounds
     * cells only) up to {@code max(width, height)}, which reaches every cell of the map.</p>
     *
     * @return walkable coordinates, or null when the map has no walkable cell.
     */
    public HexCoordinates findSpawnPosition() {
        int centerX = width / 2;
        int centerY = height / 2;
        HexCoordinates center = HexCoordinates.fromOffset(centerX, centerY);
        if (isWalkable(center)) {
            return center;
        }

        int maxRadius = Math.max(width, height);
        for (int radius = 1; radius <= maxRadius; radius++) {
            for (int dy = -radius; dy <= radius; dy++) {
                for (int dx = -radius; dx <= radius; dx++) {
                    if (Math.abs(dx) != radius && Math.abs(dy) != radius) {
                        continue;
                    }
                    int x = centerX + dx;
                    int y = centerY + dy;
                    if (x < 0 || x >= width || y < 0 || y >= height) {
                        continue;
                    }
                    HexCoordinates candidate = HexCoordinates.fromOffset(x, y);
                    if (isWalkable(candidate)) {
                        LOGGER.debug("Map center {} is blocked, spawning at {} (ring {})", center, candidate, radius);
                        return candidate;
                    }
                }
            }
        }

        LOGGER.warn("No walkable spawn cell in {}x{} map", width, height);
        return null;
    }

    /**
     * Converts a world position to hex coordinates using this grid's hex size.
     */
    public HexCoordinates worldToHex(WorldPosition position) {
        return HexCoordinates.fromWorldPosition(position, hexSize);
    }

    /**
     * Converts hex coordinates to a world position using this grid's hex size.
     */
    public WorldPosition hexToWorld(HexCoordinates coords) {
        Objects.requireNonNull(coords, "coords");
        return coords.toWorldPosition(hexSize);
    }

    /**
     * Returns an unmodifiable live view of all tiles.
     */
    public Collection<HexTile> allTiles() {
        return Collections.unmodifiableCollection(tiles.values());
    }

    /**
     * @return number of tiles currently indexed.
     */
    public int tileCount() {
        return tiles.size();
    }

    /**
     * Drops every tile. Map metadata is kept until the next {@link #initialize}.
     */
    public void clear() {
        tiles.clear();
    }
}
