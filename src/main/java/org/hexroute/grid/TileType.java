package org.hexroute.grid;

/**
 * Tile classification.
 *
 * <p>Search only consumes the walkability projection: {@code WATER} is traversable,
 * {@code TERRAIN} is blocked.</p>
 */
public enum TileType {
    WATER(true),
    TERRAIN(false);

    private final boolean walkable;

    TileType(boolean walkable) {
        this.walkable = walkable;
    }

    /**
     * @return whether an agent may occupy or pass through tiles of this type.
     */
    public boolean isWalkable() {
        return walkable;
    }
}
