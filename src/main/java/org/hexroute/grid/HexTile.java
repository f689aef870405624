package org.hexroute.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.hexroute.core.hex.HexCoordinates;

import java.util.Objects;

/**
 * One cell of a loaded map.
 *
 * <p>Immutable; owned by the {@link HexGrid} it was inserted into.</p>
 */
@Getter
@Accessors(fluent = true)
public final class HexTile {
    private final HexCoordinates coordinates;
    private final TileType tileType;

    public HexTile(HexCoordinates coordinates, TileType tileType) {
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates");
        this.tileType = Objects.requireNonNull(tileType, "tileType");
    }

    /**
     * @return whether this tile is traversable.
     */
    public boolean isWalkable() {
        return tileType.isWalkable();
    }

    @Override
    public String toString() {
        return "Tile_" + coordinates + "_" + tileType;
    }
}
