package org.hexroute.grid;

import lombok.experimental.UtilityClass;
import org.hexroute.core.hex.HexCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Populates a {@link HexGrid} from a parsed {@link TileMap}.
 *
 * <p>Map cells are laid out in odd-r offset space; each one is inserted at
 * {@link HexCoordinates#fromOffset(int, int)}.</p>
 */
@UtilityClass
public final class HexGridLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(HexGridLoader.class);

    /**
     * Clears {@code grid} and fills it with one tile per map cell.
     *
     * @param grid grid to rebuild.
     * @param tileMap parsed map layout.
     * @param hexSize hex pitch scale stored on the grid.
     * @return number of walkable tiles inserted.
     */
    public static int populate(HexGrid grid, TileMap tileMap, double hexSize) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(tileMap, "tileMap");

        grid.initialize(tileMap.width(), tileMap.height(), hexSize);
        int walkable = 0;
        for (int row = 0; row < tileMap.height(); row++) {
            for (int column = 0; column < tileMap.width(); column++) {
                TileType type = tileMap.tileType(column, row);
                grid.addTile(new HexTile(HexCoordinates.fromOffset(column, row), type));
                if (type.isWalkable()) {
                    walkable++;
                }
            }
        }

        LOGGER.info("Loaded hex grid {}x{} ({} tiles, {} walkable)",
                tileMap.width(), tileMap.height(), grid.tileCount(), walkable);
        return walkable;
    }
}
