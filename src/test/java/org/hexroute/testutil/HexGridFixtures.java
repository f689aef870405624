package org.hexroute.testutil;

import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.grid.HexTile;
import org.hexroute.grid.TileType;

/**
 * Shared grid builders for routing tests.
 */
public final class HexGridFixtures {

    private HexGridFixtures() {
    }

    /**
     * Builds an all-water axial parallelogram: q in [0, width), r in [0, height).
     */
    public static HexGrid waterParallelogram(int width, int height) {
        HexGrid grid = new HexGrid();
        grid.initialize(width, height, HexGrid.DEFAULT_HEX_SIZE);
        for (int q = 0; q < width; q++) {
            for (int r = 0; r < height; r++) {
                grid.addTile(new HexTile(new HexCoordinates(q, r), TileType.WATER));
            }
        }
        return grid;
    }

    /**
     * Replaces the given cells with terrain.
     */
    public static void block(HexGrid grid, HexCoordinates... cells) {
        for (HexCoordinates cell : cells) {
            grid.addTile(new HexTile(cell, TileType.TERRAIN));
        }
    }

    public static HexCoordinates hex(int q, int r) {
        return new HexCoordinates(q, r);
    }
}
