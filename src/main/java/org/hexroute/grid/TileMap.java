package org.hexroute.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Parsed rectangular map layout in offset (column, row) space.
 *
 * <p>Cells outside the rectangle are neither water nor terrain.</p>
 */
public final class TileMap {
    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;
    private final TileType[] cells;

    /**
     * Creates a map from row-major cell types.
     *
     * @param width column count.
     * @param height row count.
     * @param cells row-major cell types, length {@code width * height}.
     * @throws IllegalArgumentException if dimensions are not positive or cells do not match them.
     */
    public TileMap(int width, int height, TileType[] cells) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("map dimensions must be positive: " + width + "x" + height);
        }
        Objects.requireNonNull(cells, "cells");
        if (cells.length != width * height) {
            throw new IllegalArgumentException(
                    "cell count " + cells.length + " does not match " + width + "x" + height);
        }
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) {
                throw new IllegalArgumentException("cells[" + i + "] is null");
            }
        }
        this.width = width;
        this.height = height;
        this.cells = cells.clone();
    }

    /**
     * Returns whether (column, row) lies inside the map rectangle.
     */
    public boolean inBounds(int column, int row) {
        return column >= 0 && row >= 0 && column < width && row < height;
    }

    /**
     * Returns the cell type at (column, row), or null outside the map.
     */
    public TileType tileType(int column, int row) {
        if (!inBounds(column, row)) {
            return null;
        }
        return cells[row * width + column];
    }

    public boolean isWater(int column, int row) {
        return tileType(column, row) == TileType.WATER;
    }

    public boolean isTerrain(int column, int row) {
        return tileType(column, row) == TileType.TERRAIN;
    }
}
