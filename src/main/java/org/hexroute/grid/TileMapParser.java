package org.hexroute.grid;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for plain-text map layouts.
 *
 * <p>Format: one line per row, one character per column. {@code '1'} marks terrain; every
 * other character (normally {@code '0'}) is water. Empty lines are skipped. The first line
 * fixes the width; shorter lines are padded with water and longer lines are truncated,
 * both with a warning.</p>
 */
@UtilityClass
public final class TileMapParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(TileMapParser.class);

    public static final char WATER_CHAR = '0';
    public static final char TERRAIN_CHAR = '1';

    /**
     * Reads and parses a UTF-8 map file.
     *
     * @throws IOException if the file cannot be read.
     * @throws IllegalArgumentException if the file holds no map rows.
     */
    public static TileMap parse(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parses map text.
     *
     * @throws IllegalArgumentException if the text is null, empty, or has no non-empty lines.
     */
    public static TileMap parse(String mapText) {
        if (mapText == null || mapText.isEmpty()) {
            throw new IllegalArgumentException("map text is empty");
        }

        List<String> lines = new ArrayList<>();
        for (String line : mapText.split("[\r\n]+")) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("map text has no rows");
        }

        int height = lines.size();
        int width = lines.get(0).length();
        TileType[] cells = new TileType[width * height];

        for (int row = 0; row < height; row++) {
            String line = lines.get(row);
            if (line.length() != width) {
                LOGGER.warn("Inconsistent line width at row {}. Expected {}, got {}", row, width, line.length());
            }
            for (int column = 0; column < width; column++) {
                char c = column < line.length() ? line.charAt(column) : WATER_CHAR;
                cells[row * width + column] = c == TERRAIN_CHAR ? TileType.TERRAIN : TileType.WATER;
            }
        }

        LOGGER.debug("Parsed map {}x{}", width, height);
        return new TileMap(width, height, cells);
    }
}
