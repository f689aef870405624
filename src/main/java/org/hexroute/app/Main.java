package org.hexroute.app;

import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.grid.HexGridLoader;
import org.hexroute.grid.TileMap;
import org.hexroute.grid.TileMapParser;
import org.hexroute.routing.core.PathfindingRuntimeConfig;
import org.hexroute.routing.core.PathfindingSystem;
import org.hexroute.routing.strategy.SearchResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Loads a text map, searches between two axial coordinates and prints the path.</p>
 */
public class Main {
    static final String USAGE = "Usage: Main <map-file> <startQ> <startR> <goalQ> <goalR> [hexSize]";

    static final int EXIT_FOUND = 0;
    static final int EXIT_NO_PATH = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Launches the CLI routine.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_FOUND) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one search and writes the outcome to {@code out}.
     *
     * @return {@code 0} when a path was found, {@code 1} when none exists, {@code 2} on bad input.
     */
    static int run(String[] args, PrintStream out) {
        if (args == null || args.length < 5 || args.length > 6) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        HexCoordinates start;
        HexCoordinates goal;
        double hexSize;
        try {
            start = new HexCoordinates(Integer.parseInt(args[1]), Integer.parseInt(args[2]));
            goal = new HexCoordinates(Integer.parseInt(args[3]), Integer.parseInt(args[4]));
            hexSize = args.length == 6 ? Double.parseDouble(args[5]) : HexGrid.DEFAULT_HEX_SIZE;
        } catch (NumberFormatException ex) {
            out.println("Invalid number: " + ex.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        TileMap tileMap;
        try {
            tileMap = TileMapParser.parse(Path.of(args[0]));
        } catch (IOException | IllegalArgumentException ex) {
            out.println("Cannot load map " + args[0] + ": " + ex.getMessage());
            return EXIT_USAGE;
        }

        HexGrid grid = new HexGrid();
        try {
            HexGridLoader.populate(grid, tileMap, hexSize);
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            return EXIT_USAGE;
        }

        PathfindingRuntimeConfig config = PathfindingRuntimeConfig.builder()
                .offloadEnabled(false)
                .build();
        try (PathfindingSystem system = PathfindingSystem.builder().grid(grid).config(config).build()) {
            SearchResult result = system.search(start, goal);
            if (!result.isFound()) {
                out.println("No path (" + result.status() + ")");
                return EXIT_NO_PATH;
            }
            StringJoiner joiner = new StringJoiner(" -> ");
            result.path().forEach(coords -> joiner.add(coords.toString()));
            out.println("Path (" + result.path().stepCount() + " steps): " + joiner);
            return EXIT_FOUND;
        }
    }
}
