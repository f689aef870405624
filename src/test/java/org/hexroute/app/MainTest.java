package org.hexroute.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main CLI Tests")
class MainTest {

    @TempDir
    Path tempDir;

    private Path writeMap(String text) throws IOException {
        Path file = tempDir.resolve("map.txt");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private static String run(int expectedExit, String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exit = Main.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(expectedExit, exit, "unexpected exit code, output: " + output);
        return output;
    }

    @Test
    @DisplayName("Prints the path between two cells")
    void testPrintsPath() throws IOException {
        Path map = writeMap("000\n000\n");
        String output = run(Main.EXIT_FOUND, map.toString(), "0", "0", "2", "0");
        assertTrue(output.contains("Path (2 steps): Hex(0, 0) -> Hex(1, 0) -> Hex(2, 0)"), output);
    }

    @Test
    @DisplayName("Reports a blocked goal")
    void testNoPath() throws IOException {
        Path map = writeMap("001\n000\n");
        String output = run(Main.EXIT_NO_PATH, map.toString(), "0", "0", "2", "0", "2.0");
        assertTrue(output.contains("No path (GOAL_UNREACHABLE)"), output);
    }

    @Test
    @DisplayName("Usage errors exit with code 2")
    void testUsageErrors() throws IOException {
        assertTrue(run(Main.EXIT_USAGE).contains(Main.USAGE));

        Path map = writeMap("00\n");
        assertTrue(run(Main.EXIT_USAGE, map.toString(), "zero", "0", "1", "0").contains("Invalid number"));
        assertTrue(run(Main.EXIT_USAGE, map.toString(), "0", "0", "1", "0", "-1").contains("hexSize"));
        assertTrue(run(Main.EXIT_USAGE, tempDir.resolve("missing.txt").toString(), "0", "0", "1", "0")
                .contains("Cannot load map"));
    }
}
