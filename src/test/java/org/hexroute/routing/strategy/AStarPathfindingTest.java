package org.hexroute.routing.strategy;

import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.grid.HexTile;
import org.hexroute.grid.TileType;
import org.hexroute.routing.concurrent.CancellationSignal;
import org.hexroute.routing.concurrent.CancellationSource;
import org.hexroute.routing.heuristic.HeuristicType;
import org.hexroute.routing.search.SearchBudget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.hexroute.testutil.HexGridFixtures.block;
import static org.hexroute.testutil.HexGridFixtures.hex;
import static org.hexroute.testutil.HexGridFixtures.waterParallelogram;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AStarPathfinding Tests")
class AStarPathfindingTest {

    private static void assertValidPath(HexGrid grid, HexPath path, HexCoordinates start, HexCoordinates goal) {
        assertNotNull(path, "expected a path from " + start + " to " + goal);
        assertEquals(start, path.start());
        assertEquals(goal, path.goal());
        for (int i = 0; i < path.size(); i++) {
            assertTrue(grid.isWalkable(path.get(i)), "waypoint " + path.get(i) + " must be walkable");
            if (i > 0) {
                assertEquals(1, path.get(i - 1).distanceTo(path.get(i)), "waypoints must be adjacent");
            }
        }
    }

    /**
     * Wall along q = 2 with the only gap at (2, 4).
     */
    private static HexGrid wallGrid() {
        HexGrid grid = waterParallelogram(5, 5);
        block(grid, hex(2, 0), hex(2, 1), hex(2, 2), hex(2, 3));
        return grid;
    }

    @Nested
    @DisplayName("1. Path Quality")
    class PathQualityTests {

        @Test
        @DisplayName("Open grid path length equals hex distance")
        void testOpenGridOptimal() {
            HexGrid grid = waterParallelogram(5, 5);
            AStarPathfinding strategy = new AStarPathfinding();

            SearchResult result = strategy.search(hex(0, 0), hex(2, 2), grid, CancellationSignal.NONE);

            assertEquals(SearchStatus.FOUND, result.status());
            assertEquals(5, result.path().size());
            assertEquals(4, result.path().stepCount());
            assertValidPath(grid, result.path(), hex(0, 0), hex(2, 2));
        }

        @Test
        @DisplayName("Wall forces a detour of exactly two steps")
        void testWallDetour() {
            HexGrid grid = wallGrid();
            HexPath path = new AStarPathfinding().findPath(hex(0, 2), hex(4, 2), grid);

            assertValidPath(grid, path, hex(0, 2), hex(4, 2));
            assertEquals(hex(0, 2).distanceTo(hex(4, 2)) + 2, path.stepCount());
            assertTrue(path.waypoints().contains(hex(2, 4)), "path must pass the only gap");
        }

        @Test
        @DisplayName("Start equals goal yields a single waypoint")
        void testTrivialPath() {
            HexGrid grid = waterParallelogram(3, 3);
            SearchResult result = new AStarPathfinding().search(hex(1, 1), hex(1, 1), grid, CancellationSignal.NONE);

            assertEquals(SearchStatus.FOUND, result.status());
            assertEquals(List.of(hex(1, 1)), result.path().waypoints());
            assertEquals(0, result.expandedNodes());
        }

        @Test
        @DisplayName("Dijkstra and A* agree on step counts")
        void testDijkstraAgreement() {
            Random random = new Random(2024L);
            PathfindingStrategy aStar = PathfindingStrategies.create(PathfindingAlgorithm.A_STAR, SearchBudget.unbounded());
            PathfindingStrategy dijkstra = PathfindingStrategies.create(PathfindingAlgorithm.DIJKSTRA, SearchBudget.unbounded());

            for (int round = 0; round < 20; round++) {
                HexGrid grid = waterParallelogram(10, 10);
                for (int i = 0; i < 25; i++) {
                    block(grid, hex(random.nextInt(10), random.nextInt(10)));
                }
                HexCoordinates start = hex(random.nextInt(10), random.nextInt(10));
                HexCoordinates goal = hex(random.nextInt(10), random.nextInt(10));

                SearchResult a = aStar.search(start, goal, grid, CancellationSignal.NONE);
                SearchResult d = dijkstra.search(start, goal, grid, CancellationSignal.NONE);

                assertEquals(d.status(), a.status(), "status mismatch for " + start + " -> " + goal);
                if (a.isFound()) {
                    assertEquals(d.path().stepCount(), a.path().stepCount(), "cost mismatch for " + start + " -> " + goal);
                    assertValidPath(grid, a.path(), start, goal);
                    assertValidPath(grid, d.path(), start, goal);
                    assertTrue(a.expandedNodes() <= d.expandedNodes(), "A* must not expand more than Dijkstra");
                }
            }
        }

        @Test
        @DisplayName("Reused instance returns identical results")
        void testScratchReuse() {
            HexGrid grid = wallGrid();
            AStarPathfinding strategy = new AStarPathfinding();
            HexPath first = strategy.findPath(hex(0, 2), hex(4, 2), grid);
            strategy.findPath(hex(0, 0), hex(1, 4), grid);
            HexPath again = strategy.findPath(hex(0, 2), hex(4, 2), grid);
            assertEquals(first, again);
        }
    }

    @Nested
    @DisplayName("2. Unreachable Outcomes")
    class UnreachableTests {

        @Test
        @DisplayName("Blocked or missing start")
        void testStartUnreachable() {
            HexGrid grid = waterParallelogram(3, 3);
            block(grid, hex(0, 0));
            AStarPathfinding strategy = new AStarPathfinding();

            assertEquals(SearchStatus.START_UNREACHABLE, strategy.search(hex(0, 0), hex(2, 2), grid, CancellationSignal.NONE).status());
            assertEquals(SearchStatus.START_UNREACHABLE, strategy.search(hex(9, 9), hex(2, 2), grid, CancellationSignal.NONE).status());
            assertNull(strategy.findPath(hex(0, 0), hex(2, 2), grid));
        }

        @Test
        @DisplayName("Blocked goal")
        void testGoalUnreachable() {
            HexGrid grid = waterParallelogram(3, 3);
            block(grid, hex(2, 2));
            SearchResult result = new AStarPathfinding().search(hex(0, 0), hex(2, 2), grid, CancellationSignal.NONE);
            assertEquals(SearchStatus.GOAL_UNREACHABLE, result.status());
            assertNull(result.path());
        }

        @Test
        @DisplayName("Isolated goal exhausts the frontier")
        void testNoPath() {
            HexGrid grid = waterParallelogram(3, 3);
            grid.addTile(new HexTile(hex(10, 10), TileType.WATER));
            SearchResult result = new AStarPathfinding().search(hex(0, 0), hex(10, 10), grid, CancellationSignal.NONE);

            assertEquals(SearchStatus.NO_PATH, result.status());
            assertNull(result.path());
            assertEquals(9, result.expandedNodes(), "every reachable tile is expanded once");
        }

        @Test
        @DisplayName("Missing grid is a configuration error")
        void testNullGrid() {
            PathfindingException ex = assertThrows(
                    PathfindingException.class,
                    () -> new AStarPathfinding().search(hex(0, 0), hex(1, 0), null, CancellationSignal.NONE)
            );
            assertEquals(AStarPathfinding.REASON_GRID_REQUIRED, ex.getReasonCode());
        }
    }

    @Nested
    @DisplayName("3. Guardrails")
    class GuardrailTests {

        @Test
        @DisplayName("Cancelled signal stops the search")
        void testCancelled() {
            CancellationSource source = CancellationSource.create();
            source.cancel();
            SearchResult result = new AStarPathfinding().search(hex(0, 0), hex(4, 4), waterParallelogram(5, 5), source);

            assertEquals(SearchStatus.CANCELLED, result.status());
            assertNull(result.path());
        }

        @Test
        @DisplayName("Cancellation is observed between expansions")
        void testCancelledMidSearch() {
            HexGrid grid = waterParallelogram(20, 20);
            int[] polls = {0};
            CancellationSignal signal = new CancellationSignal() {
                @Override
                public boolean isCancelled() {
                    return ++polls[0] > 3;
                }

                @Override
                public Registration onCancel(Runnable callback) {
                    return Registration.EMPTY;
                }
            };

            SearchResult result = new AStarPathfinding(HeuristicType.NONE, SearchBudget.unbounded())
                    .search(hex(0, 0), hex(19, 19), grid, signal);

            assertEquals(SearchStatus.CANCELLED, result.status());
            assertEquals(3, result.expandedNodes());
        }

        @Test
        @DisplayName("Expansion budget fails fast and leaves the instance usable")
        void testBudgetExceeded() {
            HexGrid grid = wallGrid();
            AStarPathfinding strategy = new AStarPathfinding(HeuristicType.HEX_DISTANCE, SearchBudget.of(1));

            PathfindingException ex = assertThrows(
                    PathfindingException.class,
                    () -> strategy.search(hex(0, 2), hex(4, 2), grid, CancellationSignal.NONE)
            );
            assertEquals(AStarPathfinding.REASON_SEARCH_BUDGET_EXCEEDED, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[" + AStarPathfinding.REASON_SEARCH_BUDGET_EXCEEDED + "]"));

            SearchResult adjacent = strategy.search(hex(0, 0), hex(1, 0), grid, CancellationSignal.NONE);
            assertEquals(SearchStatus.FOUND, adjacent.status());
            assertEquals(1, adjacent.expandedNodes());
        }

        @Test
        @DisplayName("Re-entry into a busy instance is rejected")
        void testConcurrentReentry() {
            HexGrid grid = waterParallelogram(5, 5);
            AStarPathfinding strategy = new AStarPathfinding();
            AtomicReference<RuntimeException> nested = new AtomicReference<>();
            CancellationSignal reentrant = new CancellationSignal() {
                @Override
                public boolean isCancelled() {
                    if (nested.get() == null) {
                        try {
                            strategy.search(hex(1, 1), hex(3, 3), grid, CancellationSignal.NONE);
                            nested.set(new IllegalStateException("nested search was not rejected"));
                        } catch (RuntimeException ex) {
                            nested.set(ex);
                        }
                    }
                    return false;
                }

                @Override
                public Registration onCancel(Runnable callback) {
                    return Registration.EMPTY;
                }
            };

            SearchResult outer = strategy.search(hex(0, 0), hex(4, 4), grid, reentrant);

            assertEquals(SearchStatus.FOUND, outer.status(), "outer search is unaffected");
            PathfindingException ex = assertInstanceOf(PathfindingException.class, nested.get());
            assertEquals(AStarPathfinding.REASON_CONCURRENT_SEARCH, ex.getReasonCode());
        }

        @Test
        @DisplayName("Factory builds fresh named instances")
        void testFactory() {
            PathfindingStrategy first = PathfindingStrategies.create(PathfindingAlgorithm.A_STAR);
            PathfindingStrategy second = PathfindingStrategies.create(PathfindingAlgorithm.A_STAR);
            assertNotSame(first, second);
            assertEquals("A* Pathfinding", first.name());
            assertEquals("Dijkstra Pathfinding", PathfindingStrategies.create(PathfindingAlgorithm.DIJKSTRA).name());
            assertThrows(NullPointerException.class, () -> PathfindingStrategies.create(null));
        }
    }
}
