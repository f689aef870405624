package org.hexroute.routing.strategy;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.hexroute.core.hex.HexCoordinates;
import org.hexroute.grid.HexGrid;
import org.hexroute.routing.concurrent.CancellationSignal;
import org.hexroute.routing.heuristic.GoalBoundHeuristic;
import org.hexroute.routing.heuristic.HeuristicFactory;
import org.hexroute.routing.heuristic.HeuristicProvider;
import org.hexroute.routing.heuristic.HeuristicType;
import org.hexroute.routing.search.OpenSet;
import org.hexroute.routing.search.SearchBudget;
import org.hexroute.routing.search.SearchNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best-first hex-grid search with uniform step cost.
 *
 * <p>Execution contract:</p>
 * <ul>
 * <li>Frontier is ordered by {@code f = g + h} only, with in-place decrease-key.</li>
 * <li>A node is finalized (closed) when popped; closed nodes are never relaxed again.</li>
 * <li>Cancellation is polled once per expansion; a fired signal yields {@code CANCELLED}.</li>
 * <li>Search budget violations fail fast with {@link #REASON_SEARCH_BUDGET_EXCEEDED}.</li>
 * </ul>
 *
 * <p>With {@link HeuristicType#HEX_DISTANCE} this is A*; with {@link HeuristicType#NONE} it
 * degrades to Dijkstra. Both return optimal step counts.</p>
 *
 * <p>Open set, closed set and node map are instance scratch state reused across calls, so
 * one instance runs one search at a time. Concurrent re-entry is rejected with
 * {@link #REASON_CONCURRENT_SEARCH}.</p>
 */
public final class AStarPathfinding implements PathfindingStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(AStarPathfinding.class);

    public static final String REASON_GRID_REQUIRED = "HEX_GRID_REQUIRED";
    public static final String REASON_CONCURRENT_SEARCH = "HEX_CONCURRENT_SEARCH";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "HEX_SEARCH_BUDGET_EXCEEDED";

    private static final int STEP_COST = 1;

    private final HeuristicProvider heuristicProvider;
    private final SearchBudget budget;

    private final OpenSet openSet = new OpenSet();
    private final LongOpenHashSet closedSet = new LongOpenHashSet();
    private final Long2ObjectOpenHashMap<SearchNode> nodes = new Long2ObjectOpenHashMap<>();
    private final AtomicBoolean searching = new AtomicBoolean();

    /**
     * Creates an A* search guided by hex distance, bounded by {@link SearchBudget#defaults()}.
     */
    public AStarPathfinding() {
        this(HeuristicType.HEX_DISTANCE, SearchBudget.defaults());
    }

    /**
     * @param heuristicType heuristic mode.
     * @param budget expansion bound applied to every search.
     */
    public AStarPathfinding(HeuristicType heuristicType, SearchBudget budget) {
        this.heuristicProvider = HeuristicFactory.create(Objects.requireNonNull(heuristicType, "heuristicType"));
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public String name() {
        return heuristicProvider.type() == HeuristicType.NONE ? "Dijkstra Pathfinding" : "A* Pathfinding";
    }

    @Override
    public SearchResult search(HexCoordinates start, HexCoordinates goal, HexGrid grid, CancellationSignal signal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        if (grid == null) {
            LOGGER.error("Hex grid is not initialized, cannot search from {} to {}", start, goal);
            throw new PathfindingException(REASON_GRID_REQUIRED, "hex grid must be provided");
        }
        if (!grid.isWalkable(start)) {
            LOGGER.warn("Start position {} is not walkable", start);
            return SearchResult.startUnreachable();
        }
        if (!grid.isWalkable(goal)) {
            LOGGER.warn("Goal position {} is not walkable", goal);
            return SearchResult.goalUnreachable();
        }
        if (start.equals(goal)) {
            return SearchResult.found(HexPath.of(start), 0);
        }

        if (!searching.compareAndSet(false, true)) {
            throw new PathfindingException(
                    REASON_CONCURRENT_SEARCH,
                    name() + " instance is already searching; use one instance per concurrent search"
            );
        }
        try {
            return runSearch(start, goal, grid, signal == null ? CancellationSignal.NONE : signal);
        } catch (SearchBudget.BudgetExceededException ex) {
            throw new PathfindingException(
                    REASON_SEARCH_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        } finally {
            searching.set(false);
        }
    }

    private SearchResult runSearch(
            HexCoordinates start,
            HexCoordinates goal,
            HexGrid grid,
            CancellationSignal signal
    ) {
        openSet.clear();
        closedSet.clear();
        nodes.clear();

        GoalBoundHeuristic heuristic = heuristicProvider.bindGoal(goal);
        SearchNode startNode = new SearchNode(start);
        startNode.h = heuristic.estimateFrom(start);
        nodes.put(start.packedKey(), startNode);
        openSet.insertOrUpdate(startNode);

        int expanded = 0;
        while (!openSet.isEmpty()) {
            if (signal.isCancelled()) {
                LOGGER.debug("Search from {} to {} cancelled after {} expansions", start, goal, expanded);
                return SearchResult.cancelled(expanded);
            }

            SearchNode current = openSet.extractMin();
            if (current.coordinates.equals(goal)) {
                return SearchResult.found(reconstructPath(current), expanded);
            }

            closedSet.add(current.coordinates.packedKey());
            expanded++;
            budget.checkExpandedNodes(expanded);

            for (HexCoordinates neighbor : grid.walkableNeighbors(current.coordinates)) {
                long key = neighbor.packedKey();
                if (closedSet.contains(key)) {
                    continue;
                }

                int tentativeG = current.g + STEP_COST;
                SearchNode node = nodes.get(key);
                if (node == null) {
                    node = new SearchNode(neighbor);
                    nodes.put(key, node);
                }

                // g == 0 marks a node first reached by this relaxation; only the start has a true zero.
                if (node.g == 0 || tentativeG < node.g) {
                    node.parent = current;
                    node.g = tentativeG;
                    node.h = heuristic.estimateFrom(neighbor);
                    openSet.insertOrUpdate(node);
                }
            }
        }

        LOGGER.info("No path found from {} to {} ({} expansions)", start, goal, expanded);
        return SearchResult.noPath(expanded);
    }

    private static HexPath reconstructPath(SearchNode goalNode) {
        List<HexCoordinates> waypoints = new ArrayList<>();
        SearchNode cursor = goalNode;
        while (cursor != null) {
            waypoints.add(cursor.coordinates);
            cursor = cursor.parent;
        }
        Collections.reverse(waypoints);
        return HexPath.of(waypoints);
    }

    @Override
    public String toString() {
        return name();
    }
}
