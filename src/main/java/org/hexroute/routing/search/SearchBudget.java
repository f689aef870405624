package org.hexroute.routing.search;

/**
 * Per-search deterministic bound on node expansions.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EXPANDED_EXCEEDED = "HEX_BUDGET_EXPANDED_EXCEEDED";

    static final String PROP_MAX_EXPANDED = "hexroute.search.maxExpandedNodes";

    private static final SearchBudget UNBOUNDED_BUDGET = new SearchBudget(UNBOUNDED);

    private final int maxExpandedNodes;

    private SearchBudget(int maxExpandedNodes) {
        this.maxExpandedNodes = normalizeBound(maxExpandedNodes);
    }

    /**
     * Creates a budget with an explicit bound; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxExpandedNodes) {
        return new SearchBudget(maxExpandedNodes);
    }

    /**
     * Returns a budget that never trips.
     */
    public static SearchBudget unbounded() {
        return UNBOUNDED_BUDGET;
    }

    /**
     * Loads the bound from the {@code hexroute.search.maxExpandedNodes} system property.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_EXPANDED));
    }

    public int maxExpandedNodes() {
        return maxExpandedNodes;
    }

    /**
     * Validates expanded-node count against the configured bound.
     *
     * @throws BudgetExceededException when the count is over budget.
     */
    public void checkExpandedNodes(int expandedNodes) {
        if (expandedNodes > maxExpandedNodes) {
            throw new BudgetExceededException(
                    REASON_EXPANDED_EXCEEDED,
                    "expanded-node budget exceeded: " + expandedNodes + " > " + maxExpandedNodes
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
