package org.tobmap.routing.core;

/**
 * Per-query deterministic bound on planner work.
 */
final class SearchBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_VISITED_EXCEEDED = "BUDGET_VISITED_NODES_EXCEEDED";

    static final String PROP_MAX_VISITED = "tobmap.routing.maxVisitedNodes";

    private final int maxVisitedNodes;

    private SearchBudget(int maxVisitedNodes) {
        this.maxVisitedNodes = normalizeBound(maxVisitedNodes);
    }

    /**
     * Creates a budget with an explicit bound. Non-positive bounds mean unbounded.
     */
    static SearchBudget of(int maxVisitedNodes) {
        return new SearchBudget(maxVisitedNodes);
    }

    /**
     * Loads the bound from system property {@value #PROP_MAX_VISITED}.
     */
    static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_VISITED));
    }

    int maxVisitedNodes() {
        return maxVisitedNodes;
    }

    /**
     * Validates the settled-node count against the configured bound.
     */
    void checkVisitedNodes(int visitedNodes) {
        if (visitedNodes > maxVisitedNodes) {
            throw new BudgetExceededException(
                    REASON_VISITED_EXCEEDED,
                    "visited-node budget exceeded: " + visitedNodes + " > " + maxVisitedNodes
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
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
