package com.orderbook.domain;

import java.util.List;

/**
 * Collection of fills for one incoming order, in execution order.
 * Contains the list of individual match results and what became of the remainder.
 */
public class MatchResultSet {

    private final List<MatchResult> results;
    private final long totalFilledQuantity;
    private final long restingQuantity;

    public MatchResultSet(List<MatchResult> results, long totalFilledQuantity, long restingQuantity) {
        this.results = results;
        this.totalFilledQuantity = totalFilledQuantity;
        this.restingQuantity = restingQuantity;
    }

    public List<MatchResult> getResults() {
        return results;
    }

    public long getTotalFilledQuantity() {
        return totalFilledQuantity;
    }

    /** Quantity left on the book after matching; 0 when filled on entry. */
    public long getRestingQuantity() {
        return restingQuantity;
    }

    public int getMatchCount() {
        return results.size();
    }
}
