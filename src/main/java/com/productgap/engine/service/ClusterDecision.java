package com.productgap.engine.service;

import com.productgap.engine.model.OpportunitySnapshot;

/**
 * Outcome of assigning one signal.
 *
 * @param matched    the open opportunity the signal joins, or null when a new one is seeded
 * @param centroid   the centroid after the signal is folded in
 * @param similarity score against {@code matched}; 0 for a new opportunity
 */
public record ClusterDecision(OpportunitySnapshot matched, OpportunitySnapshot centroid, double similarity) {

    public static ClusterDecision create(OpportunitySnapshot seeded) {
        return new ClusterDecision(null, seeded, 0.0);
    }

    public static ClusterDecision attach(OpportunitySnapshot matched, OpportunitySnapshot updated, double similarity) {
        return new ClusterDecision(matched, updated, similarity);
    }

    public boolean isNewOpportunity() {
        return matched == null;
    }
}
