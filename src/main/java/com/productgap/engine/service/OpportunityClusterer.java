package com.productgap.engine.service;

import com.productgap.engine.config.ClusteringProperties;
import com.productgap.engine.model.OpportunitySnapshot;
import com.productgap.engine.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Incremental single-pass clustering of signals into opportunities.
 * <p>
 * Pure: works on snapshots only and never touches storage. Candidates are visited in ascending id
 * order and only a strictly better score replaces the current best, so equal scores resolve to the
 * lowest id and replaying the same signals in the same order reproduces the same partition.
 */
@Component
public class OpportunityClusterer {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityClusterer.class);

    private static final double EPSILON = 1e-9;

    private final ClusteringProperties properties;

    public OpportunityClusterer(ClusteringProperties properties) {
        this.properties = properties;
    }

    public ClusterDecision assign(Signal signal, List<OpportunitySnapshot> openOpportunities) {
        List<OpportunitySnapshot> candidates = new ArrayList<>(openOpportunities);
        candidates.sort(Comparator.comparing(OpportunitySnapshot::id, Comparator.nullsLast(Comparator.naturalOrder())));

        OpportunitySnapshot best = null;
        double bestScore = 0.0;
        boolean tied = false;
        for (OpportunitySnapshot candidate : candidates) {
            double score = similarity(signal, candidate);
            logger.debug("Similarity of raw post {} to opportunity {}: {}", signal.rawPostId(), candidate.id(), score);
            if (score + EPSILON < properties.getAttachThreshold()) {
                continue;
            }
            if (best == null || score > bestScore + EPSILON) {
                best = candidate;
                bestScore = score;
                tied = false;
            } else if (Math.abs(score - bestScore) <= EPSILON) {
                tied = true;
            }
        }

        if (best == null) {
            return ClusterDecision.create(OpportunitySnapshot.seed(signal));
        }
        if (tied) {
            logger.debug("Ambiguous assignment for raw post {} at score {}; resolved to lowest id {}",
                    signal.rawPostId(), bestScore, best.id());
        }
        return ClusterDecision.attach(best, best.absorb(signal), bestScore);
    }

    public double similarity(Signal signal, OpportunitySnapshot opportunity) {
        return similarity(signal.keywords(), signal.category(), signal.problemSummary(),
                opportunity.keywords(), opportunity.category(), opportunity.problemSummary());
    }

    /**
     * Weighted blend of keyword overlap, category equality and summary-word overlap, normalized by
     * the total weight so the result stays in [0, 1]. Symmetric in its two sides.
     */
    public double similarity(Set<String> keywordsA, String categoryA, String summaryA,
                             Set<String> keywordsB, String categoryB, String summaryB) {
        double total = properties.totalWeight();
        double keywordScore = TextSimilarity.jaccard(keywordsA, keywordsB);
        double categoryScore = TextSimilarity.sameCategory(categoryA, categoryB) ? 1.0 : 0.0;
        double summaryScore = TextSimilarity.jaccard(
                TextSimilarity.summaryTokens(summaryA), TextSimilarity.summaryTokens(summaryB));
        return (properties.getKeywordWeight() * keywordScore
                + properties.getCategoryWeight() * categoryScore
                + properties.getSummaryWeight() * summaryScore) / total;
    }
}
