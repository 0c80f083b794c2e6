package com.productgap.engine.service;

import com.productgap.engine.model.GrowthPattern;
import com.productgap.engine.model.Opportunity;

import java.math.BigDecimal;
import java.util.Objects;

public record OpportunityScores(
        BigDecimal painSeverity,
        int confidenceScore,
        int trendScore,
        int timingScore,
        GrowthPattern growthPattern,
        int evidencePosts) {

    /**
     * Writes the scores onto {@code opportunity}.
     *
     * @return true if any stored value changed
     */
    public boolean applyTo(Opportunity opportunity) {
        boolean changed = opportunity.getPainSeverity() == null
                || opportunity.getPainSeverity().compareTo(painSeverity) != 0
                || opportunity.getConfidenceScore() != confidenceScore
                || opportunity.getTrendScore() != trendScore
                || opportunity.getTimingScore() != timingScore
                || !Objects.equals(opportunity.getGrowthPattern(), growthPattern)
                || opportunity.getEvidenceCount() != evidencePosts;
        opportunity.setPainSeverity(painSeverity);
        opportunity.setConfidenceScore(confidenceScore);
        opportunity.setTrendScore(trendScore);
        opportunity.setTimingScore(timingScore);
        opportunity.setGrowthPattern(growthPattern);
        opportunity.setEvidenceCount(evidencePosts);
        return changed;
    }
}
