package com.productgap.engine.service;

import com.productgap.engine.config.ScoringProperties;
import com.productgap.engine.model.GrowthPattern;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Heuristic scores for one opportunity, computed from its supporting posts alone.
 * <p>
 * Time windows are anchored at the newest observation rather than the wall clock, so the same
 * evidence always yields the same scores.
 */
@Component
public class OpportunityScoreCalculator {

    private static final BigDecimal MAX_PAIN = BigDecimal.TEN.setScale(1);

    private final ScoringProperties properties;

    public OpportunityScoreCalculator(ScoringProperties properties) {
        this.properties = properties;
    }

    public OpportunityScores calculate(Collection<PostEvidence> posts, MarketContext market) {
        MarketContext context = market == null ? MarketContext.none() : market;
        int n = posts.size();
        if (n == 0) {
            return new OpportunityScores(BigDecimal.ZERO.setScale(1), 0, 0, 0, GrowthPattern.EMERGING, 0);
        }

        OffsetDateTime newest = posts.stream().map(PostEvidence::observedAt).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        OffsetDateTime oldest = posts.stream().map(PostEvidence::observedAt).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        Duration history = newest == null ? Duration.ZERO : Duration.between(oldest, newest);

        BigDecimal pain = painSeverity(posts);
        int confidence = confidence(n, countWillingToPay(posts), history);

        Duration window = properties.getTrendWindow();
        int recent = 0;
        int prior = 0;
        if (newest != null) {
            OffsetDateTime recentStart = newest.minus(window);
            OffsetDateTime priorStart = recentStart.minus(window);
            for (PostEvidence post : posts) {
                OffsetDateTime at = post.observedAt();
                if (at == null) {
                    continue;
                }
                if (at.isAfter(recentStart)) {
                    recent++;
                } else if (at.isAfter(priorStart)) {
                    prior++;
                }
            }
        }
        int trend = 10 * recent + 10 * Math.max(0, recent - prior);
        GrowthPattern pattern = growthPattern(n, history, recent, prior);
        int timing = timing(pattern, context);

        return new OpportunityScores(pain, confidence, trend, timing, pattern, n);
    }

    BigDecimal painSeverity(Collection<PostEvidence> posts) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (PostEvidence post : posts) {
            if (post.painSeverity() == null) {
                continue;
            }
            weightedSum += post.weight() * post.painSeverity();
            totalWeight += post.weight();
        }
        if (totalWeight <= 0.0) {
            return BigDecimal.ZERO.setScale(1);
        }
        BigDecimal average = BigDecimal.valueOf(weightedSum / totalWeight).setScale(1, RoundingMode.HALF_UP);
        if (average.signum() < 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return average.compareTo(MAX_PAIN) > 0 ? MAX_PAIN : average;
    }

    /**
     * c(1) + (c(n) - c(1)) * spread + bonus * (1 - e^(-k w)). The spread discount only applies to
     * corroboration beyond the first post, so the score never drops as posts are added.
     */
    int confidence(int posts, long willingToPay, Duration history) {
        if (posts <= 0) {
            return 0;
        }
        double k = properties.getConfidenceSaturation();
        double first = saturation(1, k);
        double spread = posts > 1 && history.compareTo(properties.getNarrowWindow()) <= 0
                ? properties.getNarrowWindowFactor()
                : 1.0;
        double score = first + (saturation(posts, k) - first) * spread
                + properties.getWillingnessToPayBonus() * (1.0 - Math.exp(-k * willingToPay));
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    GrowthPattern growthPattern(int posts, Duration history, int recent, int prior) {
        Duration window = properties.getTrendWindow();
        if (posts <= properties.getEmergingMaxPosts() && history.compareTo(window.multipliedBy(2)) < 0) {
            return GrowthPattern.EMERGING;
        }
        double factor = properties.getAccelerationFactor();
        if (recent >= 2 && recent >= factor * Math.max(prior, 1)) {
            return GrowthPattern.ACCELERATING;
        }
        if (prior >= 2 && recent * factor <= prior) {
            return GrowthPattern.DECLINING;
        }
        return GrowthPattern.REGULAR;
    }

    int timing(GrowthPattern pattern, MarketContext market) {
        double score = switch (pattern) {
            case ACCELERATING -> 8;
            case EMERGING -> 6;
            case REGULAR -> 5;
            case DECLINING -> 3;
        };
        if (market.yoyGrowth() != null) {
            score += Math.max(-2.0, Math.min(2.0, market.yoyGrowth().doubleValue() / 10.0));
        }
        if (market.searchTrend() != null) {
            String trend = market.searchTrend().trim().toLowerCase(Locale.ROOT);
            if (trend.equals("rising")) {
                score += 1;
            } else if (trend.equals("declining")) {
                score -= 1;
            }
        }
        score -= Math.min(2.0, Math.max(0L, market.competitorCount()) / 10.0);
        long threshold = properties.getCommunityEngagementThreshold();
        if (threshold > 0 && market.communityEngagement() >= threshold) {
            score += 1;
        }
        return (int) Math.max(0, Math.min(10, Math.round(score)));
    }

    private static long countWillingToPay(Collection<PostEvidence> posts) {
        return posts.stream().filter(PostEvidence::willingnessToPay).count();
    }

    private static double saturation(int posts, double k) {
        return 100.0 * (1.0 - Math.exp(-k * posts));
    }
}
