package com.productgap.engine.service;

import com.productgap.engine.config.ScoringProperties;
import com.productgap.engine.model.GrowthPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityScoreCalculatorTest {

    private static final OffsetDateTime T0 = Signals.BASE_TIME;

    private OpportunityScoreCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new OpportunityScoreCalculator(new ScoringProperties());
    }

    @Test
    void noEvidenceScoresZero() {
        OpportunityScores scores = calculator.calculate(List.of(), MarketContext.none());

        assertThat(scores.confidenceScore()).isZero();
        assertThat(scores.painSeverity()).isEqualByComparingTo("0.0");
        assertThat(scores.trendScore()).isZero();
        assertThat(scores.evidencePosts()).isZero();
    }

    @Test
    void corroboratedPainfulPostBeatsLonePost() {
        PostEvidence lone = post(1.0, 9, true, T0);
        OpportunityScores alone = calculator.calculate(List.of(lone), MarketContext.none());
        OpportunityScores corroborated = calculator.calculate(List.of(lone,
                post(1.0, 6, false, T0.minusDays(1)),
                post(1.0, 7, false, T0.minusDays(3))), MarketContext.none());

        assertThat(alone.confidenceScore()).isEqualTo(32);
        assertThat(corroborated.confidenceScore()).isEqualTo(68);
        assertThat(corroborated.confidenceScore()).isGreaterThan(alone.confidenceScore());
    }

    @Test
    void confidenceNeverDropsAsPostsAreAdded() {
        List<PostEvidence> spread = new ArrayList<>();
        List<PostEvidence> burst = new ArrayList<>();
        int previousSpread = 0;
        int previousBurst = 0;
        for (int i = 0; i < 30; i++) {
            spread.add(post(1.0, 5, false, T0.minusDays(i)));
            burst.add(post(1.0, 5, false, T0.minusMinutes(i)));
            int spreadScore = calculator.calculate(spread, MarketContext.none()).confidenceScore();
            int burstScore = calculator.calculate(burst, MarketContext.none()).confidenceScore();
            assertThat(spreadScore).isGreaterThanOrEqualTo(previousSpread).isBetween(0, 100);
            assertThat(burstScore).isGreaterThanOrEqualTo(previousBurst).isBetween(0, 100);
            previousSpread = spreadScore;
            previousBurst = burstScore;
        }
    }

    @Test
    void burstWithinNarrowWindowEarnsLessThanSpreadEvidence() {
        int burst = calculator.calculate(List.of(
                post(1.0, 5, false, T0),
                post(1.0, 5, false, T0.minusMinutes(10)),
                post(1.0, 5, false, T0.minusMinutes(20))), MarketContext.none()).confidenceScore();
        int spread = calculator.calculate(List.of(
                post(1.0, 5, false, T0),
                post(1.0, 5, false, T0.minusDays(2)),
                post(1.0, 5, false, T0.minusDays(4))), MarketContext.none()).confidenceScore();

        assertThat(burst).isLessThan(spread);
    }

    @Test
    void painSeverityIsWeightedByEvidenceWeight() {
        BigDecimal weighted = calculator.painSeverity(List.of(post(2.0, 9, false, T0), post(1.0, 6, false, T0)));
        BigDecimal roundedUp = calculator.painSeverity(List.of(
                post(1.0, 7, false, T0), post(1.0, 8, false, T0), post(1.0, 8, false, T0)));

        assertThat(weighted).isEqualByComparingTo("8.0");
        assertThat(roundedUp).isEqualByComparingTo("7.7");
    }

    @Test
    void postsWithoutAnalysisAreLeftOutOfPain() {
        BigDecimal pain = calculator.painSeverity(List.of(post(1.0, 4, false, T0), post(1.0, null, false, T0)));

        assertThat(pain).isEqualByComparingTo("4.0");
    }

    @Test
    void recentBurstIsAccelerating() {
        OpportunityScores scores = calculator.calculate(List.of(
                post(1.0, 5, false, T0),
                post(1.0, 5, false, T0.minusDays(1)),
                post(1.0, 5, false, T0.minusDays(2)),
                post(1.0, 5, false, T0.minusDays(8))), MarketContext.none());

        assertThat(scores.trendScore()).isEqualTo(50);
        assertThat(scores.growthPattern()).isEqualTo(GrowthPattern.ACCELERATING);
        assertThat(scores.timingScore()).isEqualTo(8);
    }

    @Test
    void fadingInterestIsDeclining() {
        OpportunityScores scores = calculator.calculate(List.of(
                post(1.0, 5, false, T0),
                post(1.0, 5, false, T0.minusDays(8)),
                post(1.0, 5, false, T0.minusDays(9)),
                post(1.0, 5, false, T0.minusDays(10))), MarketContext.none());

        assertThat(scores.trendScore()).isEqualTo(10);
        assertThat(scores.growthPattern()).isEqualTo(GrowthPattern.DECLINING);
        assertThat(scores.timingScore()).isEqualTo(3);
    }

    @Test
    void fewRecentPostsAreEmerging() {
        OpportunityScores scores = calculator.calculate(List.of(
                post(1.0, 5, false, T0), post(1.0, 5, false, T0.minusDays(1))), MarketContext.none());

        assertThat(scores.growthPattern()).isEqualTo(GrowthPattern.EMERGING);
        assertThat(scores.timingScore()).isEqualTo(6);
    }

    @Test
    void marketInputsAdjustTiming() {
        MarketContext market = new MarketContext(new BigDecimal("25.0"), "rising", 15, 600);

        int timing = calculator.timing(GrowthPattern.EMERGING, market);

        assertThat(timing).isEqualTo(9);
    }

    @Test
    void timingIsClampedToTen() {
        MarketContext market = new MarketContext(new BigDecimal("80"), "Rising", 0, 10_000);

        assertThat(calculator.timing(GrowthPattern.ACCELERATING, market)).isEqualTo(10);
        assertThat(calculator.timing(GrowthPattern.DECLINING,
                new MarketContext(new BigDecimal("-50"), "declining", 100, 0))).isZero();
    }

    @Test
    void scoresArePureFunctionOfInputs() {
        List<PostEvidence> posts = List.of(post(1.5, 8, true, T0), post(1.2, 6, false, T0.minusDays(5)));

        assertThat(calculator.calculate(posts, MarketContext.none()))
                .isEqualTo(calculator.calculate(posts, MarketContext.none()));
    }

    private static PostEvidence post(double weight, Integer pain, boolean willingToPay, OffsetDateTime at) {
        return new PostEvidence(UUID.randomUUID(), weight, pain, willingToPay, at);
    }
}
