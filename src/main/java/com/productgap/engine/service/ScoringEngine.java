package com.productgap.engine.service;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.MarketDataSnapshot;
import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.PostAnalysis;
import com.productgap.engine.model.SignalType;
import com.productgap.engine.repository.CommunitySignalSnapshotRepository;
import com.productgap.engine.repository.CompetitorListingRepository;
import com.productgap.engine.repository.EvidenceRepository;
import com.productgap.engine.repository.MarketDataSnapshotRepository;
import com.productgap.engine.repository.OpportunityRepository;
import com.productgap.engine.repository.PostAnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads everything persisted about an opportunity, hands it to {@link OpportunityScoreCalculator}
 * and stores the result.
 */
@Service
public class ScoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(ScoringEngine.class);

    private static final Comparator<PostAnalysis> NEWEST_ANALYSIS = Comparator
            .comparing(PostAnalysis::getAnalyzedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(PostAnalysis::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final EvidenceRepository evidenceRepository;
    private final PostAnalysisRepository postAnalysisRepository;
    private final OpportunityRepository opportunityRepository;
    private final MarketDataSnapshotRepository marketDataRepository;
    private final CompetitorListingRepository competitorRepository;
    private final CommunitySignalSnapshotRepository communitySignalRepository;
    private final OpportunityScoreCalculator calculator;
    private final Clock clock;

    public ScoringEngine(EvidenceRepository evidenceRepository,
                         PostAnalysisRepository postAnalysisRepository,
                         OpportunityRepository opportunityRepository,
                         MarketDataSnapshotRepository marketDataRepository,
                         CompetitorListingRepository competitorRepository,
                         CommunitySignalSnapshotRepository communitySignalRepository,
                         OpportunityScoreCalculator calculator,
                         Clock clock) {
        this.evidenceRepository = evidenceRepository;
        this.postAnalysisRepository = postAnalysisRepository;
        this.opportunityRepository = opportunityRepository;
        this.marketDataRepository = marketDataRepository;
        this.competitorRepository = competitorRepository;
        this.communitySignalRepository = communitySignalRepository;
        this.calculator = calculator;
        this.clock = clock;
    }

    @Transactional
    public OpportunityScores score(Opportunity opportunity) {
        List<Evidence> evidence = evidenceRepository.findAllForOpportunity(opportunity.getId());
        List<PostEvidence> posts = collapseByPost(evidence);
        OpportunityScores scores = calculator.calculate(posts, loadMarketContext(opportunity.getId()));

        if (scores.applyTo(opportunity)) {
            opportunity.setUpdatedAt(OffsetDateTime.now(clock));
            opportunityRepository.save(opportunity);
            logger.debug("Rescored opportunity {}: {}", opportunity.getId(), scores);
        }
        return scores;
    }

    private List<PostEvidence> collapseByPost(List<Evidence> evidence) {
        Map<UUID, List<Evidence>> byPost = new LinkedHashMap<>();
        for (Evidence row : evidence) {
            byPost.computeIfAbsent(row.getRawPostId(), id -> new ArrayList<>()).add(row);
        }
        Map<UUID, PostAnalysis> latestAnalysis = new HashMap<>();
        if (!byPost.isEmpty()) {
            for (PostAnalysis analysis : postAnalysisRepository.findAllByRawPostIdIn(byPost.keySet())) {
                latestAnalysis.merge(analysis.getRawPostId(), analysis,
                        (a, b) -> NEWEST_ANALYSIS.compare(a, b) >= 0 ? a : b);
            }
        }

        List<PostEvidence> posts = new ArrayList<>(byPost.size());
        for (Map.Entry<UUID, List<Evidence>> entry : byPost.entrySet()) {
            List<Evidence> rows = entry.getValue();
            double weight = rows.stream().mapToDouble(Evidence::getWeight).max().orElse(Evidence.DEFAULT_WEIGHT);
            OffsetDateTime observedAt = rows.stream().map(Evidence::getObservedAt)
                    .min(Comparator.naturalOrder()).orElse(null);
            PostAnalysis analysis = latestAnalysis.get(entry.getKey());
            boolean willingToPay = (analysis != null && analysis.isWillingnessToPay())
                    || rows.stream().anyMatch(row -> row.getSignalType() == SignalType.WILLINGNESS_TO_PAY);
            Integer pain = analysis == null ? null : analysis.getPainSeverity();
            posts.add(new PostEvidence(entry.getKey(), weight, pain, willingToPay, observedAt));
        }
        return posts;
    }

    private MarketContext loadMarketContext(Long opportunityId) {
        Optional<MarketDataSnapshot> market = marketDataRepository.findTopByOpportunityIdOrderByFetchedAtDesc(opportunityId);
        return new MarketContext(
                market.map(MarketDataSnapshot::getYoyGrowth).orElse(null),
                market.map(MarketDataSnapshot::getSearchTrend).orElse(null),
                competitorRepository.countByOpportunityId(opportunityId),
                communitySignalRepository.sumEngagement(opportunityId));
    }
}
