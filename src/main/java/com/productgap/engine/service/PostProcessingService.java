package com.productgap.engine.service;

import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.OpportunitySnapshot;
import com.productgap.engine.model.OpportunityStatus;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.repository.OpportunityRepository;
import com.productgap.engine.repository.RawPostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies one extracted signal: cluster, attach evidence, rescore, mark the post processed.
 * All of it commits together or not at all.
 */
@Service
public class PostProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(PostProcessingService.class);

    private final OpportunityRepository opportunityRepository;
    private final RawPostRepository rawPostRepository;
    private final OpportunityClusterer clusterer;
    private final EvidenceLedger evidenceLedger;
    private final ScoringEngine scoringEngine;
    private final Clock clock;

    public PostProcessingService(OpportunityRepository opportunityRepository,
                                 RawPostRepository rawPostRepository,
                                 OpportunityClusterer clusterer,
                                 EvidenceLedger evidenceLedger,
                                 ScoringEngine scoringEngine,
                                 Clock clock) {
        this.opportunityRepository = opportunityRepository;
        this.rawPostRepository = rawPostRepository;
        this.clusterer = clusterer;
        this.evidenceLedger = evidenceLedger;
        this.scoringEngine = scoringEngine;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PostOutcome apply(RawPost post, Signal signal) {
        List<Long> citing = evidenceLedger.opportunitiesCiting(post.getId());
        PostOutcome outcome = citing.isEmpty() ? cluster(post, signal) : reattach(post, signal, citing);
        rawPostRepository.markProcessed(post.getId());
        return outcome;
    }

    // The post already supports these opportunities; only missing rows are added.
    private PostOutcome reattach(RawPost post, Signal signal, List<Long> opportunityIds) {
        logger.debug("Raw post {} already supports opportunities {}; re-attaching", post.getId(), opportunityIds);
        int added = 0;
        List<Long> touched = new ArrayList<>();
        for (Long id : opportunityIds) {
            Opportunity opportunity = opportunityRepository.findById(id)
                    .orElseThrow(() -> new IllegalStateException("Evidence references missing opportunity " + id));
            int rows = evidenceLedger.attachSignal(opportunity, post, signal);
            if (rows > 0) {
                scoringEngine.score(opportunity);
                touched.add(id);
            }
            added += rows;
        }
        return PostOutcome.updated(touched, added);
    }

    private PostOutcome cluster(RawPost post, Signal signal) {
        List<Opportunity> open = opportunityRepository.findAllByStatusOrderByIdAsc(OpportunityStatus.ACTIVE);
        Map<Long, Opportunity> byId = open.stream()
                .collect(Collectors.toMap(Opportunity::getId, Function.identity()));
        List<OpportunitySnapshot> snapshots = open.stream().map(OpportunitySnapshot::of).toList();

        ClusterDecision decision = clusterer.assign(signal, snapshots);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (decision.isNewOpportunity()) {
            Opportunity opportunity = new Opportunity();
            decision.centroid().applyTo(opportunity);
            opportunity.setStatus(OpportunityStatus.ACTIVE);
            opportunity.setCreatedAt(now);
            opportunity.setUpdatedAt(now);
            opportunity = opportunityRepository.save(opportunity);
            int added = evidenceLedger.attachSignal(opportunity, post, signal);
            scoringEngine.score(opportunity);
            logger.info("Created opportunity {} '{}' from raw post {}", opportunity.getId(), opportunity.getTitle(), post.getId());
            return PostOutcome.created(opportunity.getId(), added);
        }

        OpportunitySnapshot matched = decision.matched();
        Opportunity opportunity = byId.get(matched.id());
        if (opportunity == null || !Objects.equals(opportunity.getVersion(), matched.version())) {
            throw new OptimisticLockingFailureException("Opportunity " + matched.id() + " changed since it was read");
        }
        decision.centroid().applyTo(opportunity);
        opportunity.setUpdatedAt(now);
        opportunityRepository.save(opportunity);
        int added = evidenceLedger.attachSignal(opportunity, post, signal);
        scoringEngine.score(opportunity);
        logger.debug("Attached raw post {} to opportunity {} at similarity {}", post.getId(), opportunity.getId(),
                decision.similarity());
        return PostOutcome.updated(List.of(opportunity.getId()), added);
    }
}
