package com.productgap.engine.service;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.OpportunityStatus;
import com.productgap.engine.repository.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Operator-facing reads and the few writes allowed outside a batch.
 */
@Service
public class OpportunityService {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityService.class);

    private final OpportunityRepository opportunityRepository;
    private final EvidenceLedger evidenceLedger;
    private final ScoringEngine scoringEngine;
    private final Clock clock;

    public OpportunityService(OpportunityRepository opportunityRepository,
                              EvidenceLedger evidenceLedger,
                              ScoringEngine scoringEngine,
                              Clock clock) {
        this.opportunityRepository = opportunityRepository;
        this.evidenceLedger = evidenceLedger;
        this.scoringEngine = scoringEngine;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Opportunity> list(OpportunityStatus status) {
        return opportunityRepository.findAllByStatusOrderByConfidenceScoreDescIdAsc(status);
    }

    @Transactional(readOnly = true)
    public Optional<Opportunity> find(Long id) {
        return opportunityRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<List<Evidence>> evidence(Long id) {
        if (!opportunityRepository.existsById(id)) {
            return Optional.empty();
        }
        return Optional.of(evidenceLedger.evidenceFor(id));
    }

    /**
     * Closes an opportunity to new evidence. Rows are kept; archiving twice is a no-op.
     */
    @Transactional
    public Optional<Opportunity> archive(Long id) {
        return opportunityRepository.findById(id).map(opportunity -> {
            if (opportunity.getStatus() != OpportunityStatus.ARCHIVED) {
                opportunity.setStatus(OpportunityStatus.ARCHIVED);
                opportunity.setUpdatedAt(OffsetDateTime.now(clock));
                logger.info("Archived opportunity {}", id);
            }
            return opportunityRepository.save(opportunity);
        });
    }

    @Transactional
    public Optional<Opportunity> rescore(Long id) {
        return opportunityRepository.findById(id).map(opportunity -> {
            scoringEngine.score(opportunity);
            return opportunity;
        });
    }
}
