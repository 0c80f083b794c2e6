package com.productgap.engine.service;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.model.SignalType;
import com.productgap.engine.repository.EvidenceRepository;
import com.productgap.engine.repository.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns the post-to-opportunity links and the denormalized evidence count.
 */
@Service
public class EvidenceLedger {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceLedger.class);

    private final EvidenceRepository evidenceRepository;
    private final OpportunityRepository opportunityRepository;
    private final Clock clock;

    public EvidenceLedger(EvidenceRepository evidenceRepository,
                          OpportunityRepository opportunityRepository,
                          Clock clock) {
        this.evidenceRepository = evidenceRepository;
        this.opportunityRepository = opportunityRepository;
        this.clock = clock;
    }

    /**
     * Links {@code post} to {@code opportunity} under {@code signalType}.
     *
     * @return false when the link already existed; nothing is written in that case
     */
    @Transactional
    public boolean attach(Opportunity opportunity, RawPost post, SignalType signalType, double weight, String excerpt) {
        if (opportunity.getId() == null) {
            throw new IllegalArgumentException("Opportunity must be persisted before evidence can be attached");
        }
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Evidence weight must be a positive number, got " + weight);
        }
        if (evidenceRepository.existsLink(opportunity.getId(), post.getId(), signalType)) {
            logger.debug("Evidence ({}, {}, {}) already recorded", opportunity.getId(), post.getId(), signalType);
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Evidence evidence = new Evidence();
        evidence.setOpportunity(opportunity);
        evidence.setRawPostId(post.getId());
        evidence.setSignalType(signalType);
        evidence.setWeight(weight);
        evidence.setContent(excerpt);
        evidence.setObservedAt(post.observedAt() != null ? post.observedAt() : now);
        evidence.setCreatedAt(now);
        evidenceRepository.save(evidence);

        refreshEvidenceCount(opportunity);
        return true;
    }

    /**
     * Attaches one row per signal type carried by {@code signal}.
     *
     * @return how many rows were new
     */
    @Transactional
    public int attachSignal(Opportunity opportunity, RawPost post, Signal signal) {
        int added = 0;
        for (SignalType type : signal.signalTypes()) {
            if (attach(opportunity, post, type, signal.weight(), signal.excerpt())) {
                added++;
            }
        }
        return added;
    }

    @Transactional
    public int refreshEvidenceCount(Opportunity opportunity) {
        int count = Math.toIntExact(evidenceRepository.countDistinctPosts(opportunity.getId()));
        if (count != opportunity.getEvidenceCount()) {
            opportunity.setEvidenceCount(count);
            opportunity.setUpdatedAt(OffsetDateTime.now(clock));
            opportunityRepository.save(opportunity);
        }
        return count;
    }

    @Transactional(readOnly = true)
    public List<Long> opportunitiesCiting(UUID rawPostId) {
        return evidenceRepository.findOpportunityIdsCiting(rawPostId);
    }

    @Transactional(readOnly = true)
    public List<Evidence> evidenceFor(Long opportunityId) {
        return evidenceRepository.findAllForOpportunity(opportunityId);
    }
}
