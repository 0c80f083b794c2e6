package com.productgap.engine.controller;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.SignalType;

import java.time.OffsetDateTime;
import java.util.UUID;

public record EvidenceView(
        Long id,
        Long opportunityId,
        UUID rawPostId,
        SignalType signalType,
        double weight,
        String content,
        OffsetDateTime observedAt,
        OffsetDateTime createdAt) {

    static EvidenceView of(Evidence evidence, Long opportunityId) {
        return new EvidenceView(evidence.getId(), opportunityId, evidence.getRawPostId(), evidence.getSignalType(),
                evidence.getWeight(), evidence.getContent(), evidence.getObservedAt(), evidence.getCreatedAt());
    }
}
