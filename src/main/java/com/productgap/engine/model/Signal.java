package com.productgap.engine.model;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;

/**
 * Normalized extraction of one raw post, the unit the clusterer works on.
 *
 * @param keywords    lower-cased, de-duplicated, sorted
 * @param signalTypes always contains {@link SignalType#PROBLEM_STATEMENT}
 * @param weight      evidence weight derived from engagement, at least 1.0
 */
public record Signal(
        UUID rawPostId,
        String category,
        SortedSet<String> keywords,
        int painSeverity,
        boolean willingnessToPay,
        String problemSummary,
        Set<SignalType> signalTypes,
        double weight,
        String excerpt,
        OffsetDateTime observedAt) {
}
