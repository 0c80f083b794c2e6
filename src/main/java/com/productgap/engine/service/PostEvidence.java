package com.productgap.engine.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Everything the score calculator needs to know about one post supporting an opportunity.
 *
 * @param weight       largest weight among the post's evidence rows
 * @param painSeverity from the post's latest analysis, null when no analysis is stored
 */
public record PostEvidence(
        UUID rawPostId,
        double weight,
        Integer painSeverity,
        boolean willingnessToPay,
        OffsetDateTime observedAt) {
}
