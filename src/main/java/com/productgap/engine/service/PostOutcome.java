package com.productgap.engine.service;

import java.util.List;

/**
 * What processing one post did to the opportunity set.
 *
 * @param created       opportunities seeded by this post
 * @param updated       existing opportunities the post was attached to
 * @param evidenceAdded new evidence rows; 0 when the post was already fully recorded
 */
public record PostOutcome(List<Long> created, List<Long> updated, int evidenceAdded) {

    public static PostOutcome created(Long opportunityId, int evidenceAdded) {
        return new PostOutcome(List.of(opportunityId), List.of(), evidenceAdded);
    }

    public static PostOutcome updated(List<Long> opportunityIds, int evidenceAdded) {
        return new PostOutcome(List.of(), List.copyOf(opportunityIds), evidenceAdded);
    }
}
