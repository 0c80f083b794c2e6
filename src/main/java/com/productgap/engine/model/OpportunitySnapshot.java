package com.productgap.engine.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable view of an opportunity's cluster centroid at a given version.
 * <p>
 * The clusterer only reads snapshots and produces new ones; the write-back to the entity is done
 * by the caller inside a transaction and checked against {@code version}.
 */
public record OpportunitySnapshot(
        Long id,
        Long version,
        String title,
        String category,
        SortedSet<String> keywords,
        String problemSummary,
        String description,
        OffsetDateTime detectedAt) {

    private static final int TITLE_MAX_LENGTH = 200;

    public OpportunitySnapshot {
        keywords = Collections.unmodifiableSortedSet(new TreeSet<>(keywords == null ? Collections.emptySet() : keywords));
    }

    public static OpportunitySnapshot of(Opportunity opportunity) {
        Collection<String> keywords = opportunity.getKeywords() == null ? Collections.emptyList() : opportunity.getKeywords();
        return new OpportunitySnapshot(
                opportunity.getId(),
                opportunity.getVersion(),
                opportunity.getTitle(),
                opportunity.getCategory(),
                new TreeSet<>(keywords),
                opportunity.getProblemSummary(),
                opportunity.getDescription(),
                opportunity.getDetectedAt());
    }

    /**
     * Seeds a brand new centroid from the first signal of a cluster.
     */
    public static OpportunitySnapshot seed(Signal signal) {
        String summary = signal.problemSummary() == null ? "" : signal.problemSummary().trim();
        String title = summary.isEmpty() ? String.join(", ", signal.keywords()) : summary;
        if (title.isEmpty()) {
            title = signal.category();
        }
        if (title.length() > TITLE_MAX_LENGTH) {
            title = title.substring(0, TITLE_MAX_LENGTH);
        }
        return new OpportunitySnapshot(null, null, title, signal.category(), signal.keywords(),
                summary, summary, signal.observedAt());
    }

    /**
     * Folds one more signal into the centroid: keywords are unioned, the latest non-empty summary
     * wins, the description keeps the longest summary seen. Title and category never change.
     */
    public OpportunitySnapshot absorb(Signal signal) {
        SortedSet<String> merged = new TreeSet<>(keywords);
        merged.addAll(signal.keywords());

        String incoming = signal.problemSummary() == null ? "" : signal.problemSummary().trim();
        String summary = incoming.isEmpty() ? problemSummary : incoming;
        String longest = description == null ? "" : description;
        if (incoming.length() > longest.length()) {
            longest = incoming;
        }
        OffsetDateTime firstSeen = detectedAt;
        if (signal.observedAt() != null && (firstSeen == null || signal.observedAt().isBefore(firstSeen))) {
            firstSeen = signal.observedAt();
        }
        return new OpportunitySnapshot(id, version, title, category, merged, summary, longest, firstSeen);
    }

    public void applyTo(Opportunity opportunity) {
        opportunity.setTitle(title);
        opportunity.setCategory(category);
        opportunity.setKeywords(new ArrayList<>(keywords));
        opportunity.setProblemSummary(problemSummary);
        opportunity.setDescription(description);
        opportunity.setDetectedAt(detectedAt);
    }
}
