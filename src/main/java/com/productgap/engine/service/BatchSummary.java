package com.productgap.engine.service;

import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Running tally of one batch, returned to the caller when the batch ends.
 */
@Getter
public class BatchSummary {

    public static final String REASON_ANALYSIS_UNAVAILABLE = "ANALYSIS_UNAVAILABLE";
    public static final String REASON_PROCESSING_ERROR = "PROCESSING_ERROR";

    public record PostFailure(UUID rawPostId, String reason, String message) {
    }

    private final String pipelineName;
    private final OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private int selected;
    private int processed;
    private int failed;
    private int evidenceAdded;
    private boolean stoppedEarly;
    private boolean leaseLost;
    private final List<PostFailure> failures = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final Set<Long> created = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<Long> updated = new LinkedHashSet<>();

    public BatchSummary(String pipelineName, OffsetDateTime startedAt) {
        this.pipelineName = pipelineName;
        this.startedAt = startedAt;
    }

    void selected(int count) {
        this.selected = count;
    }

    void record(PostOutcome outcome) {
        processed++;
        evidenceAdded += outcome.evidenceAdded();
        created.addAll(outcome.created());
        updated.addAll(outcome.updated());
    }

    void recordFailure(UUID rawPostId, String reason, String message) {
        failed++;
        failures.add(new PostFailure(rawPostId, reason, message));
    }

    void stopEarly() {
        this.stoppedEarly = true;
    }

    void loseLease() {
        this.leaseLost = true;
        this.stoppedEarly = true;
    }

    void finish(OffsetDateTime at) {
        this.finishedAt = at;
    }

    public int getOpportunitiesCreated() {
        return created.size();
    }

    /**
     * Existing opportunities that gained evidence; ones created in this same batch are not counted again.
     */
    public int getOpportunitiesUpdated() {
        Set<Long> onlyUpdated = new LinkedHashSet<>(updated);
        onlyUpdated.removeAll(created);
        return onlyUpdated.size();
    }

    public List<PostFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean isClean() {
        return failed == 0;
    }

    @Override
    public String toString() {
        return "BatchSummary{pipeline=" + pipelineName + ", selected=" + selected + ", processed=" + processed
                + ", failed=" + failed + ", created=" + getOpportunitiesCreated()
                + ", updated=" + getOpportunitiesUpdated() + ", stoppedEarly=" + stoppedEarly + ", leaseLost=" + leaseLost + "}";
    }
}
