package com.productgap.engine.service;

import com.productgap.engine.config.PipelineProperties;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.repository.RawPostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Runs batches of unprocessed posts through extraction, clustering, evidence and scoring.
 * <p>
 * Posts are handled one after another under a pipeline lease. A failed post is counted and left
 * unprocessed for the next batch; losing the data store aborts the whole batch.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final RawPostRepository rawPostRepository;
    private final SignalExtractor signalExtractor;
    private final PostProcessingService postProcessingService;
    private final PipelineLockService lockService;
    private final RunMetadataService runMetadataService;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineOrchestrator(RawPostRepository rawPostRepository,
                                SignalExtractor signalExtractor,
                                PostProcessingService postProcessingService,
                                PipelineLockService lockService,
                                RunMetadataService runMetadataService,
                                PipelineProperties properties,
                                Clock clock) {
        this.rawPostRepository = rawPostRepository;
        this.signalExtractor = signalExtractor;
        this.postProcessingService = postProcessingService;
        this.lockService = lockService;
        this.runMetadataService = runMetadataService;
        this.properties = properties;
        this.clock = clock;
    }

    public BatchSummary runBatch(int maxPosts) {
        return runBatch(maxPosts, null);
    }

    /**
     * The lease is renewed before every post. Once it is lost to another run the batch stops and the
     * remaining posts stay queued.
     *
     * @param maxPosts   upper bound on posts taken from the queue, capped by the configured maximum
     * @param timeBudget checked between posts only; null means no budget
     * @throws PipelineBusyException       if another run holds the pipeline lease
     * @throws StorageUnavailableException if the data store goes away; earlier posts stay committed
     */
    public BatchSummary runBatch(int maxPosts, Duration timeBudget) {
        if (maxPosts < 1) {
            throw new IllegalArgumentException("maxPosts must be at least 1, got " + maxPosts);
        }
        if (timeBudget != null && timeBudget.isNegative()) {
            throw new IllegalArgumentException("timeBudget must not be negative");
        }
        String pipeline = properties.getName();
        int limit = Math.min(maxPosts, properties.getMaxBatchSize());

        String owner;
        try {
            owner = lockService.acquire(pipeline, properties.getLockLease());
        } catch (RuntimeException e) {
            throw translateStorageFailure(e, "acquiring the pipeline lock");
        }

        Instant deadline = timeBudget == null ? null : clock.instant().plus(timeBudget);
        BatchSummary summary = new BatchSummary(pipeline, OffsetDateTime.now(clock));
        try {
            runMetadataService.recordStarted(pipeline);
            List<RawPost> posts = rawPostRepository.findUnprocessed(PageRequest.of(0, limit));
            summary.selected(posts.size());
            logger.info("Starting batch on {}: {} unprocessed post(s) selected (limit {})", pipeline, posts.size(), limit);

            for (RawPost post : posts) {
                if (deadline != null && !clock.instant().isBefore(deadline)) {
                    summary.stopEarly();
                    logger.info("Time budget of {} exhausted; stopping before raw post {}", timeBudget, post.getId());
                    break;
                }
                if (!lockService.renew(pipeline, owner, properties.getLockLease())) {
                    summary.loseLease();
                    logger.warn("Lease on {} lost; stopping before raw post {}", pipeline, post.getId());
                    break;
                }
                processOne(post, summary);
            }

            summary.finish(OffsetDateTime.now(clock));
            runMetadataService.recordFinished(pipeline, summary);
            logger.info("Finished batch: {}", summary);
            return summary;
        } catch (RuntimeException e) {
            if (!StorageUnavailableException.indicatesOutage(e)) {
                throw e;
            }
            StorageUnavailableException abort = e instanceof StorageUnavailableException sue
                    ? sue
                    : new StorageUnavailableException("Data store unavailable; batch aborted after "
                    + summary.getProcessed() + " processed post(s)", e);
            logger.error("Batch on {} aborted: {}", pipeline, e.getMessage(), e);
            try {
                runMetadataService.recordFailed(pipeline, abort.getMessage());
            } catch (RuntimeException metadataError) {
                abort.addSuppressed(metadataError);
            }
            throw abort;
        } finally {
            releaseQuietly(pipeline, owner);
        }
    }

    private void processOne(RawPost post, BatchSummary summary) {
        try {
            Signal signal = signalExtractor.extract(post);
            PostOutcome outcome = postProcessingService.apply(post, signal);
            summary.record(outcome);
        } catch (AnalysisUnavailableException e) {
            logger.warn("Analysis unavailable for raw post {}: {}", post.getId(), e.getMessage());
            summary.recordFailure(post.getId(), BatchSummary.REASON_ANALYSIS_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            if (StorageUnavailableException.indicatesOutage(e)) {
                throw e;
            }
            logger.warn("Processing failed for raw post {}: {}", post.getId(), e.getMessage(), e);
            summary.recordFailure(post.getId(), BatchSummary.REASON_PROCESSING_ERROR, e.getMessage());
        }
    }

    private RuntimeException translateStorageFailure(RuntimeException e, String action) {
        if (e instanceof StorageUnavailableException || !StorageUnavailableException.indicatesOutage(e)) {
            return e;
        }
        logger.error("Data store unavailable while {}", action, e);
        return new StorageUnavailableException("Data store unavailable while " + action, e);
    }

    // A lease that cannot be released expires on its own after the configured lease time.
    private void releaseQuietly(String pipeline, String owner) {
        try {
            lockService.release(pipeline, owner);
        } catch (RuntimeException e) {
            logger.warn("Could not release lock {}; it expires at the end of its lease: {}", pipeline, e.getMessage());
        }
    }
}
