package com.productgap.engine.service;

import com.productgap.engine.model.ScraperRunMetadata;
import com.productgap.engine.repository.ScraperRunMetadataRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Upserts the {@code scraper_metadata} row for a named run.
 */
@Service
public class RunMetadataService {

    private final ScraperRunMetadataRepository repository;
    private final Clock clock;

    public RunMetadataService(ScraperRunMetadataRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ScraperRunMetadata recordStarted(String name) {
        ScraperRunMetadata metadata = load(name);
        OffsetDateTime now = OffsetDateTime.now(clock);
        metadata.setLastRunAt(now);
        metadata.setStatus(ScraperRunMetadata.STATUS_RUNNING);
        metadata.setUpdatedAt(now);
        return repository.save(metadata);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ScraperRunMetadata recordFinished(String name, BatchSummary summary) {
        ScraperRunMetadata metadata = load(name);
        OffsetDateTime now = OffsetDateTime.now(clock);
        metadata.setLastRunAt(summary.getStartedAt());
        metadata.setLastSuccessAt(now);
        metadata.setRecordsProcessed(summary.getProcessed());
        if (summary.isClean()) {
            metadata.setStatus(ScraperRunMetadata.STATUS_SUCCESS);
            metadata.setErrorMessage(null);
        } else {
            metadata.setStatus(ScraperRunMetadata.STATUS_PARTIAL);
            BatchSummary.PostFailure last = summary.getFailures().get(summary.getFailures().size() - 1);
            metadata.setErrorMessage(summary.getFailed() + " post(s) failed; last: " + last.message());
        }
        metadata.setUpdatedAt(now);
        return repository.save(metadata);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ScraperRunMetadata recordFailed(String name, String errorMessage) {
        ScraperRunMetadata metadata = load(name);
        OffsetDateTime now = OffsetDateTime.now(clock);
        metadata.setLastRunAt(metadata.getLastRunAt() == null ? now : metadata.getLastRunAt());
        metadata.setStatus(ScraperRunMetadata.STATUS_FAILED);
        metadata.setErrorMessage(errorMessage);
        metadata.setUpdatedAt(now);
        return repository.save(metadata);
    }

    @Transactional(readOnly = true)
    public Optional<ScraperRunMetadata> find(String name) {
        return repository.findByScraperName(name);
    }

    private ScraperRunMetadata load(String name) {
        return repository.findByScraperName(name).orElseGet(() -> {
            ScraperRunMetadata created = new ScraperRunMetadata();
            created.setScraperName(name);
            created.setCreatedAt(OffsetDateTime.now(clock));
            return created;
        });
    }
}
