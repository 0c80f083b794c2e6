package com.productgap.engine.service;

import com.productgap.engine.model.PipelineLock;
import com.productgap.engine.repository.PipelineLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Lease-based mutual exclusion between pipeline runs, stored in {@code pipeline_locks}.
 * Every operation commits on its own so the lease is visible to other runs immediately.
 */
@Service
public class PipelineLockService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineLockService.class);

    private final PipelineLockRepository lockRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PipelineLockService(PipelineLockRepository lockRepository,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.lockRepository = lockRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Takes the named lease.
     *
     * @return the owner token to pass to {@link #renew} and {@link #release}
     * @throws PipelineBusyException if another owner holds an unexpired lease
     */
    public String acquire(String lockName, Duration lease) {
        ensureLockRow(lockName);
        String owner = UUID.randomUUID().toString();
        OffsetDateTime now = OffsetDateTime.now(clock);
        Integer updated = transactionTemplate.execute(status ->
                lockRepository.tryLease(lockName, owner, now, now.plus(lease)));
        if (updated == null || updated == 0) {
            throw new PipelineBusyException("Pipeline '" + lockName + "' is already running");
        }
        logger.debug("Acquired lock {} as {} until {}", lockName, owner, now.plus(lease));
        return owner;
    }

    /**
     * Extends a lease we still hold.
     *
     * @return false if the lease was lost to another owner
     */
    public boolean renew(String lockName, String owner, Duration lease) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Integer updated = transactionTemplate.execute(status ->
                lockRepository.renew(lockName, owner, now.plus(lease)));
        boolean renewed = updated != null && updated > 0;
        if (!renewed) {
            logger.warn("Lease on {} is no longer held by {}", lockName, owner);
        }
        return renewed;
    }

    public void release(String lockName, String owner) {
        Integer released = transactionTemplate.execute(status -> lockRepository.release(lockName, owner));
        if (released == null || released == 0) {
            logger.warn("Lock {} was not held by {} at release", lockName, owner);
        } else {
            logger.debug("Released lock {}", lockName);
        }
    }

    private void ensureLockRow(String lockName) {
        Boolean exists = transactionTemplate.execute(status -> lockRepository.existsById(lockName));
        if (Boolean.TRUE.equals(exists)) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> lockRepository.saveAndFlush(new PipelineLock(lockName)));
        } catch (DataIntegrityViolationException e) {
            logger.debug("Lock row {} was created concurrently", lockName);
        }
    }
}
