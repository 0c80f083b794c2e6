package com.productgap.engine.repository;

import com.productgap.engine.model.PipelineLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface PipelineLockRepository extends JpaRepository<PipelineLock, String> {

    /**
     * Takes the lease if nobody holds it or the current lease has expired. Returns the number of rows updated.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PipelineLock l SET l.owner = :owner, l.acquiredAt = :now, l.leasedUntil = :until " +
            "WHERE l.lockName = :name AND (l.owner IS NULL OR l.leasedUntil IS NULL OR l.leasedUntil < :now)")
    int tryLease(@Param("name") String name,
                 @Param("owner") String owner,
                 @Param("now") OffsetDateTime now,
                 @Param("until") OffsetDateTime until);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PipelineLock l SET l.leasedUntil = :until WHERE l.lockName = :name AND l.owner = :owner")
    int renew(@Param("name") String name, @Param("owner") String owner, @Param("until") OffsetDateTime until);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PipelineLock l SET l.owner = NULL, l.leasedUntil = NULL WHERE l.lockName = :name AND l.owner = :owner")
    int release(@Param("name") String name, @Param("owner") String owner);
}
