package com.productgap.engine.repository;

import com.productgap.engine.model.RawPost;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RawPostRepository extends JpaRepository<RawPost, UUID> {

    /**
     * Unprocessed posts, oldest scrape first. Ties fall back to creation time and id so the order is stable.
     */
    @Query("SELECT p FROM RawPost p WHERE p.processed = false ORDER BY p.scrapedAt ASC, p.createdAt ASC, p.id ASC")
    List<RawPost> findUnprocessed(Pageable pageable);

    long countByProcessedFalse();

    @Modifying
    @Query("UPDATE RawPost p SET p.processed = true WHERE p.id = :id")
    int markProcessed(@Param("id") UUID id);
}
