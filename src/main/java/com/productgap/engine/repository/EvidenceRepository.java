package com.productgap.engine.repository;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.SignalType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EvidenceRepository extends JpaRepository<Evidence, Long> {

    @Query("SELECT CASE WHEN COUNT(e) > 0 THEN true ELSE false END FROM Evidence e WHERE e.opportunity.id = :opportunityId " +
            "AND e.rawPostId = :rawPostId AND e.signalType = :signalType")
    boolean existsLink(@Param("opportunityId") Long opportunityId,
                       @Param("rawPostId") UUID rawPostId,
                       @Param("signalType") SignalType signalType);

    @Query("SELECT COUNT(DISTINCT e.rawPostId) FROM Evidence e WHERE e.opportunity.id = :opportunityId")
    long countDistinctPosts(@Param("opportunityId") Long opportunityId);

    @Query("SELECT e FROM Evidence e WHERE e.opportunity.id = :opportunityId ORDER BY e.observedAt ASC, e.id ASC")
    List<Evidence> findAllForOpportunity(@Param("opportunityId") Long opportunityId);

    @Query("SELECT DISTINCT e.opportunity.id FROM Evidence e WHERE e.rawPostId = :rawPostId ORDER BY e.opportunity.id ASC")
    List<Long> findOpportunityIdsCiting(@Param("rawPostId") UUID rawPostId);

    @Query("SELECT COUNT(e) FROM Evidence e WHERE e.opportunity.id = :opportunityId")
    long countRows(@Param("opportunityId") Long opportunityId);
}
