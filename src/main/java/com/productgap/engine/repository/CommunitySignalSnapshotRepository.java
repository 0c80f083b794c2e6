package com.productgap.engine.repository;

import com.productgap.engine.model.CommunitySignalSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CommunitySignalSnapshotRepository extends JpaRepository<CommunitySignalSnapshot, UUID> {

    @Query("SELECT COALESCE(SUM(c.engagementScore), 0L) FROM CommunitySignalSnapshot c WHERE c.opportunityId = :opportunityId")
    long sumEngagement(@Param("opportunityId") Long opportunityId);
}
