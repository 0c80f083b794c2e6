package com.productgap.engine.repository;

import com.productgap.engine.model.CompetitorListing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CompetitorListingRepository extends JpaRepository<CompetitorListing, UUID> {

    long countByOpportunityId(Long opportunityId);
}
