package com.productgap.engine.repository;

import com.productgap.engine.model.MarketDataSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MarketDataSnapshotRepository extends JpaRepository<MarketDataSnapshot, UUID> {

    Optional<MarketDataSnapshot> findTopByOpportunityIdOrderByFetchedAtDesc(Long opportunityId);
}
