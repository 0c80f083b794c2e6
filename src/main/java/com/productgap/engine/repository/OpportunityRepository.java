package com.productgap.engine.repository;

import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.OpportunityStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OpportunityRepository extends JpaRepository<Opportunity, Long> {

    // Open clusters in id order, which is also creation order
    List<Opportunity> findAllByStatusOrderByIdAsc(OpportunityStatus status);

    List<Opportunity> findAllByStatusOrderByConfidenceScoreDescIdAsc(OpportunityStatus status);

    long countByStatus(OpportunityStatus status);
}
