package com.productgap.engine.repository;

import com.productgap.engine.model.PostAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PostAnalysisRepository extends JpaRepository<PostAnalysis, UUID> {

    Optional<PostAnalysis> findTopByRawPostIdOrderByAnalyzedAtDesc(UUID rawPostId);

    List<PostAnalysis> findAllByRawPostIdIn(Collection<UUID> rawPostIds);

    long countByRawPostId(UUID rawPostId);
}
