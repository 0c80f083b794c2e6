package com.productgap.engine.repository;

import com.productgap.engine.model.ScraperRunMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScraperRunMetadataRepository extends JpaRepository<ScraperRunMetadata, UUID> {

    Optional<ScraperRunMetadata> findByScraperName(String scraperName);
}
