package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A marketplace product competing with an opportunity, written by the marketplace scraper.
 */
@Setter
@Getter
@Entity
@Table(name = "competitors", indexes = {
        @Index(name = "idx_competitors_opportunity", columnList = "opportunity_id"),
        @Index(name = "idx_competitors_asin", columnList = "asin")
})
public class CompetitorListing {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "opportunity_id", nullable = false)
    private Long opportunityId;

    @Column(name = "asin", length = 32)
    private String asin;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "price")
    private BigDecimal price;

    @Column(name = "rating")
    private BigDecimal rating;

    @Column(name = "review_count")
    private Integer reviewCount;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "image_url", columnDefinition = "TEXT")
    private String imageUrl;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    public CompetitorListing() {
    }
}
