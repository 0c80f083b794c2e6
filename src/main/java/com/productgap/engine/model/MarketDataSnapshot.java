package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Market size and search demand for an opportunity at one point in time.
 */
@Setter
@Getter
@Entity
@Table(name = "market_data", indexes = @Index(name = "idx_market_data_opportunity", columnList = "opportunity_id"))
public class MarketDataSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "opportunity_id", nullable = false)
    private Long opportunityId;

    @Column(name = "tam_estimate")
    private BigDecimal tamEstimate;

    @Column(name = "search_volume")
    private Integer searchVolume;

    // rising | stable | declining
    @Column(name = "search_trend", length = 20)
    private String searchTrend;

    // percent, e.g. 12.5 for +12.5%
    @Column(name = "yoy_growth")
    private BigDecimal yoyGrowth;

    @Column(name = "data_source", length = 100)
    private String dataSource;

    @Column(name = "fetched_at")
    private OffsetDateTime fetchedAt;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    public MarketDataSnapshot() {
    }
}
