package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A cluster of signals describing one candidate product gap.
 * <p>
 * Keywords, summary and description form the cluster centroid; {@code version} guards every
 * centroid write so a stale snapshot can never overwrite a newer one. Scores are derived data and
 * are only written by the scoring engine.
 */
@Setter
@Getter
@Entity
@Table(name = "opportunities", indexes = {
        @Index(name = "idx_opportunities_confidence", columnList = "confidence_score"),
        @Index(name = "idx_opportunities_status", columnList = "status"),
        @Index(name = "idx_opportunities_category", columnList = "category")
})
public class Opportunity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "problem_summary", columnDefinition = "TEXT")
    private String problemSummary;

    @Column(name = "category", length = 100)
    private String category;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "keywords")
    private List<String> keywords;

    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Column(name = "pain_severity", nullable = false, precision = 3, scale = 1)
    private BigDecimal painSeverity = BigDecimal.ZERO;

    @Column(name = "trend_score", nullable = false)
    private int trendScore;

    @Column(name = "timing_score", nullable = false)
    private int timingScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "growth_pattern", nullable = false, length = 20)
    private GrowthPattern growthPattern = GrowthPattern.EMERGING;

    @Column(name = "evidence_count", nullable = false)
    private int evidenceCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OpportunityStatus status = OpportunityStatus.ACTIVE;

    @Column(name = "detected_at")
    private OffsetDateTime detectedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public Opportunity() {
    }
}
