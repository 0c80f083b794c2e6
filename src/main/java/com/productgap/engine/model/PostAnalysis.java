package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Setter
@Getter
@Entity
@Table(name = "post_analysis", indexes = {
        @Index(name = "idx_post_analysis_raw_post", columnList = "raw_post_id"),
        @Index(name = "idx_post_analysis_category", columnList = "product_category")
})
public class PostAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "raw_post_id", nullable = false, updatable = false)
    private UUID rawPostId;

    @Column(name = "problem_summary", columnDefinition = "TEXT")
    private String problemSummary;

    @Column(name = "pain_severity", nullable = false)
    private int painSeverity;

    @Column(name = "willingness_to_pay", nullable = false)
    private boolean willingnessToPay;

    @Column(name = "product_category", length = 100)
    private String productCategory;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "keywords")
    private List<String> keywords;

    @Column(name = "model_id", length = 200)
    private String modelId;

    @Column(name = "analyzed_at", nullable = false)
    private OffsetDateTime analyzedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public PostAnalysis() {
    }
}
