package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Weighted link from one raw post to one opportunity. The raw post is referenced by id only:
 * many opportunities may cite the same post and none of them owns it.
 */
@Setter
@Getter
@Entity
@Table(name = "evidence",
        uniqueConstraints = @UniqueConstraint(name = "uq_evidence_opportunity_post_signal",
                columnNames = {"opportunity_id", "raw_post_id", "signal_type"}),
        indexes = {
                @Index(name = "idx_evidence_opportunity", columnList = "opportunity_id"),
                @Index(name = "idx_evidence_raw_post", columnList = "raw_post_id")
        })
public class Evidence {

    public static final double DEFAULT_WEIGHT = 1.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "opportunity_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Opportunity opportunity;

    @Column(name = "raw_post_id", nullable = false, updatable = false)
    private UUID rawPostId;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_type", nullable = false, length = 32)
    private SignalType signalType;

    @Column(name = "weight", nullable = false)
    private double weight = DEFAULT_WEIGHT;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "observed_at", nullable = false)
    private OffsetDateTime observedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public Evidence() {
    }
}
