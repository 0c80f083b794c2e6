package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Setter
@Getter
@Entity
@Table(name = "community_signals", indexes = {
        @Index(name = "idx_community_signals_opportunity", columnList = "opportunity_id"),
        @Index(name = "idx_community_signals_platform", columnList = "platform")
})
public class CommunitySignalSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "opportunity_id", nullable = false)
    private Long opportunityId;

    @Column(name = "platform", nullable = false, length = 100)
    private String platform;

    @Column(name = "signal_type", length = 50)
    private String signalType;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "engagement_score")
    private Integer engagementScore;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    public CommunitySignalSnapshot() {
    }
}
