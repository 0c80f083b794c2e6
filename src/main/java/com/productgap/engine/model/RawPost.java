package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A post as written by the platform scrapers. The engine only ever flips {@code processed}.
 */
@Getter
@Setter
@Entity
@Table(name = "raw_posts", indexes = {
        @Index(name = "idx_raw_posts_processed", columnList = "processed"),
        @Index(name = "idx_raw_posts_platform", columnList = "platform")
})
public class RawPost {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "platform", nullable = false, length = 100)
    private String platform;

    @Column(name = "post_id", nullable = false, length = 255)
    private String postId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "author", columnDefinition = "TEXT")
    private String author;

    @Column(name = "url", nullable = false, columnDefinition = "TEXT")
    private String url;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metrics")
    private Map<String, Object> metrics = new HashMap<>();

    @Column(name = "content_hash", nullable = false, unique = true, length = 128)
    private String contentHash;

    @Column(name = "scraped_at")
    private OffsetDateTime scrapedAt;

    @Column(name = "processed", nullable = false)
    private boolean processed = false;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    public RawPost() {
    }

    /**
     * Reads a numeric engagement counter, treating missing or non-numeric values as zero.
     */
    public long metric(String name) {
        if (metrics == null) {
            return 0L;
        }
        Object value = metrics.get(name);
        if (value instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Math.max(0L, Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    /**
     * When the post was written, as far as the scraper could tell.
     */
    public OffsetDateTime observedAt() {
        return createdAt != null ? createdAt : scrapedAt;
    }
}
