package com.productgap.engine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

/**
 * Lease row serializing pipeline runs. A lease past {@code leasedUntil} belongs to nobody.
 * <p>
 * The id is assigned by the caller, so {@link Persistable} tells Spring Data to insert a fresh row
 * instead of merging into one a concurrent run may have just created.
 */
@Setter
@Getter
@Entity
@Table(name = "pipeline_locks")
public class PipelineLock implements Persistable<String> {

    @Id
    @Column(name = "lock_name", nullable = false, updatable = false, length = 100)
    private String lockName;

    @Column(name = "owner", length = 100)
    private String owner;

    @Column(name = "acquired_at")
    private OffsetDateTime acquiredAt;

    @Column(name = "leased_until")
    private OffsetDateTime leasedUntil;

    @Transient
    private boolean fresh;

    public PipelineLock() {
    }

    public PipelineLock(String lockName) {
        this.lockName = lockName;
        this.fresh = true;
    }

    @Override
    public String getId() {
        return lockName;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }
}
