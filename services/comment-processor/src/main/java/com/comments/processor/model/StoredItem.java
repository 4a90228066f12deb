package com.comments.processor.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the items table.
 * Keyed by (item_type, item_id); status is the only column that may change after insert.
 * Always persisted as new, so a save can never merge over an existing row.
 */
@Entity
@Table(name = "items")
@IdClass(ItemKey.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredItem implements Persistable<ItemKey> {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", length = 20, updatable = false, nullable = false)
    private ItemType itemType;

    @Id
    @Column(name = "item_id", length = 255, updatable = false, nullable = false)
    private String itemId;

    @Convert(converter = PayloadConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT", updatable = false, nullable = false)
    @Builder.Default
    private Map<String, String> payload = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private ModerationStatus status;

    @Column(name = "received_at", updatable = false, nullable = false)
    private Instant receivedAt;

    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Builder.Default
    private boolean newItem = true;

    @Override
    public ItemKey getId() {
        return new ItemKey(itemType, itemId);
    }

    @Override
    public boolean isNew() {
        return newItem;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (receivedAt == null) receivedAt = createdAt;
        if (status == null) status = ModerationStatus.PENDING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        newItem = false;
    }
}
