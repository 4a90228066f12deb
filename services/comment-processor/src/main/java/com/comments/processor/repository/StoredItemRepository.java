package com.comments.processor.repository;

import java.time.Instant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.comments.processor.model.ItemKey;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;
import com.comments.processor.model.StoredItem;

/**
 * Single-key access to stored items. No range scans.
 */
@Repository
public interface StoredItemRepository extends JpaRepository<StoredItem, ItemKey> {

    /**
     * Compare-and-set on status for one key. Returns 1 when the row was in
     * {@code expected} and is now {@code target}, otherwise 0.
     */
    @Modifying
    @Transactional
    @Query("UPDATE StoredItem i SET i.status = :target, i.updatedAt = :updatedAt "
            + "WHERE i.itemType = :itemType AND i.itemId = :itemId AND i.status = :expected")
    int transitionStatus(ItemType itemType, String itemId, ModerationStatus expected, ModerationStatus target,
            Instant updatedAt);
}
