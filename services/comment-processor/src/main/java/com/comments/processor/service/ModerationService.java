package com.comments.processor.service;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.comments.processor.model.ItemKey;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves an item out of {@code PENDING}. Driven by an outside actor (a moderator or
 * a policy); the ingestion path never calls this. A decided item is never changed again.
 * Store outages surface as {@link TransientStoreException}, as they do for reads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationService {

    private final ItemStore itemStore;
    private final Clock clock;

    public TransitionResult transition(ItemType itemType, String itemId, ModerationStatus target) {
        if (target == null || !target.isFinal()) {
            throw new IllegalArgumentException("Target status must be APPROVED or REJECTED, was " + target);
        }

        ItemKey key = new ItemKey(itemType, itemId);
        if (itemStore.updateStatusIfCurrent(key, ModerationStatus.PENDING, target, clock.instant())) {
            log.info("Item {}/{} moderated: {}", itemType, itemId, target);
            return TransitionResult.TRANSITIONED;
        }

        if (itemStore.exists(key)) {
            log.warn("Item {}/{} already moderated, ignoring {}", itemType, itemId, target);
            return TransitionResult.ALREADY_MODERATED;
        }
        return TransitionResult.NOT_FOUND;
    }

    public enum TransitionResult {
        TRANSITIONED,
        ALREADY_MODERATED,
        NOT_FOUND
    }
}
