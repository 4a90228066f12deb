package com.comments.processor.service;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import com.comments.processor.model.ItemKey;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;
import com.comments.processor.model.StoredItem;
import com.comments.processor.repository.StoredItemRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keyed access to the item store.
 *
 * <p>Creation is conditional on the primary key: the row is inserted, never merged,
 * so the first writer wins and later writers for the same key observe
 * {@link CreateOutcome#ALREADY_EXISTS} without touching the stored row. Each call
 * runs in its own repository transaction; callers must not wrap it in another one.
 *
 * <p>Failures that may clear on retry surface as {@link TransientStoreException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemStore {

    private final StoredItemRepository repository;

    public CreateOutcome createIfAbsent(StoredItem item) {
        ItemKey key = item.getId();
        return guarded(key, () -> insert(key, item));
    }

    public Optional<StoredItem> find(ItemType itemType, String itemId) {
        ItemKey key = new ItemKey(itemType, itemId);
        return guarded(key, () -> repository.findById(key));
    }

    /**
     * Single-row compare-and-set on the status column.
     *
     * @return true when the row held {@code expected} and now holds {@code target}
     */
    public boolean updateStatusIfCurrent(ItemKey key, ModerationStatus expected, ModerationStatus target,
            Instant updatedAt) {
        return guarded(key, () -> repository.transitionStatus(
                key.getItemType(), key.getItemId(), expected, target, updatedAt) == 1);
    }

    public boolean exists(ItemKey key) {
        return guarded(key, () -> repository.existsById(key));
    }

    private CreateOutcome insert(ItemKey key, StoredItem item) {
        try {
            repository.saveAndFlush(item);
            log.debug("Created item {}/{}", key.getItemType(), key.getItemId());
            return CreateOutcome.CREATED;

        } catch (DataIntegrityViolationException e) {
            // Either a duplicate delivery or a racing writer got there first
            if (repository.existsById(key)) {
                log.debug("Item {}/{} already exists, leaving it untouched", key.getItemType(), key.getItemId());
                return CreateOutcome.ALREADY_EXISTS;
            }
            throw e;
        }
    }

    private <T> T guarded(ItemKey key, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TransientDataAccessException
                | DataAccessResourceFailureException
                | RecoverableDataAccessException
                | CannotCreateTransactionException e) {
            log.error("Item store unavailable for {}/{}: {}", key.getItemType(), key.getItemId(), e.getMessage());
            throw new TransientStoreException(key, e);
        }
    }

    public enum CreateOutcome {
        CREATED,
        ALREADY_EXISTS
    }
}
