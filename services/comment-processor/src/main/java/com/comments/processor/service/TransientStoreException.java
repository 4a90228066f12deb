package com.comments.processor.service;

import com.comments.processor.model.ItemKey;

/**
 * The store could not be reached or refused the operation for a reason that may
 * clear on its own (connection loss, lock timeout, throttling).
 */
public class TransientStoreException extends RuntimeException {

    private final ItemKey key;

    public TransientStoreException(ItemKey key, Throwable cause) {
        super("Item store unavailable for " + key.getItemType() + "/" + key.getItemId(), cause);
        this.key = key;
    }

    public ItemKey getKey() {
        return key;
    }
}
