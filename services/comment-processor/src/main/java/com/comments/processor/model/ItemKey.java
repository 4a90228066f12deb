package com.comments.processor.model;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two-part primary key of a stored item: (itemType, itemId).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemKey implements Serializable {

    private ItemType itemType;

    private String itemId;
}
