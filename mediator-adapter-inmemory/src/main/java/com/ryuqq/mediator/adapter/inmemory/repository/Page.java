package com.ryuqq.mediator.adapter.inmemory.repository;

import java.util.List;

/**
 * One page of entities plus the total number of matches.
 *
 * @param items the entities on this page
 * @param totalCount the number of matching entities across all pages
 * @param <E> the entity type
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record Page<E>(List<E> items, long totalCount) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if items is null or totalCount is negative
     */
    public Page {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (totalCount < 0) {
            throw new IllegalArgumentException("totalCount must be non-negative (current: " + totalCount + ")");
        }
        items = List.copyOf(items);
    }

    /**
     * Returns whether no entity matched.
     *
     * @return true if totalCount is zero
     */
    public boolean isEmpty() {
        return totalCount == 0;
    }
}
