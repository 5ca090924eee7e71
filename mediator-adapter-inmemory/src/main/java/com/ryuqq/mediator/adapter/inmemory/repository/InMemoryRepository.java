package com.ryuqq.mediator.adapter.inmemory.repository;

import com.ryuqq.mediator.core.cancellation.CancellationToken;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory asynchronous repository for testing and reference purposes.
 *
 * <p>Stands in for a persistence collaborator: every operation returns a {@link CompletableFuture},
 * checks the cancellation token before touching storage, and completes on the calling thread.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entities:</strong> ConcurrentHashMap&lt;ID, E&gt; - O(1) save and lookup</li>
 * </ul>
 *
 * <p><strong>Paging:</strong> {@link #findPage} filters, sorts with the given comparator,
 * then slices. Without a comparator the order of a ConcurrentHashMap is undefined.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRepository&lt;UUID, Order&gt; orders = new InMemoryRepository&lt;&gt;(Order::id);
 *
 * orders.save(order, token).join();
 * Optional&lt;Order&gt; found = orders.findById(order.id(), token).join();
 * Page&lt;Order&gt; page = orders.findPage(o -&gt; true, Comparator.comparing(Order::createdAt), 1, 20, token).join();
 * </pre>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No transactions</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @param <ID> the identifier type
 * @param <E> the entity type
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public class InMemoryRepository<ID, E> {

    private final ConcurrentHashMap<ID, E> entities;
    private final Function<? super E, ? extends ID> idExtractor;

    /**
     * Creates an empty repository.
     *
     * @param idExtractor reads the identifier from an entity
     * @throws IllegalArgumentException if idExtractor is null
     */
    public InMemoryRepository(Function<? super E, ? extends ID> idExtractor) {
        if (idExtractor == null) {
            throw new IllegalArgumentException("idExtractor cannot be null");
        }
        this.entities = new ConcurrentHashMap<>();
        this.idExtractor = idExtractor;
    }

    /**
     * Inserts or replaces an entity.
     *
     * @param entity the entity to store
     * @param cancellation the cancellation signal
     * @return the stored entity
     */
    public CompletableFuture<E> save(E entity, CancellationToken cancellation) {
        return run(cancellation, () -> {
            if (entity == null) {
                throw new IllegalArgumentException("entity cannot be null");
            }
            ID id = idExtractor.apply(entity);
            if (id == null) {
                throw new IllegalArgumentException("entity id cannot be null");
            }
            entities.put(id, entity);
            return entity;
        });
    }

    /**
     * Looks up an entity by identifier.
     *
     * @param id the identifier
     * @param cancellation the cancellation signal
     * @return the entity, or an empty Optional
     */
    public CompletableFuture<Optional<E>> findById(ID id, CancellationToken cancellation) {
        return run(cancellation, () -> {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
            return Optional.ofNullable(entities.get(id));
        });
    }

    /**
     * Returns one page of the entities matching the filter.
     *
     * @param filter selects matching entities
     * @param order sort order applied before slicing
     * @param pageNumber 1-based page number
     * @param pageSize page size
     * @param cancellation the cancellation signal
     * @return the page and the total match count
     */
    public CompletableFuture<Page<E>> findPage(
        Predicate<? super E> filter,
        Comparator<? super E> order,
        int pageNumber,
        int pageSize,
        CancellationToken cancellation
    ) {
        return run(cancellation, () -> {
            if (filter == null) {
                throw new IllegalArgumentException("filter cannot be null");
            }
            if (order == null) {
                throw new IllegalArgumentException("order cannot be null");
            }
            if (pageNumber <= 0) {
                throw new IllegalArgumentException("pageNumber must be positive (current: " + pageNumber + ")");
            }
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
            }

            List<E> matches = entities.values().stream()
                .filter(filter)
                .sorted(order)
                .collect(Collectors.toList());

            long offset = (long) (pageNumber - 1) * pageSize;
            List<E> items = matches.stream()
                .skip(offset)
                .limit(pageSize)
                .collect(Collectors.toList());

            return new Page<>(items, matches.size());
        });
    }

    /**
     * Counts all stored entities.
     *
     * @param cancellation the cancellation signal
     * @return the entity count
     */
    public CompletableFuture<Long> count(CancellationToken cancellation) {
        return run(cancellation, () -> (long) entities.size());
    }

    /**
     * Removes all entities. Used for test cleanup.
     */
    public void clear() {
        entities.clear();
    }

    /**
     * Returns the number of stored entities.
     *
     * @return the entity count
     */
    public int size() {
        return entities.size();
    }

    private <T> CompletableFuture<T> run(CancellationToken cancellation, Supplier<T> operation) {
        if (cancellation == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("cancellation cannot be null"));
        }
        if (cancellation.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("Repository call was cancelled"));
        }
        try {
            return CompletableFuture.completedFuture(operation.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
