package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.adapter.inmemory.repository.InMemoryRepository;
import com.ryuqq.mediator.adapter.inmemory.repository.Page;
import com.ryuqq.mediator.core.cancellation.CancellationToken;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link InMemoryRepository} 기반 OrderRepository.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class InMemoryOrderRepository implements OrderRepository {

    private static final Comparator<Order> CREATION_ORDER =
        Comparator.comparing(Order::createdAt).thenComparing(Order::id);

    private final InMemoryRepository<UUID, Order> orders = new InMemoryRepository<>(Order::id);

    @Override
    public CompletableFuture<Boolean> create(Order order, CancellationToken cancellation) {
        return orders.save(order, cancellation).thenApply(saved -> Boolean.TRUE);
    }

    @Override
    public CompletableFuture<Optional<Order>> findById(UUID orderId, CancellationToken cancellation) {
        return orders.findById(orderId, cancellation);
    }

    @Override
    public CompletableFuture<Page<Order>> findPage(
        UUID customerId,
        int pageNumber,
        int pageSize,
        CancellationToken cancellation
    ) {
        return orders.findPage(
            order -> customerId == null || customerId.equals(order.customerId()),
            CREATION_ORDER,
            pageNumber,
            pageSize,
            cancellation
        );
    }

    /**
     * 저장된 주문 수.
     *
     * @return 주문 수
     */
    public int size() {
        return orders.size();
    }

    /**
     * 모든 주문 삭제. 테스트 정리용.
     */
    public void clear() {
        orders.clear();
    }
}
