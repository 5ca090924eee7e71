package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.HandlerSupport;
import com.ryuqq.mediator.core.handler.QueryHandler;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.Response;

import java.util.concurrent.CompletableFuture;

/**
 * 단건 주문 조회 Handler. 없으면 404 "Order not found.".
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class GetOrderByIdHandler implements QueryHandler<GetOrderByIdQuery, Order> {

    public static final String NOT_FOUND = "Order not found.";

    private final HandlerSupport support;
    private final OrderRepository repository;

    public GetOrderByIdHandler(Notificator notificator, OrderRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.support = new HandlerSupport(notificator);
        this.repository = repository;
    }

    @Override
    public CompletableFuture<Response<Order>> execute(GetOrderByIdQuery query, CancellationToken cancellation) {
        return repository.findById(query.orderId(), cancellation).thenApply(found -> found
            .map(Response::success)
            .orElseGet(() -> support.failure(NOT_FOUND, HandlerSupport.NOT_FOUND)));
    }
}
