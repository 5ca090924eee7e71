package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.HandlerSupport;
import com.ryuqq.mediator.core.handler.PagedQueryHandler;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.EmptyPagePolicy;
import com.ryuqq.mediator.core.response.PagedResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 주문 목록 페이지 조회 Handler.
 *
 * <p>조회 결과가 0건일 때의 결과는 주입된 {@link EmptyPagePolicy}가 결정합니다.
 * FAILURE면 404 "No orders found.", SUCCESS면 빈 목록과 totalCount 0.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class ListOrdersHandler implements PagedQueryHandler<ListOrdersQuery, List<Order>> {

    public static final String NO_ORDERS = "No orders found.";

    private final HandlerSupport support;
    private final OrderRepository repository;
    private final EmptyPagePolicy emptyPagePolicy;

    public ListOrdersHandler(Notificator notificator, OrderRepository repository, EmptyPagePolicy emptyPagePolicy) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (emptyPagePolicy == null) {
            throw new IllegalArgumentException("emptyPagePolicy cannot be null");
        }
        this.support = new HandlerSupport(notificator);
        this.repository = repository;
        this.emptyPagePolicy = emptyPagePolicy;
    }

    @Override
    public CompletableFuture<PagedResponse<List<Order>>> execute(ListOrdersQuery query, CancellationToken cancellation) {
        return repository.findPage(query.customerId(), query.pageNumber(), query.pageSize(), cancellation)
            .thenApply(page -> support.page(
                emptyPagePolicy,
                page.items(),
                page.totalCount(),
                query.pageNumber(),
                query.pageSize(),
                NO_ORDERS
            ));
    }
}
