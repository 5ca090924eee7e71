package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.application.registry.HandlerModule;
import com.ryuqq.mediator.application.registry.HandlerRegistry;
import com.ryuqq.mediator.core.handler.HandlerSupport;
import com.ryuqq.mediator.core.response.EmptyPagePolicy;

/**
 * 샘플 주문 Handler 등록 모듈.
 *
 * <p>ServiceLoader로 발견될 때는 기본 생성자가 사용됩니다
 * (새 InMemoryOrderRepository, {@link EmptyPagePolicy#SUCCESS}, 저장 실패 코드 500).</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class OrderHandlerModule implements HandlerModule {

    private final OrderRepository repository;
    private final EmptyPagePolicy emptyPagePolicy;
    private final int creationFailureCode;
    private final CreateOrderValidator validator = new CreateOrderValidator();

    public OrderHandlerModule() {
        this(new InMemoryOrderRepository(), EmptyPagePolicy.SUCCESS, HandlerSupport.INTERNAL_ERROR);
    }

    public OrderHandlerModule(OrderRepository repository, EmptyPagePolicy emptyPagePolicy, int creationFailureCode) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (emptyPagePolicy == null) {
            throw new IllegalArgumentException("emptyPagePolicy cannot be null");
        }
        this.repository = repository;
        this.emptyPagePolicy = emptyPagePolicy;
        this.creationFailureCode = creationFailureCode;
    }

    @Override
    public void register(HandlerRegistry.Builder builder) {
        builder
            .register(CreateOrderCommand.class,
                notificator -> new CreateOrderHandler(notificator, validator, repository, creationFailureCode))
            .register(GetOrderByIdQuery.class,
                notificator -> new GetOrderByIdHandler(notificator, repository))
            .register(ListOrdersQuery.class,
                notificator -> new ListOrdersHandler(notificator, repository, emptyPagePolicy));
    }
}
