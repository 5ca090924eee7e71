package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.CommandHandler;
import com.ryuqq.mediator.core.handler.HandlerSupport;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.Response;
import com.ryuqq.mediator.core.validation.Validator;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * 주문 생성 Handler.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>Validator 실행. 실패하면 저장소를 호출하지 않고 400 반환</li>
 *   <li>저장소에 주문 저장</li>
 *   <li>저장 실패 시 "Failed to create the order."와 설정된 코드로 실패</li>
 *   <li>성공 시 새 주문 식별자를 201로 반환</li>
 * </ol>
 *
 * <p>저장소가 던진 예외와 취소는 반환 future로 그대로 전파됩니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class CreateOrderHandler implements CommandHandler<CreateOrderCommand, UUID> {

    public static final String CREATION_FAILED = "Failed to create the order.";
    public static final int CREATED = 201;

    private final HandlerSupport support;
    private final Validator<CreateOrderCommand> validator;
    private final OrderRepository repository;
    private final int creationFailureCode;

    /**
     * @param notificator 이번 dispatch의 Notificator
     * @param validator 요청 검증기
     * @param repository 주문 저장소
     * @param creationFailureCode 저장 실패 시 응답 코드 (4xx 또는 5xx)
     */
    public CreateOrderHandler(
        Notificator notificator,
        Validator<CreateOrderCommand> validator,
        OrderRepository repository,
        int creationFailureCode
    ) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (creationFailureCode < 400 || creationFailureCode >= 600) {
            throw new IllegalArgumentException(
                "creationFailureCode must be 4xx or 5xx (current: " + creationFailureCode + ")");
        }
        this.support = new HandlerSupport(notificator);
        this.validator = validator;
        this.repository = repository;
        this.creationFailureCode = creationFailureCode;
    }

    @Override
    public CompletableFuture<Response<UUID>> execute(CreateOrderCommand command, CancellationToken cancellation) {
        return support.executeValidation(validator, command, cancellation).thenCompose(valid -> {
            if (!valid) {
                return CompletableFuture.completedFuture(support.<UUID>failure(HandlerSupport.BAD_REQUEST));
            }
            Order order = Order.place(command.customerId(), command.description(), command.amount());
            return repository.create(order, cancellation).thenApply(created -> Boolean.TRUE.equals(created)
                ? Response.success(order.id(), CREATED)
                : support.<UUID>failure(CREATION_FAILED, creationFailureCode));
        });
    }
}
