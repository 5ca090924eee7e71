package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.request.Query;

import java.util.UUID;

/**
 * 단건 주문 조회 Query.
 *
 * @param orderId 주문 식별자
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record GetOrderByIdQuery(UUID orderId) implements Query<Order> {

    public GetOrderByIdQuery {
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
    }
}
