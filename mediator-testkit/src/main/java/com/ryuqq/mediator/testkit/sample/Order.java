package com.ryuqq.mediator.testkit.sample;

import java.time.Instant;
import java.util.UUID;

/**
 * 샘플 주문 엔티티.
 *
 * @param id 주문 식별자
 * @param customerId 고객 식별자
 * @param description 주문 설명
 * @param amount 주문 금액 (0 이상)
 * @param createdAt 생성 시각
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record Order(UUID id, UUID customerId, String description, long amount, Instant createdAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 amount가 음수인 경우
     */
    public Order {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (customerId == null) {
            throw new IllegalArgumentException("customerId cannot be null");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be non-negative (current: " + amount + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 새 주문 생성.
     *
     * @param customerId 고객 식별자
     * @param description 주문 설명
     * @param amount 주문 금액
     * @return 새 식별자와 현재 시각을 가진 Order
     */
    public static Order place(UUID customerId, String description, long amount) {
        return new Order(UUID.randomUUID(), customerId, description, amount, Instant.now());
    }
}
