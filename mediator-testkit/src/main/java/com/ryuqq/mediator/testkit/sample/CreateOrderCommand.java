package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.request.Command;
import com.ryuqq.mediator.core.request.CommandId;

import java.util.UUID;

/**
 * 주문 생성 Command. 성공 시 새 주문 식별자를 반환합니다.
 *
 * <p>customerId의 존재 여부는 생성 시점이 아니라 {@link CreateOrderValidator}가 검사합니다.</p>
 *
 * @param id Command 식별자
 * @param customerId 고객 식별자 (null 또는 nil UUID면 검증 실패)
 * @param description 주문 설명
 * @param amount 주문 금액
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record CreateOrderCommand(CommandId id, UUID customerId, String description, long amount)
    implements Command<UUID> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null인 경우
     */
    public CreateOrderCommand {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    /**
     * 새 CommandId로 Command 생성.
     *
     * @param customerId 고객 식별자
     * @param description 주문 설명
     * @param amount 주문 금액
     * @return 새 CreateOrderCommand
     */
    public static CreateOrderCommand of(UUID customerId, String description, long amount) {
        return new CreateOrderCommand(CommandId.generate(), customerId, description, amount);
    }
}
