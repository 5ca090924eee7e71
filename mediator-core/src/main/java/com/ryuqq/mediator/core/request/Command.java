package com.ryuqq.mediator.core.request;

import com.ryuqq.mediator.core.response.Response;

/**
 * 상태를 변경하는 요청.
 *
 * <p>Command는 생성 시점에 한 번 부여되고 재사용되지 않는 {@link CommandId}를 가집니다.</p>
 *
 * <p><strong>record 예시:</strong></p>
 * <pre>
 * public record CreateOrderCommand(CommandId id, UUID customerId, long amount)
 *         implements Command&lt;UUID&gt; {
 *
 *     public CreateOrderCommand(UUID customerId, long amount) {
 *         this(CommandId.generate(), customerId, amount);
 *     }
 * }
 * </pre>
 *
 * <p>클래스 기반 Command는 {@link AbstractCommand}를 상속하면 생성자에서 식별자가 부여됩니다.</p>
 *
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public non-sealed interface Command<T> extends Request<Response<T>> {

    /**
     * Command 식별자.
     *
     * <p>같은 인스턴스에 대해 항상 같은 값을 반환해야 합니다.</p>
     *
     * @return 생성 시점에 부여된 식별자
     */
    CommandId id();
}
