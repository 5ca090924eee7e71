package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.request.Request;
import com.ryuqq.mediator.core.response.Result;

/**
 * dispatch 단위 Handler 생성기.
 *
 * <p>Mediator는 dispatch마다 새 {@link Notificator}를 만들어 이 팩토리에 전달합니다.
 * 팩토리는 그 Notificator를 소유하는 Handler 인스턴스를 반환해야 하며,
 * Handler를 캐시하거나 Notificator를 다른 Handler와 공유해서는 안 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * HandlerFactory&lt;GetOrderByIdQuery, Response&lt;Order&gt;&gt; factory =
 *     notificator -&gt; new GetOrderByIdHandler(new HandlerSupport(notificator), repository);
 * </pre>
 *
 * @param <Q> 요청 타입
 * @param <R> 결과 형태
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandlerFactory<Q extends Request<R>, R extends Result<?>> {

    /**
     * Handler 생성.
     *
     * @param notificator 이번 dispatch 전용 Notificator (비어 있음)
     * @return 새 Handler 인스턴스
     */
    RequestHandler<Q, R> create(Notificator notificator);
}
