package com.ryuqq.mediator.application.mediator;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.request.Request;
import com.ryuqq.mediator.core.response.Result;

import java.util.concurrent.CompletableFuture;

/**
 * 요청 디스패처.
 *
 * <p>요청의 정확한 런타임 타입에 등록된 Handler 하나를 찾아 실행하고,
 * Handler가 반환한 결과를 변경 없이 그대로 돌려줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompletableFuture&lt;Response&lt;Order&gt;&gt; future = mediator.dispatch(new GetOrderByIdQuery(orderId), token);
 *
 * Response&lt;Order&gt; response = future.join();
 * if (response.isSuccess()) {
 *     // 200 OK + response.data()
 * } else {
 *     // response.code() + response.notifications()
 * }
 * </pre>
 *
 * <p><strong>책임 범위:</strong> Mediator는 검증이나 Notification 처리를 하지 않습니다.
 * 해결(resolve)과 호출(invoke)만 담당하며, 모든 비즈니스 의미는 Handler에 있습니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public interface Mediator {

    /**
     * 요청을 Handler에 전달.
     *
     * @param request 처리할 요청
     * @param cancellation 취소 신호 (Handler에 그대로 전달)
     * @param <R> 요청이 선언한 결과 형태 (Response 또는 PagedResponse)
     * @return Handler가 반환한 결과 future
     * @throws IllegalArgumentException request 또는 cancellation이 null인 경우
     * @throws com.ryuqq.mediator.application.registry.HandlerNotFoundException 요청 타입에 등록된 Handler가 없는 경우
     */
    <R extends Result<?>> CompletableFuture<R> dispatch(Request<R> request, CancellationToken cancellation);

    /**
     * 취소 신호 없이 요청을 Handler에 전달.
     *
     * @param request 처리할 요청
     * @param <R> 요청이 선언한 결과 형태
     * @return Handler가 반환한 결과 future
     * @throws com.ryuqq.mediator.application.registry.HandlerNotFoundException 요청 타입에 등록된 Handler가 없는 경우
     */
    default <R extends Result<?>> CompletableFuture<R> dispatch(Request<R> request) {
        return dispatch(request, CancellationToken.none());
    }
}
