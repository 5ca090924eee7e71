package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.request.Request;
import com.ryuqq.mediator.core.response.Result;

import java.util.concurrent.CompletableFuture;

/**
 * 하나의 요청 타입을 처리하는 Handler.
 *
 * <p>구현체는 {@link HandlerSupport}를 조합하여 다음 고정 절차를 따릅니다:</p>
 * <ol>
 *   <li>검증: 실패 시 {@code support.failure(400)} 반환 후 종료 (비즈니스 로직 호출 금지)</li>
 *   <li>비즈니스 로직 수행 (저장소/도메인 호출, 취소 토큰 전달)</li>
 *   <li>도메인 실패(없음, 규칙 위반) 시 Notification 추가 후 적절한 코드로 실패 반환 (예: 404)</li>
 *   <li>성공 시 {@code Response.success(data)} 반환 (Notificator를 거치지 않음)</li>
 * </ol>
 *
 * <p><strong>생명주기:</strong> Handler 인스턴스는 {@link HandlerFactory}가 dispatch마다
 * 새 Notificator와 함께 생성하므로, execute 호출 간에 Notification이 누적되지 않습니다.</p>
 *
 * <p><strong>예외:</strong> 예상된 실패는 예외로 던지지 않습니다.
 * 협력자의 예기치 않은 예외와 취소는 반환된 future를 통해 그대로 전파됩니다.</p>
 *
 * @param <Q> 처리하는 요청 타입
 * @param <R> 결과 형태
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R extends Result<?>> {

    /**
     * 요청 실행.
     *
     * @param request 처리할 요청
     * @param cancellation 취소 신호 (모든 외부 호출에 그대로 전달)
     * @return 결과 future
     */
    CompletableFuture<R> execute(Q request, CancellationToken cancellation);
}
