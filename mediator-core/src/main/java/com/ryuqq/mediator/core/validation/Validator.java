package com.ryuqq.mediator.core.validation;

import com.ryuqq.mediator.core.cancellation.CancellationToken;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 요청 검증 SPI.
 *
 * <p>검증 규칙 엔진은 외부 협력자이며, Handler는 이 인터페이스를 통해서만 호출합니다.
 * 결과는 (필드 경로, 메시지) 실패의 순서 있는 목록이며, 빈 목록은 통과를 의미합니다.</p>
 *
 * <p><strong>구현 지침:</strong></p>
 * <ul>
 *   <li>규칙 실패는 예외가 아니라 {@link ValidationFailure}로 보고</li>
 *   <li>실패 순서는 규칙 선언 순서를 따름</li>
 *   <li>토큰이 취소되면 {@link java.util.concurrent.CancellationException}으로 실패</li>
 * </ul>
 *
 * @param <R> 검증 대상 요청 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator<R> {

    /**
     * 요청 검증.
     *
     * @param request 검증할 요청
     * @param cancellation 취소 신호
     * @return 실패 목록 (통과 시 빈 목록)
     */
    CompletableFuture<List<ValidationFailure>> validate(R request, CancellationToken cancellation);

    /**
     * 모든 요청을 통과시키는 Validator.
     *
     * @param <R> 요청 타입
     * @return 항상 빈 목록을 반환하는 Validator
     */
    static <R> Validator<R> none() {
        return (request, cancellation) -> CompletableFuture.completedFuture(List.of());
    }
}
