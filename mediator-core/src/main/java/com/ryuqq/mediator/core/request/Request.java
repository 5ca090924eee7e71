package com.ryuqq.mediator.core.request;

import com.ryuqq.mediator.core.response.Result;

/**
 * Mediator로 전달되는 요청.
 *
 * <p>Request는 기대하는 결과 형태 {@code R}로 매개변수화된 marker이며,
 * 세 가지 변형만 허용됩니다:</p>
 * <ul>
 *   <li>{@link Command}: 상태를 변경하며, 생성 시점에 식별자를 부여받음</li>
 *   <li>{@link Query}: 읽기 전용, 단일 결과</li>
 *   <li>{@link PagedQuery}: 읽기 전용, 페이지 단위 결과</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 요청 값은 생성 후 변경할 수 없습니다.
 * 구현체는 record 또는 final 필드만 가진 클래스로 작성합니다.</p>
 *
 * <p><strong>라우팅:</strong> Mediator는 요청의 정확한 런타임 클래스로 Handler를 찾습니다.
 * 같은 상위 타입을 공유하는 두 요청 타입도 각각 별도로 등록되어야 합니다.</p>
 *
 * @param <R> 기대하는 결과 형태 (Response 또는 PagedResponse)
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public sealed interface Request<R extends Result<?>> permits Command, Query, PagedQuery {
}
