package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.request.PagedQuery;
import com.ryuqq.mediator.core.response.PagedResponse;

/**
 * {@link PagedQuery} Handler.
 *
 * <p>조회 결과가 0건일 때의 처리는 {@link com.ryuqq.mediator.core.response.EmptyPagePolicy}를
 * 주입받아 {@link HandlerSupport#page}로 결정합니다.</p>
 *
 * @param <Q> PagedQuery 타입
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PagedQueryHandler<Q extends PagedQuery<T>, T> extends RequestHandler<Q, PagedResponse<T>> {
}
