package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.request.Query;
import com.ryuqq.mediator.core.response.Response;

/**
 * {@link Query} Handler.
 *
 * @param <Q> Query 타입
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryHandler<Q extends Query<T>, T> extends RequestHandler<Q, Response<T>> {
}
