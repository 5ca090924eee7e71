package com.ryuqq.mediator.core.request;

import com.ryuqq.mediator.core.response.Response;

/**
 * 부수 효과 없는 읽기 전용 요청.
 *
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public non-sealed interface Query<T> extends Request<Response<T>> {
}
