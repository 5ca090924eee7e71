package com.ryuqq.mediator.core.request;

import com.ryuqq.mediator.core.response.PagedResponse;

/**
 * 큰 결과 집합 중 한 페이지를 요청하는 읽기 전용 요청.
 *
 * <p>pageNumber와 pageSize는 그대로 {@link PagedResponse}에 전달되며,
 * 1 미만의 값은 PagedResponse 생성 시 거부됩니다.</p>
 *
 * @param <T> 성공 시 결과 데이터 타입 (보통 List)
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public non-sealed interface PagedQuery<T> extends Request<PagedResponse<T>> {

    /**
     * 요청 페이지 번호.
     *
     * @return 1부터 시작하는 페이지 번호
     */
    int pageNumber();

    /**
     * 요청 페이지 크기.
     *
     * @return 페이지 크기 (1 이상)
     */
    int pageSize();

    /**
     * 0부터 시작하는 조회 시작 위치.
     *
     * @return (pageNumber - 1) * pageSize
     */
    default long offset() {
        return (long) (pageNumber() - 1) * pageSize();
    }
}
