package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.request.PagedQuery;

import java.util.List;
import java.util.UUID;

/**
 * 주문 목록 페이지 조회 Query.
 *
 * @param customerId 고객 필터 (null이면 전체)
 * @param pageNumber 1부터 시작하는 페이지 번호
 * @param pageSize 페이지 크기
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record ListOrdersQuery(UUID customerId, int pageNumber, int pageSize) implements PagedQuery<List<Order>> {

    public ListOrdersQuery {
        if (pageNumber <= 0) {
            throw new IllegalArgumentException("pageNumber must be positive (current: " + pageNumber + ")");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
    }

    /**
     * 전체 주문 조회.
     *
     * @param pageNumber 페이지 번호
     * @param pageSize 페이지 크기
     * @return 고객 필터 없는 Query
     */
    public static ListOrdersQuery all(int pageNumber, int pageSize) {
        return new ListOrdersQuery(null, pageNumber, pageSize);
    }
}
