package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.adapter.inmemory.repository.Page;
import com.ryuqq.mediator.core.cancellation.CancellationToken;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * 주문 저장소 포트.
 *
 * <p>모든 메서드는 취소 신호를 받으며, 취소가 관찰되면 future가
 * {@link java.util.concurrent.CancellationException}으로 실패합니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public interface OrderRepository {

    /**
     * 주문 저장.
     *
     * @param order 저장할 주문
     * @param cancellation 취소 신호
     * @return 저장 성공 여부
     */
    CompletableFuture<Boolean> create(Order order, CancellationToken cancellation);

    /**
     * 식별자로 주문 조회.
     *
     * @param orderId 주문 식별자
     * @param cancellation 취소 신호
     * @return 주문 (없으면 empty)
     */
    CompletableFuture<Optional<Order>> findById(UUID orderId, CancellationToken cancellation);

    /**
     * 주문 페이지 조회 (생성 시각 오름차순).
     *
     * @param customerId 고객 필터 (null이면 전체)
     * @param pageNumber 1부터 시작하는 페이지 번호
     * @param pageSize 페이지 크기
     * @param cancellation 취소 신호
     * @return 페이지와 전체 건수
     */
    CompletableFuture<Page<Order>> findPage(UUID customerId, int pageNumber, int pageSize, CancellationToken cancellation);
}
