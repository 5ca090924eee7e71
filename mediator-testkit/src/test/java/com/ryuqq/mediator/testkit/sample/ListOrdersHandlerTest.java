package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.adapter.inmemory.repository.Page;
import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.EmptyPagePolicy;
import com.ryuqq.mediator.core.response.PagedResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

/**
 * ListOrdersHandler 테스트.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ListOrdersHandlerTest {

    @Mock
    private OrderRepository repository;

    @Test
    @DisplayName("101건, 페이지 크기 20이면 totalPages 6")
    void computesPagingMetadata() {
        // given
        List<Order> items = List.of(Order.place(UUID.randomUUID(), "a", 1), Order.place(UUID.randomUUID(), "b", 2));
        when(repository.findPage(isNull(), eq(6), eq(20), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.completedFuture(new Page<>(items, 101)));
        ListOrdersHandler handler = new ListOrdersHandler(Notificator.create(), repository, EmptyPagePolicy.FAILURE);

        // when
        PagedResponse<List<Order>> response = handler.execute(ListOrdersQuery.all(6, 20), CancellationToken.none()).join();

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.data()).isEqualTo(items);
        assertThat(response.totalCount()).isEqualTo(101);
        assertThat(response.totalPages()).isEqualTo(6);
        assertThat(response.hasNextPage()).isFalse();
    }

    @Test
    @DisplayName("빈 페이지 + FAILURE 정책: 404 'No orders found.'")
    void emptyPageUnderFailurePolicy() {
        // given
        when(repository.findPage(isNull(), eq(1), eq(10), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.completedFuture(new Page<>(List.of(), 0)));
        ListOrdersHandler handler = new ListOrdersHandler(Notificator.create(), repository, EmptyPagePolicy.FAILURE);

        // when
        PagedResponse<List<Order>> response = handler.execute(ListOrdersQuery.all(1, 10), CancellationToken.none()).join();

        // then
        assertThat(response.isFailure()).isTrue();
        assertThat(response.code()).isEqualTo(404);
        assertThat(response.data()).isNull();
        assertThat(response.totalCount()).isZero();
        assertThat(response.notifications()).hasSize(1);
        assertThat(response.notifications().get(0).message()).isEqualTo("No orders found.");
    }

    @Test
    @DisplayName("빈 페이지 + SUCCESS 정책: 빈 목록과 totalCount 0")
    void emptyPageUnderSuccessPolicy() {
        // given
        when(repository.findPage(isNull(), eq(1), eq(10), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.completedFuture(new Page<>(List.of(), 0)));
        ListOrdersHandler handler = new ListOrdersHandler(Notificator.create(), repository, EmptyPagePolicy.SUCCESS);

        // when
        PagedResponse<List<Order>> response = handler.execute(ListOrdersQuery.all(1, 10), CancellationToken.none()).join();

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.data()).isEmpty();
        assertThat(response.totalCount()).isZero();
        assertThat(response.notifications()).isEmpty();
    }
}
