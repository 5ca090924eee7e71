package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.HandlerSupport;
import com.ryuqq.mediator.core.notification.Notification;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CreateOrderHandler 테스트.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CreateOrderHandlerTest {

    private static final int CONFIGURED_FAILURE_CODE = 503;

    @Mock
    private OrderRepository repository;

    private Notificator notificator;
    private CreateOrderHandler handler;

    @BeforeEach
    void setUp() {
        notificator = Notificator.create();
        handler = new CreateOrderHandler(notificator, new CreateOrderValidator(), repository, CONFIGURED_FAILURE_CODE);
    }

    @Test
    @DisplayName("정상 요청은 저장 후 201과 새 주문 ID")
    void createsOrder() {
        // given
        UUID customerId = UUID.randomUUID();
        when(repository.create(any(Order.class), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.completedFuture(true));

        // when
        Response<UUID> response = handler.execute(CreateOrderCommand.of(customerId, "tea", 4_500), CancellationToken.none()).join();

        // then
        ArgumentCaptor<Order> saved = ArgumentCaptor.forClass(Order.class);
        verify(repository).create(saved.capture(), any(CancellationToken.class));
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.code()).isEqualTo(CreateOrderHandler.CREATED);
        assertThat(response.data()).isEqualTo(saved.getValue().id());
        assertThat(saved.getValue().customerId()).isEqualTo(customerId);
        assertThat(notificator.hasAny()).isFalse();
    }

    @Test
    @DisplayName("빈 고객 ID: 400, Notification 1건, 저장소 미호출")
    void emptyCustomerIdNeverReachesRepository() {
        // when
        Response<UUID> response = handler.execute(CreateOrderCommand.of(new UUID(0L, 0L), "tea", 1), CancellationToken.none()).join();

        // then
        assertThat(response.isFailure()).isTrue();
        assertThat(response.code()).isEqualTo(HandlerSupport.BAD_REQUEST);
        assertThat(response.notifications())
            .containsExactly(Notification.of("customerId", "Customer ID cannot be empty."));
        verify(repository, never()).create(any(), any());
    }

    @Test
    void nullCustomerIdIsTreatedAsEmpty() {
        Response<UUID> response = handler.execute(CreateOrderCommand.of(null, "tea", 1), CancellationToken.none()).join();

        assertThat(response.notifications()).extracting(Notification::message)
            .containsExactly(CreateOrderValidator.CUSTOMER_ID_EMPTY);
        verify(repository, never()).create(any(), any());
    }

    @Test
    void reportsEveryValidationFailure() {
        Response<UUID> response = handler.execute(CreateOrderCommand.of(null, " ", -1), CancellationToken.none()).join();

        assertThat(response.notifications()).extracting(Notification::field)
            .containsExactly("customerId", "description", "amount");
    }

    @Test
    @DisplayName("저장 실패: 'Failed to create the order.'와 설정된 코드")
    void repositoryFailureUsesConfiguredCode() {
        // given
        when(repository.create(any(Order.class), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.completedFuture(false));

        // when
        Response<UUID> response = handler.execute(CreateOrderCommand.of(UUID.randomUUID(), "tea", 1), CancellationToken.none()).join();

        // then
        assertThat(response.isFailure()).isTrue();
        assertThat(response.code()).isEqualTo(CONFIGURED_FAILURE_CODE);
        assertThat(response.notifications()).extracting(Notification::message)
            .containsExactly("Failed to create the order.");
    }

    @Test
    void repositoryExceptionPropagates() {
        // given
        when(repository.create(any(Order.class), any(CancellationToken.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection lost")));

        // when
        CompletableFuture<Response<UUID>> future = handler.execute(CreateOrderCommand.of(UUID.randomUUID(), "tea", 1), CancellationToken.none());

        // then
        assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("저장 중 취소되면 부분 성공 없이 CancellationException")
    void cancellationDuringSavePropagates() {
        // given
        CancellationToken token = CancellationToken.create();
        when(repository.create(any(Order.class), any(CancellationToken.class))).thenAnswer(invocation -> {
            token.cancel();
            return CompletableFuture.failedFuture(new CancellationException("cancelled"));
        });

        // when
        CompletableFuture<Response<UUID>> future = handler.execute(CreateOrderCommand.of(UUID.randomUUID(), "tea", 1), token);

        // then
        assertThatThrownBy(future::join).hasCauseInstanceOf(CancellationException.class);
        verify(repository).create(any(Order.class), same(token));
    }

    @Test
    void rejectsFailureCodeOutsideErrorRange() {
        assertThatThrownBy(() -> new CreateOrderHandler(notificator, new CreateOrderValidator(), repository, 200))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("creationFailureCode");
    }
}
