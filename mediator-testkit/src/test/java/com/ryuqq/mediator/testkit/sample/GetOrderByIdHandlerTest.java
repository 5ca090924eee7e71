package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.notification.Notification;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GetOrderByIdHandlerTest {

    private InMemoryOrderRepository repository;
    private GetOrderByIdHandler handler;

    @BeforeEach
    void setUp() {
        repository = new InMemoryOrderRepository();
        handler = new GetOrderByIdHandler(Notificator.create(), repository);
    }

    @Test
    void returnsStoredOrder() {
        // given
        Order order = Order.place(UUID.randomUUID(), "tea", 4_500);
        repository.create(order, CancellationToken.none()).join();

        // when
        Response<Order> response = handler.execute(new GetOrderByIdQuery(order.id()), CancellationToken.none()).join();

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.data()).isEqualTo(order);
        assertThat(response.code()).isEqualTo(200);
    }

    @Test
    void unknownIdIsNotFound() {
        // when
        Response<Order> response = handler.execute(new GetOrderByIdQuery(UUID.randomUUID()), CancellationToken.none()).join();

        // then
        assertThat(response.code()).isEqualTo(404);
        assertThat(response.data()).isNull();
        assertThat(response.notifications()).containsExactly(Notification.of("Order not found."));
    }

    @Test
    void queryRejectsNullId() {
        assertThatThrownBy(() -> new GetOrderByIdQuery(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orderId cannot be null");
    }
}
