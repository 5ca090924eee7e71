package com.ryuqq.mediator.application.registry;

import com.ryuqq.mediator.application.registry.fixture.PingQuery;
import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.HandlerFactory;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.request.Query;
import com.ryuqq.mediator.core.response.Response;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HandlerRegistry 유닛 테스트.
 *
 * <p>등록 규칙과 조회 규칙을 검증합니다:</p>
 * <ul>
 *   <li>정확한 런타임 타입으로만 조회</li>
 *   <li>중복 등록 거부</li>
 *   <li>인터페이스/추상 클래스 등록 거부</li>
 *   <li>ServiceLoader 기반 모듈 발견</li>
 * </ul>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
class HandlerRegistryTest {

    abstract static class CustomerQuery implements Query<String> {
    }

    static final class FindCustomerByEmail extends CustomerQuery {
    }

    static final class FindCustomerByPhone extends CustomerQuery {
    }

    interface TaggedQuery extends Query<String> {
    }

    private static <Q extends Query<String>> HandlerFactory<Q, Response<String>> constant(String value) {
        return notificator -> (query, cancellation) -> CompletableFuture.completedFuture(Response.success(value));
    }

    @Test
    void require_정확한_런타임_타입의_팩토리_반환() {
        // given
        HandlerRegistry registry = HandlerRegistry.builder()
            .register(FindCustomerByEmail.class, constant("email"))
            .register(FindCustomerByPhone.class, constant("phone"))
            .build();

        // when
        Response<String> byEmail = registry.require(new FindCustomerByEmail())
            .create(Notificator.create())
            .execute(new FindCustomerByEmail(), CancellationToken.none())
            .join();
        Response<String> byPhone = registry.require(new FindCustomerByPhone())
            .create(Notificator.create())
            .execute(new FindCustomerByPhone(), CancellationToken.none())
            .join();

        // then
        assertThat(byEmail.data()).isEqualTo("email");
        assertThat(byPhone.data()).isEqualTo("phone");
    }

    @Test
    void require_상위_타입으로_대체_조회하지_않음() {
        // given: 같은 상위 타입의 다른 요청만 등록
        HandlerRegistry registry = HandlerRegistry.builder()
            .register(FindCustomerByEmail.class, constant("email"))
            .build();

        // when & then
        assertThatThrownBy(() -> registry.require(new FindCustomerByPhone()))
            .isInstanceOf(HandlerNotFoundException.class)
            .hasMessageContaining(FindCustomerByPhone.class.getName())
            .satisfies(e -> assertThat(((HandlerNotFoundException) e).getRequestType())
                .isEqualTo(FindCustomerByPhone.class));
    }

    @Test
    void require_null_거부() {
        HandlerRegistry registry = HandlerRegistry.builder().build();

        assertThatThrownBy(() -> registry.require(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void register_중복_등록은_AmbiguousHandlerException() {
        // given
        HandlerRegistry.Builder builder = HandlerRegistry.builder()
            .register(FindCustomerByEmail.class, constant("first"));

        // when & then
        assertThatThrownBy(() -> builder.register(FindCustomerByEmail.class, constant("second")))
            .isInstanceOf(AmbiguousHandlerException.class)
            .isInstanceOf(MediatorConfigurationException.class)
            .hasMessageContaining(FindCustomerByEmail.class.getName());
    }

    @Test
    void install_모듈_간_중복은_모듈_이름을_포함해_실패() {
        // given
        HandlerModule first = new HandlerModule() {
            @Override
            public void register(HandlerRegistry.Builder builder) {
                builder.register(FindCustomerByEmail.class, constant("first"));
            }

            @Override
            public String name() {
                return "customer-module";
            }
        };
        HandlerModule second = new HandlerModule() {
            @Override
            public void register(HandlerRegistry.Builder builder) {
                builder.register(FindCustomerByEmail.class, constant("second"));
            }

            @Override
            public String name() {
                return "legacy-module";
            }
        };

        // when & then
        assertThatThrownBy(() -> HandlerRegistry.builder().install(first).install(second))
            .isInstanceOf(AmbiguousHandlerException.class)
            .hasMessageContaining("customer-module")
            .hasMessageContaining("legacy-module");
    }

    @Test
    void register_추상_클래스_거부() {
        assertThatThrownBy(() -> HandlerRegistry.builder().register(CustomerQuery.class, constant("x")))
            .isInstanceOf(MediatorConfigurationException.class)
            .hasMessageContaining("concrete request types");
    }

    @Test
    void register_인터페이스_거부() {
        assertThatThrownBy(() -> HandlerRegistry.builder().register(TaggedQuery.class, constant("x")))
            .isInstanceOf(MediatorConfigurationException.class);
    }

    @Test
    void register_null_인자_거부() {
        assertThatThrownBy(() -> HandlerRegistry.builder().register(FindCustomerByEmail.class, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factory cannot be null");
        assertThatThrownBy(() -> HandlerRegistry.builder().install(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_이후_Builder_변경은_Registry에_영향_없음() {
        // given
        HandlerRegistry.Builder builder = HandlerRegistry.builder()
            .register(FindCustomerByEmail.class, constant("email"));
        HandlerRegistry registry = builder.build();

        // when
        builder.register(FindCustomerByPhone.class, constant("phone"));

        // then
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.contains(FindCustomerByPhone.class)).isFalse();
        assertThat(registry.find(FindCustomerByPhone.class)).isEmpty();
    }

    @Test
    void registeredTypes_등록_순서_유지_불변() {
        // given
        HandlerRegistry registry = HandlerRegistry.builder()
            .register(FindCustomerByPhone.class, constant("phone"))
            .register(FindCustomerByEmail.class, constant("email"))
            .build();

        // then
        assertThat(registry.registeredTypes()).containsExactly(FindCustomerByPhone.class, FindCustomerByEmail.class);
        assertThatThrownBy(() -> registry.registeredTypes().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void discover_ServiceLoader로_모듈_설치() {
        // when
        HandlerRegistry registry = HandlerRegistry.discover(getClass().getClassLoader());

        // then
        assertThat(registry.contains(PingQuery.class)).isTrue();
        Response<String> response = registry.require(new PingQuery("hi"))
            .create(Notificator.create())
            .execute(new PingQuery("hi"), CancellationToken.none())
            .join();
        assertThat(response.data()).isEqualTo("pong:hi");
    }
}
