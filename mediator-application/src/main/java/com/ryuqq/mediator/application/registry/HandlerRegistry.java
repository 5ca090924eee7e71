package com.ryuqq.mediator.application.registry;

import com.ryuqq.mediator.core.handler.HandlerFactory;
import com.ryuqq.mediator.core.request.Request;
import com.ryuqq.mediator.core.response.Result;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * 요청 타입 → Handler 팩토리 조회 테이블.
 *
 * <p>시작 시점에 {@link Builder}로 한 번 구성되며, 이후 읽기 전용이므로
 * 잠금 없이 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * <p><strong>등록 규칙:</strong></p>
 * <ul>
 *   <li>키는 요청의 구체 클래스 (인터페이스, 추상 클래스 등록 불가)</li>
 *   <li>하나의 구체 클래스에는 정확히 하나의 팩토리</li>
 *   <li>중복 등록 → {@link AmbiguousHandlerException}</li>
 * </ul>
 *
 * <p><strong>조회 규칙:</strong> 정확한 런타임 클래스로만 조회합니다.
 * 상위 타입이나 인터페이스로 대체 조회하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlerRegistry registry = HandlerRegistry.builder()
 *     .register(CreateOrderCommand.class, n -&gt; new CreateOrderHandler(new HandlerSupport(n), repository, validator))
 *     .install(new CustomerHandlerModule(customerRepository))
 *     .build();
 * </pre>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class HandlerRegistry {

    private final Map<Class<?>, HandlerFactory<?, ?>> factories;

    private HandlerRegistry(Map<Class<?>, HandlerFactory<?, ?>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * 빈 Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * ServiceLoader로 발견한 모든 {@link HandlerModule}을 설치한 Registry 생성.
     *
     * @param classLoader 모듈을 찾을 ClassLoader
     * @return 구성된 HandlerRegistry
     * @throws AmbiguousHandlerException 모듈 간 중복 등록이 있는 경우
     * @throws MediatorConfigurationException 모듈을 로드할 수 없는 경우
     */
    public static HandlerRegistry discover(ClassLoader classLoader) {
        Builder builder = builder();
        try {
            for (HandlerModule module : ServiceLoader.load(HandlerModule.class, classLoader)) {
                builder.install(module);
            }
        } catch (ServiceConfigurationError e) {
            throw new MediatorConfigurationException("Failed to load HandlerModule", e);
        }
        return builder.build();
    }

    /**
     * 현재 스레드의 context ClassLoader로 {@link #discover(ClassLoader)}.
     *
     * @return 구성된 HandlerRegistry
     */
    public static HandlerRegistry discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * 요청 타입의 팩토리 조회.
     *
     * @param requestType 요청의 구체 클래스
     * @return 등록된 팩토리, 없으면 빈 Optional
     */
    public Optional<HandlerFactory<?, ?>> find(Class<?> requestType) {
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        return Optional.ofNullable(factories.get(requestType));
    }

    /**
     * 요청 인스턴스의 정확한 런타임 타입으로 팩토리 조회.
     *
     * @param request 요청
     * @param <R> 결과 형태
     * @return 등록된 팩토리
     * @throws IllegalArgumentException request가 null인 경우
     * @throws HandlerNotFoundException 등록된 팩토리가 없는 경우
     */
    public <R extends Result<?>> HandlerFactory<Request<R>, R> require(Request<R> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        HandlerFactory<?, ?> factory = factories.get(request.getClass());
        if (factory == null) {
            throw new HandlerNotFoundException(request.getClass());
        }
        return narrow(factory, request);
    }

    /**
     * 조회된 팩토리를 요청의 결과 타입으로 좁힘.
     *
     * <p>팩토리는 {@link Builder#register(Class, HandlerFactory)}를 통해서만 저장되며,
     * 그 시그니처가 키 {@code Class<Q>}와 {@code HandlerFactory<Q, R>}를 묶습니다.
     * 조회 키가 request의 정확한 런타임 클래스이므로 팩토리의 Q는 request의 타입이고,
     * R은 request가 선언한 결과 타입과 같습니다.</p>
     */
    @SuppressWarnings("unchecked")
    private static <R extends Result<?>> HandlerFactory<Request<R>, R> narrow(
        HandlerFactory<?, ?> factory,
        Request<R> request
    ) {
        return (HandlerFactory<Request<R>, R>) factory;
    }

    /**
     * 요청 타입 등록 여부.
     *
     * @param requestType 요청의 구체 클래스
     * @return 등록되어 있으면 true
     */
    public boolean contains(Class<?> requestType) {
        return factories.containsKey(requestType);
    }

    /**
     * 등록된 요청 타입 목록.
     *
     * @return 등록 순서를 유지하는 불변 집합
     */
    public Set<Class<?>> registeredTypes() {
        return factories.keySet();
    }

    /**
     * 등록된 요청 타입 수.
     *
     * @return 등록 수
     */
    public int size() {
        return factories.size();
    }

    @Override
    public String toString() {
        return "HandlerRegistry{" + factories.size() + " handlers}";
    }

    /**
     * HandlerRegistry Builder.
     *
     * <p>Builder 자체는 thread-safe하지 않습니다. 시작 시점에 한 스레드에서 사용합니다.</p>
     */
    public static final class Builder {

        private static final String DIRECT = "direct registration";

        private final Map<Class<?>, HandlerFactory<?, ?>> factories = new LinkedHashMap<>();
        private final Map<Class<?>, String> sources = new HashMap<>();
        private String currentSource = DIRECT;

        private Builder() {
        }

        /**
         * 요청 타입에 Handler 팩토리 등록.
         *
         * @param requestType 요청의 구체 클래스
         * @param factory dispatch마다 Handler를 생성할 팩토리
         * @param <Q> 요청 타입
         * @param <R> 결과 형태
         * @return this
         * @throws IllegalArgumentException 인자가 null인 경우
         * @throws MediatorConfigurationException requestType이 인터페이스이거나 추상 클래스인 경우
         * @throws AmbiguousHandlerException 이미 등록된 요청 타입인 경우
         */
        public <Q extends Request<R>, R extends Result<?>> Builder register(
            Class<Q> requestType,
            HandlerFactory<Q, R> factory
        ) {
            if (requestType == null) {
                throw new IllegalArgumentException("requestType cannot be null");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            if (requestType.isInterface() || Modifier.isAbstract(requestType.getModifiers())) {
                throw new MediatorConfigurationException(
                    "Handlers can only be registered for concrete request types: " + requestType.getName());
            }
            if (factories.containsKey(requestType)) {
                throw new AmbiguousHandlerException(requestType, sources.get(requestType), currentSource);
            }

            factories.put(requestType, factory);
            sources.put(requestType, currentSource);
            return this;
        }

        /**
         * HandlerModule의 등록을 적용.
         *
         * @param module 설치할 모듈
         * @return this
         * @throws IllegalArgumentException module이 null인 경우
         * @throws AmbiguousHandlerException 다른 등록과 중복되는 경우
         */
        public Builder install(HandlerModule module) {
            if (module == null) {
                throw new IllegalArgumentException("module cannot be null");
            }
            String previous = currentSource;
            currentSource = module.name();
            try {
                module.register(this);
            } finally {
                currentSource = previous;
            }
            return this;
        }

        /**
         * 읽기 전용 Registry 생성.
         *
         * @return 현재까지의 등록을 담은 HandlerRegistry
         */
        public HandlerRegistry build() {
            return new HandlerRegistry(factories);
        }
    }
}
