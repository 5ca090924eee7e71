package com.ryuqq.mediator.adapter.dispatch;

import com.ryuqq.mediator.application.mediator.Mediator;
import com.ryuqq.mediator.application.registry.HandlerRegistry;
import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.handler.HandlerFactory;
import com.ryuqq.mediator.core.handler.RequestHandler;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.request.Request;
import com.ryuqq.mediator.core.response.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * HandlerRegistry 기반 Mediator 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>요청의 정확한 런타임 클래스로 HandlerFactory 조회 (없으면 HandlerNotFoundException)</li>
 *   <li>이번 dispatch 전용 Notificator 생성</li>
 *   <li>팩토리로 Handler 생성 (Notificator 주입)</li>
 *   <li>Handler 실행, 반환된 future를 그대로 반환</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Registry는 읽기 전용이므로 잠금 없이 공유</li>
 *   <li>Notificator와 Handler는 dispatch마다 새로 생성 (요청 간 Notification 혼입 없음)</li>
 *   <li>내부 스레드를 만들지 않음: 비동기 실행은 Handler와 협력자가 결정</li>
 * </ul>
 *
 * <p><strong>예외:</strong> 구성 오류는 호출 스레드에서 즉시 던집니다.
 * Handler의 예외와 취소는 기록만 하고 반환된 future로 그대로 전파합니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class RegistryMediator implements Mediator {

    private static final Logger log = LoggerFactory.getLogger(RegistryMediator.class);

    private final HandlerRegistry registry;
    private final DispatchConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param registry Handler 조회 테이블
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public RegistryMediator(HandlerRegistry registry) {
        this(registry, new DispatchConfig());
    }

    /**
     * 생성자.
     *
     * @param registry Handler 조회 테이블
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegistryMediator(HandlerRegistry registry, DispatchConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
        log.info("RegistryMediator initialized with {} handlers", registry.size());
    }

    @Override
    public <R extends Result<?>> CompletableFuture<R> dispatch(Request<R> request, CancellationToken cancellation) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        String requestType = request.getClass().getSimpleName();

        // 1. Handler 조회 (정확한 런타임 타입)
        HandlerFactory<Request<R>, R> factory = registry.require(request);

        // 2. dispatch 전용 Notificator + Handler 생성
        RequestHandler<Request<R>, R> handler = factory.create(Notificator.create());
        if (handler == null) {
            throw new IllegalStateException("HandlerFactory returned null for " + request.getClass().getName());
        }

        log.debug("Dispatching {} to {}", requestType, handler.getClass().getName());
        long startNanos = System.nanoTime();

        // 3. 실행, future는 변경 없이 반환
        CompletableFuture<R> result = handler.execute(request, cancellation);
        if (result == null) {
            throw new IllegalStateException("Handler returned null future for " + request.getClass().getName());
        }

        result.whenComplete((response, error) -> logCompletion(requestType, startNanos, response, error));
        return result;
    }

    /**
     * 완료 기록.
     *
     * <p>whenComplete의 파생 future는 버리므로 여기서의 실패가 호출자에게 전달되지 않습니다.</p>
     */
    private void logCompletion(String requestType, long startNanos, Result<?> response, Throwable error) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;

        if (error != null) {
            log.warn("Dispatch of {} completed exceptionally after {}ms: {}", requestType, elapsedMs, error.toString());
            return;
        }

        if (elapsedMs >= config.slowDispatchThresholdMs()) {
            log.warn("Slow dispatch of {}: {}ms (threshold: {}ms)", requestType, elapsedMs, config.slowDispatchThresholdMs());
        }

        if (response.isSuccess()) {
            log.debug("Dispatch of {} succeeded with code {} in {}ms", requestType, response.code(), elapsedMs);
        } else if (config.logNotifications()) {
            log.debug("Dispatch of {} failed with code {} in {}ms: {}",
                requestType, response.code(), elapsedMs, response.notifications());
        } else {
            log.debug("Dispatch of {} failed with code {} and {} notifications in {}ms",
                requestType, response.code(), response.notifications().size(), elapsedMs);
        }
    }
}
