package com.ryuqq.mediator.application.registry;

/**
 * Handler 등록 묶음.
 *
 * <p>애플리케이션은 관련 Handler들을 HandlerModule 하나로 묶어 등록합니다.
 * {@link HandlerRegistry#discover(ClassLoader)}로 자동 발견하려면
 * 공개 기본 생성자를 제공하고
 * {@code META-INF/services/com.ryuqq.mediator.application.registry.HandlerModule}에
 * 구현 클래스 이름을 기재합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * public final class OrderHandlerModule implements HandlerModule {
 *     public void register(HandlerRegistry.Builder builder) {
 *         builder.register(GetOrderByIdQuery.class,
 *             notificator -&gt; new GetOrderByIdHandler(new HandlerSupport(notificator), repository));
 *     }
 * }
 * </pre>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandlerModule {

    /**
     * Handler 등록.
     *
     * @param builder 등록 대상 Builder
     */
    void register(HandlerRegistry.Builder builder);

    /**
     * 오류 메시지에 쓰이는 모듈 이름.
     *
     * @return 기본값은 구현 클래스 이름
     */
    default String name() {
        return getClass().getName();
    }
}
