package com.ryuqq.mediator.application.registry;

/**
 * Handler 구성 오류.
 *
 * <p>구성 오류는 복구 가능한 런타임 상황이 아니므로 시작 시점 또는 첫 dispatch에서
 * 즉시 드러나야 하며, 잡아서 무시해서는 안 됩니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public class MediatorConfigurationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public MediatorConfigurationException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public MediatorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
