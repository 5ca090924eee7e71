package com.ryuqq.mediator.application.registry;

/**
 * 요청 타입에 등록된 Handler가 없음.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public class HandlerNotFoundException extends MediatorConfigurationException {

    private final Class<?> requestType;

    /**
     * 생성자.
     *
     * @param requestType Handler를 찾지 못한 요청 타입
     */
    public HandlerNotFoundException(Class<?> requestType) {
        super("No handler registered for request type: " + requestType.getName());
        this.requestType = requestType;
    }

    /**
     * Handler를 찾지 못한 요청 타입.
     *
     * @return 요청 타입
     */
    public Class<?> getRequestType() {
        return requestType;
    }
}
