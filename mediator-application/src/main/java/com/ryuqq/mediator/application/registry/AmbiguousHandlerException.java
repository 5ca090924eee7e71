package com.ryuqq.mediator.application.registry;

/**
 * 하나의 요청 타입에 Handler가 두 번 이상 등록됨.
 *
 * <p>모호한 라우팅은 둘 중 하나를 고르지 않고 등록 시점에 실패시킵니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public class AmbiguousHandlerException extends MediatorConfigurationException {

    private final Class<?> requestType;

    /**
     * 생성자.
     *
     * @param requestType 중복 등록된 요청 타입
     * @param existingSource 먼저 등록한 출처
     * @param duplicateSource 중복 등록을 시도한 출처
     */
    public AmbiguousHandlerException(Class<?> requestType, String existingSource, String duplicateSource) {
        super(String.format("Handler for %s is already registered by %s (duplicate from %s)",
            requestType.getName(), existingSource, duplicateSource));
        this.requestType = requestType;
    }

    /**
     * 중복 등록된 요청 타입.
     *
     * @return 요청 타입
     */
    public Class<?> getRequestType() {
        return requestType;
    }
}
