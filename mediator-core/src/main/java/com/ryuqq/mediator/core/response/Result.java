package com.ryuqq.mediator.core.response;

import com.ryuqq.mediator.core.notification.Notification;

import java.util.List;
import java.util.Optional;

/**
 * Handler 실행 결과 봉투.
 *
 * <p>Result는 두 가지 형태를 가집니다:</p>
 * <ul>
 *   <li>{@link Response}: 단일 결과</li>
 *   <li>{@link PagedResponse}: 페이지 단위 결과 (전체 건수, 페이지 정보 포함)</li>
 * </ul>
 *
 * <p><strong>불변식 (모든 구현체 공통):</strong></p>
 * <ul>
 *   <li>isSuccess == true ⇔ data 존재 ⇔ notifications 비어 있음</li>
 *   <li>isSuccess == false ⇔ data 없음 ⇔ notifications 하나 이상</li>
 * </ul>
 *
 * <p>호출자는 {@link #isSuccess()}로 분기하고, {@link #code()}를
 * 자신의 전송 계층 상태 코드(예: HTTP status)로 매핑합니다.</p>
 *
 * @param <T> 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Response, PagedResponse {

    /**
     * 성공 시 기본 코드.
     */
    int OK = 200;

    /**
     * 실패 시 기본 코드.
     */
    int BAD_REQUEST = 400;

    /**
     * 성공 여부.
     *
     * @return 성공이면 true
     */
    boolean isSuccess();

    /**
     * 결과 데이터.
     *
     * @return 성공 시 데이터, 실패 시 null
     */
    T data();

    /**
     * 실패 기록 목록.
     *
     * @return 삽입 순서가 보존된 불변 목록 (성공 시 빈 목록)
     */
    List<Notification> notifications();

    /**
     * 결과 코드.
     *
     * @return 성공 시 2xx, 실패 시 4xx 또는 5xx
     */
    int code();

    /**
     * 실패 여부.
     *
     * @return 실패이면 true
     */
    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * 결과 데이터를 Optional로 조회.
     *
     * @return 성공 시 데이터를 담은 Optional, 실패 시 빈 Optional
     */
    default Optional<T> dataOptional() {
        return Optional.ofNullable(data());
    }
}
