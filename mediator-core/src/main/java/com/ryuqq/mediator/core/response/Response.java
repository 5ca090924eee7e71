package com.ryuqq.mediator.core.response;

import com.ryuqq.mediator.core.notification.Notification;

import java.util.List;

/**
 * 단일 결과 봉투.
 *
 * <p>Command와 Query Handler가 반환하는 불변 결과입니다.
 * 생성은 static factory method로만 하며, 생성자에서 성공/실패 불변식을 검증합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Response&lt;UUID&gt; ok = Response.success(orderId);             // code 200
 * Response&lt;UUID&gt; created = Response.success(orderId, 201);
 * Response&lt;Order&gt; invalid = Response.failure(notifications);  // code 400
 * Response&lt;Order&gt; missing = Response.failure(notifications, 404);
 * </pre>
 *
 * @param isSuccess 성공 여부
 * @param data 결과 데이터 (실패 시 null)
 * @param notifications 실패 기록 (성공 시 빈 목록)
 * @param code 결과 코드
 * @param <T> 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record Response<T>(
    boolean isSuccess,
    T data,
    List<Notification> notifications,
    int code
) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공/실패 불변식을 위반한 경우
     */
    public Response {
        notifications = Envelopes.validate(isSuccess, data, notifications, code);
    }

    /**
     * 성공 결과 생성 (code 200).
     *
     * @param data 결과 데이터
     * @param <T> 결과 데이터 타입
     * @return 성공 Response
     * @throws IllegalArgumentException data가 null인 경우
     */
    public static <T> Response<T> success(T data) {
        return new Response<>(true, data, List.of(), OK);
    }

    /**
     * 성공 결과 생성 (코드 지정).
     *
     * @param data 결과 데이터
     * @param code 2xx 코드 (예: 201)
     * @param <T> 결과 데이터 타입
     * @return 성공 Response
     * @throws IllegalArgumentException data가 null이거나 code가 2xx가 아닌 경우
     */
    public static <T> Response<T> success(T data, int code) {
        return new Response<>(true, data, List.of(), code);
    }

    /**
     * 실패 결과 생성 (code 400).
     *
     * @param notifications 실패 기록 (하나 이상)
     * @param <T> 결과 데이터 타입
     * @return 실패 Response
     * @throws IllegalArgumentException notifications가 null이거나 비어 있는 경우
     */
    public static <T> Response<T> failure(List<Notification> notifications) {
        return new Response<>(false, null, notifications, BAD_REQUEST);
    }

    /**
     * 실패 결과 생성 (코드 지정).
     *
     * @param notifications 실패 기록 (하나 이상)
     * @param code 4xx 또는 5xx 코드 (예: 404)
     * @param <T> 결과 데이터 타입
     * @return 실패 Response
     * @throws IllegalArgumentException notifications가 비어 있거나 code가 4xx/5xx가 아닌 경우
     */
    public static <T> Response<T> failure(List<Notification> notifications, int code) {
        return new Response<>(false, null, notifications, code);
    }
}
