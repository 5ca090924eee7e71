package com.ryuqq.mediator.core.notification;

/**
 * 요청 처리 중 발생한 실패 기록.
 *
 * <p>Notification은 (필드 경로, 메시지) 쌍으로 구성된 불변 값입니다.
 * 심각도 구분은 없으며, 컬렉션에 존재한다는 것 자체가 현재 요청의 실패 맥락을 의미합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>field:</strong> 실패한 입력의 필드 경로 (예: customerId, items[0].quantity).
 *       특정 필드와 무관한 실패는 빈 문자열</li>
 *   <li><strong>message:</strong> 사람이 읽을 수 있는 실패 메시지</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Notification.of("customerId", "Customer ID cannot be empty.");
 * Notification.of("Order not found.");   // field = ""
 * </pre>
 *
 * @param field 필드 경로 (빈 문자열 허용, null 불가)
 * @param message 실패 메시지
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record Notification(
    String field,
    String message
) {

    /**
     * 필드와 무관한 Notification의 필드 값.
     */
    public static final String NO_FIELD = "";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Notification {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 필드 경로를 지정하여 Notification 생성.
     *
     * @param field 필드 경로
     * @param message 실패 메시지
     * @return Notification 인스턴스
     * @throws IllegalArgumentException field가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public static Notification of(String field, String message) {
        return new Notification(field, message);
    }

    /**
     * 필드 경로 없이 Notification 생성.
     *
     * <p>실행 중 발견된 비즈니스 규칙 위반에 사용합니다 (예: 조회 결과 없음).</p>
     *
     * @param message 실패 메시지
     * @return Notification 인스턴스
     * @throws IllegalArgumentException message가 null 또는 빈 문자열인 경우
     */
    public static Notification of(String message) {
        return new Notification(NO_FIELD, message);
    }

    /**
     * 필드 경로가 지정되어 있는지 확인.
     *
     * @return 필드 경로가 있으면 true
     */
    public boolean hasField() {
        return !field.isEmpty();
    }
}
