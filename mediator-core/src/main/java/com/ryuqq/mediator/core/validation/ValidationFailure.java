package com.ryuqq.mediator.core.validation;

/**
 * 검증 규칙 하나의 실패.
 *
 * @param field 실패한 필드 경로 (빈 문자열 허용, null 불가)
 * @param message 실패 메시지
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record ValidationFailure(
    String field,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public ValidationFailure {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * ValidationFailure 생성.
     *
     * @param field 필드 경로
     * @param message 실패 메시지
     * @return ValidationFailure 인스턴스
     */
    public static ValidationFailure of(String field, String message) {
        return new ValidationFailure(field, message);
    }
}
