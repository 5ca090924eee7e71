package com.ryuqq.mediator.core.response;

import com.ryuqq.mediator.core.notification.Notification;

import java.util.List;

/**
 * Response와 PagedResponse가 공유하는 불변식 검증.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
final class Envelopes {

    // Utility class - prevent instantiation
    private Envelopes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 성공/실패 불변식 검증 후 notifications의 불변 사본 반환.
     *
     * @throws IllegalArgumentException 불변식 위반 시
     */
    static List<Notification> validate(boolean isSuccess, Object data, List<Notification> notifications, int code) {
        if (notifications == null) {
            throw new IllegalArgumentException("notifications cannot be null");
        }
        // immutable lists throw on contains(null)
        for (Notification notification : notifications) {
            if (notification == null) {
                throw new IllegalArgumentException("notifications cannot contain null");
            }
        }

        if (isSuccess) {
            if (data == null) {
                throw new IllegalArgumentException("data cannot be null on success");
            }
            if (!notifications.isEmpty()) {
                throw new IllegalArgumentException(
                    "notifications must be empty on success (current: " + notifications.size() + ")");
            }
            if (code < 200 || code >= 300) {
                throw new IllegalArgumentException("success code must be 2xx (current: " + code + ")");
            }
        } else {
            if (data != null) {
                throw new IllegalArgumentException("data must be absent on failure");
            }
            if (notifications.isEmpty()) {
                throw new IllegalArgumentException("notifications cannot be empty on failure");
            }
            if (code < 400 || code >= 600) {
                throw new IllegalArgumentException("failure code must be 4xx or 5xx (current: " + code + ")");
            }
        }
        return List.copyOf(notifications);
    }
}
