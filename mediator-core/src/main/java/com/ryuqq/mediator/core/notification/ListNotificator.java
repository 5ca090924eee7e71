package com.ryuqq.mediator.core.notification;

import java.util.ArrayList;
import java.util.List;

/**
 * 리스트 기반 {@link Notificator} 구현체.
 *
 * <p>단일 dispatch 안에서 Handler의 비동기 단계들이 서로 다른 스레드에서
 * 이어 실행될 수 있으므로 모든 접근을 인스턴스 모니터로 동기화합니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class ListNotificator implements Notificator {

    private final List<Notification> notifications = new ArrayList<>();

    @Override
    public synchronized void append(Notification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        notifications.add(notification);
    }

    @Override
    public synchronized List<Notification> list() {
        return List.copyOf(notifications);
    }

    @Override
    public synchronized boolean hasAny() {
        return !notifications.isEmpty();
    }

    @Override
    public synchronized String toString() {
        return "ListNotificator{" + notifications.size() + " notifications}";
    }
}
