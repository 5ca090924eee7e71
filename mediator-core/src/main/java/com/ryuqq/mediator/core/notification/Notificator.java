package com.ryuqq.mediator.core.notification;

import java.util.List;

/**
 * 요청 단위 Notification 수집기.
 *
 * <p>Notificator는 하나의 dispatch 동안에만 존재하며, 해당 요청에서 발생한
 * 실패를 삽입 순서대로 누적합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>dispatch 시작 시 새로 생성 (항상 비어 있는 상태로 시작)</li>
 *   <li>해당 요청의 Handler 하나에만 전달</li>
 *   <li>dispatch 종료 후 폐기</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 하나의 인스턴스를 여러 dispatch가 공유하면
 * 서로 다른 요청의 실패 목록이 섞입니다. 구현체는 단일 dispatch 안의
 * 비동기 continuation에서 호출되어도 안전해야 합니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public interface Notificator {

    /**
     * Notification 추가.
     *
     * @param notification 추가할 Notification
     * @throws IllegalArgumentException notification이 null인 경우
     */
    void append(Notification notification);

    /**
     * 누적된 Notification 조회.
     *
     * @return 삽입 순서가 보존된 불변 스냅샷
     */
    List<Notification> list();

    /**
     * Notification 존재 여부 확인.
     *
     * @return 하나 이상 존재하면 true
     */
    boolean hasAny();

    /**
     * 비어 있는 새 Notificator 생성.
     *
     * @return 새 {@link ListNotificator} 인스턴스
     */
    static Notificator create() {
        return new ListNotificator();
    }
}
