package com.ryuqq.mediator.core.response;

/**
 * 조회 결과가 0건인 페이지 조회의 처리 정책.
 *
 * <p>빈 페이지를 성공으로 볼지 실패로 볼지는 호출자마다 다르므로
 * 페이지 Handler는 이 정책을 생성 시점에 주입받습니다.</p>
 *
 * <ul>
 *   <li>{@link #SUCCESS}: 빈 데이터와 totalCount 0으로 성공 반환</li>
 *   <li>{@link #FAILURE}: Handler의 메시지로 Notification을 남기고 404 실패 반환</li>
 * </ul>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public enum EmptyPagePolicy {

    SUCCESS,
    FAILURE;

    /**
     * FAILURE 정책에서 사용하는 실패 코드.
     */
    public static final int EMPTY_PAGE_CODE = 404;

    /**
     * 빈 페이지를 실패로 처리하는지 확인.
     *
     * @return FAILURE이면 true
     */
    public boolean failsOnEmpty() {
        return this == FAILURE;
    }
}
