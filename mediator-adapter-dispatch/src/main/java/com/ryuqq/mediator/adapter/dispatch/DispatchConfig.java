package com.ryuqq.mediator.adapter.dispatch;

/**
 * RegistryMediator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>slowDispatchThresholdMs: 이 시간을 넘긴 dispatch를 WARN으로 기록 (기본 1000ms)</li>
 *   <li>logNotifications: 실패 결과의 Notification 내용을 DEBUG로 기록할지 여부 (기본 false)</li>
 * </ul>
 *
 * <p>Notification 메시지에 사용자 입력이 포함될 수 있으므로 logNotifications는 기본적으로 꺼져 있습니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 * @param slowDispatchThresholdMs 느린 dispatch 기준 (밀리초, 양수여야 함)
 * @param logNotifications 실패 Notification 기록 여부
 */
public record DispatchConfig(long slowDispatchThresholdMs, boolean logNotifications) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: slowDispatchThresholdMs=1000ms, logNotifications=false</p>
     */
    public DispatchConfig() {
        this(1000, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatchConfig {
        if (slowDispatchThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "slowDispatchThresholdMs must be positive (current: " + slowDispatchThresholdMs + ")"
            );
        }
    }

    /**
     * slowDispatchThresholdMs만 변경한 새 인스턴스 생성.
     *
     * @param slowDispatchThresholdMs 새로운 기준 (밀리초)
     * @return 새 DispatchConfig 인스턴스
     */
    public DispatchConfig withSlowDispatchThresholdMs(long slowDispatchThresholdMs) {
        return new DispatchConfig(slowDispatchThresholdMs, this.logNotifications);
    }

    /**
     * logNotifications만 변경한 새 인스턴스 생성.
     *
     * @param logNotifications 새로운 값
     * @return 새 DispatchConfig 인스턴스
     */
    public DispatchConfig withLogNotifications(boolean logNotifications) {
        return new DispatchConfig(this.slowDispatchThresholdMs, logNotifications);
    }
}
