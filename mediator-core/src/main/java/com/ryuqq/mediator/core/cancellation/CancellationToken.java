package com.ryuqq.mediator.core.cancellation;

import java.util.concurrent.CancellationException;

/**
 * 협조적 취소 신호.
 *
 * <p>dispatch에 전달된 토큰은 그대로 Handler에 전달되고, Handler는 이를
 * 대기하는 모든 외부 호출(검증, 저장소)에 다시 전달합니다.
 * 취소를 관찰한 Handler는 부분 성공을 반환하지 않고 작업을 실패시켜야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture&lt;Response&lt;Order&gt;&gt; future = mediator.dispatch(query, token);
 *
 * // 다른 스레드에서
 * token.cancel();
 * </pre>
 *
 * <p><strong>동시성:</strong> 모든 메서드는 thread-safe합니다.
 * 취소는 되돌릴 수 없으며, 협력자는 호출 전에 {@link #isCancellationRequested()}를 확인합니다.</p>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 취소 가능한 새 토큰 생성.
     *
     * @return 새 CancellationToken
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 절대 취소되지 않는 공유 토큰.
     *
     * @return 취소 불가 토큰
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 요청.
     *
     * <p>이미 취소된 토큰에 대한 호출은 무시됩니다.</p>
     *
     * @throws UnsupportedOperationException {@link #none()} 토큰인 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        cancelled = true;
    }

    /**
     * 취소 요청 여부.
     *
     * @return 취소가 요청되었으면 true
     */
    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * 취소가 요청된 경우 예외 발생.
     *
     * @throws CancellationException 취소가 요청된 경우
     */
    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken{none}";
        }
        return "CancellationToken{cancelled=" + cancelled + '}';
    }
}
