package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.notification.Notification;
import com.ryuqq.mediator.core.notification.Notificator;
import com.ryuqq.mediator.core.response.EmptyPagePolicy;
import com.ryuqq.mediator.core.response.PagedResponse;
import com.ryuqq.mediator.core.response.Response;
import com.ryuqq.mediator.core.validation.ValidationFailure;
import com.ryuqq.mediator.core.validation.Validator;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handler 공통 검증/Notification 흐름.
 *
 * <p>각 Handler는 이 클래스를 상속하지 않고 필드로 조합합니다.
 * HandlerSupport는 dispatch 하나의 {@link Notificator}를 소유하므로
 * Handler와 같은 생명주기를 가집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public CompletableFuture&lt;Response&lt;UUID&gt;&gt; execute(CreateOrderCommand command, CancellationToken token) {
 *     return support.executeValidation(validator, command, token).thenCompose(valid -&gt; {
 *         if (!valid) {
 *             return CompletableFuture.completedFuture(support.failure(HandlerSupport.BAD_REQUEST));
 *         }
 *         return repository.save(order, token).thenApply(saved -&gt; saved
 *             ? Response.success(order.id())
 *             : support.failure("Failed to create the order.", HandlerSupport.INTERNAL_ERROR));
 *     });
 * }
 * </pre>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class HandlerSupport {

    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;

    private final Notificator notificator;

    /**
     * 생성자.
     *
     * @param notificator 이번 dispatch 전용 Notificator
     * @throws IllegalArgumentException notificator가 null인 경우
     */
    public HandlerSupport(Notificator notificator) {
        if (notificator == null) {
            throw new IllegalArgumentException("notificator cannot be null");
        }
        this.notificator = notificator;
    }

    /**
     * 외부 Validator로 요청 검증.
     *
     * <p>보고된 실패마다 (필드 경로, 메시지) Notification을 순서대로 추가합니다.
     * false가 반환되면 Handler는 비즈니스 로직을 호출하지 않아야 합니다.</p>
     *
     * @param validator 검증 협력자
     * @param request 검증할 요청
     * @param cancellation 취소 신호
     * @param <R> 요청 타입
     * @return 실패가 없으면 true
     * @throws IllegalArgumentException validator 또는 request가 null인 경우
     */
    public <R> CompletableFuture<Boolean> executeValidation(
        Validator<? super R> validator,
        R request,
        CancellationToken cancellation
    ) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        return validator.validate(request, cancellation).thenApply(failures -> {
            if (failures == null) {
                throw new IllegalStateException("Validator returned null for " + request.getClass().getName());
            }
            for (ValidationFailure failure : failures) {
                notificator.append(Notification.of(failure.field(), failure.message()));
            }
            return failures.isEmpty();
        });
    }

    /**
     * 필드 경로 없는 Notification 추가.
     *
     * <p>실행 중 발견된 비즈니스 규칙 실패에 사용합니다 (예: 하위 조회 결과 없음).</p>
     *
     * @param message 실패 메시지
     * @throws IllegalArgumentException message가 null 또는 빈 문자열인 경우
     */
    public void addNotification(String message) {
        notificator.append(Notification.of(message));
    }

    /**
     * 필드 경로를 지정한 Notification 추가.
     *
     * @param field 필드 경로
     * @param message 실패 메시지
     */
    public void addNotification(String field, String message) {
        notificator.append(Notification.of(field, message));
    }

    /**
     * 누적된 Notification 조회.
     *
     * @return 삽입 순서가 보존된 불변 목록
     */
    public List<Notification> getNotifications() {
        return notificator.list();
    }

    /**
     * Notification 존재 여부.
     *
     * @return 하나 이상 존재하면 true
     */
    public boolean hasNotification() {
        return notificator.hasAny();
    }

    /**
     * 누적된 Notification으로 실패 Response 생성.
     *
     * @param code 4xx 또는 5xx 코드
     * @param <T> 결과 데이터 타입
     * @return 실패 Response
     * @throws IllegalStateException 누적된 Notification이 없는 경우
     */
    public <T> Response<T> failure(int code) {
        return Response.failure(requireNotifications(), code);
    }

    /**
     * Notification을 추가한 뒤 실패 Response 생성.
     *
     * @param message 실패 메시지
     * @param code 4xx 또는 5xx 코드
     * @param <T> 결과 데이터 타입
     * @return 실패 Response
     */
    public <T> Response<T> failure(String message, int code) {
        addNotification(message);
        return failure(code);
    }

    /**
     * 누적된 Notification으로 실패 PagedResponse 생성.
     *
     * @param code 4xx 또는 5xx 코드
     * @param <T> 결과 데이터 타입
     * @return 실패 PagedResponse
     * @throws IllegalStateException 누적된 Notification이 없는 경우
     */
    public <T> PagedResponse<T> pagedFailure(int code) {
        return PagedResponse.failure(requireNotifications(), code);
    }

    /**
     * Notification을 추가한 뒤 실패 PagedResponse 생성.
     *
     * @param message 실패 메시지
     * @param code 4xx 또는 5xx 코드
     * @param <T> 결과 데이터 타입
     * @return 실패 PagedResponse
     */
    public <T> PagedResponse<T> pagedFailure(String message, int code) {
        addNotification(message);
        return pagedFailure(code);
    }

    /**
     * 빈 페이지 정책을 적용하여 PagedResponse 생성.
     *
     * <p>totalCount가 0이고 정책이 {@link EmptyPagePolicy#FAILURE}이면
     * emptyMessage로 Notification을 추가하고 404 실패를 반환합니다.
     * 그 외에는 성공을 반환합니다.</p>
     *
     * @param policy 빈 페이지 정책
     * @param data 현재 페이지 데이터
     * @param totalCount 전체 건수
     * @param pageNumber 페이지 번호
     * @param pageSize 페이지 크기
     * @param emptyMessage 빈 페이지 실패 메시지
     * @param <T> 결과 데이터 타입
     * @return 성공 또는 실패 PagedResponse
     * @throws IllegalArgumentException policy가 null이거나 페이지 계약을 위반한 경우
     */
    public <T> PagedResponse<T> page(
        EmptyPagePolicy policy,
        T data,
        long totalCount,
        int pageNumber,
        int pageSize,
        String emptyMessage
    ) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (totalCount == 0 && policy.failsOnEmpty()) {
            addNotification(emptyMessage);
            return PagedResponse.failure(requireNotifications(), EmptyPagePolicy.EMPTY_PAGE_CODE, pageNumber, pageSize);
        }
        return PagedResponse.success(data, totalCount, pageNumber, pageSize);
    }

    private List<Notification> requireNotifications() {
        List<Notification> notifications = notificator.list();
        if (notifications.isEmpty()) {
            throw new IllegalStateException("Cannot build a failure without notifications");
        }
        return notifications;
    }
}
