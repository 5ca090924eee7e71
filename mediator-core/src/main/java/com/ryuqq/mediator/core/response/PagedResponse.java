package com.ryuqq.mediator.core.response;

import com.ryuqq.mediator.core.notification.Notification;

import java.util.List;

/**
 * 페이지 단위 결과 봉투.
 *
 * <p>{@link Response}의 성공/실패 불변식에 더해 페이지 정보를 담습니다.</p>
 *
 * <p><strong>페이지 필드:</strong></p>
 * <ul>
 *   <li><strong>totalCount:</strong> 전체 건수 (0 이상)</li>
 *   <li><strong>pageNumber:</strong> 1부터 시작하는 페이지 번호</li>
 *   <li><strong>pageSize:</strong> 페이지 크기 (1 이상)</li>
 *   <li><strong>totalPages:</strong> ceil(totalCount / pageSize), 파생 값</li>
 * </ul>
 *
 * <p><strong>호출자 계약:</strong> pageNumber ≤ 0, pageSize ≤ 0, totalCount &lt; 0은
 * 보정하지 않고 {@link IllegalArgumentException}으로 거부합니다.</p>
 *
 * <p>실패 결과는 totalCount 0을 가지며, 페이지 정보를 지정하지 않으면
 * pageNumber 1, pageSize 1로 채워집니다 (totalPages 0).</p>
 *
 * @param isSuccess 성공 여부
 * @param data 결과 데이터 (실패 시 null)
 * @param notifications 실패 기록 (성공 시 빈 목록)
 * @param code 결과 코드
 * @param totalCount 전체 건수
 * @param pageNumber 페이지 번호
 * @param pageSize 페이지 크기
 * @param <T> 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public record PagedResponse<T>(
    boolean isSuccess,
    T data,
    List<Notification> notifications,
    int code,
    long totalCount,
    int pageNumber,
    int pageSize
) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공/실패 불변식 또는 페이지 계약을 위반한 경우
     */
    public PagedResponse {
        notifications = Envelopes.validate(isSuccess, data, notifications, code);
        if (totalCount < 0) {
            throw new IllegalArgumentException("totalCount must be non-negative (current: " + totalCount + ")");
        }
        if (pageNumber <= 0) {
            throw new IllegalArgumentException("pageNumber must be positive (current: " + pageNumber + ")");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        if (!isSuccess && totalCount != 0) {
            throw new IllegalArgumentException("totalCount must be 0 on failure (current: " + totalCount + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param data 현재 페이지 데이터
     * @param totalCount 전체 건수
     * @param pageNumber 페이지 번호 (1부터)
     * @param pageSize 페이지 크기
     * @param <T> 결과 데이터 타입
     * @return 성공 PagedResponse (code 200)
     * @throws IllegalArgumentException data가 null이거나 페이지 계약을 위반한 경우
     */
    public static <T> PagedResponse<T> success(T data, long totalCount, int pageNumber, int pageSize) {
        return new PagedResponse<>(true, data, List.of(), OK, totalCount, pageNumber, pageSize);
    }

    /**
     * 실패 결과 생성 (code 400).
     *
     * @param notifications 실패 기록 (하나 이상)
     * @param <T> 결과 데이터 타입
     * @return 실패 PagedResponse
     * @throws IllegalArgumentException notifications가 null이거나 비어 있는 경우
     */
    public static <T> PagedResponse<T> failure(List<Notification> notifications) {
        return failure(notifications, BAD_REQUEST);
    }

    /**
     * 실패 결과 생성 (코드 지정).
     *
     * @param notifications 실패 기록 (하나 이상)
     * @param code 4xx 또는 5xx 코드
     * @param <T> 결과 데이터 타입
     * @return 실패 PagedResponse
     * @throws IllegalArgumentException notifications가 비어 있거나 code가 4xx/5xx가 아닌 경우
     */
    public static <T> PagedResponse<T> failure(List<Notification> notifications, int code) {
        return new PagedResponse<>(false, null, notifications, code, 0, 1, 1);
    }

    /**
     * 실패 결과 생성 (요청 페이지 정보 유지).
     *
     * @param notifications 실패 기록 (하나 이상)
     * @param code 4xx 또는 5xx 코드
     * @param pageNumber 요청된 페이지 번호
     * @param pageSize 요청된 페이지 크기
     * @param <T> 결과 데이터 타입
     * @return 실패 PagedResponse
     * @throws IllegalArgumentException 불변식 또는 페이지 계약을 위반한 경우
     */
    public static <T> PagedResponse<T> failure(List<Notification> notifications, int code, int pageNumber, int pageSize) {
        return new PagedResponse<>(false, null, notifications, code, 0, pageNumber, pageSize);
    }

    /**
     * 전체 페이지 수.
     *
     * @return ceil(totalCount / pageSize)
     */
    public long totalPages() {
        return totalCount / pageSize + (totalCount % pageSize == 0 ? 0 : 1);
    }

    /**
     * 다음 페이지 존재 여부.
     *
     * @return 현재 페이지가 마지막 페이지보다 앞이면 true
     */
    public boolean hasNextPage() {
        return pageNumber < totalPages();
    }

    /**
     * 이전 페이지 존재 여부.
     *
     * @return 현재 페이지가 1보다 크면 true
     */
    public boolean hasPreviousPage() {
        return pageNumber > 1;
    }
}
