package com.ryuqq.mediator.core.request;

import java.util.UUID;

/**
 * Command의 고유 식별자.
 *
 * <p>CommandId는 Command 생성 시점에 한 번 생성되며,
 * 로그 추적이나 멱등성 키로 활용할 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가</li>
 *   <li>nil UUID(00000000-0000-0000-0000-000000000000) 불가</li>
 * </ul>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class CommandId {

    private static final UUID NIL = new UUID(0L, 0L);

    private final UUID value;

    private CommandId(UUID value) {
        if (value == null) {
            throw new IllegalArgumentException("CommandId cannot be null");
        }
        if (NIL.equals(value)) {
            throw new IllegalArgumentException("CommandId cannot be the nil UUID");
        }
        this.value = value;
    }

    /**
     * 새 CommandId 생성 (랜덤 UUID).
     *
     * @return 새 CommandId
     */
    public static CommandId generate() {
        return new CommandId(UUID.randomUUID());
    }

    /**
     * 기존 UUID로 CommandId 생성.
     *
     * @param value UUID 값
     * @return CommandId 인스턴스
     * @throws IllegalArgumentException null이거나 nil UUID인 경우
     */
    public static CommandId of(UUID value) {
        return new CommandId(value);
    }

    /**
     * 문자열 UUID로 CommandId 생성.
     *
     * @param value UUID 문자열
     * @return CommandId 인스턴스
     * @throws IllegalArgumentException null, 빈 문자열, UUID 형식이 아닌 경우
     */
    public static CommandId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CommandId cannot be null or blank");
        }
        try {
            return new CommandId(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("CommandId is not a valid UUID: " + value, e);
        }
    }

    /**
     * CommandId 값 조회.
     *
     * @return UUID 값
     */
    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandId commandId = (CommandId) o;
        return value.equals(commandId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CommandId{" + value + '}';
    }
}
