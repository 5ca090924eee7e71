package com.ryuqq.mediator.core.request;

/**
 * 생성자에서 식별자를 부여하는 Command 기반 클래스.
 *
 * <p>record를 쓸 수 없는 Command(예: 상속 계층이 필요한 경우)를 위한 기반 클래스입니다.
 * 하위 클래스의 필드도 final이어야 합니다.</p>
 *
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public abstract class AbstractCommand<T> implements Command<T> {

    private final CommandId id;

    /**
     * 새 식별자로 Command 생성.
     */
    protected AbstractCommand() {
        this(CommandId.generate());
    }

    /**
     * 지정한 식별자로 Command 생성 (재구성, 테스트 용도).
     *
     * @param id Command 식별자
     * @throws IllegalArgumentException id가 null인 경우
     */
    protected AbstractCommand(CommandId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        this.id = id;
    }

    @Override
    public final CommandId id() {
        return id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id + '}';
    }
}
