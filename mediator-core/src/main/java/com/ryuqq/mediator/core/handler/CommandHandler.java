package com.ryuqq.mediator.core.handler;

import com.ryuqq.mediator.core.request.Command;
import com.ryuqq.mediator.core.response.Response;

/**
 * {@link Command} Handler.
 *
 * @param <C> Command 타입
 * @param <T> 성공 시 결과 데이터 타입
 *
 * @author Mediator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<T>, T> extends RequestHandler<C, Response<T>> {
}
