/**
 * Dispatch Adapter Layer - Mediator 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.adapter.dispatch.RegistryMediator} - HandlerRegistry 조회 기반 Mediator</li>
 *   <li>{@link com.ryuqq.mediator.adapter.dispatch.DispatchConfig} - 로깅 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-dispatch (RegistryMediator)
 *   ↓ implements
 * application (Mediator interface)
 *   ↓ depends on
 * application (HandlerRegistry)
 *   ↓ depends on
 * core (Request, Result, HandlerFactory, Notificator)
 * </pre>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
package com.ryuqq.mediator.adapter.dispatch;
