/**
 * Mediator 진입점 패키지.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-dispatch (RegistryMediator)
 *   ↓ implements
 * application (Mediator interface, HandlerRegistry)
 *   ↓ depends on
 * core (Request, Result, RequestHandler, HandlerFactory, Notificator)
 * </pre>
 *
 * @author Mediator Team
 * @since 1.0.0
 */
package com.ryuqq.mediator.application.mediator;
