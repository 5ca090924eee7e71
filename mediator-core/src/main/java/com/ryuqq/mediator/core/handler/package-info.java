/**
 * Handler capability package.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.core.handler.RequestHandler} - Processes one concrete request type</li>
 *   <li>{@link com.ryuqq.mediator.core.handler.CommandHandler}, {@link com.ryuqq.mediator.core.handler.QueryHandler},
 *       {@link com.ryuqq.mediator.core.handler.PagedQueryHandler} - Typed views by request variant</li>
 *   <li>{@link com.ryuqq.mediator.core.handler.HandlerFactory} - Builds a handler for one dispatch</li>
 * </ul>
 *
 * <h2>Shared Workflow</h2>
 * <p>{@link com.ryuqq.mediator.core.handler.HandlerSupport} is composed into each handler
 * and owns the dispatch's notification collector. It validates, records notifications and
 * builds failure envelopes.</p>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.handler;
