/**
 * Handler registration package.
 *
 * <h2>Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.application.registry.HandlerRegistry} - Read-only request type → handler factory table</li>
 *   <li>{@link com.ryuqq.mediator.application.registry.HandlerModule} - A group of registrations, discoverable via {@link java.util.ServiceLoader}</li>
 * </ul>
 *
 * <h2>Configuration Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.application.registry.HandlerNotFoundException} - No handler for a request type</li>
 *   <li>{@link com.ryuqq.mediator.application.registry.AmbiguousHandlerException} - Two handlers for one request type</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.application.registry;
