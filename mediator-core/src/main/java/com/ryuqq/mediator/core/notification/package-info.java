/**
 * Notification model package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mediator.core.notification.Notification} - Immutable (field, message) failure record</li>
 *   <li>{@link com.ryuqq.mediator.core.notification.Notificator} - Request-scoped collector</li>
 *   <li>{@link com.ryuqq.mediator.core.notification.ListNotificator} - Default list-backed collector</li>
 * </ul>
 *
 * <p>A Notificator lives exactly as long as one dispatch. It is created by the
 * dispatch infrastructure and handed to the handler built for that dispatch.</p>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.notification;
