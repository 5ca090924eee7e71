/**
 * Request type hierarchy package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mediator.core.request.Request} - Sealed marker, parameterized by result shape</li>
 *   <li>{@link com.ryuqq.mediator.core.request.Command} - State-changing request with a {@link com.ryuqq.mediator.core.request.CommandId}</li>
 *   <li>{@link com.ryuqq.mediator.core.request.Query} - Read-only request</li>
 *   <li>{@link com.ryuqq.mediator.core.request.PagedQuery} - Read-only request for one page</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.request;
