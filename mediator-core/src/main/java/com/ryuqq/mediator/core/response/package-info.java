/**
 * Result envelope package.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.core.response.Response} - Single result envelope</li>
 *   <li>{@link com.ryuqq.mediator.core.response.PagedResponse} - Paged result envelope</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Success carries data, an empty notification list and a 2xx code</li>
 *   <li>Failure carries no data, at least one notification and a 4xx/5xx code</li>
 *   <li>Compact constructors reject any envelope that breaks these rules</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.response;
