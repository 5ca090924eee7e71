/**
 * Sample order domain exercising every request kind.
 *
 * <h2>Requests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mediator.testkit.sample.CreateOrderCommand} - validated command, returns the new order id</li>
 *   <li>{@link com.ryuqq.mediator.testkit.sample.GetOrderByIdQuery} - single lookup, 404 when missing</li>
 *   <li>{@link com.ryuqq.mediator.testkit.sample.ListOrdersQuery} - paged listing with a configurable empty page policy</li>
 * </ul>
 *
 * <h2>Wiring</h2>
 * <p>{@link com.ryuqq.mediator.testkit.sample.OrderHandlerModule} registers all three handlers.</p>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.testkit.sample;
