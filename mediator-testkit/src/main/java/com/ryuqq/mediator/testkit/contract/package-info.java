/**
 * Reusable contract suite for {@link com.ryuqq.mediator.application.mediator.Mediator} implementations.
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.testkit.contract;
