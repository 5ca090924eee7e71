/**
 * Cooperative cancellation package.
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.cancellation;
