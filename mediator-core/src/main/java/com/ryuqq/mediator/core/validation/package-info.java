/**
 * Validation Service Provider Interface (SPI) package.
 *
 * <p>The rule engine that checks a request is an external collaborator.
 * Handlers reach it only through {@link com.ryuqq.mediator.core.validation.Validator},
 * and every reported {@link com.ryuqq.mediator.core.validation.ValidationFailure}
 * becomes one notification on the dispatch's collector.</p>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.core.validation;
